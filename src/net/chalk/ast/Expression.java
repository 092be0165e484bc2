package net.chalk.ast;

public abstract class Expression extends Node {

    Expression() {}

}
