package net.chalk.ast;

public abstract class Statement extends Node {

    Statement() {}

}
