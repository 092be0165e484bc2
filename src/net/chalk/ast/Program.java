package net.chalk.ast;

public final class Program extends Node {

    private final Statements body;

    public Program(Statements body) {
        this.body = checkNotNull(body, "Program body");
    }

    public boolean equals(Object other) {
        if (! (other instanceof Program)) return false;
        return body.equals(((Program) other).getBody());
    }

    public int hashCode() {
        return body.hashCode() * 31 + 1;
    }

    public Statements getBody() {
        return body;
    }

}
