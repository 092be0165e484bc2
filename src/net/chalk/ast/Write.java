package net.chalk.ast;

public final class Write extends Statement {

    private final Expression value;

    public Write(Expression value) {
        this.value = checkNotNull(value, "Written value");
    }

    public boolean equals(Object other) {
        if (! (other instanceof Write)) return false;
        return value.equals(((Write) other).getValue());
    }

    public int hashCode() {
        return value.hashCode() * 31 + 3;
    }

    public Expression getValue() {
        return value;
    }

}
