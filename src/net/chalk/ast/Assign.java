package net.chalk.ast;

public final class Assign extends Statement {

    private final Identifier target;
    private final Expression value;

    public Assign(Identifier target, Expression value) {
        this.target = checkNotNull(target, "Assignment target");
        this.value = checkNotNull(value, "Assigned value");
    }

    public boolean equals(Object other) {
        if (! (other instanceof Assign)) return false;
        Assign ao = (Assign) other;
        return (target.equals(ao.getTarget()) &&
                value.equals(ao.getValue()));
    }

    public int hashCode() {
        return target.hashCode() * 31 + value.hashCode();
    }

    public Identifier getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

}
