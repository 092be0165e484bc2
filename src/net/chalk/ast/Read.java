package net.chalk.ast;

public final class Read extends Statement {

    private final Identifier target;

    public Read(Identifier target) {
        this.target = checkNotNull(target, "Read target");
    }

    public boolean equals(Object other) {
        if (! (other instanceof Read)) return false;
        return target.equals(((Read) other).getTarget());
    }

    public int hashCode() {
        return target.hashCode() * 31 + 2;
    }

    public Identifier getTarget() {
        return target;
    }

}
