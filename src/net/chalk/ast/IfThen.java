package net.chalk.ast;

public final class IfThen extends Statement {

    private final Comparison condition;
    private final Statements thenBranch;

    public IfThen(Comparison condition, Statements thenBranch) {
        this.condition = checkNotNull(condition, "Condition");
        this.thenBranch = checkNotNull(thenBranch, "Then branch");
    }

    public boolean equals(Object other) {
        if (! (other instanceof IfThen)) return false;
        IfThen io = (IfThen) other;
        return (condition.equals(io.getCondition()) &&
                thenBranch.equals(io.getThenBranch()));
    }

    public int hashCode() {
        return condition.hashCode() * 31 + thenBranch.hashCode();
    }

    public Comparison getCondition() {
        return condition;
    }

    public Statements getThenBranch() {
        return thenBranch;
    }

}
