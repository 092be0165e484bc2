package net.chalk.ast;

public final class IfThenElse extends Statement {

    private final Comparison condition;
    private final Statements thenBranch;
    private final Statements elseBranch;

    public IfThenElse(Comparison condition, Statements thenBranch,
                      Statements elseBranch) {
        this.condition = checkNotNull(condition, "Condition");
        this.thenBranch = checkNotNull(thenBranch, "Then branch");
        this.elseBranch = checkNotNull(elseBranch, "Else branch");
    }

    public boolean equals(Object other) {
        if (! (other instanceof IfThenElse)) return false;
        IfThenElse io = (IfThenElse) other;
        return (condition.equals(io.getCondition()) &&
                thenBranch.equals(io.getThenBranch()) &&
                elseBranch.equals(io.getElseBranch()));
    }

    public int hashCode() {
        return (condition.hashCode() * 31 + thenBranch.hashCode()) * 31 +
            elseBranch.hashCode();
    }

    public Comparison getCondition() {
        return condition;
    }

    public Statements getThenBranch() {
        return thenBranch;
    }

    public Statements getElseBranch() {
        return elseBranch;
    }

}
