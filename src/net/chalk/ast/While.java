package net.chalk.ast;

public final class While extends Statement {

    private final Comparison condition;
    private final Statements body;

    public While(Comparison condition, Statements body) {
        this.condition = checkNotNull(condition, "Condition");
        this.body = checkNotNull(body, "Loop body");
    }

    public boolean equals(Object other) {
        if (! (other instanceof While)) return false;
        While wo = (While) other;
        return (condition.equals(wo.getCondition()) &&
                body.equals(wo.getBody()));
    }

    public int hashCode() {
        return condition.hashCode() * 37 + body.hashCode();
    }

    public Comparison getCondition() {
        return condition;
    }

    public Statements getBody() {
        return body;
    }

}
