package net.chalk.ast;

/**
 * A single relational test between two expressions.
 * Comparisons do not nest; they are not expressions themselves.
 */
public final class Comparison extends Node {

    public enum Operator {
        LESS("<"),
        EQUAL("="),
        GREATER(">"),
        LESS_EQUAL("<="),
        NOT_EQUAL("!="),
        GREATER_EQUAL(">=");

        private final String symbol;

        private Operator(String symbol) {
            this.symbol = symbol;
        }

        public String getSymbol() {
            return symbol;
        }

        public static Operator fromSymbol(String symbol) {
            for (Operator op : values()) {
                if (op.getSymbol().equals(symbol)) return op;
            }
            throw new IllegalArgumentException("Unrecognized relational " +
                "operator " + symbol);
        }

    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public Comparison(Expression left, Operator operator, Expression right) {
        this.left = checkNotNull(left, "Left operand");
        this.operator = checkNotNull(operator, "Operator");
        this.right = checkNotNull(right, "Right operand");
    }

    public boolean equals(Object other) {
        if (! (other instanceof Comparison)) return false;
        Comparison co = (Comparison) other;
        return (left.equals(co.getLeft()) &&
                operator == co.getOperator() &&
                right.equals(co.getRight()));
    }

    public int hashCode() {
        return (left.hashCode() * 31 + operator.hashCode()) * 31 +
            right.hashCode();
    }

    public Expression getLeft() {
        return left;
    }

    public Operator getOperator() {
        return operator;
    }

    public Expression getRight() {
        return right;
    }

}
