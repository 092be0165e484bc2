package net.chalk.ast;

public final class BinaryExpr extends Expression {

    public enum Operator {
        ADD("+"),
        SUBTRACT("-"),
        MULTIPLY("*"),
        DIVIDE("/");

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
            throw new IllegalArgumentException("Unrecognized arithmetic " +
                "operator " + symbol);
        }

    }

    private final Expression left;
    private final Operator operator;
    private final Expression right;

    public BinaryExpr(Expression left, Operator operator, Expression right) {
        this.left = checkNotNull(left, "Left operand");
        this.operator = checkNotNull(operator, "Operator");
        this.right = checkNotNull(right, "Right operand");
    }

    public boolean equals(Object other) {
        if (! (other instanceof BinaryExpr)) return false;
        BinaryExpr bo = (BinaryExpr) other;
        return (left.equals(bo.getLeft()) &&
                operator == bo.getOperator() &&
                right.equals(bo.getRight()));
    }

    public int hashCode() {
        return (left.hashCode() * 37 + operator.hashCode()) * 37 +
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
