package net.chalk.print;

import net.chalk.ast.Assign;
import net.chalk.ast.BinaryExpr;
import net.chalk.ast.Comparison;
import net.chalk.ast.Identifier;
import net.chalk.ast.IfThen;
import net.chalk.ast.IfThenElse;
import net.chalk.ast.Node;
import net.chalk.ast.NumberLiteral;
import net.chalk.ast.Program;
import net.chalk.ast.Read;
import net.chalk.ast.Statement;
import net.chalk.ast.Statements;
import net.chalk.ast.While;
import net.chalk.ast.Write;

/**
 * Renders a syntax tree as a single line of program text.
 * Every binary expression is enclosed in parentheses, so the grouping of
 * operands is visible regardless of precedence.
 */
public final class CanonicalPrinter {

    // Prevent construction.
    private CanonicalPrinter() {}

    public static String render(Node node) {
        StringBuilder sb = new StringBuilder();
        render(node, sb);
        return sb.toString();
    }

    public static void render(Node node, StringBuilder drain) {
        if (node instanceof Program) {
            render(((Program) node).getBody(), drain);
        } else if (node instanceof Statements) {
            boolean first = true;
            for (Statement st : ((Statements) node).getItems()) {
                if (first) {
                    first = false;
                } else {
                    drain.append("; ");
                }
                render(st, drain);
            }
        } else if (node instanceof IfThen) {
            IfThen st = (IfThen) node;
            drain.append("if ");
            render(st.getCondition(), drain);
            drain.append(" then ");
            render(st.getThenBranch(), drain);
            drain.append(" end");
        } else if (node instanceof IfThenElse) {
            IfThenElse st = (IfThenElse) node;
            drain.append("if ");
            render(st.getCondition(), drain);
            drain.append(" then ");
            render(st.getThenBranch(), drain);
            drain.append(" else ");
            render(st.getElseBranch(), drain);
            drain.append(" end");
        } else if (node instanceof While) {
            While st = (While) node;
            drain.append("while ");
            render(st.getCondition(), drain);
            drain.append(" do ");
            render(st.getBody(), drain);
            drain.append(" end");
        } else if (node instanceof Assign) {
            Assign st = (Assign) node;
            render(st.getTarget(), drain);
            drain.append(":=");
            render(st.getValue(), drain);
        } else if (node instanceof Read) {
            drain.append("read ");
            render(((Read) node).getTarget(), drain);
        } else if (node instanceof Write) {
            drain.append("write ");
            render(((Write) node).getValue(), drain);
        } else if (node instanceof Comparison) {
            Comparison cmp = (Comparison) node;
            render(cmp.getLeft(), drain);
            drain.append(cmp.getOperator().getSymbol());
            render(cmp.getRight(), drain);
        } else if (node instanceof BinaryExpr) {
            BinaryExpr expr = (BinaryExpr) node;
            drain.append('(');
            render(expr.getLeft(), drain);
            drain.append(expr.getOperator().getSymbol());
            render(expr.getRight(), drain);
            drain.append(')');
        } else if (node instanceof NumberLiteral) {
            drain.append(((NumberLiteral) node).getText());
        } else if (node instanceof Identifier) {
            drain.append(((Identifier) node).getName());
        } else {
            throw new IllegalArgumentException("Unrecognized node " +
                node.getClass().getName());
        }
    }

}
