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
 * Renders a syntax tree with one node per line, showing the tree levels
 * by indentation.
 * Every line, including the last one, is terminated by a newline. A
 * Program does not contribute a line of its own.
 */
public class TreePrinter {

    public static final int DEFAULT_INDENT = 4;

    private final String indentUnit;

    public TreePrinter(int indent) {
        if (indent < 0)
            throw new IllegalArgumentException("Negative indentation " +
                indent);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indent; i++) sb.append(' ');
        this.indentUnit = sb.toString();
    }
    public TreePrinter() {
        this(DEFAULT_INDENT);
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public String render(Node node) {
        StringBuilder sb = new StringBuilder();
        render(node, 0, sb);
        return sb.toString();
    }

    public void render(Node node, int level, StringBuilder drain) {
        if (node instanceof Program) {
            render(((Program) node).getBody(), level, drain);
        } else if (node instanceof Statements) {
            line("Statements", level, drain);
            for (Statement st : ((Statements) node).getItems()) {
                render(st, level + 1, drain);
            }
        } else if (node instanceof IfThen) {
            IfThen st = (IfThen) node;
            line("If", level, drain);
            render(st.getCondition(), level + 1, drain);
            render(st.getThenBranch(), level + 1, drain);
        } else if (node instanceof IfThenElse) {
            IfThenElse st = (IfThenElse) node;
            line("If-Else", level, drain);
            render(st.getCondition(), level + 1, drain);
            render(st.getThenBranch(), level + 1, drain);
            render(st.getElseBranch(), level + 1, drain);
        } else if (node instanceof While) {
            While st = (While) node;
            line("While", level, drain);
            render(st.getCondition(), level + 1, drain);
            render(st.getBody(), level + 1, drain);
        } else if (node instanceof Assign) {
            Assign st = (Assign) node;
            line("Assign", level, drain);
            render(st.getTarget(), level + 1, drain);
            render(st.getValue(), level + 1, drain);
        } else if (node instanceof Read) {
            line("Read", level, drain);
            render(((Read) node).getTarget(), level + 1, drain);
        } else if (node instanceof Write) {
            line("Write", level, drain);
            render(((Write) node).getValue(), level + 1, drain);
        } else if (node instanceof Comparison) {
            Comparison cmp = (Comparison) node;
            line(cmp.getOperator().getSymbol(), level, drain);
            render(cmp.getLeft(), level + 1, drain);
            render(cmp.getRight(), level + 1, drain);
        } else if (node instanceof BinaryExpr) {
            BinaryExpr expr = (BinaryExpr) node;
            line(expr.getOperator().getSymbol(), level, drain);
            render(expr.getLeft(), level + 1, drain);
            render(expr.getRight(), level + 1, drain);
        } else if (node instanceof NumberLiteral) {
            line(((NumberLiteral) node).getText(), level, drain);
        } else if (node instanceof Identifier) {
            line(((Identifier) node).getName(), level, drain);
        } else {
            throw new IllegalArgumentException("Unrecognized node " +
                node.getClass().getName());
        }
    }

    protected void line(String label, int level, StringBuilder drain) {
        for (int i = 0; i < level; i++) drain.append(indentUnit);
        drain.append(label).append('\n');
    }

}
