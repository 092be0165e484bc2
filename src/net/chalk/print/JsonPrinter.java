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
import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Converts syntax trees to JSON.
 * Every node becomes an object whose "type" member names the node class;
 * the remaining members hold the children.
 */
public final class JsonPrinter {

    // Prevent construction.
    private JsonPrinter() {}

    public static String render(Node node, int indent) {
        return toJSON(node).toString(indent);
    }

    public static JSONObject toJSON(Node node) {
        if (node instanceof Program) {
            return make("Program")
                .put("body", toJSON(((Program) node).getBody()));
        } else if (node instanceof Statements) {
            JSONArray items = new JSONArray();
            for (Statement st : ((Statements) node).getItems()) {
                items.put(toJSON(st));
            }
            return make("Statements").put("items", items);
        } else if (node instanceof IfThen) {
            IfThen st = (IfThen) node;
            return make("IfThen")
                .put("condition", toJSON(st.getCondition()))
                .put("then", toJSON(st.getThenBranch()));
        } else if (node instanceof IfThenElse) {
            IfThenElse st = (IfThenElse) node;
            return make("IfThenElse")
                .put("condition", toJSON(st.getCondition()))
                .put("then", toJSON(st.getThenBranch()))
                .put("else", toJSON(st.getElseBranch()));
        } else if (node instanceof While) {
            While st = (While) node;
            return make("While")
                .put("condition", toJSON(st.getCondition()))
                .put("body", toJSON(st.getBody()));
        } else if (node instanceof Assign) {
            Assign st = (Assign) node;
            return make("Assign")
                .put("target", toJSON(st.getTarget()))
                .put("value", toJSON(st.getValue()));
        } else if (node instanceof Read) {
            return make("Read")
                .put("target", toJSON(((Read) node).getTarget()));
        } else if (node instanceof Write) {
            return make("Write")
                .put("value", toJSON(((Write) node).getValue()));
        } else if (node instanceof Comparison) {
            Comparison cmp = (Comparison) node;
            return make("Comparison")
                .put("left", toJSON(cmp.getLeft()))
                .put("op", cmp.getOperator().getSymbol())
                .put("right", toJSON(cmp.getRight()));
        } else if (node instanceof BinaryExpr) {
            BinaryExpr expr = (BinaryExpr) node;
            return make("BinaryExpr")
                .put("left", toJSON(expr.getLeft()))
                .put("op", expr.getOperator().getSymbol())
                .put("right", toJSON(expr.getRight()));
        } else if (node instanceof NumberLiteral) {
            return make("NumberLiteral")
                .put("text", ((NumberLiteral) node).getText());
        } else if (node instanceof Identifier) {
            return make("Identifier")
                .put("name", ((Identifier) node).getName());
        } else {
            throw new IllegalArgumentException("Unrecognized node " +
                node.getClass().getName());
        }
    }

    private static JSONObject make(String type) {
        return new JSONObject().put("type", type);
    }

}
