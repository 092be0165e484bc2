package net.chalk.print;

import static org.junit.jupiter.api.Assertions.assertEquals;

import net.chalk.parser.Parser;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.Test;

public class JsonPrinterTest {

    @Test
    public void nodeStructure() throws Exception {
        JSONObject prog = JsonPrinter.toJSON(Parser.parse(
            "x := 2 * y; write x"));
        assertEquals("Program", prog.getString("type"));
        JSONObject body = prog.getJSONObject("body");
        assertEquals("Statements", body.getString("type"));
        JSONArray items = body.getJSONArray("items");
        assertEquals(2, items.length());
        JSONObject assign = items.getJSONObject(0);
        assertEquals("Assign", assign.getString("type"));
        assertEquals("x", assign.getJSONObject("target").getString("name"));
        JSONObject value = assign.getJSONObject("value");
        assertEquals("BinaryExpr", value.getString("type"));
        assertEquals("*", value.getString("op"));
        assertEquals("2", value.getJSONObject("left").getString("text"));
        assertEquals("Write", items.getJSONObject(1).getString("type"));
    }

    @Test
    public void conditionals() throws Exception {
        JSONObject st = JsonPrinter.toJSON(Parser.parse(
            "if a != 0 then read a else write a end")).getJSONObject("body")
            .getJSONArray("items").getJSONObject(0);
        assertEquals("IfThenElse", st.getString("type"));
        JSONObject cond = st.getJSONObject("condition");
        assertEquals("Comparison", cond.getString("type"));
        assertEquals("!=", cond.getString("op"));
        assertEquals("NumberLiteral",
                     cond.getJSONObject("right").getString("type"));
        assertEquals("Read", st.getJSONObject("then").getJSONArray("items")
                     .getJSONObject(0).getString("type"));
        assertEquals("Write", st.getJSONObject("else").getJSONArray("items")
                     .getJSONObject(0).getString("type"));
    }

    @Test
    public void renderedTextParsesBack() throws Exception {
        String text = JsonPrinter.render(Parser.parse(
            "while n > 0 do n := n - 1 end"), 2);
        JSONObject loop = new JSONObject(text).getJSONObject("body")
            .getJSONArray("items").getJSONObject(0);
        assertEquals("While", loop.getString("type"));
        assertEquals("Statements", loop.getJSONObject("body")
                     .getString("type"));
    }

}
