package net.chalk;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import net.chalk.print.OutputFormat;
import net.chalk.util.config.DynamicConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ChalkRunnerTest {

    private ChalkRunner runner;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;

    @BeforeEach
    public void setUp() {
        runner = new ChalkRunner();
        runner.setConfig(new DynamicConfiguration());
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
    }

    private int run(String source) throws Exception {
        return runner.run(
            new ByteArrayInputStream(source.getBytes(StandardCharsets.UTF_8)),
            new PrintStream(out, true, "UTF-8"),
            new PrintStream(err, true, "UTF-8"));
    }

    private String output() throws Exception {
        return out.toString("UTF-8");
    }

    private String errors() throws Exception {
        return err.toString("UTF-8");
    }

    private static File writeFile(File file, String text) throws Exception {
        Writer wr = new OutputStreamWriter(new FileOutputStream(file),
                                           StandardCharsets.UTF_8);
        try {
            wr.write(text);
        } finally {
            wr.close();
        }
        return file;
    }

    @Test
    public void printsTreeByDefault() throws Exception {
        assertEquals(ChalkRunner.EXIT_OK, run("write 1"));
        assertEquals("Statements\n    Write\n        1\n", output());
        assertEquals("", errors());
    }

    @Test
    public void lexicalErrorExitsWithOne() throws Exception {
        assertEquals(ChalkRunner.EXIT_SOURCE_ERROR, run("x := 1 # 2"));
        assertEquals("", output());
        assertEquals("lexical error: no token found at the start of " +
                     "\"# 2\" (line 1 column 8)\n", errors());
    }

    @Test
    public void syntaxErrorExitsWithOne() throws Exception {
        assertEquals(ChalkRunner.EXIT_SOURCE_ERROR, run("x := 1 end"));
        assertEquals("", output());
        assertEquals("syntax error: end of input expected but token END " +
                     "found (line 1 column 8)\n", errors());
    }

    @Test
    public void deepNestingIsReportedOnOneLine() throws Exception {
        int depth = 100000;
        StringBuilder sb = new StringBuilder("x := ");
        for (int i = 0; i < depth; i++) sb.append('(');
        sb.append('1');
        for (int i = 0; i < depth; i++) sb.append(')');
        assertEquals(ChalkRunner.EXIT_SOURCE_ERROR, run(sb.toString()));
        assertEquals("", output());
        assertEquals(ChalkRunner.NESTING_DIAGNOSTIC + "\n", errors());
    }

    @Test
    public void explicitFormatWins() throws Exception {
        runner.getConfig().put(ChalkRunner.FORMAT_KEY, "json");
        runner.setFormat(OutputFormat.CANONICAL);
        assertEquals(ChalkRunner.EXIT_OK, run("x := 1 + 2 * 3"));
        assertEquals("x:=(1+(2*3))\n", output());
    }

    @Test
    public void configurationSelectsFormatAndIndent() throws Exception {
        runner.getConfig().put(ChalkRunner.INDENT_KEY, "2");
        assertEquals(ChalkRunner.EXIT_OK, run("read a"));
        assertEquals("Statements\n  Read\n    a\n", output());
        runner.getConfig().put(ChalkRunner.FORMAT_KEY, "canonical");
        assertEquals(OutputFormat.CANONICAL, runner.resolveFormat());
    }

    @Test
    public void badConfigurationExitsWithTwo() throws Exception {
        runner.getConfig().put(ChalkRunner.INDENT_KEY, "-3");
        assertEquals(ChalkRunner.EXIT_ENVIRONMENT_ERROR, run("read a"));
        assertTrue(errors().startsWith("configuration error: "));
        assertEquals("", output());
    }

    @Test
    public void listsTokens() throws Exception {
        runner.setListTokens(true);
        assertEquals(ChalkRunner.EXIT_OK, run("x := 12"));
        assertEquals("ID x\nBEC\nNUM 12\n", output());
    }

    @Test
    public void readsFromFile(@TempDir Path dir) throws Exception {
        File file = writeFile(dir.resolve("prog.chalk").toFile(),
                              "read a; write a\n");
        runner.setInput(file);
        runner.setFormat(OutputFormat.CANONICAL);
        assertEquals(ChalkRunner.EXIT_OK, run("ignored"));
        assertEquals("read a; write a\n", output());
    }

    @Test
    public void missingFileExitsWithTwo(@TempDir Path dir) throws Exception {
        runner.setInput(dir.resolve("missing.chalk").toFile());
        assertEquals(ChalkRunner.EXIT_ENVIRONMENT_ERROR, run("write 1"));
        assertTrue(errors().startsWith("I/O error: "));
    }

    @Test
    public void dashMeansStandardInput() {
        runner.setInput(new File("-"));
        assertEquals(null, runner.getInput());
    }

    @Test
    public void configFilesRankBelowExplicitEntries(@TempDir Path dir)
            throws Exception {
        File file = writeFile(dir.resolve("chalk.properties").toFile(),
                              "chalk.indent=1\nchalk.format=canonical\n");
        runner.addConfigFile(file);
        runner.getConfig().put(ChalkRunner.FORMAT_KEY, "tree");
        assertEquals(1, runner.resolveIndent());
        assertEquals(OutputFormat.TREE, runner.resolveFormat());
    }

}
