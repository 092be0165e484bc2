package net.chalk;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.chalk.ast.Program;
import net.chalk.parser.LexicalException;
import net.chalk.parser.Parser;
import net.chalk.parser.ParserException;
import net.chalk.parser.Scanner;
import net.chalk.parser.SyntaxException;
import net.chalk.print.OutputFormat;
import net.chalk.print.TokenPrinter;
import net.chalk.print.TreePrinter;
import net.chalk.util.Util;
import net.chalk.util.config.DynamicConfiguration;
import net.chalk.util.config.PropertiesConfiguration;

public class ChalkRunner {

    public static final String INDENT_KEY = "chalk.indent";
    public static final String FORMAT_KEY = "chalk.format";

    public static final int EXIT_OK = 0;
    public static final int EXIT_SOURCE_ERROR = 1;
    public static final int EXIT_ENVIRONMENT_ERROR = 2;

    public static final String NESTING_DIAGNOSTIC =
        "error: program nested too deeply";

    private static final Logger LOGGER = Logger.getLogger("ChalkRunner");

    private DynamicConfiguration config;
    private File input;
    private OutputFormat format;
    private boolean listTokens;

    public DynamicConfiguration getConfig() {
        return config;
    }
    public void setConfig(DynamicConfiguration cfg) {
        config = cfg;
    }
    public DynamicConfiguration makeConfig() {
        if (config == null) config = DynamicConfiguration.makeDefault();
        return config;
    }

    /**
     * Add a properties file as a configuration source.
     * Entries from the file take precedence over system properties and
     * environment variables, but not over explicitly set entries.
     */
    public void addConfigFile(File path) throws IOException {
        makeConfig().getSources().add(0, PropertiesConfiguration.load(path));
        LOGGER.config("Loaded configuration file " + path);
    }

    /**
     * The file to read the program from, or null for standard input.
     */
    public File getInput() {
        return input;
    }
    public void setInput(File path) {
        input = (path == null || path.getPath().equals("-")) ? null : path;
    }

    /**
     * The format to render syntax trees in, or null to consult the
     * configuration.
     */
    public OutputFormat getFormat() {
        return format;
    }
    public void setFormat(OutputFormat fmt) {
        format = fmt;
    }

    public boolean isListTokens() {
        return listTokens;
    }
    public void setListTokens(boolean lt) {
        listTokens = lt;
    }

    public int resolveIndent() {
        String value = makeConfig().get(INDENT_KEY);
        if (value == null) return TreePrinter.DEFAULT_INDENT;
        return Util.parseNonNegativeInt(INDENT_KEY, value);
    }

    public OutputFormat resolveFormat() {
        if (format != null) return format;
        String value = makeConfig().get(FORMAT_KEY);
        if (value == null) return OutputFormat.TREE;
        return OutputFormat.fromName(value);
    }

    public String readInput(InputStream stdin) throws IOException {
        InputStream stream = (input == null) ? stdin :
            new FileInputStream(input);
        try {
            Reader rd = new InputStreamReader(stream, StandardCharsets.UTF_8);
            return Util.readFully(rd);
        } finally {
            if (input != null) stream.close();
        }
    }

    /**
     * Render source according to the current settings.
     * Either the token listing or the syntax tree of source is returned;
     * if there is any error, nothing is rendered at all.
     */
    public String process(String source, OutputFormat fmt, int indent)
            throws LexicalException, SyntaxException {
        if (listTokens) return TokenPrinter.render(new Scanner(source));
        Program prog = new Parser(new Scanner(source)).parse();
        LOGGER.fine("Parsed program with " + prog.getBody().size() +
                    " top-level statement(s)");
        return fmt.render(prog, indent);
    }

    public int run(InputStream stdin, PrintStream out, PrintStream err) {
        OutputFormat fmt;
        int indent;
        try {
            fmt = resolveFormat();
            indent = resolveIndent();
        } catch (IllegalArgumentException exc) {
            err.println("configuration error: " + exc.getMessage());
            return EXIT_ENVIRONMENT_ERROR;
        }
        LOGGER.config("Output format " + fmt.getName() + ", indentation " +
                      indent);
        String source;
        try {
            source = readInput(stdin);
        } catch (IOException exc) {
            LOGGER.log(Level.SEVERE, "Could not read input:", exc);
            err.println("I/O error: " + exc.getMessage());
            return EXIT_ENVIRONMENT_ERROR;
        }
        LOGGER.fine("Read " + source.length() + " characters from " +
                    ((input == null) ? "standard input" : input));
        String output;
        try {
            output = process(source, fmt, indent);
        } catch (ParserException exc) {
            LOGGER.log(Level.FINE, "Rejecting input:", exc);
            err.println(exc.toDiagnostic());
            return EXIT_SOURCE_ERROR;
        } catch (StackOverflowError exc) {
            LOGGER.fine("Rejecting input: nesting exceeds the stack");
            err.println(NESTING_DIAGNOSTIC);
            return EXIT_SOURCE_ERROR;
        }
        out.print(output);
        out.flush();
        return EXIT_OK;
    }

}
