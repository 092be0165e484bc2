package net.chalk;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.chalk.print.OutputFormat;
import net.chalk.util.Logging;
import net.chalk.util.argparse.Argument;
import net.chalk.util.argparse.ArgumentParser;
import net.chalk.util.argparse.Converter;
import net.chalk.util.argparse.KeyValue;
import net.chalk.util.argparse.Option;
import net.chalk.util.argparse.ParseResult;
import net.chalk.util.argparse.ParsingException;

public class Main implements Runnable {

    public static final String APPNAME = "chalk";
    public static final String VERSION = "1.0.0";
    public static final String DESCRIPTION = "Parses a program of a " +
        "minimal imperative teaching language and prints its syntax tree.";

    private static final Logger LOGGER;

    static {
        Logging.initFormat();
        LOGGER = Logger.getLogger("Main");
        Converter.register(OutputFormat.class,
                           new Converter<OutputFormat>("<FORMAT>") {
            public OutputFormat convert(String data)
                    throws ParsingException {
                try {
                    return OutputFormat.fromName(data);
                } catch (IllegalArgumentException exc) {
                    throw new ParsingException("Invalid output format: " +
                                               data, exc);
                }
            }
        });
        Converter.register(Level.class, new Converter<Level>("<LEVEL>") {
            public Level convert(String data) throws ParsingException {
                try {
                    return Level.parse(data.toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException exc) {
                    throw new ParsingException("Invalid logging level: " +
                                               data, exc);
                }
            }
        });
    }

    private final String[] args;
    private ChalkRunner runner;
    private PrintStream logStream;

    public Main(String[] args) {
        this.args = args;
        this.runner = new ChalkRunner();
        this.logStream = System.err;
    }

    public ChalkRunner getRunner() {
        return runner;
    }
    public void setRunner(ChalkRunner r) {
        runner = r;
    }

    /**
     * The stream log records are written to once the command line has
     * been parsed.
     */
    public PrintStream getLogStream() {
        return logStream;
    }
    public void setLogStream(PrintStream s) {
        logStream = s;
    }

    protected ParseResult parseArguments(ArgumentParser p)
            throws IOException {
        p.addStandardOptions();
        Option<OutputFormat> format = p.add(Option.of(OutputFormat.class,
            "format", 'f', "Syntax tree rendering.")
            .withComment("tree, canonical, or json; default from " +
                         ChalkRunner.FORMAT_KEY + " or tree"));
        Option<Boolean> tokens = p.add(Option.flag("tokens", 't',
            "List tokens instead of parsing."));
        Option<Level> logLevel = p.add(Option.of(Level.class, "log-level",
            'L', "Logging level.").defaultsTo(Level.WARNING));
        Option<File> config = p.add(Option.of(File.class, "config", 'C',
            "Configuration file."));
        Option<List<KeyValue>> options = p.add(Option.ofAccum(
            KeyValue.class, "option", 'o',
            "Additional configuration parameter."));
        Argument<File> input = p.add(Argument.of(File.class, "input",
            "Program to parse.").withComment("\"-\" = standard input"));
        ParseResult r = parseArgumentsInner(p);
        Logging.redirectToStream(logStream);
        Logging.setLevel(r.get(logLevel));
        runner.makeConfig().putAll(r.get(options));
        File configPath = r.get(config);
        if (configPath != null) runner.addConfigFile(configPath);
        runner.setFormat(r.get(format));
        runner.setListTokens(r.get(tokens));
        runner.setInput(r.get(input));
        return r;
    }
    protected ParseResult parseArgumentsInner(ArgumentParser p) {
        return p.parseOrExit(args);
    }

    public int execute(InputStream stdin, PrintStream out, PrintStream err) {
        setLogStream(err);
        try {
            parseArguments(new ArgumentParser(APPNAME, VERSION,
                                              DESCRIPTION));
        } catch (IOException exc) {
            LOGGER.log(Level.SEVERE, "Could not load configuration:", exc);
            err.println("configuration error: " + exc.getMessage());
            return ChalkRunner.EXIT_ENVIRONMENT_ERROR;
        }
        LOGGER.fine(APPNAME + " " + VERSION);
        return runner.run(stdin, out, err);
    }

    public void run() {
        int code = execute(System.in, System.out, System.err);
        if (code != ChalkRunner.EXIT_OK) System.exit(code);
    }

    public static void main(String[] args) {
        new Main(args).run();
    }

}
