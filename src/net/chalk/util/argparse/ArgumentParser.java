package net.chalk.util.argparse;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Formatter;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ArgumentParser {

    public abstract class PrintAndExitAction extends ActionOption {

        public PrintAndExitAction(String name, Character shortName,
                                  String help) {
            super(name, shortName, help);
        }

        public ArgumentParser getParser() {
            return ArgumentParser.this;
        }

        public void show(String text) {
            getParser().getMessageStream().println(text);
        }
        public abstract String createMessage();
        public void finish() {
            System.exit(0);
        }

        public void run() {
            show(createMessage());
            finish();
        }

    }

    public class HelpAction extends PrintAndExitAction {

        public HelpAction() {
            super("help", '?', "Display help.");
        }

        public String createMessage() {
            return getParser().formatFullHelp();
        }

    }

    public class VersionAction extends PrintAndExitAction {

        public VersionAction() {
            super("version", 'V', "Display version.");
        }

        public String createMessage() {
            String ret = getParser().getProgName();
            String version = getParser().getVersion();
            if (version != null) ret += " " + version;
            return ret;
        }

    }

    public static final String USAGE_LINE_HEADER = "USAGE: ";

    private final String progName;
    private final String version;
    private final String description;
    private final Map<String, Option<?>> longOptions;
    private final Map<Character, Option<?>> shortOptions;
    private final List<Argument<?>> arguments;
    private PrintStream messageStream;

    public ArgumentParser(String progName, String version,
                          String description) {
        this.progName = progName;
        this.version = version;
        this.description = description;
        this.longOptions = new LinkedHashMap<String, Option<?>>();
        this.shortOptions = new LinkedHashMap<Character, Option<?>>();
        this.arguments = new ArrayList<Argument<?>>();
        this.messageStream = System.err;
    }

    public String getProgName() {
        return progName;
    }

    public String getVersion() {
        return version;
    }

    public String getDescription() {
        return description;
    }

    public PrintStream getMessageStream() {
        return messageStream;
    }
    public void setMessageStream(PrintStream s) {
        messageStream = s;
    }

    public List<Processor<?>> getAllProcessors() {
        List<Processor<?>> ret = new ArrayList<Processor<?>>();
        ret.addAll(longOptions.values());
        ret.addAll(arguments);
        return ret;
    }

    public <X extends Processor<?>> X add(X proc) {
        if (proc instanceof Option<?>) {
            Option<?> opt = (Option<?>) proc;
            if (longOptions.containsKey(opt.getName()))
                throw new IllegalArgumentException("Duplicate option --" +
                    opt.getName());
            Character sn = opt.getShortName();
            if (sn != null && shortOptions.containsKey(sn))
                throw new IllegalArgumentException("Duplicate option -" +
                    sn);
            longOptions.put(opt.getName(), opt);
            if (sn != null) shortOptions.put(sn, opt);
        } else if (proc instanceof Argument<?>) {
            arguments.add((Argument<?>) proc);
        } else {
            throw new IllegalArgumentException("Unrecognized processor " +
                proc);
        }
        return proc;
    }

    public void addStandardOptions() {
        add(new HelpAction());
        if (version != null) add(new VersionAction());
    }

    public ParseResult parse(String[] args) throws ParsingException {
        ParseResult result = new ParseResult();
        Iterator<Argument<?>> positional = arguments.iterator();
        boolean optionsDone = false;
        int i = 0;
        while (i < args.length) {
            String arg = args[i++];
            if (optionsDone || arg.equals("-") || ! arg.startsWith("-")) {
                if (! positional.hasNext())
                    throw new ParsingException("Superfluous argument",
                                               "\"" + arg + "\"");
                apply(positional.next(), arg, result);
            } else if (arg.equals("--")) {
                optionsDone = true;
            } else if (arg.startsWith("--")) {
                String name = arg.substring(2), value = null;
                int eq = name.indexOf('=');
                if (eq != -1) {
                    value = name.substring(eq + 1);
                    name = name.substring(0, eq);
                }
                Option<?> opt = longOptions.get(name);
                if (opt == null)
                    throw new ParsingException("Unknown option",
                                               "--" + name);
                if (! opt.takesValue()) {
                    if (value != null)
                        throw new ParsingException("Superfluous value for",
                                                   opt.formatName());
                } else if (value == null) {
                    if (i == args.length)
                        throw new ParsingException("Missing value for",
                                                   opt.formatName());
                    value = args[i++];
                }
                invoke(opt, value, result);
            } else {
                for (int j = 1; j < arg.length(); j++) {
                    Option<?> opt = shortOptions.get(arg.charAt(j));
                    if (opt == null)
                        throw new ParsingException("Unknown option",
                                                   "-" + arg.charAt(j));
                    if (! opt.takesValue()) {
                        invoke(opt, null, result);
                        continue;
                    }
                    // The rest of the cluster is the value.
                    String value = arg.substring(j + 1);
                    if (value.isEmpty()) {
                        if (i == args.length)
                            throw new ParsingException("Missing value for",
                                                       opt.formatName());
                        value = args[i++];
                    }
                    invoke(opt, value, result);
                    break;
                }
            }
        }
        for (Argument<?> a : arguments) {
            if (a.isRequired() && ! result.contains(a))
                throw new ParsingException("Missing required",
                                           a.formatName());
        }
        return result;
    }

    public ParseResult parseOrExit(String[] args) {
        try {
            return parse(args);
        } catch (ParsingException exc) {
            getMessageStream().println(formatUsageLine());
            getMessageStream().println("ERROR: " + exc.getMessage());
            System.exit(2);
            // Not reached.
            return null;
        }
    }

    public String formatUsageLine() {
        StringBuilder sb = new StringBuilder(USAGE_LINE_HEADER);
        sb.append((progName == null) ? "..." : progName);
        for (Processor<?> p : getAllProcessors()) {
            sb.append(' ').append(p.formatUsage());
        }
        return sb.toString();
    }

    public String formatHelp() {
        List<HelpLine> lines = new ArrayList<HelpLine>();
        for (Processor<?> p : getAllProcessors()) {
            lines.add(p.getHelpLine());
        }
        StringBuilder sb = new StringBuilder();
        HelpLine.format(lines, new Formatter(sb, null));
        return sb.toString();
    }

    public String formatFullHelp() {
        StringBuilder sb = new StringBuilder(formatUsageLine());
        if (description != null) sb.append('\n').append(description);
        return sb.append('\n').append(formatHelp()).toString();
    }

    private static <T> void apply(Processor<T> proc, String value,
                                  ParseResult result)
            throws ParsingException {
        try {
            result.put(proc, proc.process(result.get(proc), value));
        } catch (ParsingException exc) {
            throw new ParsingException(exc.getMessage() + " for",
                                       proc.formatName(), exc);
        }
    }

    private static void invoke(Option<?> opt, String value,
                               ParseResult result) throws ParsingException {
        apply(opt, value, result);
        if (opt instanceof ActionOption) ((ActionOption) opt).run();
    }

}
