package net.chalk.util.argparse;

/**
 * Common base of options and positional arguments.
 * A Processor turns the command-line strings addressed to it into a value
 * of type T, possibly combining them with the value it produced before.
 */
public abstract class Processor<T> {

    private final String name;
    private final String help;
    private T defaultValue;
    private String comment;

    protected Processor(String name, String help) {
        if (name == null)
            throw new NullPointerException("Processor name may not be null");
        this.name = name;
        this.help = help;
    }

    public String getName() {
        return name;
    }

    public String getHelp() {
        return help;
    }

    public T getDefault() {
        return defaultValue;
    }
    public void setDefault(T v) {
        defaultValue = v;
    }

    public String getComment() {
        return comment;
    }
    public void setComment(String c) {
        comment = c;
    }

    /**
     * The placeholder for the value this processor consumes, or null if it
     * does not consume any.
     */
    public abstract String getPlaceholder();

    public boolean takesValue() {
        return (getPlaceholder() != null);
    }

    public abstract String formatName();

    public abstract String formatUsage();

    public abstract HelpLine getHelpLine();

    public abstract T process(T previous, String value)
        throws ParsingException;

    protected String formatAddendum() {
        T def = getDefault();
        String ret = (def == null) ? null : "default " + def;
        String cmt = getComment();
        if (cmt == null) return ret;
        return (ret == null) ? cmt : ret + "; " + cmt;
    }

}
