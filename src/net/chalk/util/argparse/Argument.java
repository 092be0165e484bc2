package net.chalk.util.argparse;

public abstract class Argument<T> extends Processor<T> {

    private boolean required;

    protected Argument(String name, String help) {
        super(name, help);
    }

    public boolean isRequired() {
        return required;
    }

    public Argument<T> required() {
        required = true;
        return this;
    }

    public Argument<T> defaultsTo(T v) {
        setDefault(v);
        return this;
    }

    public Argument<T> withComment(String comment) {
        setComment(comment);
        return this;
    }

    public String formatName() {
        return "argument <" + getName() + ">";
    }

    public String formatUsage() {
        String ret = "<" + getName() + ">";
        return (required) ? ret : "[" + ret + "]";
    }

    public HelpLine getHelpLine() {
        return new HelpLine("<" + getName() + ">", getPlaceholder(),
                            getHelp(), formatAddendum());
    }

    public static <T> Argument<T> of(Class<T> cls, String name,
                                     String help) {
        final Converter<T> cvt = Converter.get(cls);
        return new Argument<T>(name, help) {
            public String getPlaceholder() {
                return cvt.getPlaceholder();
            }
            public T process(T previous, String value)
                    throws ParsingException {
                return cvt.convert(value);
            }
        };
    }

}
