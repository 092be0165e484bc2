package net.chalk.util.argparse;

import java.util.ArrayList;
import java.util.List;

public abstract class Option<T> extends Processor<T> {

    private final Character shortName;

    protected Option(String name, Character shortName, String help) {
        super(name, help);
        this.shortName = shortName;
    }

    public Character getShortName() {
        return shortName;
    }

    public Option<T> defaultsTo(T v) {
        setDefault(v);
        return this;
    }

    public Option<T> withComment(String comment) {
        setComment(comment);
        return this;
    }

    public String formatName() {
        return "option --" + getName();
    }

    public String formatUsage() {
        String sn = (shortName == null) ? "--" + getName() : "-" + shortName;
        String ph = getPlaceholder();
        return "[" + sn + ((ph == null) ? "" : " " + ph) + "]";
    }

    public HelpLine getHelpLine() {
        String names = ((shortName == null) ? "    " :
                        "-" + shortName + ", ") + "--" + getName();
        return new HelpLine(names, getPlaceholder(), getHelp(),
                            formatAddendum());
    }

    public static <T> Option<T> of(Class<T> cls, String name,
            Character shortName, String help) {
        final Converter<T> cvt = Converter.get(cls);
        return new Option<T>(name, shortName, help) {
            public String getPlaceholder() {
                return cvt.getPlaceholder();
            }
            public T process(T previous, String value)
                    throws ParsingException {
                return cvt.convert(value);
            }
        };
    }

    public static <T> Option<List<T>> ofAccum(Class<T> cls, String name,
            Character shortName, String help) {
        final Converter<T> cvt = Converter.get(cls);
        Option<List<T>> ret = new Option<List<T>>(name, shortName, help) {
            public String getPlaceholder() {
                return cvt.getPlaceholder();
            }
            public List<T> process(List<T> previous, String value)
                    throws ParsingException {
                List<T> acc = new ArrayList<T>();
                if (previous != null) acc.addAll(previous);
                acc.add(cvt.convert(value));
                return acc;
            }
            protected String formatAddendum() {
                return "may be repeated";
            }
        };
        return ret.defaultsTo(new ArrayList<T>());
    }

    public static Option<Boolean> flag(String name, Character shortName,
                                       String help) {
        Option<Boolean> ret = new Option<Boolean>(name, shortName, help) {
            public String getPlaceholder() {
                return null;
            }
            public Boolean process(Boolean previous, String value) {
                return Boolean.TRUE;
            }
            protected String formatAddendum() {
                return null;
            }
        };
        return ret.defaultsTo(Boolean.FALSE);
    }

}
