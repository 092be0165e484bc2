package net.chalk.util.argparse;

import java.io.File;
import java.util.HashMap;
import java.util.Map;

public abstract class Converter<T> {

    private static final Map<Class<?>, Converter<?>> registry;

    static {
        registry = new HashMap<Class<?>, Converter<?>>();
        register(String.class, new Converter<String>("<STR>") {
            public String convert(String data) {
                return data;
            }
        });
        register(Integer.class, new Converter<Integer>("<INT>") {
            public Integer convert(String data) throws ParsingException {
                try {
                    return Integer.parseInt(data);
                } catch (NumberFormatException exc) {
                    throw new ParsingException("Invalid integer: " + data,
                                               exc);
                }
            }
        });
        register(File.class, new Converter<File>("<PATH>") {
            public File convert(String data) {
                return new File(data);
            }
        });
        register(KeyValue.class, new Converter<KeyValue>("<KEY>=<VALUE>") {
            public KeyValue convert(String data) throws ParsingException {
                KeyValue ret = KeyValue.parse(data);
                if (ret.getValue() == null)
                    throw new ParsingException("Missing value in " +
                        "key-value pair: " + data);
                return ret;
            }
        });
    }

    private final String placeholder;

    protected Converter(String placeholder) {
        this.placeholder = placeholder;
    }

    public String getPlaceholder() {
        return placeholder;
    }

    public abstract T convert(String data) throws ParsingException;

    public static <X> void register(Class<X> cls, Converter<X> cvt) {
        registry.put(cls, cvt);
    }
    public static <X> Converter<X> get(Class<X> cls) {
        @SuppressWarnings("unchecked")
        Converter<X> ret = (Converter<X>) registry.get(cls);
        if (ret == null)
            throw new IllegalArgumentException("No converter for " +
                cls.getName());
        return ret;
    }

}
