package net.chalk.util.argparse;

import java.util.LinkedHashMap;
import java.util.Map;

public class ParseResult {

    private final Map<Processor<?>, Object> data;

    public ParseResult() {
        data = new LinkedHashMap<Processor<?>, Object>();
    }

    /**
     * Whether key was given explicitly on the command line.
     */
    public boolean contains(Processor<?> key) {
        return data.containsKey(key);
    }

    /**
     * The value of key, or its default if it was not given.
     */
    public <T> T get(Processor<T> key) {
        if (! data.containsKey(key)) return key.getDefault();
        @SuppressWarnings("unchecked")
        T ret = (T) data.get(key);
        return ret;
    }

    public <T> void put(Processor<T> key, T value) {
        data.put(key, value);
    }

}
