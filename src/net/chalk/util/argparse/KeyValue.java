package net.chalk.util.argparse;

import java.util.Map;

public class KeyValue implements Map.Entry<String, String> {

    private final String key;
    private final String value;

    public KeyValue(String key, String value) {
        if (key == null)
            throw new NullPointerException("KeyValue key must not be null");
        this.key = key;
        this.value = value;
    }

    public String toString() {
        return (value == null) ? key : key + "=" + value;
    }

    public boolean equals(Object o) {
        if (! (o instanceof Map.Entry)) return false;
        Map.Entry<?, ?> e = (Map.Entry<?, ?>) o;
        return key.equals(e.getKey()) && ((value == null) ?
            e.getValue() == null : value.equals(e.getValue()));
    }

    public int hashCode() {
        return key.hashCode() ^ ((value == null) ? 0 : value.hashCode());
    }

    public String getKey() {
        return key;
    }

    public String getValue() {
        return value;
    }

    public String setValue(String ignored) {
        throw new UnsupportedOperationException("KeyValue is immutable");
    }

    /**
     * Split text at the first equals sign.
     * If there is none, the value is null.
     */
    public static KeyValue parse(String text) {
        String[] items = text.split("=", 2);
        return new KeyValue(items[0], (items.length < 2) ? null : items[1]);
    }

}
