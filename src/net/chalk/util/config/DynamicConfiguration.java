package net.chalk.util.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A configuration consisting of explicitly set entries, backed by an
 * ordered list of further sources.
 * Explicit entries take precedence; the sources are consulted in the order
 * they were added.
 */
public class DynamicConfiguration implements Configuration {

    public static final Configuration PROPERTY_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getProperty(key);
        }
    };

    public static final Configuration ENV_SOURCE = new Configuration() {
        public String get(String key) {
            return System.getenv(key.toUpperCase(Locale.ROOT)
                                 .replace(".", "_"));
        }
    };

    private final List<Configuration> sources;
    private final Map<String, String> data;

    public DynamicConfiguration() {
        sources = new ArrayList<Configuration>();
        data = new LinkedHashMap<String, String>();
    }

    public List<Configuration> getSources() {
        return sources;
    }

    public String get(String key) {
        if (data.containsKey(key)) return data.get(key);
        for (Configuration src : sources) {
            String ret = src.get(key);
            if (ret != null) return ret;
        }
        return null;
    }

    public void put(String key, String value) {
        data.put(key, value);
    }
    public void putAll(
            Iterable<? extends Map.Entry<String, String>> entries) {
        for (Map.Entry<String, String> e : entries) {
            put(e.getKey(), e.getValue());
        }
    }

    public void remove(String key) {
        data.remove(key);
    }

    public void addSource(Configuration source) {
        sources.add(source);
    }
    public void removeSource(Configuration source) {
        sources.remove(source);
    }

    /**
     * A configuration consulting system properties and then environment
     * variables (upper-cased, with dots replaced by underscores).
     */
    public static DynamicConfiguration makeDefault() {
        DynamicConfiguration ret = new DynamicConfiguration();
        ret.addSource(PROPERTY_SOURCE);
        ret.addSource(ENV_SOURCE);
        return ret;
    }

}
