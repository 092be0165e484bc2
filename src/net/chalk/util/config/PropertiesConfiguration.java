package net.chalk.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static PropertiesConfiguration load(File path)
            throws IOException {
        Properties props = new Properties();
        InputStream in = new FileInputStream(path);
        try {
            Reader rd = new InputStreamReader(in, StandardCharsets.UTF_8);
            props.load(rd);
        } finally {
            in.close();
        }
        return new PropertiesConfiguration(props);
    }

}
