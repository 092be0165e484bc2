package net.chalk.util;

import java.io.IOException;
import java.io.Reader;

public final class Util {

    private static final int BUFFER_SIZE = 8192;

    // Prevent construction.
    private Util() {}

    public static String readFully(Reader input) throws IOException {
        StringBuilder sb = new StringBuilder();
        char[] data = new char[BUFFER_SIZE];
        for (;;) {
            int rd = input.read(data);
            if (rd < 0) break;
            sb.append(data, 0, rd);
        }
        return sb.toString();
    }

    public static int parseNonNegativeInt(String key, String value) {
        int ret;
        try {
            ret = Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            throw new IllegalArgumentException("Invalid integer for " + key +
                ": " + Formats.formatString(value), exc);
        }
        if (ret < 0)
            throw new IllegalArgumentException("Negative value for " + key +
                ": " + ret);
        return ret;
    }

}
