package net.chalk.util;

public final class Formats {

    // Prevent construction.
    private Formats() {}

    public static String escapeCharacter(int codepoint) {
        switch (codepoint) {
            case '\t': return "\\t";
            case '\n': return "\\n";
            case '\r': return "\\r";
            case '"' : return "\\\"";
            case '\\': return "\\\\";
        }
        if (codepoint < 0x20 || codepoint == 0x7F) {
            return String.format("\\x%02X", codepoint);
        } else if (codepoint >= 0x80 && ! Character.isLetterOrDigit(
                codepoint)) {
            return String.format("\\u%04X", codepoint);
        } else {
            return new String(Character.toChars(codepoint));
        }
    }

    public static String formatCharacter(int codepoint) {
        return "'" + escapeCharacter(codepoint) + "'";
    }

    /**
     * Quote s and escape its special characters so that it fits into a
     * single line of output.
     */
    public static String formatString(CharSequence s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < s.length(); ) {
            int cp = Character.codePointAt(s, i);
            sb.append(escapeCharacter(cp));
            i += Character.charCount(cp);
        }
        return sb.append('"').toString();
    }

}
