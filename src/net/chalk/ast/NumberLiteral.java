package net.chalk.ast;

import java.util.regex.Pattern;

public final class NumberLiteral extends Expression {

    private static final Pattern DIGITS = Pattern.compile("[0-9]+");

    private final String text;

    public NumberLiteral(String text) {
        checkNotNull(text, "Number text");
        if (! DIGITS.matcher(text).matches())
            throw new IllegalArgumentException("Invalid number literal " +
                text);
        this.text = text;
    }

    public boolean equals(Object other) {
        if (! (other instanceof NumberLiteral)) return false;
        return text.equals(((NumberLiteral) other).getText());
    }

    public int hashCode() {
        return text.hashCode() ^ 0x4E554D;
    }

    public String getText() {
        return text;
    }

}
