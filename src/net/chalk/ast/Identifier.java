package net.chalk.ast;

import java.util.regex.Pattern;

public final class Identifier extends Expression {

    private static final Pattern LETTERS = Pattern.compile("[a-z]+");

    private final String name;

    public Identifier(String name) {
        checkNotNull(name, "Identifier name");
        if (! LETTERS.matcher(name).matches())
            throw new IllegalArgumentException("Invalid identifier " + name);
        this.name = name;
    }

    public boolean equals(Object other) {
        if (! (other instanceof Identifier)) return false;
        return name.equals(((Identifier) other).getName());
    }

    public int hashCode() {
        return name.hashCode();
    }

    public String getName() {
        return name;
    }

}
