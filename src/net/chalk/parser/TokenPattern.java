package net.chalk.parser;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TokenPattern {

    private final TokenKind kind;
    private final Pattern pattern;

    public TokenPattern(TokenKind kind, Pattern pattern) {
        if (kind == null)
            throw new NullPointerException(
                "TokenPattern kind may not be null");
        if (pattern == null)
            throw new NullPointerException(
                "TokenPattern pattern may not be null");
        this.kind = kind;
        this.pattern = pattern;
    }

    public String toString() {
        return String.format("%s@%h[kind=%s,pattern=%s]",
            getClass().getName(), this, getKind(), getPattern());
    }

    public boolean equals(Object other) {
        if (! (other instanceof TokenPattern)) return false;
        TokenPattern to = (TokenPattern) other;
        return (getKind() == to.getKind() &&
                getPattern().pattern().equals(to.getPattern().pattern()));
    }

    public int hashCode() {
        return getKind().hashCode() ^ getPattern().pattern().hashCode();
    }

    public TokenKind getKind() {
        return kind;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Matcher matcher(CharSequence input) {
        return getPattern().matcher(input);
    }

    public Token createToken(TextLocation position, String content) {
        return new Token(getKind(), position, content);
    }

    public static TokenPattern fixed(TokenKind kind) {
        String sym = kind.getSymbol();
        if (sym == null)
            throw new IllegalArgumentException("Token kind " + kind +
                " has no fixed symbol");
        return new TokenPattern(kind, Pattern.compile(Pattern.quote(sym)));
    }
    public static TokenPattern regex(TokenKind kind, String regex) {
        return new TokenPattern(kind, Pattern.compile(regex));
    }

}
