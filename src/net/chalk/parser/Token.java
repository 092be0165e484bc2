package net.chalk.parser;

import net.chalk.util.Formats;

public class Token {

    private final TokenKind kind;
    private final TextLocation position;
    private final String content;

    public Token(TokenKind kind, TextLocation position, String content) {
        if (kind == null)
            throw new NullPointerException("Token kind may not be null");
        if (position == null)
            throw new NullPointerException(
                "Token coordinates may not be null");
        if (content == null)
            throw new NullPointerException(
                "Token content may not be null");
        this.kind = kind;
        this.position = position;
        this.content = content;
    }

    public String toString() {
        return String.format("%s (%s) at %s",
            Formats.formatString(getContent()), getKind(), getPosition());
    }

    public boolean equals(Object other) {
        if (! (other instanceof Token)) return false;
        Token to = (Token) other;
        return (getKind() == to.getKind() &&
                getPosition().equals(to.getPosition()) &&
                getContent().equals(to.getContent()));
    }

    public int hashCode() {
        return getKind().hashCode() ^ getPosition().hashCode() ^
            getContent().hashCode();
    }

    public TokenKind getKind() {
        return kind;
    }

    public TextLocation getPosition() {
        return position;
    }

    /**
     * The text matched by this token.
     */
    public String getContent() {
        return content;
    }

    /**
     * The value of this token: the matched text for numbers and
     * identifiers, null for all other kinds.
     */
    public String getValue() {
        return (kind.hasValue()) ? content : null;
    }

}
