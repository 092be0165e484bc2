package net.chalk.print;

import net.chalk.parser.LexicalException;
import net.chalk.parser.Token;
import net.chalk.parser.TokenSource;

/**
 * Lists the tokens of a source text, one per line.
 * Numbers and identifiers are followed by their value.
 */
public final class TokenPrinter {

    // Prevent construction.
    private TokenPrinter() {}

    public static String formatToken(Token tok) {
        String value = tok.getValue();
        String name = tok.getKind().name();
        return (value == null) ? name : name + " " + value;
    }

    /**
     * Drain source and render all of its tokens.
     * If a lexical error occurs, the exception propagates and nothing is
     * returned.
     */
    public static String render(TokenSource source) throws LexicalException {
        StringBuilder sb = new StringBuilder();
        for (;;) {
            Token tok = source.next();
            if (tok == null) break;
            sb.append(formatToken(tok)).append('\n');
        }
        return sb.toString();
    }

}
