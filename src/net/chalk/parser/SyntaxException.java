package net.chalk.parser;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.TreeSet;

/**
 * Thrown when the current token is not among the kinds admissible at the
 * current point of the grammar.
 * An empty set of expected kinds means that the end of input was expected.
 */
public class SyntaxException extends LocatedParserException {

    private final Set<TokenKind> expected;
    private final TokenKind found;

    public SyntaxException(TextLocation pos,
                           Collection<TokenKind> expected,
                           TokenKind found) {
        super(pos, formatMessage(expected, found));
        Set<TokenKind> exp = EnumSet.noneOf(TokenKind.class);
        exp.addAll(expected);
        this.expected = Collections.unmodifiableSet(exp);
        this.found = found;
    }

    public String getCategory() {
        return "syntax error";
    }

    public Set<TokenKind> getExpected() {
        return expected;
    }

    /**
     * The kind of the offending token, or null if the end of input was
     * reached.
     */
    public TokenKind getFound() {
        return found;
    }

    public boolean isTrailingInput() {
        return expected.isEmpty();
    }

    public static String formatKinds(Collection<TokenKind> kinds) {
        Set<String> names = new TreeSet<String>();
        for (TokenKind k : kinds) names.add(k.name());
        return new ArrayList<String>(names).toString();
    }

    public static String formatFound(TokenKind kind) {
        return (kind == null) ? "end of input" : kind.name();
    }

    private static String formatMessage(Collection<TokenKind> expected,
                                        TokenKind found) {
        if (expected.isEmpty())
            return "end of input expected but token " + formatFound(found) +
                " found";
        return "token in " + formatKinds(expected) + " expected but " +
            formatFound(found) + " found";
    }

}
