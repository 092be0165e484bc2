package net.chalk.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered list of token patterns.
 * Where several patterns produce a longest match of the same length, the
 * one listed first wins; this is what makes keywords take precedence over
 * identifiers of the same length.
 */
public class TokenTable {

    public static final TokenTable STANDARD;

    static {
        List<TokenPattern> patterns = new ArrayList<TokenPattern>();
        for (TokenKind k : TokenKind.values()) {
            if (k.getSymbol() != null) patterns.add(TokenPattern.fixed(k));
        }
        patterns.add(TokenPattern.regex(TokenKind.NUM, "[0-9]+"));
        patterns.add(TokenPattern.regex(TokenKind.ID, "[a-z]+"));
        STANDARD = new TokenTable(patterns);
    }

    private final List<TokenPattern> patterns;

    public TokenTable(List<TokenPattern> patterns) {
        Set<TokenKind> seen = EnumSet.noneOf(TokenKind.class);
        for (TokenPattern p : patterns) {
            if (! seen.add(p.getKind()))
                throw new IllegalArgumentException("Duplicate pattern for " +
                    "token kind " + p.getKind());
        }
        this.patterns = Collections.unmodifiableList(
            new ArrayList<TokenPattern>(patterns));
    }

    public List<TokenPattern> getPatterns() {
        return patterns;
    }

    public TokenPattern getPattern(TokenKind kind) {
        for (TokenPattern p : patterns) {
            if (p.getKind() == kind) return p;
        }
        return null;
    }

}
