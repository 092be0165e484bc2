package net.chalk.parser;

import java.io.IOException;
import java.io.Reader;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import net.chalk.util.Locations;
import net.chalk.util.Util;

/**
 * A longest-match scanner over an in-memory source text.
 * The token following the cursor is scanned eagerly (upon construction and
 * after every consumption), so that lexical errors surface as soon as the
 * offending token becomes the lookahead.
 */
public class Scanner implements TokenSource {

    private final String input;
    private final Map<TokenPattern, Matcher> matchers;
    private final Locations.LocationTracker position;
    private int index;
    private Token currentToken;

    public Scanner(String input, TokenTable table) throws LexicalException {
        if (input == null)
            throw new NullPointerException("Scanner input may not be null");
        if (table == null)
            throw new NullPointerException("Token table may not be null");
        this.input = input;
        this.matchers = new LinkedHashMap<TokenPattern, Matcher>();
        for (TokenPattern p : table.getPatterns()) {
            Matcher m = p.matcher(input);
            m.useAnchoringBounds(false);
            matchers.put(p, m);
        }
        this.position = new Locations.LocationTracker();
        this.index = 0;
        this.currentToken = scan();
    }
    public Scanner(String input) throws LexicalException {
        this(input, TokenTable.STANDARD);
    }
    public Scanner(Reader input) throws IOException, LexicalException {
        this(Util.readFully(input), TokenTable.STANDARD);
    }

    public String getInput() {
        return input;
    }

    /**
     * The amount of characters consumed so far.
     * Whitespace preceding the current token counts as consumed.
     */
    public int getIndex() {
        return index;
    }

    public TextLocation getCurrentPosition() {
        return position.snapshot();
    }

    public Token getCurrentToken() {
        return currentToken;
    }

    public TokenKind lookahead() {
        return (currentToken == null) ? null : currentToken.getKind();
    }

    public boolean isAtEnd() {
        return (currentToken == null);
    }

    public Token consume(Set<TokenKind> expected)
            throws LexicalException, SyntaxException {
        Token tok = currentToken;
        if (tok == null || ! expected.contains(tok.getKind()))
            throw new SyntaxException(getCurrentPosition(), expected,
                                      lookahead());
        advance(tok);
        return tok;
    }
    public Token consume(TokenKind first, TokenKind... rest)
            throws LexicalException, SyntaxException {
        return consume(EnumSet.of(first, rest));
    }

    public Token next() throws LexicalException {
        Token tok = currentToken;
        if (tok != null) advance(tok);
        return tok;
    }

    public SyntaxException trailingInput() {
        return new SyntaxException(getCurrentPosition(),
            Collections.<TokenKind>emptySet(), lookahead());
    }

    protected void advance(Token tok) throws LexicalException {
        int length = tok.getContent().length();
        position.advance(input, index, length);
        index += length;
        currentToken = null;
        currentToken = scan();
    }

    protected void skipWhitespace() {
        while (index < input.length()) {
            char ch = input.charAt(index);
            if (! isSpace(ch)) break;
            position.advance(ch);
            index++;
        }
    }

    /**
     * Whether ch separates tokens.
     * Besides the Java whitespace characters, this includes the
     * non-breaking Unicode spaces and NEL (U+0085).
     */
    public static boolean isSpace(char ch) {
        return (Character.isWhitespace(ch) || Character.isSpaceChar(ch) ||
                ch == '\u0085');
    }

    protected Token scan() throws LexicalException {
        skipWhitespace();
        if (index == input.length()) return null;
        TokenPattern bestPattern = null;
        int bestEnd = index;
        for (Map.Entry<TokenPattern, Matcher> ent : matchers.entrySet()) {
            Matcher m = ent.getValue();
            m.region(index, input.length());
            if (! m.lookingAt()) continue;
            // Ties go to the pattern listed first.
            if (m.end() <= bestEnd) continue;
            bestPattern = ent.getKey();
            bestEnd = m.end();
        }
        if (bestPattern == null)
            throw new LexicalException(getCurrentPosition(),
                                       input.substring(index));
        return bestPattern.createToken(getCurrentPosition(),
                                       input.substring(index, bestEnd));
    }

}
