package net.chalk.parser;

import java.util.Set;

public interface TokenSource {

    TextLocation getCurrentPosition();

    /**
     * The next unconsumed token, or null at the end of input.
     */
    Token getCurrentToken();

    /**
     * The kind of the next unconsumed token, or null at the end of input.
     */
    TokenKind lookahead();

    boolean isAtEnd();

    /**
     * Consume the next token if its kind is one of expected.
     * Otherwise, a SyntaxException naming expected and the kind actually
     * found is thrown, and nothing is consumed.
     */
    Token consume(Set<TokenKind> expected)
        throws LexicalException, SyntaxException;

    Token consume(TokenKind first, TokenKind... rest)
        throws LexicalException, SyntaxException;

    /**
     * Consume the next token, whatever its kind.
     * Returns null (and consumes nothing) at the end of input.
     */
    Token next() throws LexicalException;

    /**
     * An exception reporting that the end of input was expected but the
     * current token was found.
     */
    SyntaxException trailingInput();

}
