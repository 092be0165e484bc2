package net.chalk.parser;

/**
 * The closed set of token kinds of the language.
 * The end of input is not a kind; it is represented by null where a kind
 * is expected.
 */
public enum TokenKind {

    DO("do"),
    ELSE("else"),
    END("end"),
    IF("if"),
    THEN("then"),
    WHILE("while"),
    READ("read"),
    WRITE("write"),
    SEM(";"),
    BEC(":="),
    LESS("<"),
    EQ("="),
    GRTR(">"),
    LEQ("<="),
    NEQ("!="),
    GEQ(">="),
    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    LPAR("("),
    RPAR(")"),
    NUM(null),
    ID(null);

    private final String symbol;

    private TokenKind(String symbol) {
        this.symbol = symbol;
    }

    /**
     * The fixed text of tokens of this kind, or null for kinds whose
     * text varies.
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Whether tokens of this kind carry their matched text as a value.
     */
    public boolean hasValue() {
        return symbol == null;
    }

}
