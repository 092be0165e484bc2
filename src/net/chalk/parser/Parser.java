package net.chalk.parser;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import net.chalk.ast.Assign;
import net.chalk.ast.BinaryExpr;
import net.chalk.ast.Comparison;
import net.chalk.ast.Expression;
import net.chalk.ast.Identifier;
import net.chalk.ast.IfThen;
import net.chalk.ast.IfThenElse;
import net.chalk.ast.NumberLiteral;
import net.chalk.ast.Program;
import net.chalk.ast.Read;
import net.chalk.ast.Statement;
import net.chalk.ast.Statements;
import net.chalk.ast.While;
import net.chalk.ast.Write;

/**
 * Predictive recursive-descent parser.
 * There is one method per nonterminal of the grammar; each decides on its
 * production using the single token of lookahead provided by the
 * TokenSource and leaves the source positioned just after the text it
 * covers.
 */
public class Parser {

    public static final Set<TokenKind> STATEMENT_KINDS = freeze(EnumSet.of(
        TokenKind.IF, TokenKind.WHILE, TokenKind.ID));
    public static final Set<TokenKind> RELATIONAL_KINDS = freeze(EnumSet.of(
        TokenKind.LESS, TokenKind.EQ, TokenKind.GRTR, TokenKind.LEQ,
        TokenKind.NEQ, TokenKind.GEQ));
    public static final Set<TokenKind> ADDITIVE_KINDS = freeze(EnumSet.of(
        TokenKind.ADD, TokenKind.SUB));
    public static final Set<TokenKind> MULTIPLICATIVE_KINDS = freeze(
        EnumSet.of(TokenKind.MUL, TokenKind.DIV));
    public static final Set<TokenKind> FACTOR_KINDS = freeze(EnumSet.of(
        TokenKind.LPAR, TokenKind.NUM, TokenKind.ID));

    private final TokenSource source;

    public Parser(TokenSource source) {
        if (source == null)
            throw new NullPointerException(
                "Parser token source may not be null");
        this.source = source;
    }

    public TokenSource getSource() {
        return source;
    }

    /**
     * Parse a complete program and ensure that no input remains after it.
     */
    public Program parse() throws LexicalException, SyntaxException {
        Program ret = parseProgram();
        if (! source.isAtEnd()) throw source.trailingInput();
        return ret;
    }

    public Program parseProgram() throws LexicalException, SyntaxException {
        return new Program(parseStatements());
    }

    public Statements parseStatements()
            throws LexicalException, SyntaxException {
        List<Statement> items = new ArrayList<Statement>();
        items.add(parseStatement());
        while (source.lookahead() == TokenKind.SEM) {
            source.consume(TokenKind.SEM);
            items.add(parseStatement());
        }
        return new Statements(items);
    }

    public Statement parseStatement()
            throws LexicalException, SyntaxException {
        TokenKind kind = source.lookahead();
        if (kind != null) {
            switch (kind) {
                case IF:
                    return parseIf();
                case WHILE:
                    return parseWhile();
                case ID:
                    return parseAssignment();
                case READ:
                    return parseRead();
                case WRITE:
                    return parseWrite();
                default:
                    break;
            }
        }
        throw unexpected(STATEMENT_KINDS);
    }

    public Statement parseIf() throws LexicalException, SyntaxException {
        source.consume(TokenKind.IF);
        Comparison condition = parseComparison();
        source.consume(TokenKind.THEN);
        Statements thenBranch = parseStatements();
        Token tok = source.consume(TokenKind.ELSE, TokenKind.END);
        if (tok.getKind() == TokenKind.END)
            return new IfThen(condition, thenBranch);
        Statements elseBranch = parseStatements();
        source.consume(TokenKind.END);
        return new IfThenElse(condition, thenBranch, elseBranch);
    }

    public While parseWhile() throws LexicalException, SyntaxException {
        source.consume(TokenKind.WHILE);
        Comparison condition = parseComparison();
        source.consume(TokenKind.DO);
        Statements body = parseStatements();
        source.consume(TokenKind.END);
        return new While(condition, body);
    }

    public Assign parseAssignment()
            throws LexicalException, SyntaxException {
        Identifier target = parseIdentifier();
        source.consume(TokenKind.BEC);
        return new Assign(target, parseExpression());
    }

    public Read parseRead() throws LexicalException, SyntaxException {
        source.consume(TokenKind.READ);
        return new Read(parseIdentifier());
    }

    public Write parseWrite() throws LexicalException, SyntaxException {
        source.consume(TokenKind.WRITE);
        return new Write(parseExpression());
    }

    public Comparison parseComparison()
            throws LexicalException, SyntaxException {
        Expression left = parseExpression();
        Token op = source.consume(RELATIONAL_KINDS);
        Expression right = parseExpression();
        return new Comparison(left, Comparison.Operator.fromSymbol(
            op.getKind().getSymbol()), right);
    }

    public Expression parseExpression()
            throws LexicalException, SyntaxException {
        Expression result = parseTerm();
        while (ADDITIVE_KINDS.contains(source.lookahead())) {
            Token op = source.consume(ADDITIVE_KINDS);
            result = new BinaryExpr(result, BinaryExpr.Operator.fromSymbol(
                op.getKind().getSymbol()), parseTerm());
        }
        return result;
    }

    public Expression parseTerm() throws LexicalException, SyntaxException {
        Expression result = parseFactor();
        while (MULTIPLICATIVE_KINDS.contains(source.lookahead())) {
            Token op = source.consume(MULTIPLICATIVE_KINDS);
            result = new BinaryExpr(result, BinaryExpr.Operator.fromSymbol(
                op.getKind().getSymbol()), parseFactor());
        }
        return result;
    }

    public Expression parseFactor()
            throws LexicalException, SyntaxException {
        TokenKind kind = source.lookahead();
        if (kind == TokenKind.LPAR) {
            source.consume(TokenKind.LPAR);
            Expression result = parseExpression();
            source.consume(TokenKind.RPAR);
            return result;
        } else if (kind == TokenKind.NUM) {
            return new NumberLiteral(source.consume(TokenKind.NUM)
                                     .getValue());
        } else if (kind == TokenKind.ID) {
            return parseIdentifier();
        } else {
            throw unexpected(FACTOR_KINDS);
        }
    }

    public Identifier parseIdentifier()
            throws LexicalException, SyntaxException {
        return new Identifier(source.consume(TokenKind.ID).getValue());
    }

    protected SyntaxException unexpected(Set<TokenKind> expected) {
        return new SyntaxException(source.getCurrentPosition(), expected,
                                   source.lookahead());
    }

    public static Program parse(String text)
            throws LexicalException, SyntaxException {
        return new Parser(new Scanner(text)).parse();
    }
    public static Program parse(Reader input)
            throws IOException, LexicalException, SyntaxException {
        return new Parser(new Scanner(input)).parse();
    }

    private static Set<TokenKind> freeze(Set<TokenKind> kinds) {
        return Collections.unmodifiableSet(kinds);
    }

}
