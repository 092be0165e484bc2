package net.chalk.parser;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ScannerTest {

    private static List<TokenKind> kinds(String text) throws Exception {
        Scanner sc = new Scanner(text);
        List<TokenKind> ret = new ArrayList<TokenKind>();
        for (;;) {
            Token tok = sc.next();
            if (tok == null) break;
            ret.add(tok.getKind());
        }
        return ret;
    }

    @Test
    public void longestMatchBeatsKeyword() throws Exception {
        Scanner sc = new Scanner("whilex");
        assertEquals(TokenKind.ID, sc.lookahead());
        Token tok = sc.consume(TokenKind.ID);
        assertEquals("whilex", tok.getValue());
        assertTrue(sc.isAtEnd());
        assertNull(sc.lookahead());
    }

    @Test
    public void keywordWinsTieWithIdentifier() throws Exception {
        assertEquals(TokenKind.WHILE, new Scanner("while").lookahead());
        assertEquals(Arrays.asList(TokenKind.IF, TokenKind.ID,
                                             TokenKind.END),
                     kinds("if iff end"));
    }

    @Test
    public void longerOperatorWins() throws Exception {
        assertEquals(Arrays.asList(TokenKind.LEQ), kinds("<="));
        assertEquals(Arrays.asList(TokenKind.LESS, TokenKind.EQ),
                     kinds("< ="));
        assertEquals(Arrays.asList(TokenKind.GEQ, TokenKind.NEQ,
                                             TokenKind.GRTR, TokenKind.BEC),
                     kinds(">=!=>:="));
    }

    @Test
    public void whitespaceAndNewlinesAreSkipped() throws Exception {
        assertEquals(Arrays.asList(TokenKind.ID, TokenKind.BEC,
                                             TokenKind.NUM, TokenKind.SEM,
                                             TokenKind.WRITE, TokenKind.ID),
                     kinds("  x\n:=\t12 ;\r\n write x \n"));
        assertTrue(new Scanner(" \n\t ").isAtEnd());
        assertTrue(new Scanner("").isAtEnd());
    }

    @Test
    public void unicodeSpacesSeparateTokens() throws Exception {
        assertEquals(Arrays.asList(TokenKind.ID, TokenKind.BEC, TokenKind.NUM,
                                   TokenKind.SEM, TokenKind.WRITE,
                                   TokenKind.ID),
                     kinds("x :=\u00a01;\u2007write\u202fx\u0085"));
        assertEquals("x:=1", Parser.parse("x :=\u00a01").toString());
        assertTrue(Scanner.isSpace('\u0085'));
        assertFalse(Scanner.isSpace('#'));
    }

    @Test
    public void onlyNumbersAndIdentifiersCarryValues() throws Exception {
        Scanner sc = new Scanner("a+42");
        assertEquals("a", sc.consume(TokenKind.ID).getValue());
        Token plus = sc.consume(TokenKind.ADD);
        assertNull(plus.getValue());
        assertEquals("+", plus.getContent());
        assertEquals("42", sc.consume(TokenKind.NUM).getValue());
    }

    @Test
    public void digitsAndLettersSplit() throws Exception {
        Scanner sc = new Scanner("12ab");
        assertEquals("12", sc.consume(TokenKind.NUM).getValue());
        assertEquals("ab", sc.consume(TokenKind.ID).getValue());
    }

    @Test
    public void consumeRejectsUnexpectedKind() throws Exception {
        Scanner sc = new Scanner("x := 1");
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> sc.consume(TokenKind.READ, TokenKind.WRITE));
        assertEquals(EnumSet.of(TokenKind.READ, TokenKind.WRITE),
                     exc.getExpected());
        assertEquals(TokenKind.ID, exc.getFound());
        // Nothing was consumed.
        assertEquals(TokenKind.ID, sc.lookahead());
    }

    @Test
    public void consumeAtEndReportsEndOfInput() throws Exception {
        Scanner sc = new Scanner("x");
        sc.consume(TokenKind.ID);
        SyntaxException exc = assertThrows(SyntaxException.class,
            () -> sc.consume(TokenKind.BEC));
        assertNull(exc.getFound());
        assertEquals("token in [BEC] expected but end of input found",
                     exc.getMessage());
    }

    @Test
    public void lexicalErrorReportsRemainingInput() throws Exception {
        Scanner sc = new Scanner("x := 1 # 2");
        sc.consume(TokenKind.ID);
        sc.consume(TokenKind.BEC);
        LexicalException exc = assertThrows(LexicalException.class,
            () -> sc.consume(TokenKind.NUM));
        assertEquals("# 2", exc.getRemainingInput());
        assertEquals(1, exc.getLocation().getLine());
        assertEquals(8, exc.getLocation().getColumn());
        assertEquals("lexical error: no token found at the start of " +
                     "\"# 2\" (line 1 column 8)", exc.toDiagnostic());
    }

    @Test
    public void lexicalErrorOnFirstTokenIsEager() {
        LexicalException exc = assertThrows(LexicalException.class,
            () -> new Scanner("  X := 1"));
        assertEquals("X := 1", exc.getRemainingInput());
        assertEquals(3, exc.getLocation().getColumn());
    }

    @Test
    public void tokenPositionsTrackLines() throws Exception {
        Scanner sc = new Scanner("read a;\n  write a");
        sc.consume(TokenKind.READ);
        sc.consume(TokenKind.ID);
        sc.consume(TokenKind.SEM);
        Token tok = sc.getCurrentToken();
        assertEquals(TokenKind.WRITE, tok.getKind());
        assertEquals(2, tok.getPosition().getLine());
        assertEquals(3, tok.getPosition().getColumn());
        assertEquals(10, tok.getPosition().getCharacterIndex());
        assertEquals(10, sc.getIndex());
    }

    @Test
    public void lookaheadHasNoSideEffects() throws Exception {
        Scanner sc = new Scanner("do end");
        assertEquals(TokenKind.DO, sc.lookahead());
        assertEquals(TokenKind.DO, sc.lookahead());
        sc.consume(TokenKind.DO);
        assertEquals(TokenKind.END, sc.lookahead());
        assertFalse(sc.isAtEnd());
    }

    @Test
    public void readsFromReader() throws Exception {
        Scanner sc = new Scanner(new StringReader("write 7"));
        assertEquals(TokenKind.WRITE, sc.lookahead());
        assertEquals("write 7", sc.getInput());
    }

    @Test
    public void nextReturnsNullAtEnd() throws Exception {
        Scanner sc = new Scanner("x");
        assertEquals(TokenKind.ID, sc.next().getKind());
        assertNull(sc.next());
        assertNull(sc.next());
    }

}
