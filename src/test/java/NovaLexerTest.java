import com.nova.script.parser.LexError;
import com.nova.script.parser.Lexer;
import com.nova.script.parser.Token;
import com.nova.script.parser.TokenType;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class NovaLexerTest {

    @Test
    void simpleSum_isExactlyThreeTokens() {
        List<Token> tokens = new Lexer("5+3").tokenize();

        assertEquals(3, tokens.size());
        assertEquals(TokenType.NUMBER, tokens.get(0).type);
        assertEquals(5L, tokens.get(0).literal);
        assertTrue(tokens.get(1).is(TokenType.OPERATOR, "+"));
        assertEquals(TokenType.NUMBER, tokens.get(2).type);
        assertEquals(3L, tokens.get(2).literal);
    }

    @Test
    void decimalsBecomeDoubles() {
        List<Token> tokens = new Lexer("3.25").tokenize();
        assertEquals(1, tokens.size());
        assertEquals(3.25, tokens.get(0).literal);
    }

    @Test
    void twoCharOperatorsAreSingleTokens() {
        List<Token> tokens = new Lexer("a == b != c <= d >= e").tokenize();
        assertEquals("==", tokens.get(1).lexeme);
        assertEquals("!=", tokens.get(3).lexeme);
        assertEquals("<=", tokens.get(5).lexeme);
        assertEquals(">=", tokens.get(7).lexeme);
    }

    @Test
    void commentsAndWhitespaceAreSkipped() {
        List<Token> tokens = new Lexer("put 1 // trailing\n\t put 2").tokenize();
        assertEquals(4, tokens.size());
        assertEquals(2, tokens.get(2).line);
    }

    @Test
    void textLiteral_keepsContentWithoutQuotes() {
        List<Token> tokens = new Lexer("put \"hello world\";").tokenize();
        assertEquals(TokenType.TEXT, tokens.get(1).type);
        assertEquals("hello world", tokens.get(1).literal);
        assertEquals(TokenType.SEMICOLON, tokens.get(2).type);
    }

    @Test
    void positionsTrackLineAndColumn() {
        List<Token> tokens = new Lexer("have x = 1\n  put x").tokenize();
        Token put = tokens.get(4);
        assertEquals("put", put.lexeme);
        assertEquals(2, put.line);
        assertEquals(3, put.column);
        assertEquals("2:3", put.position());
    }

    @Test
    void unknownCharacter_reportsPositionAndCharacter() {
        LexError e = assertThrows(LexError.class, () -> new Lexer("have x = 1 @ 2").tokenize());
        assertEquals('@', e.character());
        assertEquals(11, e.position());
        assertTrue(e.getMessage().startsWith("[line 1:12]"));
    }

    @Test
    void loneBang_isRejected() {
        LexError e = assertThrows(LexError.class, () -> new Lexer("!x").tokenize());
        assertEquals('!', e.character());
    }

    @Test
    void unterminatedText_failsAtOpeningQuote() {
        LexError e = assertThrows(LexError.class, () -> new Lexer("put \"oops").tokenize());
        assertEquals(4, e.position());
        assertEquals('"', e.character());
    }

    @Test
    void hugeIntegerLiteral_isALexError() {
        assertThrows(LexError.class, () -> new Lexer("99999999999999999999").tokenize());
    }

    @Test
    void emptySource_hasNoTokens() {
        assertTrue(new Lexer("").tokenize().isEmpty());
        assertTrue(new Lexer("   // only a comment").tokenize().isEmpty());
    }
}
