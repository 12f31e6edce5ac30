import org.junit.jupiter.api.Test;

import com.rapcode.script.parser.ErrorKind;
import com.rapcode.script.parser.Lexer;
import com.rapcode.script.parser.RapcodeException;
import com.rapcode.script.parser.Token;
import com.rapcode.script.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RapcodeLexerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Lexer(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void keywords_areCaseInsensitive() {
        assertEquals(
                List.of(TokenType.IF, TokenType.NOT, TokenType.TRUE, TokenType.THEN, TokenType.ENDIF, TokenType.EOF),
                types("if Not true Then endif"));
    }

    @Test
    void assignmentAndComparisonOperators() {
        assertEquals(
                List.of(TokenType.IDENTIFIER, TokenType.ASSIGN, TokenType.IDENTIFIER, TokenType.EQUAL,
                        TokenType.NUMBER, TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL,
                        TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL, TokenType.LESS, TokenType.GREATER,
                        TokenType.EOF),
                types("x := y = 1 == != <= >= < >"));
    }

    @Test
    void commentsAreSkipped() {
        assertEquals(
                List.of(TokenType.OUTPUT, TokenType.NUMBER, TokenType.OUTPUT, TokenType.NUMBER, TokenType.EOF),
                types("OUTPUT 1 // trailing\n# whole line\nOUTPUT 2"));
    }

    @Test
    void numberAndStringLiterals() {
        List<Token> tokens = new Lexer("3.25 \"hi there\"").tokenize();
        assertEquals(TokenType.NUMBER, tokens.get(0).type);
        assertEquals("3.25", tokens.get(0).lexeme);
        assertEquals(TokenType.STRING, tokens.get(1).type);
        assertEquals("\"hi there\"", tokens.get(1).lexeme);
    }

    @Test
    void tracksLineAndColumn() {
        List<Token> tokens = new Lexer("x := 1\n  OUTPUT x").tokenize();
        Token output = tokens.get(3);
        assertEquals(TokenType.OUTPUT, output.type);
        assertEquals(2, output.line);
        assertEquals(3, output.column);
    }

    @Test
    void unterminatedString_isLexicalError() {
        RapcodeException ex = assertThrows(RapcodeException.class, () -> new Lexer("OUTPUT \"oops").tokenize());
        assertEquals(ErrorKind.LEXICAL, ex.kind());
        assertEquals(1, ex.line());
        assertEquals(8, ex.column());
    }

    @Test
    void strayCharacters_areLexicalErrors() {
        assertEquals(ErrorKind.LEXICAL,
                assertThrows(RapcodeException.class, () -> new Lexer("x : 1").tokenize()).kind());
        assertEquals(ErrorKind.LEXICAL,
                assertThrows(RapcodeException.class, () -> new Lexer("!x").tokenize()).kind());
        RapcodeException ex = assertThrows(RapcodeException.class, () -> new Lexer("x := 1 @ 2").tokenize());
        assertTrue(ex.getMessage().startsWith("[Lexical error] line 1:8: "), ex.getMessage());
    }

    @Test
    void isKeyword_ignoresCase() {
        assertTrue(Lexer.isKeyword("endloop"));
        assertTrue(Lexer.isKeyword("SET"));
        assertFalse(Lexer.isKeyword("counter"));
    }
}
