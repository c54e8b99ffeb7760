import org.junit.jupiter.api.Test;

import com.rpal.script.ErrorKind;
import com.rpal.script.RpalRuntimeException;
import com.rpal.script.parser.Lexer;
import com.rpal.script.parser.Token;
import com.rpal.script.parser.TokenType;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RpalLexerTest {

    private static List<String> lexemes(List<Token> tokens) {
        List<String> out = new ArrayList<>();
        for (Token t : tokens) out.add(t.lexeme);
        return out;
    }

    private static List<TokenType> types(List<Token> tokens) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : tokens) out.add(t.getType());
        return out;
    }

    @Test
    void letProgram_tokensAndKinds() {
        List<Token> tokens = new Lexer("let X = 3 in X + 1").tokenize();

        assertEquals(List.of("let", "X", "=", "3", "in", "X", "+", "1", ""), lexemes(tokens));
        assertEquals(List.of(
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.INTEGER,
                TokenType.KEYWORD, TokenType.IDENTIFIER, TokenType.OPERATOR, TokenType.INTEGER,
                TokenType.EOF), types(tokens));
    }

    @Test
    void operators_maximalMunch() {
        List<Token> tokens = new Lexer("x->y|z**2>=1").tokenize();
        assertEquals(List.of("x", "->", "y", "|", "z", "**", "2", ">=", "1", ""), lexemes(tokens));
    }

    @Test
    void punctuation_isSeparateFromOperators() {
        List<Token> tokens = new Lexer("(a, b);").tokenize();
        assertEquals(List.of("(", "a", ",", "b", ")", ";", ""), lexemes(tokens));
        assertEquals(TokenType.PUNCTUATION, tokens.get(0).getType());
        assertEquals(TokenType.PUNCTUATION, tokens.get(2).getType());
    }

    @Test
    void comments_areDroppedAndLinesCounted() {
        List<Token> tokens = new Lexer("// leading comment\nx // trailing\n  y").tokenize();

        assertEquals(List.of("x", "y", ""), lexemes(tokens));
        assertEquals(2, tokens.get(0).line);
        assertEquals(3, tokens.get(1).line);
    }

    @Test
    void commentDirectlyAfterOperator_isNotPartOfOperator() {
        List<Token> tokens = new Lexer("a +// note\nb").tokenize();
        assertEquals(List.of("a", "+", "b", ""), lexemes(tokens));
    }

    @Test
    void strings_keepQuotesAndEscapes() {
        List<Token> tokens = new Lexer("'hi there' 'a\\nb'").tokenize();

        assertEquals(TokenType.STRING, tokens.get(0).getType());
        assertEquals("'hi there'", tokens.get(0).lexeme);
        assertEquals("'a\\nb'", tokens.get(1).lexeme);
    }

    @Test
    void identifiers_mayContainDigitsAndUnderscores() {
        List<Token> tokens = new Lexer("My_var2 letter").tokenize();

        assertEquals(TokenType.IDENTIFIER, tokens.get(0).getType());
        assertEquals("My_var2", tokens.get(0).lexeme);
        // keyword prefix does not make a keyword
        assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
    }

    @Test
    void reservedWords_areKeywords() {
        List<Token> tokens = new Lexer("where rec fn aug or not gr ge ls le eq ne true false nil dummy within and").tokenize();
        for (int i = 0; i < tokens.size() - 1; i++) {
            assertEquals(TokenType.KEYWORD, tokens.get(i).getType(), tokens.get(i).lexeme);
        }
    }

    @Test
    void digitsRunningIntoLetters_isSyntaxError() {
        RpalRuntimeException ex = assertThrows(RpalRuntimeException.class, () -> new Lexer("12abc").tokenize());
        assertEquals(ErrorKind.SYNTAX, ex.kind());
        assertTrue(ex.getMessage().contains("Invalid token"));
    }

    @Test
    void unterminatedString_isSyntaxError() {
        RpalRuntimeException ex = assertThrows(RpalRuntimeException.class, () -> new Lexer("x\n'abc").tokenize());
        assertEquals(ErrorKind.SYNTAX, ex.kind());
        assertTrue(ex.getMessage().contains("[line 2]"));
    }

    @Test
    void integerTooLarge_isSyntaxError() {
        RpalRuntimeException ex = assertThrows(RpalRuntimeException.class,
                () -> new Lexer("99999999999999999999").tokenize());
        assertEquals(ErrorKind.SYNTAX, ex.kind());
    }
}
