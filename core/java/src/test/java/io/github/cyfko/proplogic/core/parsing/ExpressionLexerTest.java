package io.github.cyfko.proplogic.core.parsing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link ExpressionLexer}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@DisplayName("ExpressionLexer Tests")
class ExpressionLexerTest {

    private static List<TokenType> types(String source) {
        return ExpressionLexer.tokenize(source).stream().map(Token::type).toList();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "   \t\n "})
    @DisplayName("Should produce no token for blank input")
    void shouldProduceNoTokenForBlankInput(String source) {
        assertTrue(ExpressionLexer.tokenize(source).isEmpty());
    }

    @Test
    @DisplayName("Should recognize every operator and parenthesis")
    void shouldRecognizeEveryOperator() {
        assertEquals(
                List.of(TokenType.LEFT_PAREN, TokenType.NOT, TokenType.IDENTIFIER, TokenType.AND,
                        TokenType.IDENTIFIER, TokenType.OR, TokenType.IDENTIFIER, TokenType.RIGHT_PAREN,
                        TokenType.IMPLIES, TokenType.IDENTIFIER, TokenType.IFF, TokenType.IDENTIFIER),
                types("(~A & B | C) -> D <-> E"));
    }

    @Test
    @DisplayName("Should prefer '<->' over '->' and work without spaces")
    void shouldMatchLongestOperatorFirst() {
        List<Token> tokens = ExpressionLexer.tokenize("A<->B->C");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.IFF, TokenType.IDENTIFIER,
                TokenType.IMPLIES, TokenType.IDENTIFIER), tokens.stream().map(Token::type).toList());
        assertEquals("<->", tokens.get(1).text());
        assertEquals(1, tokens.get(1).position());
        assertEquals(5, tokens.get(3).position());
    }

    @Test
    @DisplayName("Should read maximal identifier runs with digits and underscores")
    void shouldReadMaximalIdentifiers() {
        List<Token> tokens = ExpressionLexer.tokenize("rain_today & _p1&Q2");

        assertEquals(4, tokens.size());
        assertEquals("rain_today", tokens.get(0).text());
        assertEquals("_p1", tokens.get(2).text());
        assertEquals(14, tokens.get(2).position());
        assertEquals("Q2", tokens.get(3).text());
    }

    @Test
    @DisplayName("Should keep identifiers case-sensitive")
    void shouldKeepCase() {
        List<Token> tokens = ExpressionLexer.tokenize("a A");

        assertEquals("a", tokens.get(0).text());
        assertEquals("A", tokens.get(1).text());
    }

    @Test
    @DisplayName("Should pass unknown characters through one at a time")
    void shouldPassUnknownCharactersThrough() {
        List<Token> tokens = ExpressionLexer.tokenize("A # 1B");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.UNKNOWN, TokenType.UNKNOWN, TokenType.IDENTIFIER),
                tokens.stream().map(Token::type).toList());
        assertEquals("#", tokens.get(1).text());
        assertEquals(2, tokens.get(1).position());
        assertEquals("1", tokens.get(2).text());
        assertEquals("B", tokens.get(3).text());
    }

    @Test
    @DisplayName("Should split a lone '<' and '-' into unknown tokens")
    void shouldRejectPartialArrows() {
        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.UNKNOWN, TokenType.UNKNOWN, TokenType.IDENTIFIER),
                types("A <- B"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\u00A0", "\u202F", "\u2007", "\u3000", "\u001C"})
    @DisplayName("Should skip Unicode space separators like ordinary whitespace")
    void shouldSkipUnicodeSpaces(String space) {
        List<Token> tokens = ExpressionLexer.tokenize("A" + space + "&" + space + "B");

        assertEquals(List.of(TokenType.IDENTIFIER, TokenType.AND, TokenType.IDENTIFIER),
                tokens.stream().map(Token::type).toList());
        assertEquals(2, tokens.get(1).position());
        assertTrue(ExpressionLexer.tokenize(space + space).isEmpty());
    }

    @Test
    @DisplayName("Should reject null source")
    void shouldRejectNullSource() {
        assertThrows(NullPointerException.class, () -> ExpressionLexer.tokenize(null));
    }
}
