package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.config.PatternConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass tokenizer for propositional formulas.
 * <p>
 * Tokens are recognized longest match first:
 * </p>
 * <ol>
 *   <li>{@code <->} then {@code ->}</li>
 *   <li>the single characters {@code ( ) ~ & |}</li>
 *   <li>a maximal run matching {@code [A-Za-z_][A-Za-z0-9_]*}</li>
 *   <li>any other non-whitespace character, as an {@link TokenType#UNKNOWN} token</li>
 * </ol>
 * <p>
 * Whitespace, Unicode space separators such as U+00A0 included, separates tokens and is
 * otherwise ignored. The lexer never fails: unknown
 * characters are passed through so that the parser reports them with their position. Empty
 * or blank input yields an empty list.
 * </p>
 *
 * <pre>{@code
 * ExpressionLexer.tokenize("~A<->B");
 * // [NOT('~')@0, IDENTIFIER('A')@1, IFF('<->')@2, IDENTIFIER('B')@5]
 * }</pre>
 *
 * <p>This class is stateless and thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExpressionLexer {

    private ExpressionLexer() {}

    /**
     * Splits the source into tokens.
     *
     * @param source the formula text
     * @return the tokens in source order, empty for blank input
     * @throws NullPointerException if source is null
     */
    public static List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source");

        List<Token> tokens = new ArrayList<>();
        int length = source.length();
        int i = 0;

        while (i < length) {
            char c = source.charAt(i);

            if (isSeparator(c)) {
                i++;
                continue;
            }

            if (source.startsWith("<->", i)) {
                tokens.add(new Token(TokenType.IFF, "<->", i));
                i += 3;
                continue;
            }
            if (source.startsWith("->", i)) {
                tokens.add(new Token(TokenType.IMPLIES, "->", i));
                i += 2;
                continue;
            }

            TokenType single = switch (c) {
                case '(' -> TokenType.LEFT_PAREN;
                case ')' -> TokenType.RIGHT_PAREN;
                case '~' -> TokenType.NOT;
                case '&' -> TokenType.AND;
                case '|' -> TokenType.OR;
                default -> null;
            };
            if (single != null) {
                tokens.add(new Token(single, String.valueOf(c), i));
                i++;
                continue;
            }

            if (PatternConfig.isIdentifierStart(c)) {
                int start = i;
                while (i < length && PatternConfig.isIdentifierPart(source.charAt(i))) {
                    i++;
                }
                tokens.add(new Token(TokenType.IDENTIFIER, source.substring(start, i), start));
                continue;
            }

            // Surrogate pairs stay a single unknown token
            int width = Character.charCount(source.codePointAt(i));
            tokens.add(new Token(TokenType.UNKNOWN, source.substring(i, i + width), i));
            i += width;
        }

        return tokens;
    }

    private static boolean isSeparator(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }
}
