package io.github.cyfko.proplogic.core.parsing;

/**
 * Lexical categories of the propositional language.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum TokenType {
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    NOT("~"),
    AND("&"),
    OR("|"),
    IMPLIES("->"),
    IFF("<->"),
    IDENTIFIER(null),
    /** Any other non-whitespace character, kept so the parser can reject it precisely. */
    UNKNOWN(null);

    private final String symbol;

    TokenType(String symbol) {
        this.symbol = symbol;
    }

    /**
     * @return the fixed spelling of this token, {@code null} for identifiers and unknown characters
     */
    public String symbol() {
        return symbol;
    }
}
