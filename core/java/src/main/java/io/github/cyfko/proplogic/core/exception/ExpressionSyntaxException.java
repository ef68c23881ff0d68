package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.impl.BasicExpressionParser;

import java.util.Objects;

/**
 * Exception thrown when a propositional expression cannot be tokenized or parsed.
 * <p>
 * Every instance carries a {@link SyntaxErrorKind} and the zero-based character position at
 * which the problem was detected, so that callers can point at the faulty part of the input.
 * There is no recovery: the first error aborts the parse.
 * </p>
 *
 * <p><strong>Error Examples and Messages:</strong></p>
 * <pre>{@code
 * parser.parse("");
 * // → EMPTY_EXPRESSION: "Expression cannot be null or empty"
 *
 * parser.parse("(A & B");
 * // → UNMATCHED_PARENTHESIS: "Unmatched '(' at position 0"
 *
 * parser.parse("A &");
 * // → UNEXPECTED_END_OF_INPUT: "Unexpected end of input at position 3, expected a variable, '~' or '('"
 *
 * parser.parse("A B");
 * // → UNEXPECTED_TOKEN: "Unexpected token 'B' at position 2"
 *
 * parser.parse("A # B");
 * // → INVALID_TOKEN: "Invalid token '#' at position 2"
 * }</pre>
 *
 * <p><strong>Handling:</strong></p>
 * <pre>{@code
 * try {
 *     Expression expr = parser.parse(userInput);
 * } catch (ExpressionSyntaxException e) {
 *     log.warning("Rejected formula (" + e.getKind() + "): " + e.getMessage());
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ExpressionParser
 * @see BasicExpressionParser
 */
public class ExpressionSyntaxException extends RuntimeException {

    private final SyntaxErrorKind kind;
    private final int position;

    /**
     * Creates a syntax exception.
     *
     * @param kind     the failure classification, never {@code null}
     * @param position zero-based character position of the failure
     * @param message  description of the failure
     */
    public ExpressionSyntaxException(SyntaxErrorKind kind, int position, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = position;
    }

    /**
     * Creates a syntax exception wrapping an underlying cause.
     *
     * @param kind     the failure classification, never {@code null}
     * @param position zero-based character position of the failure
     * @param message  description of the failure
     * @param cause    the original cause
     */
    public ExpressionSyntaxException(SyntaxErrorKind kind, int position, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.position = position;
    }

    public SyntaxErrorKind getKind() {
        return kind;
    }

    /**
     * @return position of the offending token, the end of the last token for end-of-input errors
     */
    public int getPosition() {
        return position;
    }
}
