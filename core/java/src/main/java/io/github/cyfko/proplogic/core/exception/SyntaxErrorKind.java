package io.github.cyfko.proplogic.core.exception;

/**
 * Classification of the failures reported by {@link ExpressionSyntaxException}.
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum SyntaxErrorKind {
    /** The source is null, empty or contains only whitespace. */
    EMPTY_EXPRESSION,
    /** A well-formed token appears where the grammar does not allow it. */
    UNEXPECTED_TOKEN,
    /** The input ended while a token was still required. */
    UNEXPECTED_END_OF_INPUT,
    /** A '(' without its ')' or a ')' without its '('. */
    UNMATCHED_PARENTHESIS,
    /** A character that is neither an operator, a parenthesis nor part of an identifier. */
    INVALID_TOKEN
}
