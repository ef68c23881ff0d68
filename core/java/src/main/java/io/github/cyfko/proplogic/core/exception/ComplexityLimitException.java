package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.config.VerifierPolicy;

/**
 * Exception thrown when an input exceeds a bound configured by a {@link ParserPolicy} or a
 * {@link VerifierPolicy}.
 * <p>
 * Enumeration costs 2<sup>v</sup> evaluations for v free variables, so callers bound v (and
 * the size of the source text) through policies rather than letting a query run unbounded.
 * </p>
 *
 * <pre>{@code
 * // → "Too many variables (30, max: 24). Policy applied: DEFAULT_POLICY"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class ComplexityLimitException extends RuntimeException {

    /**
     * @param message description of the exceeded bound
     */
    public ComplexityLimitException(String message) {
        super(message);
    }
}
