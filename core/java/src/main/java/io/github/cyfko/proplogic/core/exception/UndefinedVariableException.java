package io.github.cyfko.proplogic.core.exception;

import io.github.cyfko.proplogic.core.model.Valuation;

/**
 * Exception thrown when an expression is evaluated against a {@link Valuation} that does not
 * assign one of its free variables.
 * <p>
 * The decision procedures always build total valuations, so this only surfaces when the
 * evaluator is called directly with a hand-built, incomplete valuation.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class UndefinedVariableException extends RuntimeException {

    private final String variableName;

    /**
     * @param variableName the variable missing from the valuation
     */
    public UndefinedVariableException(String variableName) {
        super(String.format("Variable '%s' is not assigned by the valuation", variableName));
        this.variableName = variableName;
    }

    public String getVariableName() {
        return variableName;
    }
}
