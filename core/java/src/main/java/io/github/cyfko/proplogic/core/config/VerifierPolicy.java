package io.github.cyfko.proplogic.core.config;

import io.github.cyfko.proplogic.core.enumeration.ValuationEnumerator;

/**
 * Bounds applied by the enumeration-based verifier.
 * <p>
 * Every decision enumerates 2<sup>v</sup> valuations for v free variables. The verifier makes
 * no attempt to avoid that blow-up, so the caller bounds v here.
 * </p>
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxVariables</strong>: Maximum number of distinct variables in one query (default: 24)</li>
 *   <li><strong>defaultMaxModels</strong>: Model cap used when none is given to
 *       {@code isSatisfiable} (default: 10)</li>
 * </ul>
 *
 * <pre>{@code
 * VerifierPolicy policy = VerifierPolicy.builder()
 *     .maxVariables(20)
 *     .defaultMaxModels(5)
 *     .build();
 * }</pre>
 *
 * @param policyName       name reported in limit violations
 * @param maxVariables     maximum number of free variables per query, at most
 *                         {@link ValuationEnumerator#MAX_VARIABLES}
 * @param defaultMaxModels model cap for satisfiability queries without an explicit cap
 * @author Frank KOSSI
 * @since 1.0
 */
public record VerifierPolicy(
    String policyName,
    int maxVariables,
    int defaultMaxModels
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a bound is out of range
     */
    public VerifierPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxVariables < 0 || maxVariables > ValuationEnumerator.MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "maxVariables must be between 0 and %d, got: %d", ValuationEnumerator.MAX_VARIABLES, maxVariables));
        }
        if (defaultMaxModels <= 0) {
            throw new IllegalArgumentException("defaultMaxModels must be positive, got: " + defaultMaxModels);
        }
    }

    /**
     * At most 24 variables (about 16 million valuations), 10 models by default.
     *
     * @return default configuration
     */
    public static VerifierPolicy defaults() {
        return new VerifierPolicy(PolicyName.DEFAULT_POLICY.name(), 24, 10);
    }

    /**
     * At most 16 variables, 10 models by default.
     *
     * @return strict configuration
     */
    public static VerifierPolicy strict() {
        return new VerifierPolicy(PolicyName.STRICT_POLICY.name(), 16, 10);
    }

    /**
     * Up to the enumerator capacity. A query near that bound does not finish in practice.
     *
     * @return relaxed configuration
     */
    public static VerifierPolicy relaxed() {
        return new VerifierPolicy(PolicyName.RELAXED_POLICY.name(), ValuationEnumerator.MAX_VARIABLES, 10);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxVariables = 24;
        private int _defaultMaxModels = 10;

        private Builder() {}

        public VerifierPolicy build() {
            return new VerifierPolicy(_policyName, _maxVariables, _defaultMaxModels);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxVariables(int maxVariables) { this._maxVariables = maxVariables; return this; }
        public Builder defaultMaxModels(int defaultMaxModels) { this._defaultMaxModels = defaultMaxModels; return this; }
    }
}
