package io.github.cyfko.proplogic.core.config;

/**
 * Complexity limits applied by the expression parser.
 *
 * <h2>Configurable Limits</h2>
 * <ul>
 *   <li><strong>maxExpressionLength</strong>: Maximum character length of the trimmed source (default: 5000)</li>
 *   <li><strong>maxNestingDepth</strong>: Maximum height of the parsed tree, every operator counting one level (default: 200).
 *       Parentheses may nest twice as deep.</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * ParserPolicy policy = ParserPolicy.defaults();
 * ParserPolicy policy = ParserPolicy.strict();   // untrusted input
 * ParserPolicy policy = ParserPolicy.relaxed();  // generated formulas
 *
 * ParserPolicy policy = ParserPolicy.builder()
 *     .maxNestingDepth(100)
 *     .build();
 * }</pre>
 *
 * @param policyName          name reported in limit violations
 * @param maxExpressionLength maximum character length of the expression
 * @param maxNestingDepth     maximum height of a parsed expression tree
 * @author Frank KOSSI
 * @since 1.0
 */
public record ParserPolicy(
    String policyName,
    int maxExpressionLength,
    int maxNestingDepth
) {

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if the name is blank or a limit is not positive
     */
    public ParserPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (maxExpressionLength <= 0) {
            throw new IllegalArgumentException("maxExpressionLength must be positive, got: " + maxExpressionLength);
        }
        if (maxNestingDepth <= 0) {
            throw new IllegalArgumentException("maxNestingDepth must be positive, got: " + maxNestingDepth);
        }
    }

    /**
     * Balanced limits for most uses.
     * <ul>
     *   <li>Max Expression Length: 5000 characters</li>
     *   <li>Max Nesting Depth: 200</li>
     * </ul>
     *
     * @return default configuration
     */
    public static ParserPolicy defaults() {
        return new ParserPolicy(PolicyName.DEFAULT_POLICY.name(), 5000, 200);
    }

    /**
     * Tight limits for formulas coming from untrusted sources.
     * <ul>
     *   <li>Max Expression Length: 1000 characters</li>
     *   <li>Max Nesting Depth: 50</li>
     * </ul>
     *
     * @return strict configuration
     */
    public static ParserPolicy strict() {
        return new ParserPolicy(PolicyName.STRICT_POLICY.name(), 1000, 50);
    }

    /**
     * Generous limits for trusted or generated formulas.
     * <ul>
     *   <li>Max Expression Length: 20000 characters</li>
     *   <li>Max Nesting Depth: 400</li>
     * </ul>
     *
     * @return relaxed configuration
     */
    public static ParserPolicy relaxed() {
        return new ParserPolicy(PolicyName.RELAXED_POLICY.name(), 20000, 400);
    }

    /**
     * Builder initialized with the {@link #defaults()} limits.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private int _maxExpressionLength = 5000;
        private int _maxNestingDepth = 200;

        private Builder() {}

        public ParserPolicy build() {
            return new ParserPolicy(_policyName, _maxExpressionLength, _maxNestingDepth);
        }

        public Builder policyName(String policyName) { this._policyName = policyName; return this; }
        public Builder maxExpressionLength(int maxExpressionLength) { this._maxExpressionLength = maxExpressionLength; return this; }
        public Builder maxNestingDepth(int maxNestingDepth) { this._maxNestingDepth = maxNestingDepth; return this; }
    }
}
