package io.github.cyfko.proplogic.core.config;

/**
 * Names of the preset policies.
 *
 * @since 1.0
 */
public enum PolicyName {
    DEFAULT_POLICY,
    STRICT_POLICY,
    RELAXED_POLICY,
    CUSTOM_POLICY
}
