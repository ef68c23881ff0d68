package io.github.cyfko.proplogic.core.config;

import java.util.regex.Pattern;

/**
 * Pre-compiled patterns for propositional variable identifiers.
 * <p>
 * Identifiers start with a letter or underscore, followed by letters, digits or underscores.
 * They are case-sensitive and have no length limit.
 * Example valid: "A", "rain_today", "_p1". Example invalid: "1p", "p-q".
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public abstract class PatternConfig {
    private PatternConfig() {}

    public static final String IDENTIFIER_FORM = "[A-Za-z_][A-Za-z0-9_]*";

    /**
     * Matches a whole string that is a valid identifier.
     */
    public static final Pattern IDENTIFIER_PATTERN = Pattern.compile("^" + IDENTIFIER_FORM + "$");

    public static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    public static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
