package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable assignment of truth values to a finite set of variable names.
 * <p>
 * Valuations produced by the enumerator are total over the variables of the query and keep
 * those variables in enumeration order. {@link #of(Map)} builds hand-made valuations, which
 * may be partial; evaluating a formula against a valuation that misses one of its variables
 * fails with {@link UndefinedVariableException}.
 * </p>
 *
 * <p>Equality is the equality of the underlying mappings, regardless of order.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Valuation {

    private static final Valuation EMPTY = new Valuation(new LinkedHashMap<>());

    private final Map<String, Boolean> values;

    private Valuation(LinkedHashMap<String, Boolean> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Creates a valuation from a mapping. Iteration order of the mapping is kept.
     *
     * @param values variable names to truth values, no {@code null} key or value
     * @return an immutable valuation
     * @throws NullPointerException if the mapping or one of its entries is {@code null}
     */
    public static Valuation of(Map<String, Boolean> values) {
        Objects.requireNonNull(values, "values");
        LinkedHashMap<String, Boolean> copy = new LinkedHashMap<>(values.size() * 2);
        values.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "variable name"),
                Objects.requireNonNull(value, "value of " + name)));
        return new Valuation(copy);
    }

    /**
     * Creates the valuation assigning {@code bits[i]} to {@code variables.get(i)}.
     *
     * @param variables ordered variable names
     * @param bits      truth values, same length as {@code variables}
     * @return an immutable valuation
     */
    public static Valuation of(List<String> variables, boolean[] bits) {
        if (variables.size() != bits.length) {
            throw new IllegalArgumentException(String.format(
                    "Expected %d values, got %d", variables.size(), bits.length));
        }
        LinkedHashMap<String, Boolean> map = new LinkedHashMap<>(variables.size() * 2);
        for (int i = 0; i < bits.length; i++) {
            map.put(variables.get(i), bits[i]);
        }
        return new Valuation(map);
    }

    /**
     * @return the valuation over no variable
     */
    public static Valuation empty() {
        return EMPTY;
    }

    /**
     * Returns the value assigned to a variable.
     *
     * @param name the variable name
     * @return its truth value
     * @throws UndefinedVariableException if the variable is not assigned
     */
    public boolean valueOf(String name) {
        Boolean value = values.get(name);
        if (value == null) {
            throw new UndefinedVariableException(name);
        }
        return value;
    }

    public boolean isDefined(String name) {
        return values.containsKey(name);
    }

    /**
     * @return the assigned variables, in assignment order
     */
    public List<String> variables() {
        return List.copyOf(values.keySet());
    }

    public int size() {
        return values.size();
    }

    /**
     * @return an unmodifiable view of the assignment
     */
    public Map<String, Boolean> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Valuation other)) return false;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
