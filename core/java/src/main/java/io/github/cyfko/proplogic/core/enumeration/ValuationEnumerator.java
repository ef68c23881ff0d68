package io.github.cyfko.proplogic.core.enumeration;

import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Valuation;
import io.github.cyfko.proplogic.core.parsing.FreeVariableCollector;

import java.util.Collection;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy, restartable enumeration of every total {@link Valuation} over an ordered list of
 * variables.
 *
 * <h2>Canonical Order</h2>
 * <p>
 * For n variables, the integers {@code 0 .. 2^n - 1} are visited in increasing order. Index
 * {@code i} assigns to the k-th variable (0-based) the bit {@code n - 1 - k} of {@code i}: the
 * first variable is the most significant bit and {@code false} comes before {@code true}.
 * </p>
 * <pre>{@code
 * new ValuationEnumerator(List.of("A", "B"))
 * // {A=false, B=false}, {A=false, B=true}, {A=true, B=false}, {A=true, B=true}
 * }</pre>
 * <p>
 * With no variable, exactly one valuation (the empty one) is produced.
 * </p>
 *
 * <h2>Capacity</h2>
 * <p>
 * The counter is a {@code long}, so at most {@link #MAX_VARIABLES} variables can be enumerated.
 * That bound is far beyond what completes in practice; callers bound the variable count through
 * {@link io.github.cyfko.proplogic.core.config.VerifierPolicy}.
 * </p>
 *
 * <p>
 * Each call to {@link #iterator()} starts a fresh, independent pass. Instances are immutable and
 * may be shared; iterators may not.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ValuationEnumerator implements Iterable<Valuation> {

    /**
     * Largest number of variables whose 2<sup>n</sup> valuations fit a {@code long} counter.
     */
    public static final int MAX_VARIABLES = 62;

    private final List<String> variables;

    /**
     * @param variables ordered variable names, without duplicates
     * @throws IllegalArgumentException if a name is repeated or more than {@link #MAX_VARIABLES} are given
     * @throws NullPointerException     if the list or one of its names is {@code null}
     */
    public ValuationEnumerator(List<String> variables) {
        Objects.requireNonNull(variables, "variables");
        if (variables.size() > MAX_VARIABLES) {
            throw new IllegalArgumentException(String.format(
                    "Cannot enumerate %d variables (max: %d)", variables.size(), MAX_VARIABLES));
        }
        Set<String> seen = new HashSet<>();
        for (String name : variables) {
            if (!seen.add(Objects.requireNonNull(name, "variable name"))) {
                throw new IllegalArgumentException("Duplicate variable '" + name + "'");
            }
        }
        this.variables = List.copyOf(variables);
    }

    /**
     * Builds the enumerator over the lexicographically sorted union of the free variables of
     * the given expressions.
     *
     * @param expressions the formulas of a query
     * @return the enumerator for that query
     */
    public static ValuationEnumerator over(Collection<? extends Expression> expressions) {
        return new ValuationEnumerator(List.copyOf(FreeVariableCollector.collectAll(expressions)));
    }

    public List<String> variables() {
        return variables;
    }

    /**
     * @return the number of valuations produced, {@code 2^n}
     */
    public long size() {
        return 1L << variables.size();
    }

    @Override
    public Iterator<Valuation> iterator() {
        return new CanonicalIterator();
    }

    /**
     * @return a sequential stream over a fresh pass
     */
    public Stream<Valuation> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public String toString() {
        return "ValuationEnumerator" + variables;
    }

    private final class CanonicalIterator implements Iterator<Valuation> {
        private final long end = size();
        private long next;

        @Override
        public boolean hasNext() {
            return next < end;
        }

        @Override
        public Valuation next() {
            if (next >= end) {
                throw new NoSuchElementException();
            }
            int n = variables.size();
            boolean[] bits = new boolean[n];
            for (int k = 0; k < n; k++) {
                bits[k] = ((next >>> (n - 1 - k)) & 1L) == 1L;
            }
            next++;
            return Valuation.of(variables, bits);
        }
    }
}
