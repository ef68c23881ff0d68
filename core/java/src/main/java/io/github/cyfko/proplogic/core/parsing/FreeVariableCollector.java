package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.api.ExpressionVisitor;
import io.github.cyfko.proplogic.core.model.Expression;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Collects the names of the variables occurring in one or more expressions.
 * <p>
 * Names are returned in lexicographic order, which is the variable order used by every
 * enumeration so that results are reproducible.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class FreeVariableCollector implements ExpressionVisitor<Void> {

    private final SortedSet<String> names;

    private FreeVariableCollector(SortedSet<String> names) {
        this.names = names;
    }

    /**
     * @param expression the formula to inspect
     * @return an unmodifiable, sorted set of its variable names
     */
    public static SortedSet<String> collect(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        SortedSet<String> names = new TreeSet<>();
        expression.accept(new FreeVariableCollector(names));
        return Collections.unmodifiableSortedSet(names);
    }

    /**
     * @param expressions the formulas to inspect
     * @return an unmodifiable, sorted union of their variable names
     */
    public static SortedSet<String> collectAll(Collection<? extends Expression> expressions) {
        Objects.requireNonNull(expressions, "expressions");
        SortedSet<String> names = new TreeSet<>();
        FreeVariableCollector collector = new FreeVariableCollector(names);
        for (Expression expression : expressions) {
            Objects.requireNonNull(expression, "expression").accept(collector);
        }
        return Collections.unmodifiableSortedSet(names);
    }

    @Override
    public Void visitVar(Expression.Var var) {
        names.add(var.name());
        return null;
    }

    @Override
    public Void visitNot(Expression.Not not) {
        return not.child().accept(this);
    }

    @Override
    public Void visitAnd(Expression.And and) {
        return visitBoth(and.left(), and.right());
    }

    @Override
    public Void visitOr(Expression.Or or) {
        return visitBoth(or.left(), or.right());
    }

    @Override
    public Void visitImplies(Expression.Implies implies) {
        return visitBoth(implies.left(), implies.right());
    }

    @Override
    public Void visitIff(Expression.Iff iff) {
        return visitBoth(iff.left(), iff.right());
    }

    private Void visitBoth(Expression left, Expression right) {
        left.accept(this);
        return right.accept(this);
    }
}
