package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.model.Expression;

/**
 * Visitor over the closed set of {@link Expression} variants.
 * <p>
 * One method per variant: adding a variant to {@link Expression} adds a method here, and every
 * operation written as a visitor (evaluation, free-variable collection, rendering) then fails
 * to compile until it handles the new case.
 * </p>
 *
 * <pre>{@code
 * int depth = expr.accept(new ExpressionVisitor<Integer>() {
 *     public Integer visitVar(Expression.Var var) { return 1; }
 *     public Integer visitNot(Expression.Not not) { return 1 + not.child().accept(this); }
 *     // ... one method per binary connective
 * });
 * }</pre>
 *
 * @param <R> result type of the traversal
 * @author Frank KOSSI
 * @since 1.0
 */
public interface ExpressionVisitor<R> {

    R visitVar(Expression.Var var);

    R visitNot(Expression.Not not);

    R visitAnd(Expression.And and);

    R visitOr(Expression.Or or);

    R visitImplies(Expression.Implies implies);

    R visitIff(Expression.Iff iff);
}
