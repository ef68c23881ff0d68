package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.api.ExpressionVisitor;
import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.model.Valuation;

import java.util.Objects;

/**
 * Computes the truth value of an {@link Expression} under a {@link Valuation}.
 * <p>
 * Both operands of a binary connective are always evaluated, so a valuation missing any
 * variable of the formula is reported even when the other operand would decide the result.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExpressionEvaluator implements ExpressionVisitor<Boolean> {

    private final Valuation valuation;

    private ExpressionEvaluator(Valuation valuation) {
        this.valuation = valuation;
    }

    /**
     * @param expression the formula to evaluate
     * @param valuation  an assignment covering every variable of the formula
     * @return the truth value of the formula
     * @throws UndefinedVariableException if a variable of the formula is not assigned
     */
    public static boolean evaluate(Expression expression, Valuation valuation) {
        Objects.requireNonNull(expression, "expression");
        Objects.requireNonNull(valuation, "valuation");
        return expression.accept(new ExpressionEvaluator(valuation));
    }

    @Override
    public Boolean visitVar(Expression.Var var) {
        return valuation.valueOf(var.name());
    }

    @Override
    public Boolean visitNot(Expression.Not not) {
        return !not.child().accept(this);
    }

    @Override
    public Boolean visitAnd(Expression.And and) {
        boolean left = and.left().accept(this);
        boolean right = and.right().accept(this);
        return left & right;
    }

    @Override
    public Boolean visitOr(Expression.Or or) {
        boolean left = or.left().accept(this);
        boolean right = or.right().accept(this);
        return left | right;
    }

    @Override
    public Boolean visitImplies(Expression.Implies implies) {
        boolean left = implies.left().accept(this);
        boolean right = implies.right().accept(this);
        return !left | right;
    }

    @Override
    public Boolean visitIff(Expression.Iff iff) {
        boolean left = iff.left().accept(this);
        boolean right = iff.right().accept(this);
        return left == right;
    }
}
