package io.github.cyfko.proplogic.core.model;

import io.github.cyfko.proplogic.core.api.ExpressionVisitor;
import io.github.cyfko.proplogic.core.config.PatternConfig;
import io.github.cyfko.proplogic.core.exception.UndefinedVariableException;
import io.github.cyfko.proplogic.core.parsing.ExpressionEvaluator;
import io.github.cyfko.proplogic.core.parsing.ExpressionRenderer;
import io.github.cyfko.proplogic.core.parsing.FreeVariableCollector;

import java.util.Objects;
import java.util.SortedSet;

/**
 * Immutable propositional formula.
 * <p>
 * The type is closed: a formula is a {@link Var} leaf or one of the five connectives
 * {@link Not}, {@link And}, {@link Or}, {@link Implies}, {@link Iff}. Every node owns its
 * children outright, so a formula is a finite tree without sharing or cycles. Variants are
 * records, hence two formulas are {@code equals} exactly when they have the same shape and
 * the same variable names.
 * </p>
 *
 * <h2>Semantics</h2>
 * <table border="1">
 * <caption>Connectives</caption>
 * <thead>
 * <tr><th>Variant</th><th>Symbol</th><th>Value</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Not</td><td>~</td><td>negation of the child</td></tr>
 * <tr><td>And</td><td>&amp;</td><td>both children true</td></tr>
 * <tr><td>Or</td><td>|</td><td>at least one child true</td></tr>
 * <tr><td>Implies</td><td>-&gt;</td><td>left false or right true</td></tr>
 * <tr><td>Iff</td><td>&lt;-&gt;</td><td>both children have the same value</td></tr>
 * </tbody>
 * </table>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Expression modusPonens = new Expression.Implies(new Expression.Var("A"), new Expression.Var("B"));
 * boolean value = modusPonens.evaluate(Valuation.of(Map.of("A", true, "B", false))); // false
 * String text = modusPonens.toString();                                             // "(A -> B)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ExpressionVisitor
 */
public sealed interface Expression
        permits Expression.Var, Expression.Not, Expression.And, Expression.Or, Expression.Implies, Expression.Iff {

    /**
     * Dispatches to the visitor method matching this variant.
     *
     * @param visitor the traversal to apply
     * @param <R>     result type of the traversal
     * @return the visitor's result for this node
     */
    <R> R accept(ExpressionVisitor<R> visitor);

    /**
     * Evaluates this formula under the given valuation.
     *
     * @param valuation an assignment covering every free variable of this formula
     * @return the truth value of this formula
     * @throws UndefinedVariableException if a free variable is not assigned
     */
    default boolean evaluate(Valuation valuation) {
        return ExpressionEvaluator.evaluate(this, valuation);
    }

    /**
     * @return the names of all variables occurring in this formula, in lexicographic order
     */
    default SortedSet<String> freeVariables() {
        return FreeVariableCollector.collect(this);
    }

    /**
     * Variable reference.
     *
     * @param name a case-sensitive identifier matching {@link PatternConfig#IDENTIFIER_PATTERN}
     */
    record Var(String name) implements Expression {
        public Var {
            Objects.requireNonNull(name, "name");
            if (!PatternConfig.IDENTIFIER_PATTERN.matcher(name).matches()) {
                throw new IllegalArgumentException("Invalid variable name '" + name + "'");
            }
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitVar(this);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * Negation.
     */
    record Not(Expression child) implements Expression {
        public Not {
            Objects.requireNonNull(child, "child");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitNot(this);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * Conjunction.
     */
    record And(Expression left, Expression right) implements Expression {
        public And {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitAnd(this);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * Disjunction.
     */
    record Or(Expression left, Expression right) implements Expression {
        public Or {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitOr(this);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * Material implication.
     */
    record Implies(Expression left, Expression right) implements Expression {
        public Implies {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitImplies(this);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }

    /**
     * Biconditional.
     */
    record Iff(Expression left, Expression right) implements Expression {
        public Iff {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R> R accept(ExpressionVisitor<R> visitor) {
            return visitor.visitIff(this);
        }

        @Override
        public String toString() {
            return ExpressionRenderer.render(this);
        }
    }
}
