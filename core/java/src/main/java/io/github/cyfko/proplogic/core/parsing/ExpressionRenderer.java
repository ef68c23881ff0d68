package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.api.ExpressionVisitor;
import io.github.cyfko.proplogic.core.model.Expression;

import java.util.Objects;

/**
 * Renders an {@link Expression} in fully parenthesized infix form.
 * <p>
 * Every connective is wrapped in parentheses: {@code (~A)}, {@code (A & B)}, {@code (A | B)},
 * {@code (A -> B)}, {@code (A <-> B)}. The output parses back to an equal tree, although it
 * usually differs textually from the original source.
 * </p>
 *
 * <pre>{@code
 * ExpressionRenderer.render(parser.parse("~A & B -> C"));  // "(((~A) & B) -> C)"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class ExpressionRenderer implements ExpressionVisitor<StringBuilder> {

    private final StringBuilder out = new StringBuilder();

    private ExpressionRenderer() {}

    public static String render(Expression expression) {
        Objects.requireNonNull(expression, "expression");
        return expression.accept(new ExpressionRenderer()).toString();
    }

    @Override
    public StringBuilder visitVar(Expression.Var var) {
        return out.append(var.name());
    }

    @Override
    public StringBuilder visitNot(Expression.Not not) {
        out.append("(~");
        not.child().accept(this);
        return out.append(')');
    }

    @Override
    public StringBuilder visitAnd(Expression.And and) {
        return binary(and.left(), TokenType.AND, and.right());
    }

    @Override
    public StringBuilder visitOr(Expression.Or or) {
        return binary(or.left(), TokenType.OR, or.right());
    }

    @Override
    public StringBuilder visitImplies(Expression.Implies implies) {
        return binary(implies.left(), TokenType.IMPLIES, implies.right());
    }

    @Override
    public StringBuilder visitIff(Expression.Iff iff) {
        return binary(iff.left(), TokenType.IFF, iff.right());
    }

    private StringBuilder binary(Expression left, TokenType operator, Expression right) {
        out.append('(');
        left.accept(this);
        out.append(' ').append(operator.symbol()).append(' ');
        right.accept(this);
        return out.append(')');
    }
}
