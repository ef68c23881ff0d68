package io.github.cyfko.proplogic.core.parsing;

import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.ExpressionSyntaxException;
import io.github.cyfko.proplogic.core.exception.SyntaxErrorKind;
import io.github.cyfko.proplogic.core.model.Expression;

import java.util.List;
import java.util.Objects;

/**
 * Recursive-descent parser building an {@link Expression} from a token sequence.
 *
 * <h2>Grammar</h2>
 * <p>From the loosest to the tightest binding:</p>
 * <pre>
 * iff   := imp ( '&lt;-&gt;' imp )*     left-associative
 * imp   := or ( '-&gt;' imp )?        right-associative
 * or    := and ( '|' and )*        left-associative
 * and   := not ( '&amp;' not )*        left-associative
 * not   := '~' not | atom
 * atom  := IDENTIFIER | '(' iff ')'
 * </pre>
 * <p>
 * The grammar is LL(1): tokens are consumed left to right with one token of lookahead and no
 * backtracking. {@code A | B | C} yields {@code (A | B) | C}, {@code A -> B -> C} yields
 * {@code A -> (B -> C)}.
 * </p>
 *
 * <h2>Error Detection</h2>
 * <ul>
 *   <li>{@link SyntaxErrorKind#EMPTY_EXPRESSION}: no token at all</li>
 *   <li>{@link SyntaxErrorKind#UNEXPECTED_END_OF_INPUT}: input ends where an operand is required</li>
 *   <li>{@link SyntaxErrorKind#UNMATCHED_PARENTHESIS}: '(' never closed, or ')' with nothing to close</li>
 *   <li>{@link SyntaxErrorKind#INVALID_TOKEN}: a character outside the language</li>
 *   <li>{@link SyntaxErrorKind#UNEXPECTED_TOKEN}: any other misplaced token, including trailing ones</li>
 * </ul>
 *
 * <h2>Nesting Limits</h2>
 * <p>
 * The height of the resulting tree, counting every operator node including each step of a
 * left-folded chain, may not exceed {@link ParserPolicy#maxNestingDepth()}. Recursion through
 * '(', '~' and '-&gt;' is bounded by twice that value, which is the most the canonical
 * rendering of an accepted tree needs: one parenthesis pair plus at most one '~' or '-&gt;'
 * step per level. Both bounds raise {@link ComplexityLimitException}.
 * </p>
 *
 * <p>An instance parses one token sequence and is not thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class RecursiveDescentParser {

    private final List<Token> tokens;
    private final ParserPolicy policy;
    private final int endPosition;
    private int pos;
    private int depth;
    private int openParentheses;

    private RecursiveDescentParser(List<Token> tokens, ParserPolicy policy) {
        this.tokens = tokens;
        this.policy = policy;
        if (tokens.isEmpty()) {
            this.endPosition = 0;
        } else {
            Token last = tokens.get(tokens.size() - 1);
            this.endPosition = last.position() + last.text().length();
        }
    }

    /**
     * Parses a complete token sequence.
     *
     * @param tokens tokens produced by {@link ExpressionLexer#tokenize(String)}
     * @param policy complexity limits to enforce
     * @return the expression tree
     * @throws ExpressionSyntaxException if the tokens do not form exactly one expression
     * @throws ComplexityLimitException  if nesting exceeds the policy
     */
    public static Expression parse(List<Token> tokens, ParserPolicy policy) {
        Objects.requireNonNull(tokens, "tokens");
        Objects.requireNonNull(policy, "policy");

        if (tokens.isEmpty()) {
            throw new ExpressionSyntaxException(SyntaxErrorKind.EMPTY_EXPRESSION, 0,
                    "Expression cannot be null or empty");
        }
        return new RecursiveDescentParser(tokens, policy).parseExpression();
    }

    private Expression parseExpression() {
        Expression expression = parseIff().expression();

        Token leftover = peek();
        if (leftover != null) {
            if (leftover.is(TokenType.RIGHT_PAREN)) {
                throw new ExpressionSyntaxException(SyntaxErrorKind.UNMATCHED_PARENTHESIS, leftover.position(),
                        "Unmatched ')' at position " + leftover.position());
            }
            throw unexpected(leftover, "end of expression");
        }
        return expression;
    }

    private Node parseIff() {
        Node left = parseImplication();
        while (accept(TokenType.IFF)) {
            Node right = parseImplication();
            left = node(new Expression.Iff(left.expression(), right.expression()), left, right);
        }
        return left;
    }

    private Node parseImplication() {
        Node left = parseOr();
        if (accept(TokenType.IMPLIES)) {
            descend();
            Node right = parseImplication();
            depth--;
            return node(new Expression.Implies(left.expression(), right.expression()), left, right);
        }
        return left;
    }

    private Node parseOr() {
        Node left = parseAnd();
        while (accept(TokenType.OR)) {
            Node right = parseAnd();
            left = node(new Expression.Or(left.expression(), right.expression()), left, right);
        }
        return left;
    }

    private Node parseAnd() {
        Node left = parseNot();
        while (accept(TokenType.AND)) {
            Node right = parseNot();
            left = node(new Expression.And(left.expression(), right.expression()), left, right);
        }
        return left;
    }

    private Node parseNot() {
        if (accept(TokenType.NOT)) {
            descend();
            Node child = parseNot();
            depth--;
            return node(new Expression.Not(child.expression()), child, child);
        }
        return parseAtom();
    }

    private Node parseAtom() {
        Token token = peek();
        if (token == null) {
            throw new ExpressionSyntaxException(SyntaxErrorKind.UNEXPECTED_END_OF_INPUT, endPosition,
                    "Unexpected end of input at position " + endPosition + ", expected a variable, '~' or '('");
        }

        switch (token.type()) {
            case IDENTIFIER -> {
                pos++;
                return new Node(new Expression.Var(token.text()), 0);
            }
            case LEFT_PAREN -> {
                pos++;
                return parseParenthesized(token);
            }
            case RIGHT_PAREN -> {
                if (openParentheses == 0) {
                    throw new ExpressionSyntaxException(SyntaxErrorKind.UNMATCHED_PARENTHESIS, token.position(),
                            "Unmatched ')' at position " + token.position());
                }
                throw unexpected(token, "a variable, '~' or '('");
            }
            default -> throw unexpected(token, "a variable, '~' or '('");
        }
    }

    private Node parseParenthesized(Token opening) {
        descend();
        openParentheses++;
        Node inner = parseIff();

        Token closing = peek();
        if (closing == null) {
            throw new ExpressionSyntaxException(SyntaxErrorKind.UNMATCHED_PARENTHESIS, opening.position(),
                    "Unmatched '(' at position " + opening.position());
        }
        if (!closing.is(TokenType.RIGHT_PAREN)) {
            throw unexpected(closing, "')'");
        }
        pos++;
        openParentheses--;
        depth--;
        return inner;
    }

    private Node node(Expression expression, Node left, Node right) {
        int height = Math.max(left.height(), right.height()) + 1;
        if (height > policy.maxNestingDepth()) {
            throw new ComplexityLimitException(String.format(
                    "Expression nested too deeply (depth %d, max: %d). Policy applied: %s",
                    height, policy.maxNestingDepth(), policy.policyName()));
        }
        return new Node(expression, height);
    }

    private Token peek() {
        return pos < tokens.size() ? tokens.get(pos) : null;
    }

    private boolean accept(TokenType type) {
        Token token = peek();
        if (token != null && token.is(type)) {
            pos++;
            return true;
        }
        return false;
    }

    private void descend() {
        long maxGroups = 2L * policy.maxNestingDepth();
        if (++depth > maxGroups) {
            throw new ComplexityLimitException(String.format(
                    "Expression nested too deeply (%d nested groups, max: %d). Policy applied: %s",
                    depth, maxGroups, policy.policyName()));
        }
    }

    private static ExpressionSyntaxException unexpected(Token token, String expected) {
        if (token.is(TokenType.UNKNOWN)) {
            return new ExpressionSyntaxException(SyntaxErrorKind.INVALID_TOKEN, token.position(),
                    String.format("Invalid token '%s' at position %d", token.text(), token.position()));
        }
        return new ExpressionSyntaxException(SyntaxErrorKind.UNEXPECTED_TOKEN, token.position(),
                String.format("Unexpected token '%s' at position %d, expected %s",
                        token.text(), token.position(), expected));
    }

    /** A parsed subtree with its height, a variable having height 0. */
    private record Node(Expression expression, int height) {}
}
