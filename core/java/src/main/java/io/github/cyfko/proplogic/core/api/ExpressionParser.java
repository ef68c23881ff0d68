package io.github.cyfko.proplogic.core.api;

import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.ExpressionSyntaxException;
import io.github.cyfko.proplogic.core.model.Expression;

import java.util.List;

/**
 * Parser turning infix propositional formulas into {@link Expression} trees.
 *
 * <h2>Syntax</h2>
 * <table border="1">
 * <caption>Operator Reference</caption>
 * <thead>
 * <tr><th>Operator</th><th>Symbol</th><th>Precedence</th><th>Associativity</th><th>Example</th></tr>
 * </thead>
 * <tbody>
 * <tr><td>Parentheses</td><td>( )</td><td>Highest</td><td>N/A</td><td>(A | B)</td></tr>
 * <tr><td>NOT</td><td>~</td><td>5</td><td>Right</td><td>~~A</td></tr>
 * <tr><td>AND</td><td>&amp;</td><td>4</td><td>Left</td><td>A &amp; B</td></tr>
 * <tr><td>OR</td><td>|</td><td>3</td><td>Left</td><td>A | B</td></tr>
 * <tr><td>IMPLIES</td><td>-&gt;</td><td>2</td><td>Right</td><td>A -&gt; B</td></tr>
 * <tr><td>IFF</td><td>&lt;-&gt;</td><td>1</td><td>Left</td><td>A &lt;-&gt; B</td></tr>
 * </tbody>
 * </table>
 * <p>
 * Variables match {@code [A-Za-z_][A-Za-z0-9_]*} and are case-sensitive. There are no
 * constants. Whitespace is ignored.
 * </p>
 *
 * <h2>Usage Examples</h2>
 * <pre>{@code
 * ExpressionParser parser = new BasicExpressionParser();
 *
 * Expression e1 = parser.parse("A -> B");
 * Expression e2 = parser.parse("~(rain & cold) <-> (~rain | ~cold)");
 * List<Expression> axioms = parser.parseAll(List.of("A -> B", "A"));
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see ExpressionSyntaxException
 */
public interface ExpressionParser {

    /**
     * Parses one formula.
     *
     * @param text the formula source
     * @return the expression tree
     * @throws ExpressionSyntaxException if the text is empty or not a single well-formed formula
     * @throws ComplexityLimitException  if the text exceeds the parser's limits
     */
    Expression parse(String text) throws ExpressionSyntaxException;

    /**
     * Parses every formula in order, failing on the first bad one. No partial result is returned.
     *
     * @param texts the formula sources
     * @return an unmodifiable list of trees, in input order
     * @throws ExpressionSyntaxException on the first text that fails to parse
     * @throws NullPointerException      if texts is {@code null}
     */
    default List<Expression> parseAll(List<String> texts) throws ExpressionSyntaxException {
        return texts.stream().map(this::parse).toList();
    }
}
