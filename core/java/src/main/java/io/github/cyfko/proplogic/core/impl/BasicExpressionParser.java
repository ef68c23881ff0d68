package io.github.cyfko.proplogic.core.impl;

import io.github.cyfko.proplogic.core.api.ExpressionParser;
import io.github.cyfko.proplogic.core.config.ParserPolicy;
import io.github.cyfko.proplogic.core.exception.ComplexityLimitException;
import io.github.cyfko.proplogic.core.exception.ExpressionSyntaxException;
import io.github.cyfko.proplogic.core.exception.SyntaxErrorKind;
import io.github.cyfko.proplogic.core.model.Expression;
import io.github.cyfko.proplogic.core.parsing.ExpressionLexer;
import io.github.cyfko.proplogic.core.parsing.RecursiveDescentParser;
import io.github.cyfko.proplogic.core.parsing.Token;

import java.util.List;

/**
 * Default {@link ExpressionParser}: lexing then recursive descent, under a {@link ParserPolicy}.
 *
 * <h2>Two-Phase Architecture</h2>
 * <ol>
 *   <li><strong>Phase 1</strong>: {@link ExpressionLexer#tokenize(String)} - single pass, never fails</li>
 *   <li><strong>Phase 2</strong>: {@link RecursiveDescentParser#parse(List, ParserPolicy)} -
 *       LL(1) descent, fails on the first syntax error</li>
 * </ol>
 *
 * <h2>Complexity Limits</h2>
 * <ul>
 *   <li><strong>Expression Length</strong>: checked on the trimmed source before lexing</li>
 *   <li><strong>Nesting Depth</strong>: tree height checked as nodes are built, parentheses while descending</li>
 * </ul>
 *
 * <pre>{@code
 * BasicExpressionParser parser = new BasicExpressionParser();
 * Expression expr = parser.parse("(A -> B) & A");
 *
 * BasicExpressionParser strictParser = new BasicExpressionParser(ParserPolicy.strict());
 * }</pre>
 *
 * <p>Instances hold no mutable state and are thread-safe.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class BasicExpressionParser implements ExpressionParser {

    private final ParserPolicy parserPolicy;

    /**
     * Parser using {@link ParserPolicy#defaults()}.
     */
    public BasicExpressionParser() {
        this(ParserPolicy.defaults());
    }

    /**
     * @param parserPolicy the complexity limits to enforce
     * @throws IllegalArgumentException if the policy is null
     */
    public BasicExpressionParser(ParserPolicy parserPolicy) {
        if (parserPolicy == null) {
            throw new IllegalArgumentException("Parser policy is required");
        }
        this.parserPolicy = parserPolicy;
    }

    public ParserPolicy getParserPolicy() {
        return parserPolicy;
    }

    /**
     * {@inheritDoc}
     * <p>A {@code null} or blank text is reported as {@link SyntaxErrorKind#EMPTY_EXPRESSION}.</p>
     */
    @Override
    public Expression parse(String text) throws ExpressionSyntaxException {
        if (text == null || text.isBlank()) {
            throw new ExpressionSyntaxException(SyntaxErrorKind.EMPTY_EXPRESSION, 0,
                    "Expression cannot be null or empty");
        }

        int length = text.trim().length();
        if (length > parserPolicy.maxExpressionLength()) {
            throw new ComplexityLimitException(String.format(
                    "Expression too long (%d characters, max: %d). Policy applied: %s",
                    length, parserPolicy.maxExpressionLength(), parserPolicy.policyName()));
        }

        List<Token> tokens = ExpressionLexer.tokenize(text);
        return RecursiveDescentParser.parse(tokens, parserPolicy);
    }
}
