package io.github.cyfko.proplogic.core.parsing;

import java.util.Objects;

/**
 * A lexical token together with its position in the source text.
 *
 * @param type     lexical category
 * @param text     exact source text of the token
 * @param position zero-based index of the first character in the source
 * @author Frank KOSSI
 * @since 1.0
 */
public record Token(TokenType type, String text, int position) {

    public Token {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + position;
    }
}
