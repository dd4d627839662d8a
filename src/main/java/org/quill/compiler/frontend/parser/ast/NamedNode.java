package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

/**
 * A node made of a single name token: an {@link Identifier} or an {@link Operator}.
 * The two share this shape but are dispatched separately.
 */
public sealed interface NamedNode extends Expression permits Identifier, Operator {

    Token token();

    /**
     * @return The textual payload of the token.
     */
    default String source() {
        return token().text();
    }

    /**
     * @return {@code true} if the token is synthetic, i.e. made up by the front end.
     */
    default boolean isSynthetic() {
        return token().isSynthetic();
    }

    @Override
    default Token getBeginToken() {
        return Spans.real(token());
    }

    @Override
    default Token getEndToken() {
        return Spans.real(token());
    }
}
