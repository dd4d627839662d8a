package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A literal backed by a single token. The value is decoded from the token text on every access.
 *
 * @param <T> The type of the decoded value.
 */
public sealed interface Literal<T> extends Expression
        permits LiteralBool, LiteralDouble, LiteralInt, LiteralNull, LiteralString {

    Token token();

    /**
     * Decodes the token text. If decoding fails, the literal's {@link DecodeErrorHandler} is
     * invoked with the token and a description; if the handler returns normally the result is empty.
     *
     * @return The decoded value, or empty if the text cannot be decoded or the literal is {@code null}.
     */
    Optional<T> value();

    @Override
    default List<AstNode> children() {
        return List.of();
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
