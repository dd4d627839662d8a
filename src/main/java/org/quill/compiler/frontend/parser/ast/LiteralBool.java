package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * A boolean literal. Only the keywords {@code true} and {@code false} decode.
 *
 * @param id The node id.
 * @param token The literal token.
 * @param handler Receives decode failures.
 */
public record LiteralBool(long id, Token token, DecodeErrorHandler handler) implements Literal<Boolean> {

    public LiteralBool {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(handler, "handler");
    }

    @Override
    public Optional<Boolean> value() {
        switch (token.text()) {
            case "true":
                return Optional.of(Boolean.TRUE);
            case "false":
                return Optional.of(Boolean.FALSE);
            default:
                handler.onDecodeError(token, "Not a bool: '" + token.text() + "'", null);
                return Optional.empty();
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_BOOL;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<LiteralBool> asLiteralBool() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralBool other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return unparse();
    }
}
