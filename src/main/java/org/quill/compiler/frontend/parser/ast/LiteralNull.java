package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * The {@code null} literal. Its value is always empty, whatever the token text.
 */
public record LiteralNull(long id, Token token) implements Literal<Object> {

    public LiteralNull {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public Optional<Object> value() {
        return Optional.empty();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_NULL;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<LiteralNull> asLiteralNull() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralNull other && other.id == id;
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
