package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * A string literal. The value is the raw token text, quotes included.
 */
public record LiteralString(long id, Token token) implements Literal<String> {

    public LiteralString {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public Optional<String> value() {
        return Optional.of(token.text());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_STRING;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<LiteralString> asLiteralString() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralString other && other.id == id;
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
