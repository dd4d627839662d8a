package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A {@code throw} statement. The expression is absent for a rethrow.
 */
public record Throw(long id, Expression expression, Token throwToken, Token endToken) implements Statement {

    @Override
    public List<AstNode> children() {
        return Spans.present(expression);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(throwToken, children());
    }

    @Override
    public Token getEndToken() {
        return Spans.endOr(endToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.THROW;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Throw> asThrow() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Throw other && other.id == id;
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
