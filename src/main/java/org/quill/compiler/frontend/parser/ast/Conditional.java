package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A conditional expression, {@code condition ? thenExpression : elseExpression}.
 */
public record Conditional(long id, Expression condition, Expression thenExpression, Expression elseExpression,
                          Token questionToken, Token colonToken) implements Expression {

    @Override
    public List<AstNode> children() {
        return Spans.present(condition, thenExpression, elseExpression);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CONDITIONAL;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Conditional> asConditional() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Conditional other && other.id == id;
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
