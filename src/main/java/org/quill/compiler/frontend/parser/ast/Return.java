package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A {@code return} statement, also used for arrow function bodies ({@code => expression;}).
 *
 * @param id The node id.
 * @param beginToken The {@code return} keyword or the arrow.
 * @param endToken The terminating semicolon.
 * @param expression The returned value, or {@code null}.
 */
public record Return(long id, Token beginToken, Token endToken, Expression expression) implements Statement {

    public boolean hasExpression() {
        return expression != null;
    }

    @Override
    public List<AstNode> children() {
        return Spans.present(expression);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(beginToken, children());
    }

    @Override
    public Token getEndToken() {
        return Spans.endOr(endToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.RETURN;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Return> asReturn() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Return other && other.id == id;
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
