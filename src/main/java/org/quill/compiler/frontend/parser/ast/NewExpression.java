package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * An instance creation, {@code new T(...)} or {@code const T(...)}.
 *
 * @param id The node id.
 * @param newToken The {@code new} or {@code const} keyword.
 * @param send The constructor call; its receiver is expected to be absent.
 */
public record NewExpression(long id, Token newToken, Send send) implements Expression {

    public boolean isConst() {
        return newToken != null && "const".equals(newToken.text());
    }

    @Override
    public List<AstNode> children() {
        return Spans.present(send);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(newToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NEW_EXPRESSION;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<NewExpression> asNewExpression() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NewExpression other && other.id == id;
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
