package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.BeginGroupToken;
import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * An expression in parentheses. The closing parenthesis is reached through the opening one.
 *
 * @param id The node id.
 * @param expression The enclosed expression.
 * @param beginToken The opening parenthesis.
 */
public record ParenthesizedExpression(long id, Expression expression, BeginGroupToken beginToken)
        implements Expression {

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
        return Spans.endOr(beginToken == null ? null : beginToken.endGroup(), children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARENTHESIZED_EXPRESSION;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ParenthesizedExpression> asParenthesizedExpression() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ParenthesizedExpression other && other.id == id;
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
