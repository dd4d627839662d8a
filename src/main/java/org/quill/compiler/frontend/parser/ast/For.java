package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A classic {@code for} loop.
 *
 * @param id The node id.
 * @param initializer Either a variable declaration or an expression, or {@code null}.
 * @param conditionStatement Either an expression statement or {@code null} for an empty condition.
 * @param update The update expression, or {@code null}.
 * @param body The loop body.
 * @param forToken The {@code for} keyword.
 */
public record For(long id, AstNode initializer, Statement conditionStatement, AstNode update, Statement body,
                  Token forToken) implements Loop {

    /**
     * @return The expression of the condition statement, or {@code null} if the loop has no condition.
     */
    @Override
    public Expression condition() {
        if (conditionStatement instanceof ExpressionStatement statement) {
            return statement.expression();
        }
        return null;
    }

    @Override
    public List<AstNode> children() {
        return Spans.present(initializer, conditionStatement, update, body);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(forToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FOR;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<For> asFor() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof For other && other.id == id;
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
