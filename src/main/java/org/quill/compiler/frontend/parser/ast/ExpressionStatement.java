package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * An expression evaluated for its effect, terminated by a semicolon.
 */
public record ExpressionStatement(long id, Expression expression, Token endToken) implements Statement {

    @Override
    public List<AstNode> children() {
        return Spans.present(expression);
    }

    @Override
    public Token getEndToken() {
        return Spans.endOr(endToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.EXPRESSION_STATEMENT;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ExpressionStatement> asExpressionStatement() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ExpressionStatement other && other.id == id;
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
