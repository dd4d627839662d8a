package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A {@code while} loop.
 *
 * @param id The node id.
 * @param condition The loop condition.
 * @param body The loop body.
 * @param whileKeyword The {@code while} keyword.
 */
public record While(long id, Expression condition, Statement body, Token whileKeyword) implements Loop {

    @Override
    public List<AstNode> children() {
        return Spans.present(condition, body);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(whileKeyword, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.WHILE;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<While> asWhile() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof While other && other.id == id;
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
