package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A {@code do ... while (condition);} loop. The body comes first in the source.
 *
 * @param id The node id.
 * @param body The loop body.
 * @param condition The loop condition.
 * @param doKeyword The {@code do} keyword.
 * @param whileKeyword The {@code while} keyword.
 * @param endToken The terminating semicolon.
 */
public record DoWhile(long id, Statement body, Expression condition, Token doKeyword, Token whileKeyword,
                      Token endToken) implements Loop {

    @Override
    public List<AstNode> children() {
        return Spans.present(body, condition);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(doKeyword, children());
    }

    @Override
    public Token getEndToken() {
        return Spans.endOr(endToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.DO_WHILE;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<DoWhile> asDoWhile() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DoWhile other && other.id == id;
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
