package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * An {@code if} statement with an optional {@code else} part.
 *
 * @param id The node id.
 * @param condition The parenthesized condition.
 * @param thenPart The statement executed when the condition holds.
 * @param elsePart The statement executed otherwise, or {@code null}.
 * @param ifToken The {@code if} keyword.
 * @param elseToken The {@code else} keyword, or {@code null}.
 */
public record If(long id, ParenthesizedExpression condition, Statement thenPart, Statement elsePart,
                 Token ifToken, Token elseToken) implements Statement {

    public boolean hasElsePart() {
        return elsePart != null;
    }

    @Override
    public List<AstNode> children() {
        return Spans.present(condition, thenPart, elsePart);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(ifToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IF;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<If> asIf() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof If other && other.id == id;
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
