package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An operator used as the selector of a send, e.g. {@code +}, {@code ++} or {@code []},
 * or as the assignment operator of a {@link SendSet}.
 *
 * @param id The node id.
 * @param token The operator token.
 */
public record Operator(long id, Token token) implements NamedNode {

    public Operator {
        Objects.requireNonNull(token, "token");
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.OPERATOR;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Operator> asOperator() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Operator other && other.id == id;
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
