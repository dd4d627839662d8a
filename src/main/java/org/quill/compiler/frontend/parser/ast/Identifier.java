package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An AST node that represents an identifier, e.g. a variable, type or method name.
 * Synthetic identifiers carry a position-less token and have no span of their own.
 *
 * @param id The node id.
 * @param token The token of the identifier.
 */
public record Identifier(long id, Token token) implements NamedNode {

    public Identifier {
        Objects.requireNonNull(token, "token");
    }

    public boolean isThis() {
        return "this".equals(source());
    }

    @Override
    public List<AstNode> children() {
        return List.of();
    }

    @Override
    public NodeKind kind() {
        return NodeKind.IDENTIFIER;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Identifier> asIdentifier() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Identifier other && other.id == id;
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
