package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A list literal such as {@code [1, 2]} or {@code <int>[1, 2]}.
 *
 * @param id The node id.
 * @param type The element type argument including its angle brackets, or {@code null}.
 * @param elements The elements including the square brackets.
 */
public record LiteralList(long id, NodeList type, NodeList elements) implements Expression {

    @Override
    public List<AstNode> children() {
        return Spans.present(type, elements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_LIST;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<LiteralList> asLiteralList() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralList other && other.id == id;
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
