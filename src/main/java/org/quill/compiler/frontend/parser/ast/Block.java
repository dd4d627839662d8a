package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A block statement. The statement list carries the braces as its bracket tokens.
 *
 * @param id The node id.
 * @param statements The statements, in order.
 */
public record Block(long id, NodeList statements) implements Statement {

    @Override
    public List<AstNode> children() {
        return Spans.present(statements);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Block> asBlock() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Block other && other.id == id;
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
