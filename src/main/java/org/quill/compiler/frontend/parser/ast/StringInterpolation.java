package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A string with embedded expressions: the leading string fragment followed by the parts,
 * each of which is an expression and the fragment after it.
 *
 * @param id The node id.
 * @param string The fragment before the first interpolation.
 * @param parts The {@link StringInterpolationPart}s, in order.
 */
public record StringInterpolation(long id, LiteralString string, NodeList parts) implements Expression {

    @Override
    public List<AstNode> children() {
        return Spans.present(string, parts);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRING_INTERPOLATION;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<StringInterpolation> asStringInterpolation() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringInterpolation other && other.id == id;
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
