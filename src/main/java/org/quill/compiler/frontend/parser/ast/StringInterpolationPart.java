package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * One interpolated expression and the string fragment that follows it.
 */
public record StringInterpolationPart(long id, Expression expression, LiteralString string) implements AstNode {

    @Override
    public List<AstNode> children() {
        return Spans.present(expression, string);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.STRING_INTERPOLATION_PART;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<StringInterpolationPart> asStringInterpolationPart() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringInterpolationPart other && other.id == id;
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
