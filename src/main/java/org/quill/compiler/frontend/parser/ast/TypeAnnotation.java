package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A type reference such as {@code int} or {@code Map<String, List<int>>}.
 *
 * @param id The node id.
 * @param typeName The name of the type.
 * @param typeArguments The type arguments including the angle brackets, or {@code null}.
 */
public record TypeAnnotation(long id, Identifier typeName, NodeList typeArguments) implements AstNode {

    @Override
    public List<AstNode> children() {
        return Spans.present(typeName, typeArguments);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TYPE_ANNOTATION;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<TypeAnnotation> asTypeAnnotation() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof TypeAnnotation other && other.id == id;
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
