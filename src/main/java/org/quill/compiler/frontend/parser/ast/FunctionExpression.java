package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A function, method or constructor: named declarations as well as anonymous function literals.
 *
 * @param id The node id.
 * @param name The name (an identifier, or a send for qualified constructor names), or {@code null}.
 * @param parameters The parameter list including its parentheses.
 * @param body The body; a {@link Return} for arrow bodies, or {@code null} for abstract members.
 * @param returnType The declared return type, or {@code null}.
 * @param modifiers The modifiers, or {@code null}.
 * @param initializers The constructor initializer list, or {@code null}.
 */
public record FunctionExpression(long id, AstNode name, NodeList parameters, Statement body,
                                 TypeAnnotation returnType, Modifiers modifiers,
                                 NodeList initializers) implements Expression {

    @Override
    public List<AstNode> children() {
        return Spans.present(modifiers, returnType, name, parameters, initializers, body);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.FUNCTION_EXPRESSION;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<FunctionExpression> asFunctionExpression() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof FunctionExpression other && other.id == id;
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
