package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A variable declaration statement, e.g. {@code final int a = 1, b;}.
 *
 * @param id The node id.
 * @param type The declared type, or {@code null}.
 * @param modifiers The modifiers, or {@code null}.
 * @param definitions The declared variables (identifiers or assignments).
 * @param endToken The terminating semicolon, or {@code null} inside a parameter list.
 */
public record VariableDefinitions(long id, TypeAnnotation type, Modifiers modifiers, NodeList definitions,
                                  Token endToken) implements Statement {

    @Override
    public List<AstNode> children() {
        return Spans.present(modifiers, type, definitions);
    }

    @Override
    public Token getEndToken() {
        return Spans.endOr(endToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.VARIABLE_DEFINITIONS;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<VariableDefinitions> asVariableDefinitions() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof VariableDefinitions other && other.id == id;
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
