package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.List;
import java.util.Optional;

/**
 * A class or interface declaration header.
 *
 * @param id The node id.
 * @param name The declared name.
 * @param superclass The type after {@code extends}, or {@code null}.
 * @param interfaces The implemented interfaces, or {@code null}.
 * @param beginToken The {@code class} or {@code interface} keyword.
 * @param extendsKeyword The {@code extends} keyword, or {@code null}.
 * @param endToken The closing brace of the declaration.
 */
public record ClassNode(long id, Identifier name, TypeAnnotation superclass, NodeList interfaces,
                        Token beginToken, Token extendsKeyword, Token endToken) implements AstNode {

    public boolean isInterface() {
        return beginToken != null && "interface".equals(beginToken.text());
    }

    public boolean isClass() {
        return !isInterface();
    }

    @Override
    public List<AstNode> children() {
        return Spans.present(name, superclass, interfaces);
    }

    @Override
    public Token getBeginToken() {
        return Spans.beginOr(beginToken, children());
    }

    @Override
    public Token getEndToken() {
        return Spans.endOr(endToken, children());
    }

    @Override
    public NodeKind kind() {
        return NodeKind.CLASS_NODE;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<ClassNode> asClassNode() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ClassNode other && other.id == id;
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
