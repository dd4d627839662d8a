package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * A message send. Models property access ({@code a.b}), calls ({@code a.b(c)}, {@code f(x)}),
 * binary operators ({@code a + b}), indexing ({@code a[i]}) and unary operators
 * ({@code -a}, {@code a++}) with one node; see {@link MessageSend} for the classification.
 *
 * @param id The node id.
 * @param receiver The receiver, or {@code null} for unqualified sends.
 * @param selector The selector, or {@code null} when a function object is invoked.
 * @param argumentsNode The argument list, or {@code null} for property access.
 */
public record Send(long id, AstNode receiver, AstNode selector, NodeList argumentsNode) implements MessageSend {

    @Override
    public List<AstNode> children() {
        if (isPrefix()) {
            return Spans.present(selector, receiver, argumentsNode);
        }
        return Spans.present(receiver, selector, argumentsNode);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEND;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Send> asSend() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Send other && other.id == id;
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
