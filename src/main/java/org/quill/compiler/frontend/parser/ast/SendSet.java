package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A send that assigns: {@code a.b = c}, {@code x += 1}, {@code a[i] = v}, {@code ++x}, {@code x--}.
 * The assignment operator is always present.
 *
 * @param id The node id.
 * @param receiver The receiver of the assigned property, or {@code null}.
 * @param selector The assigned name or the index operator.
 * @param assignmentOperator The assignment or compound assignment operator.
 * @param argumentsNode The assigned value (preceded by the index for index assignments).
 */
public record SendSet(long id, AstNode receiver, AstNode selector, Operator assignmentOperator,
                      NodeList argumentsNode) implements MessageSend {

    public SendSet {
        Objects.requireNonNull(assignmentOperator, "assignmentOperator");
    }

    @Override
    public List<AstNode> children() {
        if (isPrefix()) {
            return Spans.present(assignmentOperator, receiver, selector, argumentsNode);
        }
        return Spans.present(receiver, selector, assignmentOperator, argumentsNode);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.SEND_SET;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<SendSet> asSendSet() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SendSet other && other.id == id;
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
