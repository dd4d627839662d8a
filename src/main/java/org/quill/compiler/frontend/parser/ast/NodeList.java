package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * An ordered sequence of nodes: arguments, statements, parameters, interfaces and so on.
 * Order is construction order and never changes.
 * <p>
 * Slots may be {@code null}; they are skipped by {@link #length()}, {@link #children()} and
 * traversal. The optional bracket tokens delimit the list in the source, and the delimiter
 * spelling (e.g. {@code ","}) is used when regenerating text.
 *
 * @param id The node id.
 * @param beginToken The opening bracket, or {@code null}.
 * @param nodes The elements in order.
 * @param endToken The closing bracket, or {@code null}.
 * @param delimiter The separator spelling, or {@code null}.
 * @param fixity Whether this list holds call arguments or marks a prefix/postfix operator application.
 */
public record NodeList(long id, Token beginToken, List<AstNode> nodes, Token endToken, String delimiter,
                       Fixity fixity) implements AstNode {

    /**
     * Position of the operator relative to its operand when the list is the argument list of a send.
     */
    public enum Fixity {
        /** A regular list, e.g. call arguments. */
        ARGUMENTS,
        /** The owning send applies its operator before the receiver, e.g. {@code -x}. */
        PREFIX,
        /** The owning send applies its operator after the receiver, e.g. {@code x++}. */
        POSTFIX
    }

    public NodeList {
        nodes = nodes == null ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(nodes));
        if (fixity == null) {
            fixity = Fixity.ARGUMENTS;
        }
    }

    public NodeList(long id, Token beginToken, List<AstNode> nodes, Token endToken, String delimiter) {
        this(id, beginToken, nodes, endToken, delimiter, Fixity.ARGUMENTS);
    }

    /**
     * @return The number of non-null elements.
     */
    public int length() {
        int length = 0;
        for (AstNode node : nodes) {
            if (node != null) {
                length++;
            }
        }
        return length;
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    @Override
    public List<AstNode> children() {
        if (!nodes.contains(null)) {
            return nodes;
        }
        return Spans.present(nodes.toArray(new AstNode[0]));
    }

    @Override
    public Token getBeginToken() {
        Token begin = Spans.real(beginToken);
        if (begin != null) return begin;
        Token first = Spans.first(nodes);
        return first != null ? first : Spans.real(endToken);
    }

    @Override
    public Token getEndToken() {
        Token end = Spans.real(endToken);
        if (end != null) return end;
        Token last = Spans.last(nodes);
        return last != null ? last : Spans.real(beginToken);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.NODE_LIST;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<NodeList> asNodeList() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof NodeList other && other.id == id;
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
