package org.quill.compiler.frontend.parser.ast;

import java.util.List;
import java.util.Optional;

/**
 * Modifiers such as {@code static}, {@code abstract} or {@code final}.
 * <p>
 * The flags are folded from the identifier list once, at construction; unknown spellings are
 * ignored. Order and combination of modifiers are not validated here.
 *
 * @param id The node id.
 * @param nodes The modifier identifiers, in source order.
 * @param flags Bit pattern of the recognised modifiers, see {@code FLAG_*}.
 */
public record Modifiers(long id, NodeList nodes, int flags) implements AstNode {

    public static final int FLAG_STATIC = 1;
    public static final int FLAG_ABSTRACT = FLAG_STATIC << 1;
    public static final int FLAG_FINAL = FLAG_ABSTRACT << 1;
    public static final int FLAG_VAR = FLAG_FINAL << 1;
    public static final int FLAG_CONST = FLAG_VAR << 1;

    public Modifiers {
        int expected = computeFlags(nodes);
        if (flags != expected) {
            throw new IllegalArgumentException("Flags " + flags + " do not match modifier list (expected " + expected + ")");
        }
    }

    public Modifiers(long id, NodeList nodes) {
        this(id, nodes, computeFlags(nodes));
    }

    /**
     * Folds the modifier spellings into a bit pattern.
     *
     * @param nodes The modifier list, may be {@code null}.
     * @return The flags.
     */
    public static int computeFlags(NodeList nodes) {
        int flags = 0;
        if (nodes == null) {
            return flags;
        }
        for (AstNode node : nodes.children()) {
            if (!(node instanceof NamedNode named)) {
                continue;
            }
            switch (named.source()) {
                case "static" -> flags |= FLAG_STATIC;
                case "abstract" -> flags |= FLAG_ABSTRACT;
                case "final" -> flags |= FLAG_FINAL;
                case "var" -> flags |= FLAG_VAR;
                case "const" -> flags |= FLAG_CONST;
                default -> { }
            }
        }
        return flags;
    }

    public boolean isStatic() {
        return (flags & FLAG_STATIC) != 0;
    }

    public boolean isAbstract() {
        return (flags & FLAG_ABSTRACT) != 0;
    }

    public boolean isFinal() {
        return (flags & FLAG_FINAL) != 0;
    }

    public boolean isVar() {
        return (flags & FLAG_VAR) != 0;
    }

    public boolean isConst() {
        return (flags & FLAG_CONST) != 0;
    }

    @Override
    public List<AstNode> children() {
        return Spans.present(nodes);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MODIFIERS;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<Modifiers> asModifiers() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Modifiers other && other.id == id;
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
