package org.quill.compiler.frontend;

import org.quill.compiler.frontend.parser.ast.AstNode;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing a syntax tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * so that a pass only names the node types it is interested in.
 * <p>
 * Nodes are visited in pre-order, children in source order.
 */
public class TreeWalker {

    private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node classes to their corresponding handlers.
     */
    public TreeWalker(Map<Class<? extends AstNode>, Consumer<AstNode>> handlers) {
        this.handlers = Map.copyOf(handlers);
    }

    /**
     * Starts a builder with typed handler registration.
     * @return A new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Walks a list of nodes.
     * @param nodes The list of nodes to walk.
     */
    public void walk(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            walk(node);
        }
    }

    /**
     * Walks a single node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        Consumer<AstNode> handler = handlers.get(node.getClass());
        if (handler != null) {
            handler.accept(node);
        }

        for (AstNode child : node.children()) {
            walk(child);
        }
    }

    /**
     * Builder that keeps the handler's parameter type tied to the registered class.
     */
    public static final class Builder {

        private final Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = new HashMap<>();

        private Builder() {
        }

        public <N extends AstNode> Builder on(Class<N> type, Consumer<? super N> handler) {
            handlers.merge(type, node -> handler.accept(type.cast(node)), Consumer::andThen);
            return this;
        }

        public TreeWalker build() {
            return new TreeWalker(handlers);
        }
    }
}
