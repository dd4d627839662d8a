package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Span derivation shared by all node variants.
 */
final class Spans {

    private Spans() {}

    /**
     * @return The token itself if it can serve as a span boundary, otherwise {@code null}.
     */
    static Token real(Token token) {
        return token == null || token.isSynthetic() ? null : token;
    }

    /**
     * First boundary of a sequence of nodes: the begin token of the first node that has one,
     * falling back to that node's end token.
     */
    static Token first(List<? extends AstNode> nodes) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Token begin = real(node.getBeginToken());
            if (begin != null) return begin;
            Token end = real(node.getEndToken());
            if (end != null) return end;
        }
        return null;
    }

    /**
     * Last boundary of a sequence of nodes: the end token of the last node that has one,
     * falling back to that node's begin token.
     */
    static Token last(List<? extends AstNode> nodes) {
        for (int i = nodes.size() - 1; i >= 0; i--) {
            AstNode node = nodes.get(i);
            if (node == null) continue;
            Token end = real(node.getEndToken());
            if (end != null) return end;
            Token begin = real(node.getBeginToken());
            if (begin != null) return begin;
        }
        return null;
    }

    /**
     * Uses the explicit token when present, otherwise the first boundary of the children.
     */
    static Token beginOr(Token explicit, List<AstNode> children) {
        Token token = real(explicit);
        return token != null ? token : first(children);
    }

    /**
     * Uses the explicit token when present, otherwise the last boundary of the children.
     */
    static Token endOr(Token explicit, List<AstNode> children) {
        Token token = real(explicit);
        return token != null ? token : last(children);
    }

    /**
     * Collects the non-null arguments, keeping their order.
     */
    static List<AstNode> present(AstNode... nodes) {
        List<AstNode> result = new ArrayList<>(nodes.length);
        for (AstNode node : nodes) {
            if (node != null) {
                result.add(node);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
