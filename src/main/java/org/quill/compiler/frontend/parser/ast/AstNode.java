package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.unparse.Unparser;

import java.util.List;
import java.util.Optional;

/**
 * The base interface for all nodes in the syntax tree.
 * <p>
 * Nodes are immutable records built once by the parser and then read by any number of passes.
 * Every node carries an id handed out by a {@link NodeIdAllocator}; equality and hash codes are
 * based on that id alone, so two nodes describe the same occurrence in the source only if they
 * are the same node.
 * <p>
 * Besides the visitor protocol ({@link #accept(AstVisitor)}), every node answers the full set of
 * narrowing queries ({@code asBlock()}, {@code asSend()}, ...). Exactly one of them is present
 * for any node, namely the one named after its {@link #kind()}.
 */
public sealed interface AstNode
        permits Expression, Statement, ClassNode, Modifiers, NodeList, StringInterpolationPart, TypeAnnotation {

    /**
     * @return The id assigned to this node at construction.
     */
    long id();

    /**
     * @return The concrete variant of this node.
     */
    NodeKind kind();

    /**
     * Accepts a visitor. Part of the visitor pattern.
     * @param visitor The visitor to dispatch to.
     * @param <T> The return type of the visitor.
     * @return The result of the visit operation.
     */
    <T> T accept(AstVisitor<T> visitor);

    /**
     * Returns the direct, non-absent children of this node in source order.
     * Span derivation and {@link #visitChildren(AstVisitor)} both follow this order.
     *
     * @return A list of child nodes, empty for leaves.
     */
    List<AstNode> children();

    /**
     * Dispatches the visitor on each direct child. This does not recurse; visitors
     * that want the whole subtree call this again from their own visit methods.
     *
     * @param visitor The visitor to dispatch to.
     */
    default void visitChildren(AstVisitor<?> visitor) {
        for (AstNode child : children()) {
            child.accept(visitor);
        }
    }

    /**
     * @return The first source token of this node, or {@code null} if none can be derived.
     */
    default Token getBeginToken() {
        return Spans.first(children());
    }

    /**
     * @return The last source token of this node, or {@code null} if none can be derived.
     */
    default Token getEndToken() {
        return Spans.last(children());
    }

    /**
     * @return The begin/end token pair of this node.
     */
    default TokenSpan span() {
        return new TokenSpan(getBeginToken(), getEndToken());
    }

    /**
     * Regenerates source text for this node. Never throws; see {@link Unparser}.
     *
     * @return The regenerated text, or an {@code <<unparse error ...>>} description.
     */
    default String unparse() {
        return Unparser.render(this);
    }

    /**
     * @return A short description such as {@code SEND#12}, safe to use in diagnostics.
     */
    default String describe() {
        return kind() + "#" + id();
    }

    default Optional<Block> asBlock() { return Optional.empty(); }
    default Optional<ClassNode> asClassNode() { return Optional.empty(); }
    default Optional<Conditional> asConditional() { return Optional.empty(); }
    default Optional<DoWhile> asDoWhile() { return Optional.empty(); }
    default Optional<ExpressionStatement> asExpressionStatement() { return Optional.empty(); }
    default Optional<For> asFor() { return Optional.empty(); }
    default Optional<FunctionExpression> asFunctionExpression() { return Optional.empty(); }
    default Optional<Identifier> asIdentifier() { return Optional.empty(); }
    default Optional<If> asIf() { return Optional.empty(); }
    default Optional<LiteralBool> asLiteralBool() { return Optional.empty(); }
    default Optional<LiteralDouble> asLiteralDouble() { return Optional.empty(); }
    default Optional<LiteralInt> asLiteralInt() { return Optional.empty(); }
    default Optional<LiteralList> asLiteralList() { return Optional.empty(); }
    default Optional<LiteralNull> asLiteralNull() { return Optional.empty(); }
    default Optional<LiteralString> asLiteralString() { return Optional.empty(); }
    default Optional<Modifiers> asModifiers() { return Optional.empty(); }
    default Optional<NewExpression> asNewExpression() { return Optional.empty(); }
    default Optional<NodeList> asNodeList() { return Optional.empty(); }
    default Optional<Operator> asOperator() { return Optional.empty(); }
    default Optional<ParenthesizedExpression> asParenthesizedExpression() { return Optional.empty(); }
    default Optional<Return> asReturn() { return Optional.empty(); }
    default Optional<Send> asSend() { return Optional.empty(); }
    default Optional<SendSet> asSendSet() { return Optional.empty(); }
    default Optional<StringInterpolation> asStringInterpolation() { return Optional.empty(); }
    default Optional<StringInterpolationPart> asStringInterpolationPart() { return Optional.empty(); }
    default Optional<Throw> asThrow() { return Optional.empty(); }
    default Optional<TypeAnnotation> asTypeAnnotation() { return Optional.empty(); }
    default Optional<VariableDefinitions> asVariableDefinitions() { return Optional.empty(); }
    default Optional<While> asWhile() { return Optional.empty(); }
}
