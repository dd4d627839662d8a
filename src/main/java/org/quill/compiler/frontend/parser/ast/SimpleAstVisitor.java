package org.quill.compiler.frontend.parser.ast;

/**
 * A visitor whose every visit method funnels into {@link #visitNode(AstNode)}.
 * Subclasses override the variants they care about and inherit a no-op for the rest.
 *
 * @param <T> The return type of the visit methods.
 */
public abstract class SimpleAstVisitor<T> implements AstVisitor<T> {

    /**
     * @return The result returned for variants the subclass does not handle.
     */
    protected T defaultResult() {
        return null;
    }

    /**
     * Called for every variant that is not overridden.
     * @param node The visited node.
     * @return {@link #defaultResult()} unless overridden.
     */
    protected T visitNode(AstNode node) {
        return defaultResult();
    }

    @Override public T visit(Block node) { return visitNode(node); }
    @Override public T visit(ClassNode node) { return visitNode(node); }
    @Override public T visit(Conditional node) { return visitNode(node); }
    @Override public T visit(DoWhile node) { return visitNode(node); }
    @Override public T visit(ExpressionStatement node) { return visitNode(node); }
    @Override public T visit(For node) { return visitNode(node); }
    @Override public T visit(FunctionExpression node) { return visitNode(node); }
    @Override public T visit(Identifier node) { return visitNode(node); }
    @Override public T visit(If node) { return visitNode(node); }
    @Override public T visit(LiteralBool node) { return visitNode(node); }
    @Override public T visit(LiteralDouble node) { return visitNode(node); }
    @Override public T visit(LiteralInt node) { return visitNode(node); }
    @Override public T visit(LiteralList node) { return visitNode(node); }
    @Override public T visit(LiteralNull node) { return visitNode(node); }
    @Override public T visit(LiteralString node) { return visitNode(node); }
    @Override public T visit(Modifiers node) { return visitNode(node); }
    @Override public T visit(NewExpression node) { return visitNode(node); }
    @Override public T visit(NodeList node) { return visitNode(node); }
    @Override public T visit(Operator node) { return visitNode(node); }
    @Override public T visit(ParenthesizedExpression node) { return visitNode(node); }
    @Override public T visit(Return node) { return visitNode(node); }
    @Override public T visit(Send node) { return visitNode(node); }
    @Override public T visit(SendSet node) { return visitNode(node); }
    @Override public T visit(StringInterpolation node) { return visitNode(node); }
    @Override public T visit(StringInterpolationPart node) { return visitNode(node); }
    @Override public T visit(Throw node) { return visitNode(node); }
    @Override public T visit(TypeAnnotation node) { return visitNode(node); }
    @Override public T visit(VariableDefinitions node) { return visitNode(node); }
    @Override public T visit(While node) { return visitNode(node); }
}
