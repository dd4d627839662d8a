package org.quill.compiler.frontend.parser.ast;

/**
 * A visitor for the syntax tree, with one method per concrete node variant.
 * <p>
 * Abstract families such as {@link Expression}, {@link Statement} or {@link Loop} are never
 * dispatch targets. Passes that only care about a few variants extend {@link SimpleAstVisitor}.
 *
 * @param <T> The return type of the visit methods.
 */
public interface AstVisitor<T> {
    T visit(Block node);
    T visit(ClassNode node);
    T visit(Conditional node);
    T visit(DoWhile node);
    T visit(ExpressionStatement node);
    T visit(For node);
    T visit(FunctionExpression node);
    T visit(Identifier node);
    T visit(If node);
    T visit(LiteralBool node);
    T visit(LiteralDouble node);
    T visit(LiteralInt node);
    T visit(LiteralList node);
    T visit(LiteralNull node);
    T visit(LiteralString node);
    T visit(Modifiers node);
    T visit(NewExpression node);
    T visit(NodeList node);
    T visit(Operator node);
    T visit(ParenthesizedExpression node);
    T visit(Return node);
    T visit(Send node);
    T visit(SendSet node);
    T visit(StringInterpolation node);
    T visit(StringInterpolationPart node);
    T visit(Throw node);
    T visit(TypeAnnotation node);
    T visit(VariableDefinitions node);
    T visit(While node);
}
