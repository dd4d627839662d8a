package org.quill.compiler.frontend.parser.ast;

/**
 * The closed set of concrete node variants. A {@code switch} over this enum without a
 * {@code default} branch is checked for exhaustiveness by the compiler.
 */
public enum NodeKind {
    BLOCK(Block.class),
    CLASS_NODE(ClassNode.class),
    CONDITIONAL(Conditional.class),
    DO_WHILE(DoWhile.class),
    EXPRESSION_STATEMENT(ExpressionStatement.class),
    FOR(For.class),
    FUNCTION_EXPRESSION(FunctionExpression.class),
    IDENTIFIER(Identifier.class),
    IF(If.class),
    LITERAL_BOOL(LiteralBool.class),
    LITERAL_DOUBLE(LiteralDouble.class),
    LITERAL_INT(LiteralInt.class),
    LITERAL_LIST(LiteralList.class),
    LITERAL_NULL(LiteralNull.class),
    LITERAL_STRING(LiteralString.class),
    MODIFIERS(Modifiers.class),
    NEW_EXPRESSION(NewExpression.class),
    NODE_LIST(NodeList.class),
    OPERATOR(Operator.class),
    PARENTHESIZED_EXPRESSION(ParenthesizedExpression.class),
    RETURN(Return.class),
    SEND(Send.class),
    SEND_SET(SendSet.class),
    STRING_INTERPOLATION(StringInterpolation.class),
    STRING_INTERPOLATION_PART(StringInterpolationPart.class),
    THROW(Throw.class),
    TYPE_ANNOTATION(TypeAnnotation.class),
    VARIABLE_DEFINITIONS(VariableDefinitions.class),
    WHILE(While.class);

    private final Class<? extends AstNode> nodeType;

    NodeKind(Class<? extends AstNode> nodeType) {
        this.nodeType = nodeType;
    }

    /**
     * @return The record class implementing this variant.
     */
    public Class<? extends AstNode> nodeType() {
        return nodeType;
    }
}
