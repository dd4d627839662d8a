package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.BeginGroupToken;
import org.quill.compiler.frontend.lexer.Token;

import java.util.Collections;
import java.util.List;

/**
 * The construction context used by the parser. Every node built through a factory gets a fresh
 * id from the factory's {@link NodeIdAllocator}.
 * <p>
 * A factory may be shared by parsers running on several threads; the trees they build are
 * independent and ids stay unique.
 */
public final class AstFactory {

    private final NodeIdAllocator ids;

    public AstFactory() {
        this(new NodeIdAllocator());
    }

    public AstFactory(NodeIdAllocator ids) {
        if (ids == null) {
            throw new IllegalArgumentException("Id allocator must not be null");
        }
        this.ids = ids;
    }

    public NodeIdAllocator ids() {
        return ids;
    }

    // region Names and literals

    public Identifier identifier(Token token) {
        return new Identifier(ids.nextId(), token);
    }

    /**
     * Creates an identifier that has no source position, e.g. an implicit {@code this}.
     */
    public Identifier syntheticIdentifier(String name) {
        return new Identifier(ids.nextId(), Token.synthetic(name));
    }

    public Operator operator(Token token) {
        return new Operator(ids.nextId(), token);
    }

    public Operator syntheticOperator(String spelling) {
        return new Operator(ids.nextId(), Token.synthetic(spelling));
    }

    public LiteralInt literalInt(Token token, DecodeErrorHandler handler) {
        return new LiteralInt(ids.nextId(), token, handler);
    }

    public LiteralDouble literalDouble(Token token, DecodeErrorHandler handler) {
        return new LiteralDouble(ids.nextId(), token, handler);
    }

    public LiteralBool literalBool(Token token, DecodeErrorHandler handler) {
        return new LiteralBool(ids.nextId(), token, handler);
    }

    public LiteralString literalString(Token token) {
        return new LiteralString(ids.nextId(), token);
    }

    public LiteralNull literalNull(Token token) {
        return new LiteralNull(ids.nextId(), token);
    }

    public LiteralList literalList(NodeList type, NodeList elements) {
        return new LiteralList(ids.nextId(), type, elements);
    }

    // endregion

    // region Lists

    public NodeList nodeList(Token beginToken, List<AstNode> nodes, Token endToken, String delimiter) {
        return new NodeList(ids.nextId(), beginToken, nodes, endToken, delimiter, NodeList.Fixity.ARGUMENTS);
    }

    public NodeList singletonList(AstNode node) {
        return nodeList(null, Collections.singletonList(node), null, null);
    }

    public NodeList emptyList() {
        return nodeList(null, List.of(), null, null);
    }

    private NodeList fixityList(NodeList.Fixity fixity, AstNode argument) {
        List<AstNode> nodes = argument == null ? List.of() : List.of(argument);
        return new NodeList(ids.nextId(), null, nodes, null, null, fixity);
    }

    // endregion

    // region Sends

    public Send send(AstNode receiver, AstNode selector, NodeList argumentsNode) {
        return new Send(ids.nextId(), receiver, selector, argumentsNode);
    }

    /**
     * Creates a prefix operator application such as {@code -x}: the receiver is the operand and the
     * selector the operator.
     */
    public Send prefixSend(AstNode receiver, AstNode selector) {
        return prefixSend(receiver, selector, null);
    }

    public Send prefixSend(AstNode receiver, AstNode selector, AstNode argument) {
        return new Send(ids.nextId(), receiver, selector, fixityList(NodeList.Fixity.PREFIX, argument));
    }

    public Send postfixSend(AstNode receiver, AstNode selector) {
        return postfixSend(receiver, selector, null);
    }

    public Send postfixSend(AstNode receiver, AstNode selector, AstNode argument) {
        return new Send(ids.nextId(), receiver, selector, fixityList(NodeList.Fixity.POSTFIX, argument));
    }

    public SendSet sendSet(AstNode receiver, AstNode selector, Operator assignmentOperator, NodeList argumentsNode) {
        return new SendSet(ids.nextId(), receiver, selector, assignmentOperator, argumentsNode);
    }

    public SendSet prefixSendSet(AstNode receiver, AstNode selector, Operator assignmentOperator) {
        return new SendSet(ids.nextId(), receiver, selector, assignmentOperator,
                fixityList(NodeList.Fixity.PREFIX, null));
    }

    public SendSet postfixSendSet(AstNode receiver, AstNode selector, Operator assignmentOperator) {
        return new SendSet(ids.nextId(), receiver, selector, assignmentOperator,
                fixityList(NodeList.Fixity.POSTFIX, null));
    }

    public NewExpression newExpression(Token newToken, Send send) {
        return new NewExpression(ids.nextId(), newToken, send);
    }

    // endregion

    // region Statements and expressions

    public Block block(NodeList statements) {
        return new Block(ids.nextId(), statements);
    }

    public If ifStatement(ParenthesizedExpression condition, Statement thenPart, Statement elsePart,
                          Token ifToken, Token elseToken) {
        return new If(ids.nextId(), condition, thenPart, elsePart, ifToken, elseToken);
    }

    public Conditional conditional(Expression condition, Expression thenExpression, Expression elseExpression,
                                   Token questionToken, Token colonToken) {
        return new Conditional(ids.nextId(), condition, thenExpression, elseExpression, questionToken, colonToken);
    }

    public For forLoop(AstNode initializer, Statement conditionStatement, AstNode update, Statement body,
                       Token forToken) {
        return new For(ids.nextId(), initializer, conditionStatement, update, body, forToken);
    }

    public While whileLoop(Expression condition, Statement body, Token whileKeyword) {
        return new While(ids.nextId(), condition, body, whileKeyword);
    }

    public DoWhile doWhile(Statement body, Expression condition, Token doKeyword, Token whileKeyword,
                           Token endToken) {
        return new DoWhile(ids.nextId(), body, condition, doKeyword, whileKeyword, endToken);
    }

    public ExpressionStatement expressionStatement(Expression expression, Token endToken) {
        return new ExpressionStatement(ids.nextId(), expression, endToken);
    }

    public Return returnStatement(Token beginToken, Token endToken, Expression expression) {
        return new Return(ids.nextId(), beginToken, endToken, expression);
    }

    public Throw throwStatement(Expression expression, Token throwToken, Token endToken) {
        return new Throw(ids.nextId(), expression, throwToken, endToken);
    }

    public ParenthesizedExpression parenthesized(Expression expression, BeginGroupToken beginToken) {
        return new ParenthesizedExpression(ids.nextId(), expression, beginToken);
    }

    public StringInterpolation stringInterpolation(LiteralString string, NodeList parts) {
        return new StringInterpolation(ids.nextId(), string, parts);
    }

    public StringInterpolationPart stringInterpolationPart(Expression expression, LiteralString string) {
        return new StringInterpolationPart(ids.nextId(), expression, string);
    }

    // endregion

    // region Declarations

    public ClassNode classNode(Identifier name, TypeAnnotation superclass, NodeList interfaces,
                               Token beginToken, Token extendsKeyword, Token endToken) {
        return new ClassNode(ids.nextId(), name, superclass, interfaces, beginToken, extendsKeyword, endToken);
    }

    public FunctionExpression functionExpression(AstNode name, NodeList parameters, Statement body,
                                                 TypeAnnotation returnType, Modifiers modifiers,
                                                 NodeList initializers) {
        return new FunctionExpression(ids.nextId(), name, parameters, body, returnType, modifiers, initializers);
    }

    public VariableDefinitions variableDefinitions(TypeAnnotation type, Modifiers modifiers, NodeList definitions,
                                                   Token endToken) {
        return new VariableDefinitions(ids.nextId(), type, modifiers, definitions, endToken);
    }

    public TypeAnnotation typeAnnotation(Identifier typeName, NodeList typeArguments) {
        return new TypeAnnotation(ids.nextId(), typeName, typeArguments);
    }

    public Modifiers modifiers(NodeList nodes) {
        return new Modifiers(ids.nextId(), nodes);
    }

    // endregion
}
