package org.quill.compiler.frontend.parser.ast;

import java.util.List;

/**
 * A message send, the unified model of property access, method and function calls and
 * operator application. {@link Send} and {@link SendSet} share this shape.
 * <p>
 * The form of a send is given by which parts are present and by the fixity of its argument list:
 * <ul>
 *     <li>property access: no argument list</li>
 *     <li>call: an argument list of fixity {@link NodeList.Fixity#ARGUMENTS}</li>
 *     <li>prefix operator: an argument list of fixity {@link NodeList.Fixity#PREFIX}</li>
 *     <li>postfix operator: an argument list of fixity {@link NodeList.Fixity#POSTFIX}</li>
 * </ul>
 * Exactly one of {@link #isPropertyAccess()}, {@link #isCall()}, {@link #isPrefix()} and
 * {@link #isPostfix()} holds for every send.
 */
public sealed interface MessageSend extends Expression permits Send, SendSet {

    /** Selector spelling of the index operator. */
    String INDEX_OPERATOR = "[]";

    AstNode receiver();

    AstNode selector();

    NodeList argumentsNode();

    default boolean isOperator() {
        return selector() instanceof Operator;
    }

    default boolean isPropertyAccess() {
        return argumentsNode() == null;
    }

    default boolean isFunctionObjectInvocation() {
        return selector() == null;
    }

    default boolean isCall() {
        return argumentsNode() != null && argumentsNode().fixity() == NodeList.Fixity.ARGUMENTS;
    }

    default boolean isPrefix() {
        return argumentsNode() != null && argumentsNode().fixity() == NodeList.Fixity.PREFIX;
    }

    default boolean isPostfix() {
        return argumentsNode() != null && argumentsNode().fixity() == NodeList.Fixity.POSTFIX;
    }

    default boolean isIndex() {
        return selector() instanceof Operator op && INDEX_OPERATOR.equals(op.source());
    }

    /**
     * @return The number of arguments, 0 for property access.
     */
    default int argumentCount() {
        return argumentsNode() == null ? 0 : argumentsNode().length();
    }

    /**
     * @return The arguments in order, empty for property access.
     */
    default List<AstNode> arguments() {
        return argumentsNode() == null ? List.of() : argumentsNode().children();
    }
}
