package org.quill.compiler.frontend.parser.ast;

/**
 * Marker for nodes that produce a value. Never a dispatch target.
 */
public sealed interface Expression extends AstNode
        permits Conditional, FunctionExpression, Literal, LiteralList, MessageSend, NamedNode, NewExpression,
                ParenthesizedExpression, StringInterpolation {
}
