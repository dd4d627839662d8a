package org.quill.compiler.frontend.parser.ast;

/**
 * Marker for nodes executed for their effect. Never a dispatch target.
 */
public sealed interface Statement extends AstNode
        permits Block, ExpressionStatement, If, Loop, Return, Throw, VariableDefinitions {
}
