package org.quill.compiler.frontend.unparse;

import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.AstVisitor;
import org.quill.compiler.frontend.parser.ast.Block;
import org.quill.compiler.frontend.parser.ast.ClassNode;
import org.quill.compiler.frontend.parser.ast.Conditional;
import org.quill.compiler.frontend.parser.ast.DoWhile;
import org.quill.compiler.frontend.parser.ast.ExpressionStatement;
import org.quill.compiler.frontend.parser.ast.For;
import org.quill.compiler.frontend.parser.ast.FunctionExpression;
import org.quill.compiler.frontend.parser.ast.Identifier;
import org.quill.compiler.frontend.parser.ast.If;
import org.quill.compiler.frontend.parser.ast.Literal;
import org.quill.compiler.frontend.parser.ast.LiteralBool;
import org.quill.compiler.frontend.parser.ast.LiteralDouble;
import org.quill.compiler.frontend.parser.ast.LiteralInt;
import org.quill.compiler.frontend.parser.ast.LiteralList;
import org.quill.compiler.frontend.parser.ast.LiteralNull;
import org.quill.compiler.frontend.parser.ast.LiteralString;
import org.quill.compiler.frontend.parser.ast.Modifiers;
import org.quill.compiler.frontend.parser.ast.NewExpression;
import org.quill.compiler.frontend.parser.ast.NodeList;
import org.quill.compiler.frontend.parser.ast.Operator;
import org.quill.compiler.frontend.parser.ast.ParenthesizedExpression;
import org.quill.compiler.frontend.parser.ast.Return;
import org.quill.compiler.frontend.parser.ast.Send;
import org.quill.compiler.frontend.parser.ast.SendSet;
import org.quill.compiler.frontend.parser.ast.Statement;
import org.quill.compiler.frontend.parser.ast.StringInterpolation;
import org.quill.compiler.frontend.parser.ast.StringInterpolationPart;
import org.quill.compiler.frontend.parser.ast.Throw;
import org.quill.compiler.frontend.parser.ast.TypeAnnotation;
import org.quill.compiler.frontend.parser.ast.VariableDefinitions;
import org.quill.compiler.frontend.parser.ast.While;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Regenerates source-like text from a syntax tree.
 * <p>
 * Stored tokens are emitted verbatim where the tree has them; missing keywords and brackets are
 * filled in with their usual spelling. Whitespace and comments are not part of the tree, so the
 * output is a normalized rendering rather than the original text.
 * <p>
 * {@link #unparse(AstNode)} never throws. A required child that is absent is recorded as a
 * problem and rendered as {@value #MISSING}; any other failure stops the traversal and is
 * recorded together with the text produced so far.
 * <p>
 * An instance keeps state while it runs and must not be shared between threads.
 */
public final class Unparser implements AstVisitor<Void> {

    private static final Logger LOG = LoggerFactory.getLogger(Unparser.class);

    /** Placeholder emitted for a required child that is absent. */
    public static final String MISSING = "<?>";

    private final UnparserOptions options;
    private final StringBuilder sb = new StringBuilder();
    private final List<String> problems = new ArrayList<>();

    public Unparser() {
        this(UnparserOptions.DEFAULTS);
    }

    public Unparser(UnparserOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Options must not be null");
        }
        this.options = options;
    }

    /**
     * Renders a node with default options, for {@code toString()} and debugging output.
     *
     * @param node The node to render.
     * @return The regenerated text or an {@code <<unparse error ...>>} description.
     */
    public static String render(AstNode node) {
        return new Unparser().unparse(node).render();
    }

    /**
     * Regenerates the text of a node.
     *
     * @param node The node to unparse.
     * @return The result, carrying the text and any problems found on the way.
     */
    public UnparseResult unparse(AstNode node) {
        sb.setLength(0);
        problems.clear();
        if (node == null) {
            problems.add("no node to unparse");
            return new UnparseResult("<none>", "", problems);
        }
        try {
            node.accept(this);
        } catch (RuntimeException e) {
            LOG.debug("Unparsing {} failed after {} characters", node.describe(), sb.length(), e);
            problems.add(e.getMessage() == null
                    ? e.getClass().getSimpleName()
                    : e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (StackOverflowError e) {
            // The trace is as deep as the tree; only the position is logged.
            LOG.debug("Unparsing {} overflowed the stack after {} characters", node.describe(), sb.length());
            problems.add("StackOverflowError: tree nested too deeply");
        }
        return new UnparseResult(node.describe(), truncate(sb.toString()), problems);
    }

    private String truncate(String text) {
        int max = options.maxLength();
        if (max == 0 || text.length() <= max) {
            return text;
        }
        return text.substring(0, max) + "...";
    }

    // region Emission helpers

    private void add(String text) {
        sb.append(text);
    }

    private void token(Token token, String fallback) {
        sb.append(token != null ? token.text() : fallback);
    }

    private void emit(AstNode node) {
        if (node != null) {
            node.accept(this);
        }
    }

    private void require(AstNode owner, String role, AstNode child) {
        if (child == null) {
            problems.add(owner.describe() + " has no " + role);
            sb.append(MISSING);
            return;
        }
        child.accept(this);
    }

    private void operator(String spelling) {
        if (options.operatorSpacing()) {
            sb.append(' ').append(spelling).append(' ');
        } else {
            sb.append(spelling);
        }
    }

    private void elements(List<AstNode> nodes, String separator) {
        boolean first = true;
        for (AstNode node : nodes) {
            if (!first) {
                add(separator);
            }
            node.accept(this);
            first = false;
        }
    }

    private static String separatorOf(NodeList list) {
        return list.delimiter() == null ? " " : list.delimiter() + " ";
    }

    /**
     * Emits a list with its own bracket tokens, or the given brackets where it has none.
     */
    private void bracketed(NodeList list, String open, String close) {
        token(list.beginToken(), open);
        elements(list.children(), separatorOf(list));
        token(list.endToken(), close);
    }

    private static boolean isEmpty(NodeList list) {
        return list == null || list.isEmpty();
    }

    // endregion

    @Override
    public Void visit(Block node) {
        if (node.statements() == null) {
            require(node, "statements", null);
            return null;
        }
        bracketed(node.statements(), "{", "}");
        return null;
    }

    @Override
    public Void visit(ClassNode node) {
        token(node.beginToken(), "class");
        add(" ");
        require(node, "name", node.name());
        if (node.superclass() != null) {
            add(" ");
            token(node.extendsKeyword(), "extends");
            add(" ");
            node.superclass().accept(this);
        }
        if (!isEmpty(node.interfaces())) {
            add(node.isInterface() ? " extends " : " implements ");
            elements(node.interfaces().children(), ", ");
        }
        add(" {");
        token(node.endToken(), "}");
        return null;
    }

    @Override
    public Void visit(Conditional node) {
        require(node, "condition", node.condition());
        operator(node.questionToken() != null ? node.questionToken().text() : "?");
        require(node, "then expression", node.thenExpression());
        operator(node.colonToken() != null ? node.colonToken().text() : ":");
        require(node, "else expression", node.elseExpression());
        return null;
    }

    @Override
    public Void visit(DoWhile node) {
        token(node.doKeyword(), "do");
        add(" ");
        require(node, "body", node.body());
        add(" ");
        token(node.whileKeyword(), "while");
        add(" ");
        condition(node, node.condition());
        token(node.endToken(), ";");
        return null;
    }

    @Override
    public Void visit(ExpressionStatement node) {
        require(node, "expression", node.expression());
        token(node.endToken(), ";");
        return null;
    }

    @Override
    public Void visit(For node) {
        token(node.forToken(), "for");
        add(" (");
        emit(node.initializer());
        if (!(node.initializer() instanceof Statement)) {
            add(";");
        }
        add(" ");
        if (node.conditionStatement() == null) {
            add(";");
        } else {
            node.conditionStatement().accept(this);
        }
        if (node.update() != null) {
            add(" ");
            node.update().accept(this);
        }
        add(") ");
        require(node, "body", node.body());
        return null;
    }

    @Override
    public Void visit(FunctionExpression node) {
        if (!isEmpty(node.modifiers() == null ? null : node.modifiers().nodes())) {
            node.modifiers().accept(this);
            add(" ");
        }
        if (node.returnType() != null) {
            node.returnType().accept(this);
            add(" ");
        }
        emit(node.name());
        if (node.parameters() == null) {
            require(node, "parameters", null);
        } else {
            bracketed(node.parameters(), "(", ")");
        }
        if (!isEmpty(node.initializers())) {
            add(" : ");
            elements(node.initializers().children(), ", ");
        }
        if (node.body() == null) {
            add(";");
        } else {
            add(" ");
            node.body().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(Identifier node) {
        add(node.source());
        return null;
    }

    @Override
    public Void visit(If node) {
        token(node.ifToken(), "if");
        add(" ");
        require(node, "condition", node.condition());
        add(" ");
        require(node, "then part", node.thenPart());
        if (node.hasElsePart()) {
            add(" ");
            token(node.elseToken(), "else");
            add(" ");
            node.elsePart().accept(this);
        }
        return null;
    }

    @Override
    public Void visit(LiteralBool node) {
        return literal(node);
    }

    @Override
    public Void visit(LiteralDouble node) {
        return literal(node);
    }

    @Override
    public Void visit(LiteralInt node) {
        return literal(node);
    }

    @Override
    public Void visit(LiteralList node) {
        if (node.type() != null) {
            bracketed(node.type(), "<", ">");
        }
        if (node.elements() == null) {
            require(node, "elements", null);
        } else {
            bracketed(node.elements(), "[", "]");
        }
        return null;
    }

    @Override
    public Void visit(LiteralNull node) {
        return literal(node);
    }

    @Override
    public Void visit(LiteralString node) {
        return literal(node);
    }

    private Void literal(Literal<?> node) {
        add(node.token().text());
        return null;
    }

    @Override
    public Void visit(Modifiers node) {
        if (node.nodes() == null) {
            require(node, "modifier list", null);
            return null;
        }
        elements(node.nodes().children(), " ");
        return null;
    }

    @Override
    public Void visit(NewExpression node) {
        token(node.newToken(), "new");
        add(" ");
        require(node, "constructor call", node.send());
        return null;
    }

    @Override
    public Void visit(NodeList node) {
        token(node.beginToken(), "");
        elements(node.children(), separatorOf(node));
        token(node.endToken(), "");
        return null;
    }

    @Override
    public Void visit(Operator node) {
        add(node.source());
        return null;
    }

    @Override
    public Void visit(ParenthesizedExpression node) {
        token(node.beginToken(), "(");
        require(node, "expression", node.expression());
        token(node.beginToken() == null ? null : node.beginToken().endGroup(), ")");
        return null;
    }

    @Override
    public Void visit(Return node) {
        token(node.beginToken(), "return");
        if (node.hasExpression()) {
            add(" ");
            node.expression().accept(this);
        }
        token(node.endToken(), "");
        return null;
    }

    @Override
    public Void visit(Send node) {
        if (node.isPrefix()) {
            require(node, "operator", node.selector());
            require(node, "operand", node.receiver());
            trailingArguments(node.argumentsNode());
        } else if (node.isPostfix()) {
            require(node, "operand", node.receiver());
            require(node, "operator", node.selector());
            trailingArguments(node.argumentsNode());
        } else if (node.isIndex()) {
            require(node, "receiver", node.receiver());
            add("[");
            elements(node.arguments(), ", ");
            add("]");
        } else if (node.isOperator() && node.isCall()) {
            require(node, "left operand", node.receiver());
            operator(((Operator) node.selector()).source());
            elements(node.arguments(), separatorOf(node.argumentsNode()));
        } else {
            emit(node.receiver());
            if (node.selector() != null) {
                if (node.receiver() != null) {
                    add(".");
                }
                node.selector().accept(this);
            }
            if (node.argumentsNode() != null) {
                bracketed(node.argumentsNode(), "(", ")");
            }
        }
        return null;
    }

    private void trailingArguments(NodeList arguments) {
        if (!isEmpty(arguments)) {
            add(" ");
            elements(arguments.children(), ", ");
        }
    }

    @Override
    public Void visit(SendSet node) {
        String assignment = node.assignmentOperator().source();
        if (node.isPrefix()) {
            add(assignment);
            assignmentTarget(node);
        } else if (node.isPostfix()) {
            assignmentTarget(node);
            add(assignment);
        } else if (node.isIndex()) {
            require(node, "receiver", node.receiver());
            List<AstNode> arguments = node.arguments();
            add("[");
            if (arguments.isEmpty()) {
                require(node, "index", null);
            } else {
                arguments.get(0).accept(this);
            }
            add("]");
            operator(assignment);
            if (arguments.size() < 2) {
                require(node, "assigned value", null);
            } else {
                elements(arguments.subList(1, arguments.size()), ", ");
            }
        } else {
            assignmentTarget(node);
            operator(assignment);
            if (node.argumentCount() == 0) {
                require(node, "assigned value", null);
            } else {
                elements(node.arguments(), ", ");
            }
        }
        return null;
    }

    private void assignmentTarget(SendSet node) {
        emit(node.receiver());
        if (node.receiver() != null && node.selector() != null) {
            add(".");
        }
        require(node, "selector", node.selector());
    }

    @Override
    public Void visit(StringInterpolation node) {
        require(node, "leading string", node.string());
        if (node.parts() != null) {
            elements(node.parts().children(), "");
        }
        return null;
    }

    @Override
    public Void visit(StringInterpolationPart node) {
        add("${");
        require(node, "expression", node.expression());
        add("}");
        require(node, "string", node.string());
        return null;
    }

    @Override
    public Void visit(Throw node) {
        token(node.throwToken(), "throw");
        if (node.expression() != null) {
            add(" ");
            node.expression().accept(this);
        }
        token(node.endToken(), ";");
        return null;
    }

    @Override
    public Void visit(TypeAnnotation node) {
        require(node, "type name", node.typeName());
        if (node.typeArguments() != null) {
            bracketed(node.typeArguments(), "<", ">");
        }
        return null;
    }

    @Override
    public Void visit(VariableDefinitions node) {
        if (node.modifiers() != null && !isEmpty(node.modifiers().nodes())) {
            node.modifiers().accept(this);
            add(" ");
        }
        if (node.type() != null) {
            node.type().accept(this);
            add(" ");
        }
        if (node.definitions() == null) {
            require(node, "definitions", null);
        } else {
            elements(node.definitions().children(), ", ");
        }
        token(node.endToken(), "");
        return null;
    }

    @Override
    public Void visit(While node) {
        token(node.whileKeyword(), "while");
        add(" ");
        condition(node, node.condition());
        add(" ");
        require(node, "body", node.body());
        return null;
    }

    private void condition(AstNode owner, AstNode condition) {
        if (condition instanceof ParenthesizedExpression) {
            condition.accept(this);
        } else {
            add("(");
            require(owner, "condition", condition);
            add(")");
        }
    }
}
