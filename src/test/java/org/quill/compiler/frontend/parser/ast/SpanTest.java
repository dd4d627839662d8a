package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.frontend.lexer.BeginGroupToken;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.testing.SampleTrees;
import org.quill.compiler.testing.TokenSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class SpanTest {

    private SampleTrees trees;
    private TokenSource tokens;
    private AstFactory ast;

    @BeforeEach
    void setUp() {
        trees = new SampleTrees();
        tokens = trees.tokens();
        ast = trees.factory();
    }

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void samplesHaveCompleteOrderedSpans(NodeKind kind) {
        TokenSpan span = trees.sample(kind).span();

        assertThat(span.isComplete()).as(span.toString()).isTrue();
        assertThat(span.isOrdered()).as(span.toString()).isTrue();
    }

    @Test
    void returnUsesKeywordAndSemicolon() {
        Token returnToken = tokens.keyword("return");
        LiteralInt value = trees.integer("1");
        Token semicolon = tokens.punctuation(";");

        Return statement = ast.returnStatement(returnToken, semicolon, value);

        assertThat(statement.getBeginToken()).isSameAs(returnToken);
        assertThat(statement.getEndToken()).isSameAs(semicolon);
    }

    @Test
    void returnWithoutTokensFallsBackToExpression() {
        LiteralInt value = trees.integer("1");

        Return statement = ast.returnStatement(null, null, value);

        assertThat(statement.getBeginToken()).isSameAs(value.token());
        assertThat(statement.getEndToken()).isSameAs(value.token());
    }

    @Test
    void ifWithoutElseEndsWithThenPart() {
        Token ifToken = tokens.keyword("if");
        ParenthesizedExpression condition = trees.parenthesized(tokens.open("("), trees.identifier("a"));
        ExpressionStatement then = trees.statement(trees.identifier("x"));

        If statement = ast.ifStatement(condition, then, null, ifToken, null);

        assertThat(statement.hasElsePart()).isFalse();
        assertThat(statement.getBeginToken()).isSameAs(ifToken);
        assertThat(statement.getEndToken()).isSameAs(then.endToken());
    }

    @Test
    void parenthesizedExpressionEndsAtMatchingGroupToken() {
        BeginGroupToken open = tokens.open("(");
        Identifier inner = trees.identifier("a");
        Token close = tokens.close(")");

        ParenthesizedExpression expression = ast.parenthesized(inner, open);

        assertThat(expression.getBeginToken()).isSameAs(open);
        assertThat(expression.getEndToken()).isSameAs(close);
    }

    @Test
    void syntheticIdentifierHasNoSpan() {
        Identifier implicitThis = ast.syntheticIdentifier("this");

        assertThat(implicitThis.isSynthetic()).isTrue();
        assertThat(implicitThis.isThis()).isTrue();
        assertThat(implicitThis.span().isComplete()).isFalse();
        assertThat(implicitThis.span().toSourceInfo()).isEqualTo(SourceInfo.UNKNOWN);
    }

    @Test
    void syntheticChildrenAreSkippedWhenDerivingSpans() {
        Identifier implicitThis = ast.syntheticIdentifier("this");
        Identifier field = trees.identifier("field");

        Send send = ast.send(implicitThis, field, null);

        assertThat(send.getBeginToken()).isSameAs(field.token());
        assertThat(send.getEndToken()).isSameAs(field.token());
    }

    @Test
    void forLoopConditionComesFromConditionStatement() {
        For loop = (For) trees.sample(NodeKind.FOR);

        assertThat(loop.condition()).isInstanceOf(Send.class);
        assertThat(loop.condition().unparse()).isEqualTo("i < n");
        assertThat(loop.getBeginToken().text()).isEqualTo("for");
        assertThat(loop.getEndToken().text()).isEqualTo(";");
    }

    @Test
    void emptyNodeHasNoSpan() {
        Block empty = ast.block(ast.nodeList(null, List.of(), null, null));

        assertThat(empty.getBeginToken()).isNull();
        assertThat(empty.getEndToken()).isNull();
        assertThat(empty.span().isOrdered()).isFalse();
    }

    @Test
    void sourceInfoComesFromBeginToken() {
        tokens.newLine();
        Identifier x = trees.identifier("x");

        SourceInfo info = x.span().toSourceInfo();

        assertThat(info.fileName()).isEqualTo("test.quill");
        assertThat(info.lineNumber()).isEqualTo(2);
        assertThat(info.columnNumber()).isEqualTo(1);
    }

    @Test
    void syntheticTokensCannotBeOrdered() {
        Token real = tokens.identifier("x");

        assertThatThrownBy(() -> real.isAtOrBefore(Token.synthetic("y")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
