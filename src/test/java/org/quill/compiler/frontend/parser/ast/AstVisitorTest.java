package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.testing.SampleTrees;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class AstVisitorTest {

    /** Records the kind of every node it is dispatched on. */
    private static final class KindRecorder extends SimpleAstVisitor<Void> {
        final List<NodeKind> visited = new ArrayList<>();

        @Override
        protected Void visitNode(AstNode node) {
            visited.add(node.kind());
            return defaultResult();
        }
    }

    @ParameterizedTest
    @EnumSource(NodeKind.class)
    void acceptDispatchesToTheVariantsVisit(NodeKind kind) {
        AstNode node = new SampleTrees().sample(kind);
        KindRecorder recorder = new KindRecorder();

        node.accept(recorder);

        assertThat(recorder.visited).containsExactly(kind);
    }

    @Test
    void visitChildrenIsOneLevelInSourceOrder() {
        // if (a) x; else y;
        If statement = (If) new SampleTrees().sample(NodeKind.IF);
        KindRecorder recorder = new KindRecorder();

        statement.visitChildren(recorder);

        assertThat(recorder.visited).containsExactly(
                NodeKind.PARENTHESIZED_EXPRESSION, NodeKind.EXPRESSION_STATEMENT, NodeKind.EXPRESSION_STATEMENT);
    }

    @Test
    void visitChildrenSkipsAbsentChildren() {
        SampleTrees trees = new SampleTrees();
        Identifier a = trees.identifier("a");
        Send propertyAccess = trees.factory().send(null, a, null);
        KindRecorder recorder = new KindRecorder();

        propertyAccess.visitChildren(recorder);

        assertThat(recorder.visited).containsExactly(NodeKind.IDENTIFIER);
    }

    @Test
    void leavesHaveNoChildrenToVisit() {
        KindRecorder recorder = new KindRecorder();

        new SampleTrees().identifier("x").visitChildren(recorder);

        assertThat(recorder.visited).isEmpty();
    }

    @Test
    void recursiveVisitorCountsIdentifiers() {
        AstNode function = new SampleTrees().sample(NodeKind.FUNCTION_EXPRESSION);
        List<String> names = new ArrayList<>();

        function.accept(new SimpleAstVisitor<Void>() {
            @Override
            public Void visit(Identifier node) {
                names.add(node.source());
                return null;
            }

            @Override
            protected Void visitNode(AstNode node) {
                node.visitChildren(this);
                return null;
            }
        });

        assertThat(names).containsExactly("static", "int", "twice", "x", "x");
    }

    @Test
    void simpleVisitorReturnsDefaultResult() {
        SimpleAstVisitor<String> visitor = new SimpleAstVisitor<>() {
            @Override
            protected String defaultResult() {
                return "default";
            }
        };

        assertThat(new SampleTrees().sample(NodeKind.BLOCK).accept(visitor)).isEqualTo("default");
    }
}
