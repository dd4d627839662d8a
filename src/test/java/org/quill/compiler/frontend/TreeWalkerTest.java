package org.quill.compiler.frontend;

import org.quill.compiler.frontend.parser.ast.AstNode;
import org.quill.compiler.frontend.parser.ast.Identifier;
import org.quill.compiler.frontend.parser.ast.LiteralInt;
import org.quill.compiler.frontend.parser.ast.NodeKind;
import org.quill.compiler.frontend.parser.ast.Operator;
import org.quill.compiler.frontend.parser.ast.Send;
import org.quill.compiler.testing.SampleTrees;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TreeWalkerTest {

    @Test
    void walkVisitsWholeTreeInPreOrder() {
        // Arrange
        SampleTrees trees = new SampleTrees();
        AstNode function = trees.sample(NodeKind.FUNCTION_EXPRESSION);
        List<String> seen = new ArrayList<>();
        TreeWalker walker = TreeWalker.builder()
                .on(Identifier.class, id -> seen.add(id.source()))
                .on(Operator.class, op -> seen.add(op.source()))
                .on(LiteralInt.class, literal -> seen.add(literal.token().text()))
                .build();

        // Act
        walker.walk(function);

        // Assert
        assertThat(seen).containsExactly("static", "int", "twice", "x", "x", "*", "2");
    }

    @Test
    void handlersForTheSameTypeRunInRegistrationOrder() {
        SampleTrees trees = new SampleTrees();
        List<String> calls = new ArrayList<>();
        TreeWalker walker = TreeWalker.builder()
                .on(Send.class, send -> calls.add("first"))
                .on(Send.class, send -> calls.add("second"))
                .build();

        walker.walk(trees.sample(NodeKind.SEND));

        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    void walkWithMapSkipsUnregisteredTypesAndNulls() {
        SampleTrees trees = new SampleTrees();
        List<AstNode> blocks = new ArrayList<>();
        Map<Class<? extends AstNode>, Consumer<AstNode>> handlers = Map.of(
                NodeKind.BLOCK.nodeType(), blocks::add);
        TreeWalker walker = new TreeWalker(handlers);
        AstNode block = trees.sample(NodeKind.BLOCK);

        walker.walk((AstNode) null);
        walker.walk(List.of(trees.sample(NodeKind.IDENTIFIER), block));

        assertThat(blocks).containsExactly(block);
    }
}
