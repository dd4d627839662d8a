package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.testing.SampleTrees;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class NodeIdentityTest {

    @Test
    void nodesWithSameContentAreDistinct() {
        AstFactory ast = new AstFactory();
        Token token = new SampleTrees().tokens().identifier("x");

        Identifier first = ast.identifier(token);
        Identifier second = ast.identifier(token);

        assertThat(first).isNotEqualTo(second);
        assertThat(first.id()).isNotEqualTo(second.id());
        assertThat(Set.of(first, second)).hasSize(2);
    }

    @Test
    void equalityFollowsId() {
        Token token = new SampleTrees().tokens().identifier("x");

        Identifier original = new Identifier(7L, token);
        Identifier sameId = new Identifier(7L, Token.synthetic("y"));

        assertThat(original).isEqualTo(sameId);
        assertThat(original.hashCode()).isEqualTo(sameId.hashCode());
    }

    @Test
    void idsAreUniqueAcrossAWholeTree() {
        SampleTrees trees = new SampleTrees();
        Set<Long> ids = new HashSet<>();
        int[] count = {0};

        for (NodeKind kind : EnumSet.allOf(NodeKind.class)) {
            collect(trees.sample(kind), ids, count);
        }

        assertThat(ids).hasSize(count[0]);
    }

    @Test
    void toStringIsTheUnparsedText() {
        SampleTrees trees = new SampleTrees();

        AstNode statement = trees.sample(NodeKind.RETURN);

        assertThat(statement).hasToString("return 1;");
    }

    private static void collect(AstNode node, Set<Long> ids, int[] count) {
        ids.add(node.id());
        count[0]++;
        for (AstNode child : node.children()) {
            collect(child, ids, count);
        }
    }
}
