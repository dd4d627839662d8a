package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.testing.SampleTrees;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModifiersTest {

    private final SampleTrees trees = new SampleTrees();

    @Test
    void flagsFollowModifierSpellings() {
        Modifiers modifiers = trees.modifiers("static", "final");

        assertThat(modifiers.isStatic()).isTrue();
        assertThat(modifiers.isFinal()).isTrue();
        assertThat(modifiers.isAbstract()).isFalse();
        assertThat(modifiers.isVar()).isFalse();
        assertThat(modifiers.isConst()).isFalse();
        assertThat(modifiers.flags()).isEqualTo(Modifiers.FLAG_STATIC | Modifiers.FLAG_FINAL);
    }

    @Test
    void conflictingModifiersAreKeptAsWritten() {
        Modifiers modifiers = trees.modifiers("var", "const", "abstract");

        assertThat(modifiers.isVar()).isTrue();
        assertThat(modifiers.isConst()).isTrue();
        assertThat(modifiers.isAbstract()).isTrue();
    }

    @Test
    void unknownSpellingsAreIgnored() {
        Modifiers modifiers = trees.modifiers("external");

        assertThat(modifiers.flags()).isZero();
        assertThat(modifiers.nodes().length()).isEqualTo(1);
    }

    @Test
    void nullListHasNoFlags() {
        assertThat(Modifiers.computeFlags(null)).isZero();
    }

    @Test
    void explicitFlagsMustMatchTheList() {
        NodeList nodes = trees.factory().nodeList(null, List.of(trees.keywordName("static")), null, null);

        assertThatThrownBy(() -> new Modifiers(99L, nodes, Modifiers.FLAG_FINAL))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(new Modifiers(99L, nodes, Modifiers.FLAG_STATIC).isStatic()).isTrue();
    }
}
