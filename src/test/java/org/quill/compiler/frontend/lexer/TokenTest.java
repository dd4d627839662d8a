package org.quill.compiler.frontend.lexer;

import org.quill.compiler.api.SourceInfo;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class TokenTest {

    @Test
    void tokensAreComparedByIdentity() {
        Token first = new Token(TokenType.IDENTIFIER, "x", null, 1, 1, 0, "a.quill");
        Token second = new Token(TokenType.IDENTIFIER, "x", null, 1, 1, 0, "a.quill");

        assertThat(first).isNotEqualTo(second);
        assertThat(first.toString()).isEqualTo("'x'@1:1");
    }

    @Test
    void orderFollowsOffset() {
        Token first = new Token(TokenType.IDENTIFIER, "a", null, 1, 1, 0, "a.quill");
        Token second = new Token(TokenType.IDENTIFIER, "b", null, 2, 1, 2, "a.quill");

        assertThat(first.isAtOrBefore(second)).isTrue();
        assertThat(second.isAtOrBefore(first)).isFalse();
        assertThat(first.isAtOrBefore(first)).isTrue();
        assertThat(second.sourceInfo()).isEqualTo(new SourceInfo("a.quill", 2, 1));
    }

    @Test
    void syntheticTokenHasNoPosition() {
        Token token = Token.synthetic("this");

        assertThat(token.isSynthetic()).isTrue();
        assertThat(token.type()).isEqualTo(TokenType.SYNTHETIC);
        assertThat(token.sourceInfo().isKnown()).isFalse();
    }

    @Test
    void groupIsLinkedOnce() {
        BeginGroupToken open = new BeginGroupToken("(", 1, 1, 0, "a.quill");
        Token close = new Token(TokenType.END_GROUP, ")", null, 1, 3, 2, "a.quill");

        assertThat(open.endGroup()).isNull();
        open.linkEndGroup(close);

        assertThat(open.endGroup()).isSameAs(close);
        assertThatThrownBy(() -> open.linkEndGroup(close)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void textIsRequired() {
        assertThatThrownBy(() -> new Token(TokenType.STRING, null, null, 1, 1, 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
