package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.diagnostics.Diagnostic;
import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.testing.TokenSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@Tag("unit")
@ExtendWith(MockitoExtension.class)
class LiteralTest {

    @Mock
    private DecodeErrorHandler handler;

    private TokenSource tokens;
    private AstFactory ast;

    @BeforeEach
    void setUp() {
        tokens = new TokenSource();
        ast = new AstFactory();
    }

    @ParameterizedTest
    @CsvSource({"42, 42", "0, 0", "0x1F, 31", "0XfF, 255", "9223372036854775807, 9223372036854775807"})
    void integersDecode(String text, long expected) {
        LiteralInt literal = ast.literalInt(tokens.integer(text), handler);

        assertThat(literal.value()).contains(expected);
        verify(handler, never()).onDecodeError(any(), anyString(), any());
    }

    @ParameterizedTest
    @ValueSource(strings = {"9223372036854775808", "0x", "12abc", "0x-5", "0x+5"})
    void malformedIntegersReachTheHandler(String text) {
        Token token = tokens.integer(text);
        LiteralInt literal = ast.literalInt(token, handler);

        assertThat(literal.value()).isEmpty();
        verify(handler).onDecodeError(eq(token), contains(text), any(NumberFormatException.class));
    }

    @Test
    void doublesDecode() {
        LiteralDouble literal = ast.literalDouble(tokens.decimal("2.5e3"), handler);

        assertThat(literal.value()).contains(2500.0);
    }

    @Test
    void malformedDoubleReachesTheHandler() {
        Token token = tokens.decimal("1.2.3");
        LiteralDouble literal = ast.literalDouble(token, handler);

        assertThat(literal.value()).isEmpty();
        verify(handler).onDecodeError(eq(token), contains("1.2.3"), any());
    }

    @Test
    void booleansDecodeOnlyFromKeywords() {
        LiteralBool yes = ast.literalBool(tokens.keyword("true"), handler);
        LiteralBool no = ast.literalBool(tokens.keyword("false"), handler);
        Token maybeToken = tokens.keyword("maybe");
        LiteralBool maybe = ast.literalBool(maybeToken, handler);

        assertThat(yes.value()).contains(true);
        assertThat(no.value()).contains(false);
        assertThat(maybe.value()).isEmpty();
        verify(handler).onDecodeError(eq(maybeToken), eq("Not a bool: 'maybe'"), isNull());
    }

    @Test
    void failingHandlerThrowsWithToken() {
        Token token = tokens.keyword("maybe");
        LiteralBool literal = ast.literalBool(token, DecodeErrorHandler.failing());

        assertThatThrownBy(literal::value)
                .isInstanceOf(LiteralDecodeException.class)
                .hasMessageContaining("Not a bool: 'maybe'")
                .hasMessageContaining("test.quill:1:1")
                .satisfies(e -> assertThat(((LiteralDecodeException) e).getToken()).isSameAs(token));
    }

    @Test
    void reportingHandlerRecordsAnError() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        LiteralInt literal = ast.literalInt(tokens.integer("0xZZ"), DecodeErrorHandler.reportingTo(diagnostics));

        assertThat(literal.value()).isEmpty();
        assertThat(diagnostics.hasErrors()).isTrue();
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(error.message()).contains("0xZZ");
        assertThat(error.location().lineNumber()).isEqualTo(1);
    }

    @Test
    void stringValueIsRawText() {
        LiteralString literal = ast.literalString(tokens.string("\"a\\nb\""));

        assertThat(literal.value()).contains("\"a\\nb\"");
    }

    @Test
    void nullHasNoValue() {
        LiteralNull literal = ast.literalNull(tokens.keyword("null"));

        assertThat(literal.value()).isEmpty();
        assertThat(literal.children()).isEmpty();
        assertThat(literal.getBeginToken()).isSameAs(literal.token());
    }
}
