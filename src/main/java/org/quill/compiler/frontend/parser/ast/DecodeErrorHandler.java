package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.frontend.lexer.Token;

/**
 * Receives literal decode failures. Supplied by the parser when it builds a literal and
 * invoked synchronously while {@link Literal#value()} runs.
 * <p>
 * A handler may abort by throwing, or record the failure and return, in which case the
 * literal's value is empty.
 */
@FunctionalInterface
public interface DecodeErrorHandler {

    /**
     * @param token The token whose text could not be decoded.
     * @param description What went wrong.
     * @param cause The underlying exception, or {@code null} if there is none.
     */
    void onDecodeError(Token token, String description, Throwable cause);

    /**
     * @return A handler that throws {@link LiteralDecodeException}.
     */
    static DecodeErrorHandler failing() {
        return (token, description, cause) -> {
            throw new LiteralDecodeException(token, description, cause);
        };
    }

    /**
     * @param diagnostics The engine that receives one error per failure.
     * @return A handler that reports failures as error diagnostics at the token position.
     */
    static DecodeErrorHandler reportingTo(DiagnosticsEngine diagnostics) {
        return new DiagnosticsDecodeErrorHandler(diagnostics);
    }
}
