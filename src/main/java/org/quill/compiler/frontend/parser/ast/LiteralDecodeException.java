package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

/**
 * Thrown by {@link DecodeErrorHandler#failing()} when a literal token cannot be decoded.
 */
public class LiteralDecodeException extends RuntimeException {

    private final transient Token token;

    public LiteralDecodeException(Token token, String description, Throwable cause) {
        super(String.format("%s at %s", description, token.sourceInfo()), cause);
        this.token = token;
    }

    /**
     * @return The token that could not be decoded.
     */
    public Token getToken() {
        return token;
    }
}
