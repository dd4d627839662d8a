package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.diagnostics.DiagnosticsEngine;
import org.quill.compiler.frontend.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Records decode failures in a {@link DiagnosticsEngine} instead of aborting.
 */
final class DiagnosticsDecodeErrorHandler implements DecodeErrorHandler {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsDecodeErrorHandler.class);

    private final DiagnosticsEngine diagnostics;

    DiagnosticsDecodeErrorHandler(DiagnosticsEngine diagnostics) {
        if (diagnostics == null) {
            throw new IllegalArgumentException("Diagnostics engine must not be null");
        }
        this.diagnostics = diagnostics;
    }

    @Override
    public void onDecodeError(Token token, String description, Throwable cause) {
        LOG.debug("Literal {} could not be decoded: {}", token, description);
        diagnostics.reportError(description, token.sourceInfo());
    }
}
