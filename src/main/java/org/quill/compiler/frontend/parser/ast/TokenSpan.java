package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.api.SourceInfo;
import org.quill.compiler.frontend.lexer.Token;

/**
 * The first and last source token of a node.
 *
 * @param begin The first token, or {@code null} if it cannot be derived.
 * @param end The last token, or {@code null} if it cannot be derived.
 */
public record TokenSpan(Token begin, Token end) {

    /**
     * @return {@code true} if both boundaries are known.
     */
    public boolean isComplete() {
        return begin != null && end != null;
    }

    /**
     * @return {@code true} if both boundaries are known and the begin token does not come after the end token.
     */
    public boolean isOrdered() {
        return isComplete() && begin.isAtOrBefore(end);
    }

    /**
     * @return The location of the first known boundary, for diagnostics.
     */
    public SourceInfo toSourceInfo() {
        if (begin != null) {
            return begin.sourceInfo();
        }
        return end != null ? end.sourceInfo() : SourceInfo.UNKNOWN;
    }

    @Override
    public String toString() {
        return "[" + describe(begin) + " .. " + describe(end) + "]";
    }

    private static String describe(Token token) {
        return token == null ? "?" : token.line() + ":" + token.column();
    }
}
