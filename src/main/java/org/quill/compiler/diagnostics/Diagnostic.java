package org.quill.compiler.diagnostics;

import org.quill.compiler.api.SourceInfo;

/**
 * Represents a single diagnostic message (error, warning, info) raised while building or
 * reading a syntax tree.
 *
 * @param type The type of the diagnostic (e.g., ERROR, WARNING).
 * @param message The diagnostic message.
 * @param location Where the issue occurred.
 */
public record Diagnostic(
        Type type,
        String message,
        SourceInfo location
) {
    /**
     * The type of a diagnostic message.
     */
    public enum Type {
        /** An error that prevents further compilation. */
        ERROR,
        /** A warning that does not prevent compilation. */
        WARNING,
        /** An informational message. */
        INFO
    }

    @Override
    public String toString() {
        return String.format("[%s] %s: %s", type, location, message);
    }
}
