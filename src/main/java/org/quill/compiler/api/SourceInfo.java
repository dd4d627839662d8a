package org.quill.compiler.api;

/**
 * A pure data class representing a position in the source code.
 * It is part of the public API and free of implementation details.
 *
 * @param fileName The file where the code is located, or {@code null} if unknown.
 * @param lineNumber The line number (1-based).
 * @param columnNumber The column number (1-based).
 */
public record SourceInfo(String fileName, int lineNumber, int columnNumber) {

    /** Location used when a node has no real token to point at. */
    public static final SourceInfo UNKNOWN = new SourceInfo(null, -1, -1);

    public boolean isKnown() {
        return lineNumber > 0;
    }

    @Override
    public String toString() {
        String file = fileName != null ? fileName : "<unknown>";
        return isKnown() ? file + ":" + lineNumber + ":" + columnNumber : file;
    }
}
