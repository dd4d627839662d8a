package org.quill.compiler.frontend.lexer;

import org.quill.compiler.api.SourceInfo;

/**
 * A single token produced by the lexer and referenced from syntax tree nodes.
 * <p>
 * Tokens are compared by identity: two tokens with the same text at the same place are still
 * two different occurrences. Positions are 1-based line/column and a 0-based character offset;
 * synthetic tokens have no position at all.
 */
public class Token {

    private static final int NO_POSITION = -1;

    private final TokenType type;
    private final String text;
    private final Object value;
    private final int line;
    private final int column;
    private final int offset;
    private final String fileName;

    /**
     * Creates a token.
     *
     * @param type The type of the token.
     * @param text The exact text of the token from the source code.
     * @param value The processed value of the token, or {@code null} if the lexer did not decode one.
     * @param line The line number where the token was found.
     * @param column The column number where the token begins.
     * @param offset The character offset of the first character of the token.
     * @param fileName The logical file name the token originates from.
     */
    public Token(TokenType type, String text, Object value, int line, int column, int offset, String fileName) {
        if (type == null) {
            throw new IllegalArgumentException("Token type must not be null");
        }
        if (text == null) {
            throw new IllegalArgumentException("Token text must not be null");
        }
        this.type = type;
        this.text = text;
        this.value = value;
        this.line = line;
        this.column = column;
        this.offset = offset;
        this.fileName = fileName;
    }

    /**
     * Creates a token that does not originate from source text, e.g. the name of an
     * implicit constructor. Synthetic tokens are never used as span boundaries.
     *
     * @param text The text of the token.
     * @return A new synthetic token.
     */
    public static Token synthetic(String text) {
        return new Token(TokenType.SYNTHETIC, text, null, NO_POSITION, NO_POSITION, NO_POSITION, null);
    }

    public TokenType type() {
        return type;
    }

    public String text() {
        return text;
    }

    /**
     * @return The value decoded by the lexer, or {@code null}.
     */
    public Object value() {
        return value;
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public int offset() {
        return offset;
    }

    public String fileName() {
        return fileName;
    }

    public boolean isSynthetic() {
        return type == TokenType.SYNTHETIC || offset < 0;
    }

    /**
     * Returns whether this token starts no later than the other token in the source.
     * Both tokens must carry a position.
     *
     * @param other The token to compare with.
     * @return {@code true} if this token is at or before {@code other}.
     */
    public boolean isAtOrBefore(Token other) {
        if (isSynthetic() || other.isSynthetic()) {
            throw new IllegalArgumentException("Synthetic tokens have no source order: " + this + ", " + other);
        }
        return offset <= other.offset;
    }

    /**
     * @return The source position of this token.
     */
    public SourceInfo sourceInfo() {
        return new SourceInfo(fileName, line, column);
    }

    @Override
    public String toString() {
        if (isSynthetic()) {
            return "'" + text + "'";
        }
        return String.format("'%s'@%d:%d", text, line, column);
    }
}
