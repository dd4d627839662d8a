package org.quill.compiler.frontend.lexer;

/**
 * An opening bracket token that knows its matching closing token.
 * <p>
 * The lexer creates the opening token before it has seen the closing one, so the link is
 * established afterwards through {@link #linkEndGroup(Token)}, exactly once.
 */
public final class BeginGroupToken extends Token {

    private Token endGroup;

    public BeginGroupToken(String text, int line, int column, int offset, String fileName) {
        super(TokenType.BEGIN_GROUP, text, null, line, column, offset, fileName);
    }

    /**
     * Links this token to its closing bracket.
     *
     * @param closing The matching closing token.
     * @throws IllegalStateException if the token has already been linked.
     */
    public void linkEndGroup(Token closing) {
        if (closing == null) {
            throw new IllegalArgumentException("Closing token must not be null");
        }
        if (endGroup != null) {
            throw new IllegalStateException("Group " + this + " is already closed by " + endGroup);
        }
        this.endGroup = closing;
    }

    /**
     * @return The matching closing token, or {@code null} if the group was never closed.
     */
    public Token endGroup() {
        return endGroup;
    }
}
