package org.quill.compiler.testing;

import org.quill.compiler.frontend.lexer.BeginGroupToken;
import org.quill.compiler.frontend.lexer.Token;
import org.quill.compiler.frontend.lexer.TokenType;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Hands out tokens at increasing source positions, as a lexer would, so that trees can be
 * built by hand in source order. Tokens on a line are separated by one column of space.
 */
public final class TokenSource {

    private final String fileName;
    private final Deque<BeginGroupToken> openGroups = new ArrayDeque<>();
    private int line = 1;
    private int column = 1;
    private int offset = 0;

    public TokenSource() {
        this("test.quill");
    }

    public TokenSource(String fileName) {
        this.fileName = fileName;
    }

    public Token identifier(String name) {
        return next(TokenType.IDENTIFIER, name);
    }

    public Token keyword(String keyword) {
        return next(TokenType.KEYWORD, keyword);
    }

    public Token operator(String spelling) {
        return next(TokenType.OPERATOR, spelling);
    }

    public Token punctuation(String text) {
        return next(TokenType.PUNCTUATION, text);
    }

    public Token integer(String text) {
        return next(TokenType.INT, text);
    }

    public Token decimal(String text) {
        return next(TokenType.DOUBLE, text);
    }

    public Token string(String text) {
        return next(TokenType.STRING, text);
    }

    /**
     * Opens a bracket group; the matching {@link #close(String)} links its end token.
     */
    public BeginGroupToken open(String text) {
        BeginGroupToken token = new BeginGroupToken(text, line, column, offset, fileName);
        advance(text);
        openGroups.push(token);
        return token;
    }

    public Token close(String text) {
        if (openGroups.isEmpty()) {
            throw new IllegalStateException("No open group to close with '" + text + "'");
        }
        Token token = next(TokenType.END_GROUP, text);
        openGroups.pop().linkEndGroup(token);
        return token;
    }

    /**
     * Continues on the next line.
     */
    public TokenSource newLine() {
        line++;
        offset++;
        column = 1;
        return this;
    }

    private Token next(TokenType type, String text) {
        Token token = new Token(type, text, null, line, column, offset, fileName);
        advance(text);
        return token;
    }

    private void advance(String text) {
        column += text.length() + 1;
        offset += text.length() + 1;
    }
}
