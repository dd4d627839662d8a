package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;

/**
 * An integer literal. Decimal and {@code 0x} hexadecimal spellings are accepted, the latter
 * without a sign after the prefix; values that do not fit in a {@code long} are decode failures.
 *
 * @param id The node id.
 * @param token The literal token.
 * @param handler Receives decode failures.
 */
public record LiteralInt(long id, Token token, DecodeErrorHandler handler) implements Literal<Long> {

    public LiteralInt {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(handler, "handler");
    }

    @Override
    public Optional<Long> value() {
        String text = token.text();
        try {
            return Optional.of(parse(text));
        } catch (NumberFormatException e) {
            handler.onDecodeError(token, "Malformed integer literal '" + text + "'", e);
            return Optional.empty();
        }
    }

    private static long parse(String text) {
        if (text.startsWith("0x") || text.startsWith("0X")) {
            String digits = text.substring(2);
            if (digits.startsWith("-") || digits.startsWith("+")) {
                throw new NumberFormatException("Sign after hexadecimal prefix: " + text);
            }
            return Long.parseLong(digits, 16);
        }
        return Long.parseLong(text);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_INT;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<LiteralInt> asLiteralInt() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralInt other && other.id == id;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(id);
    }

    @Override
    public String toString() {
        return unparse();
    }
}
