package org.quill.compiler.frontend.parser.ast;

import org.quill.compiler.frontend.lexer.Token;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A floating-point literal such as {@code 1.5}, {@code .5} or {@code 2e10}.
 *
 * @param id The node id.
 * @param token The literal token.
 * @param handler Receives decode failures.
 */
public record LiteralDouble(long id, Token token, DecodeErrorHandler handler) implements Literal<Double> {

    // Double.parseDouble alone would also take "NaN", "1f" or hex floats.
    private static final Pattern DOUBLE_SYNTAX = Pattern.compile("(\\d+(\\.\\d+)?|\\.\\d+)([eE][+-]?\\d+)?");

    public LiteralDouble {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(handler, "handler");
    }

    @Override
    public Optional<Double> value() {
        String text = token.text();
        try {
            if (!DOUBLE_SYNTAX.matcher(text).matches()) {
                throw new NumberFormatException("For input string: \"" + text + "\"");
            }
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            handler.onDecodeError(token, "Malformed floating-point literal '" + text + "'", e);
            return Optional.empty();
        }
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LITERAL_DOUBLE;
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }

    @Override
    public Optional<LiteralDouble> asLiteralDouble() {
        return Optional.of(this);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LiteralDouble other && other.id == id;
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
