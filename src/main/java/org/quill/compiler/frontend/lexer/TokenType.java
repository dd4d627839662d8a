package org.quill.compiler.frontend.lexer;

/**
 * Defines the kinds of tokens the lexer hands to the syntax tree.
 */
public enum TokenType {
    /** An identifier, such as a variable, type or method name. */
    IDENTIFIER,
    /** A reserved word, such as {@code class}, {@code if} or {@code return}. */
    KEYWORD,
    /** An operator spelling, such as {@code +}, {@code ++} or {@code []}. */
    OPERATOR,
    /** An integer literal. */
    INT,
    /** A floating-point literal. */
    DOUBLE,
    /** A string literal or string fragment. */
    STRING,
    /** An opening bracket: '(', '[', '{' or '<'. */
    BEGIN_GROUP,
    /** A closing bracket matching a {@link #BEGIN_GROUP} token. */
    END_GROUP,
    /** Separators and terminators such as ',', ';' or ':'. */
    PUNCTUATION,
    /** Represents the end of the source file. */
    END_OF_FILE,
    /** A token made up by the front end that has no source position. */
    SYNTHETIC
}
