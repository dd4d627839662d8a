package org.quill.compiler.frontend.parser.ast;

/**
 * Common shape of {@link For}, {@link While} and {@link DoWhile}.
 */
public sealed interface Loop extends Statement permits DoWhile, For, While {

    /**
     * @return The loop body, or {@code null} if the parser did not supply one.
     */
    Statement body();

    /**
     * @return The loop condition, or {@code null} if the loop has none.
     */
    Expression condition();
}
