package org.quill.compiler.frontend.unparse;

import java.util.List;

/**
 * Outcome of regenerating source text for a node.
 *
 * @param description Short description of the unparsed node, e.g. {@code BLOCK#3}.
 * @param text The regenerated text; partial if problems occurred.
 * @param problems What went wrong, in the order it was found. Empty for a complete result.
 */
public record UnparseResult(String description, String text, List<String> problems) {

    public UnparseResult {
        problems = List.copyOf(problems);
    }

    public boolean isComplete() {
        return problems.isEmpty();
    }

    /**
     * @return The text if complete, otherwise an {@code <<unparse error: ...>>} description
     *         that embeds the problems and the partial text.
     */
    public String render() {
        if (isComplete()) {
            return text;
        }
        return "<<unparse error: " + description + ": " + String.join("; ", problems) + ": " + text + ">>";
    }
}
