package org.quill.compiler.diagnostics;

import org.quill.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting diagnostic messages (errors, warnings) produced by the front end.
 * <p>
 * This decouples error reporting from the code that detects the problem, e.g. a literal
 * that cannot be decoded.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param message  The error message.
     * @param location Where the error occurred.
     */
    public void reportError(String message, SourceInfo location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, location));
    }

    /**
     * Reports a warning.
     *
     * @param message  The warning message.
     * @param location Where the warning occurred.
     */
    public void reportWarning(String message, SourceInfo location) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, location));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable list of all collected diagnostics.
     *
     * @return An unmodifiable list of diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as a single, formatted string.
     *
     * @return A formatted string summary of all diagnostics.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
