package org.ansimark.markup.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An engine for collecting the non-fatal diagnostics of a render call.
 * <p>
 * This decouples reporting from the parser. Warnings are also logged so that callers
 * who never look at the engine still see them.
 */
public class DiagnosticsEngine {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosticsEngine.class);

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports a warning.
     *
     * @param message  The warning message.
     * @param position The position in the markup the warning refers to.
     */
    public void reportWarning(String message, String position) {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, message, position);
        diagnostics.add(diagnostic);
        LOG.warn("{} at position {}", message, position);
    }

    /**
     * Checks if warnings have been reported.
     *
     * @return {@code true} if at least one warning exists, otherwise {@code false}.
     */
    public boolean hasWarnings() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.WARNING);
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
