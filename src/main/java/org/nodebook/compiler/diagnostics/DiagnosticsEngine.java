package org.nodebook.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects diagnostics across all compilation stages of one submission.
 * <p>
 * Stages never throw on user errors; they report here and carry on with the
 * remaining declarations. The compiler consults the engine once all stages have
 * run to decide whether the submission is aborted.
 * <p>
 * Not thread-safe. One engine belongs to exactly one compilation.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    /**
     * Reports an error.
     *
     * @param kind    The error classification.
     * @param message Human-readable description.
     * @param line    1-based source line, or 0 when not tied to a line.
     */
    public void reportError(ErrorKind kind, String message, int line) {
        diagnostics.add(new Diagnostic(line, message, kind));
    }

    /**
     * @return true if at least one error has been reported.
     */
    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * @return true if an error of an always-fatal kind has been reported.
     */
    public boolean hasFatalErrors() {
        return diagnostics.stream().anyMatch(d -> d.kind().isAlwaysFatal());
    }

    /**
     * @param kind The kind to look for.
     * @return true if an error of the given kind has been reported.
     */
    public boolean hasErrorOfKind(ErrorKind kind) {
        return diagnostics.stream().anyMatch(d -> d.kind() == kind);
    }

    /**
     * Returns all diagnostics ordered by line; reports on the same line keep their
     * reporting order.
     *
     * @return An unmodifiable, line-ordered view.
     */
    public List<Diagnostic> getDiagnostics() {
        List<Diagnostic> sorted = new ArrayList<>(diagnostics);
        sorted.sort(Comparator.comparingInt(Diagnostic::line));
        return Collections.unmodifiableList(sorted);
    }

    /**
     * @return A multi-line summary of all diagnostics, one per line.
     */
    public String summary() {
        return getDiagnostics().stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining(System.lineSeparator()));
    }
}
