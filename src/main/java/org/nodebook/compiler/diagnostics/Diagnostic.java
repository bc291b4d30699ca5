package org.nodebook.compiler.diagnostics;

/**
 * A single compiler error tied to a source line.
 *
 * @param line    1-based source line, or 0 for problems not tied to a line (schema integrity).
 * @param message Human-readable description.
 * @param kind    The error classification.
 */
public record Diagnostic(int line, String message, ErrorKind kind) {

    @Override
    public String toString() {
        return "[" + kind + "] line " + line + ": " + message;
    }
}
