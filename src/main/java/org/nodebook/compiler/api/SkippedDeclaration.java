package org.nodebook.compiler.api;

import org.nodebook.compiler.diagnostics.ErrorKind;

/**
 * A declaration a lenient compilation left out.
 *
 * @param line        Source line of the declaration.
 * @param kind        Why it was skipped.
 * @param description Human-readable reason.
 */
public record SkippedDeclaration(int line, ErrorKind kind, String description) {
}
