package org.nodebook.compiler.diagnostics;

/**
 * Classifies every problem the CNL compiler can report.
 * <p>
 * Kinds fall into four families:
 * <ul>
 *   <li><strong>Syntax/structure:</strong> the line could not be classified or is misplaced.</li>
 *   <li><strong>Schema resolution:</strong> a declared name does not exist in the schema,
 *       or the schema itself is unusable.</li>
 *   <li><strong>Semantic:</strong> the declaration resolves but violates a type rule.</li>
 *   <li><strong>Diff conflicts:</strong> the submission is ambiguous.</li>
 * </ul>
 * Kinds marked {@link #isAlwaysFatal() always fatal} abort the compilation
 * independent of strict or lenient mode.
 */
public enum ErrorKind {
    SYNTAX(false),
    STRUCTURAL(false),
    UNKNOWN_NODE_TYPE(false),
    UNKNOWN_RELATION_TYPE(false),
    UNKNOWN_ATTRIBUTE_TYPE(false),
    UNKNOWN_TARGET_NODE(false),
    CYCLIC_TYPE_HIERARCHY(true),
    INVALID_SCHEMA(true),
    DOMAIN_RANGE_VIOLATION(false),
    ATTRIBUTE_OUT_OF_SCOPE(false),
    INVALID_ATTRIBUTE_VALUE(false),
    UNKNOWN_ATTRIBUTE_REFERENCE(false),
    CIRCULAR_DERIVATION(false),
    EVALUATION_FAILURE(false),
    IDENTITY_CONFLICT(true);

    private final boolean alwaysFatal;

    ErrorKind(boolean alwaysFatal) {
        this.alwaysFatal = alwaysFatal;
    }

    /**
     * @return true if an error of this kind aborts the whole compilation regardless of mode.
     */
    public boolean isAlwaysFatal() {
        return alwaysFatal;
    }
}
