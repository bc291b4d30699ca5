package org.nodebook.compiler.frontend.lexer;

/**
 * Classification of a single CNL source line.
 */
public enum LineKind {
    /** {@code # Name [Type1; Type2]} */
    NODE_HEADING,
    /** {@code ## Morph name} (two or more hashes) */
    MORPH_HEADING,
    /** {@code <relation> Target;} */
    RELATION,
    /** {@code has name: value;} */
    ATTRIBUTE,
    /** Opening fence of a node or morph description. */
    DESCRIPTION_OPEN,
    /** Opening fence of the graph-level description. */
    GRAPH_DESCRIPTION_OPEN,
    /** Closing fence. */
    FENCE_CLOSE,
    /** A line inside a fenced block, passed through unclassified. */
    VERBATIM,
    BLANK,
    /** A line that failed classification; already reported. */
    INVALID
}
