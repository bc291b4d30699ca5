package org.nodebook.compiler.frontend.lexer;

import java.util.List;

/**
 * A source line after classification. Which fields are populated depends on the kind:
 * <ul>
 *   <li>{@code NODE_HEADING}: name (base name), declaredTypes, modifiers (emphasis, quantifier)</li>
 *   <li>{@code MORPH_HEADING}: name</li>
 *   <li>{@code RELATION}: name (relation), value (target name), modifiers (emphasis, modality)</li>
 *   <li>{@code ATTRIBUTE}: name, value, modifiers</li>
 *   <li>{@code VERBATIM}: raw only</li>
 * </ul>
 *
 * @param lineNumber    1-based line number.
 * @param kind          The classification.
 * @param raw           The unmodified line text.
 * @param name          Extracted name, or null.
 * @param value         Extracted value or target, or null.
 * @param declaredTypes Declared node types of a heading; empty otherwise.
 * @param modifiers     Extracted inline modifiers.
 */
public record ClassifiedLine(int lineNumber, LineKind kind, String raw, String name, String value,
                             List<String> declaredTypes, Modifiers modifiers) {

    public ClassifiedLine {
        declaredTypes = declaredTypes == null ? List.of() : List.copyOf(declaredTypes);
        modifiers = modifiers == null ? Modifiers.NONE : modifiers;
    }

    static ClassifiedLine bare(int lineNumber, LineKind kind, String raw) {
        return new ClassifiedLine(lineNumber, kind, raw, null, null, List.of(), Modifiers.NONE);
    }
}
