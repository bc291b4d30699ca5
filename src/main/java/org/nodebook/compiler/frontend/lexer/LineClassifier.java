package org.nodebook.compiler.frontend.lexer;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies each line of a CNL document.
 * <p>
 * Fence delimiters take priority: between an opening description fence and the
 * next closing fence every line is {@link LineKind#VERBATIM}. Outside fences a line
 * is a node heading (exactly one {@code #}), a morph heading (two or more), a
 * relation ({@code <name> target}), an attribute ({@code has name: value}) or blank.
 * Anything else is reported as a {@link ErrorKind#SYNTAX} error and kept as
 * {@link LineKind#INVALID} so the parser knows which block it damaged.
 */
public class LineClassifier {

    static final String DESCRIPTION_FENCE = "```description";
    static final String GRAPH_DESCRIPTION_FENCE = "```graph-description";
    static final String CLOSING_FENCE = "```";

    private static final Pattern NODE_HEADING = Pattern.compile("^#(?!#)\\s*(.*?)\\s*$");
    private static final Pattern MORPH_HEADING = Pattern.compile("^#{2,}\\s*(.*?)\\s*$");
    private static final Pattern TYPE_LIST = Pattern.compile("^(.*?)\\s*\\[([^\\[\\]]*)\\]$");
    private static final Pattern RELATION = Pattern.compile("^<([^<>]*)>\\s*(.*?)\\s*;?\\s*$");
    private static final Pattern ATTRIBUTE = Pattern.compile("^has\\s+([^:]*):\\s*(.*?)\\s*;?\\s*$");
    private static final Pattern ATTRIBUTE_KEYWORD = Pattern.compile("^has(\\s|$)");
    private static final Pattern LINE_BREAK = Pattern.compile("\\r?\\n");
    private static final Pattern TYPE_SEPARATOR = Pattern.compile("[;,]");

    private final DiagnosticsEngine diagnostics;

    public LineClassifier(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Classifies every line of the source text. Lines with syntax errors are reported
     * and returned as {@link LineKind#INVALID}.
     *
     * @param source The CNL document.
     * @return The classified lines in source order.
     */
    public List<ClassifiedLine> classify(String source) {
        List<ClassifiedLine> result = new ArrayList<>();
        String[] lines = LINE_BREAK.split(source, -1);
        int fenceOpenedAt = 0;

        for (int i = 0; i < lines.length; i++) {
            int lineNumber = i + 1;
            String raw = lines[i];
            String trimmed = raw.trim();

            if (fenceOpenedAt > 0) {
                if (trimmed.equals(CLOSING_FENCE)) {
                    result.add(ClassifiedLine.bare(lineNumber, LineKind.FENCE_CLOSE, raw));
                    fenceOpenedAt = 0;
                } else {
                    result.add(ClassifiedLine.bare(lineNumber, LineKind.VERBATIM, raw));
                }
                continue;
            }

            ClassifiedLine classified = null;
            if (trimmed.isEmpty()) {
                classified = ClassifiedLine.bare(lineNumber, LineKind.BLANK, raw);
            } else if (trimmed.equals(DESCRIPTION_FENCE)) {
                classified = ClassifiedLine.bare(lineNumber, LineKind.DESCRIPTION_OPEN, raw);
                fenceOpenedAt = lineNumber;
            } else if (trimmed.equals(GRAPH_DESCRIPTION_FENCE)) {
                classified = ClassifiedLine.bare(lineNumber, LineKind.GRAPH_DESCRIPTION_OPEN, raw);
                fenceOpenedAt = lineNumber;
            } else if (trimmed.startsWith(CLOSING_FENCE)) {
                syntaxError(trimmed.equals(CLOSING_FENCE)
                        ? "Closing fence without an opening fence"
                        : "Unsupported fence '" + trimmed + "'", lineNumber);
            } else if (trimmed.startsWith("##")) {
                classified = classifyMorphHeading(trimmed, raw, lineNumber);
            } else if (trimmed.startsWith("#")) {
                classified = classifyNodeHeading(trimmed, raw, lineNumber);
            } else if (trimmed.startsWith("<")) {
                classified = classifyRelation(trimmed, raw, lineNumber);
            } else if (ATTRIBUTE_KEYWORD.matcher(trimmed).lookingAt()) {
                classified = classifyAttribute(trimmed, raw, lineNumber);
            } else {
                syntaxError("Unrecognized line '" + trimmed + "'", lineNumber);
            }
            result.add(classified != null ? classified : ClassifiedLine.bare(lineNumber, LineKind.INVALID, raw));
        }

        if (fenceOpenedAt > 0) {
            syntaxError("Fence opened here is never closed", fenceOpenedAt);
        }
        return result;
    }

    private ClassifiedLine classifyNodeHeading(String trimmed, String raw, int lineNumber) {
        Matcher heading = NODE_HEADING.matcher(trimmed);
        if (!heading.matches()) {
            syntaxError("Malformed node heading", lineNumber);
            return null;
        }
        String body = heading.group(1);
        List<String> types = List.of();
        Matcher typeList = TYPE_LIST.matcher(body);
        if (typeList.matches()) {
            body = typeList.group(1);
            types = Arrays.stream(TYPE_SEPARATOR.split(typeList.group(2)))
                    .map(String::trim)
                    .filter(t -> !t.isEmpty())
                    .toList();
        }

        ModifierExtractor.Extraction extraction = ModifierExtractor.extract(body);
        if (!extraction.isValid()) {
            syntaxError(extraction.error(), lineNumber);
            return null;
        }
        Modifiers modifiers = extraction.modifiers();
        if (modifiers.unit() != null || modifiers.modality() != null) {
            syntaxError("Node heading accepts only adjective and quantifier modifiers", lineNumber);
            return null;
        }
        if (extraction.remainder().isEmpty()) {
            syntaxError("Node heading without a name", lineNumber);
            return null;
        }
        return new ClassifiedLine(lineNumber, LineKind.NODE_HEADING, raw, extraction.remainder(), null,
                types, modifiers);
    }

    private ClassifiedLine classifyMorphHeading(String trimmed, String raw, int lineNumber) {
        Matcher heading = MORPH_HEADING.matcher(trimmed);
        if (!heading.matches() || heading.group(1).isEmpty()) {
            syntaxError("Morph heading without a name", lineNumber);
            return null;
        }
        return new ClassifiedLine(lineNumber, LineKind.MORPH_HEADING, raw, heading.group(1), null,
                List.of(), Modifiers.NONE);
    }

    private ClassifiedLine classifyRelation(String trimmed, String raw, int lineNumber) {
        Matcher relation = RELATION.matcher(trimmed);
        if (!relation.matches()) {
            syntaxError("Malformed relation, expected '<name> target;'", lineNumber);
            return null;
        }
        String name = relation.group(1).trim();
        if (name.isEmpty()) {
            syntaxError("Relation without a name", lineNumber);
            return null;
        }
        ModifierExtractor.Extraction extraction = ModifierExtractor.extract(relation.group(2));
        if (!extraction.isValid()) {
            syntaxError(extraction.error(), lineNumber);
            return null;
        }
        if (extraction.modifiers().quantifier() != null || extraction.modifiers().unit() != null) {
            syntaxError("Relation accepts only adverb and modality modifiers", lineNumber);
            return null;
        }
        if (extraction.remainder().isEmpty()) {
            syntaxError("Relation '" + name + "' without a target", lineNumber);
            return null;
        }
        return new ClassifiedLine(lineNumber, LineKind.RELATION, raw, name, extraction.remainder(),
                List.of(), extraction.modifiers());
    }

    private ClassifiedLine classifyAttribute(String trimmed, String raw, int lineNumber) {
        Matcher attribute = ATTRIBUTE.matcher(trimmed);
        if (!attribute.matches()) {
            syntaxError("Malformed attribute, expected 'has name: value;'", lineNumber);
            return null;
        }
        String name = attribute.group(1).trim();
        if (name.isEmpty()) {
            syntaxError("Attribute without a name", lineNumber);
            return null;
        }
        ModifierExtractor.Extraction extraction = ModifierExtractor.extract(attribute.group(2));
        if (!extraction.isValid()) {
            syntaxError(extraction.error(), lineNumber);
            return null;
        }
        if (extraction.remainder().isEmpty()) {
            syntaxError("Attribute '" + name + "' without a value", lineNumber);
            return null;
        }
        return new ClassifiedLine(lineNumber, LineKind.ATTRIBUTE, raw, name, extraction.remainder(),
                List.of(), extraction.modifiers());
    }

    private void syntaxError(String message, int lineNumber) {
        diagnostics.reportError(ErrorKind.SYNTAX, message, lineNumber);
    }
}
