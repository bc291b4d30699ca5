package org.nodebook.compiler.frontend.lexer;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts inline modifier tokens from a line segment in secondary passes.
 * Emphasis is extracted before unit so that {@code **x**} is never read as two units.
 */
public final class ModifierExtractor {

    private static final Pattern EMPHASIS = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern QUANTIFIER = Pattern.compile("\\+\\+([^+]+)\\+\\+");
    private static final Pattern UNIT = Pattern.compile("(?<!\\*)\\*([^*]+)\\*(?!\\*)");
    private static final Pattern MODALITY = Pattern.compile("\\[([^\\[\\]]+)\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Result of an extraction.
     *
     * @param remainder The segment with all modifiers removed and whitespace collapsed.
     * @param modifiers The extracted modifiers.
     * @param error     Description of a malformed modifier, or null on success.
     */
    public record Extraction(String remainder, Modifiers modifiers, String error) {

        public boolean isValid() {
            return error == null;
        }
    }

    private ModifierExtractor() {
    }

    /**
     * Extracts all modifier kinds from the segment.
     */
    public static Extraction extract(String segment) {
        StringBuilder text = new StringBuilder(segment);
        String[] found = new String[4];
        Pattern[] patterns = {EMPHASIS, QUANTIFIER, UNIT, MODALITY};
        String[] labels = {"emphasis", "quantifier", "unit", "modality"};

        for (int i = 0; i < patterns.length; i++) {
            Matcher matcher = patterns[i].matcher(text);
            if (matcher.find()) {
                found[i] = matcher.group(1).trim();
                int start = matcher.start();
                int end = matcher.end();
                if (matcher.find()) {
                    return new Extraction(segment, Modifiers.NONE, "duplicate " + labels[i] + " modifier");
                }
                text.replace(start, end, " ");
            }
        }

        String remainder = WHITESPACE.matcher(text.toString().trim()).replaceAll(" ");
        String leftover = unbalancedToken(remainder);
        if (leftover != null) {
            return new Extraction(segment, Modifiers.NONE, "malformed modifier token '" + leftover + "'");
        }
        return new Extraction(remainder, new Modifiers(found[0], found[1], found[2], found[3]), null);
    }

    private static String unbalancedToken(String remainder) {
        if (remainder.contains("++")) return "++";
        if (remainder.contains("*")) return "*";
        if (remainder.contains("[")) return "[";
        if (remainder.contains("]")) return "]";
        return null;
    }
}
