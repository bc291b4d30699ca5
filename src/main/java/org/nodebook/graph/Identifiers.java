package org.nodebook.graph;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives stable, human-readable identifiers from declared names.
 */
public final class Identifiers {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private Identifiers() {
    }

    /**
     * Lower-cases, trims and replaces whitespace runs with underscores.
     */
    public static String normalize(String label) {
        if (label == null) return "";
        return WHITESPACE.matcher(label.trim().toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    /**
     * Joins quantifier, adjective and base name with underscores, skipping empty parts.
     *
     * @throws IllegalArgumentException if the base name is blank.
     */
    public static String composeNodeId(String quantifier, String adjective, String baseName) {
        if (baseName == null || baseName.isBlank()) {
            throw new IllegalArgumentException("base name is mandatory for node id composition");
        }
        StringBuilder id = new StringBuilder();
        for (String part : new String[]{quantifier, adjective, baseName}) {
            if (part == null || part.isBlank()) continue;
            if (id.length() > 0) id.append('_');
            id.append(normalize(part));
        }
        return id.toString();
    }

    public static MorphId morphId(String nodeId, String morphName) {
        return new MorphId(nodeId + "::" + normalize(morphName));
    }

    public static String relationId(String sourceId, String name, String targetId, MorphId morphId) {
        return "rel_" + sourceId + "_" + normalize(name) + "_" + targetId + "@" + morphSuffix(morphId);
    }

    public static String attributeId(String sourceId, String name, String value, MorphId morphId) {
        return "attr_" + sourceId + "_" + normalize(name) + "_" + normalize(value) + "@" + morphSuffix(morphId);
    }

    public static String derivedAttributeId(String sourceId, String name, MorphId morphId) {
        return "attr_" + sourceId + "_" + normalize(name) + "@" + morphSuffix(morphId);
    }

    /**
     * Appends an ordinal to the name part of a relation or attribute id, keeping the
     * morph suffix: {@code attr_rex_age_3@basic} becomes {@code attr_rex_age_3_2@basic}.
     */
    public static String withOrdinal(String id, int ordinal) {
        int at = id.lastIndexOf('@');
        return at < 0 ? id + "_" + ordinal : id.substring(0, at) + "_" + ordinal + id.substring(at);
    }

    private static String morphSuffix(MorphId morphId) {
        String value = morphId.value();
        int sep = value.lastIndexOf("::");
        return sep >= 0 ? value.substring(sep + 2) : value;
    }
}
