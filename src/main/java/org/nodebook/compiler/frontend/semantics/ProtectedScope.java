package org.nodebook.compiler.frontend.semantics;

import org.nodebook.graph.Identifiers;
import org.nodebook.graph.MorphId;
import org.nodebook.graph.Node;

/**
 * Marks stored entities that a lenient compilation must not delete because the
 * declaration that would have kept them was skipped. Null components are wildcards.
 *
 * @param nodeId   Id of the owning node, or null to match by base name.
 * @param baseName Normalized base name, used when the node id is unknown.
 * @param morphId  Morph, or null for the whole node.
 * @param name     Normalized relation or attribute name, or null for the whole morph.
 */
public record ProtectedScope(String nodeId, String baseName, MorphId morphId, String name) {

    public static ProtectedScope node(String baseName) {
        return new ProtectedScope(null, Identifiers.normalize(baseName), null, null);
    }

    public static ProtectedScope morph(String nodeId, MorphId morphId) {
        return new ProtectedScope(nodeId, null, morphId, null);
    }

    public static ProtectedScope entry(String nodeId, MorphId morphId, String name) {
        return new ProtectedScope(nodeId, null, morphId, Identifiers.normalize(name));
    }

    /**
     * @return true if this scope protects the node itself from deletion.
     */
    public boolean coversNode(Node node) {
        return morphId == null && name == null && matchesNode(node);
    }

    /**
     * @return true if this scope protects a relation or attribute of the given node.
     */
    public boolean coversEntry(Node owner, MorphId entryMorph, String entryName) {
        if (!matchesNode(owner)) return false;
        if (morphId != null && !morphId.equals(entryMorph)) return false;
        return name == null || name.equals(Identifiers.normalize(entryName));
    }

    private boolean matchesNode(Node node) {
        if (nodeId != null) return nodeId.equals(node.id());
        return baseName != null && baseName.equals(Identifiers.normalize(node.baseName()));
    }
}
