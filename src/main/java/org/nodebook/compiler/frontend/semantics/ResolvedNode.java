package org.nodebook.compiler.frontend.semantics;

import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Morph;
import org.nodebook.graph.MorphId;
import org.nodebook.graph.Node;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A node after resolution, owning the morphs the submission declares for it.
 * <p>
 * Nodes are either declared by a heading or referenced as a relation target only.
 * Referenced nodes never have touched morphs.
 */
public final class ResolvedNode {

    private Node node;
    private final boolean declared;
    private final int line;
    private final Map<MorphId, ResolvedMorph> morphs = new LinkedHashMap<>();

    ResolvedNode(Node node, boolean declared, int line) {
        this.node = node;
        this.declared = declared;
        this.line = line;
        MorphId defaultId = Identifiers.morphId(node.id(), Morph.DEFAULT_NAME);
        morphs.put(defaultId, new ResolvedMorph(new Morph(defaultId, node.id(), Morph.DEFAULT_NAME, ""), declared, line));
    }

    public Node node() {
        return node;
    }

    /**
     * Replaces the node fields after a repeated declaration merged into it.
     *
     * @throws IllegalArgumentException if the id differs.
     */
    public void updateNode(Node node) {
        if (!node.id().equals(this.node.id())) {
            throw new IllegalArgumentException("Node id must not change: " + this.node.id() + " -> " + node.id());
        }
        this.node = node;
    }

    public boolean declared() {
        return declared;
    }

    /**
     * @return The line of the first heading declaring the node, or of the first
     * relation referencing it.
     */
    public int line() {
        return line;
    }

    public ResolvedMorph defaultMorph() {
        return morphs.get(Identifiers.morphId(node.id(), Morph.DEFAULT_NAME));
    }

    public Optional<ResolvedMorph> morph(MorphId morphId) {
        return Optional.ofNullable(morphs.get(morphId));
    }

    public Collection<ResolvedMorph> morphs() {
        return Collections.unmodifiableCollection(morphs.values());
    }

    public ResolvedMorph addMorph(String name, String description, int line) {
        MorphId id = Identifiers.morphId(node.id(), name);
        return morphs.computeIfAbsent(id, k -> new ResolvedMorph(new Morph(k, node.id(), name, description), true, line));
    }
}
