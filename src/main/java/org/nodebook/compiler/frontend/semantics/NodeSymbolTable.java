package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.frontend.parser.ast.MorphDecl;
import org.nodebook.compiler.frontend.parser.ast.NodeDecl;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Node;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Holds every node known to one compilation, keyed by identity.
 * <p>
 * A node's identity is its normalized base name together with its role. Nodes that
 * match an identity in the stored graph keep the stored id. New nodes get an id
 * composed from quantifier, adjective and base name; on collision with another
 * identity the normalized role is appended.
 * <p>
 * Like a compiler symbol table it also tracks the current scope (node and morph)
 * while the resolver walks the parse tree.
 */
public class NodeSymbolTable {

    private final GraphSnapshot prior;
    private final Map<String, Node> priorByIdentity = new HashMap<>();
    private final Map<String, ResolvedNode> nodes = new LinkedHashMap<>();
    private final Set<String> usedIds = new HashSet<>();
    private final Map<NodeDecl, ResolvedNode> nodeBindings = new IdentityHashMap<>();
    private final Map<MorphDecl, ResolvedMorph> morphBindings = new IdentityHashMap<>();
    private final List<ProtectedScope> protectedScopes = new ArrayList<>();

    private ResolvedNode currentNode;
    private ResolvedMorph currentMorph;

    public NodeSymbolTable(GraphSnapshot prior) {
        this.prior = prior;
        for (Node node : prior.nodes()) {
            priorByIdentity.putIfAbsent(identityKey(node.baseName(), node.role()), node);
        }
    }

    public static String identityKey(String baseName, String role) {
        return Identifiers.normalize(baseName) + "|" + Identifiers.normalize(role);
    }

    public GraphSnapshot prior() {
        return prior;
    }

    public Optional<ResolvedNode> lookup(String identityKey) {
        return Optional.ofNullable(nodes.get(identityKey));
    }

    /**
     * Defines a new node. The id of the given node is replaced by the stored id for
     * the same identity, or by a freshly allocated one.
     *
     * @param node     The node; its id is ignored.
     * @param declared Whether a heading declares the node.
     * @param line     Line of the declaration or reference.
     * @return The registered node.
     * @throws IllegalStateException if the identity is already defined.
     */
    public ResolvedNode define(Node node, boolean declared, int line) {
        String key = identityKey(node.baseName(), node.role());
        if (nodes.containsKey(key)) {
            throw new IllegalStateException("Node identity already defined: " + key);
        }
        Node stored = priorByIdentity.get(key);
        String id = stored != null ? stored.id() : allocateId(node);
        usedIds.add(id);
        ResolvedNode resolved = new ResolvedNode(withId(node, id), declared, line);
        nodes.put(key, resolved);
        return resolved;
    }

    /**
     * Registers a stored node that the submission references without declaring it.
     */
    public ResolvedNode reference(Node storedNode, int line) {
        String key = identityKey(storedNode.baseName(), storedNode.role());
        ResolvedNode existing = nodes.get(key);
        if (existing != null) return existing;
        usedIds.add(storedNode.id());
        ResolvedNode resolved = new ResolvedNode(storedNode, false, line);
        nodes.put(key, resolved);
        return resolved;
    }

    private String allocateId(Node node) {
        String candidate = Identifiers.composeNodeId(node.quantifier(), node.adjective(), node.baseName());
        if (isTaken(candidate)) {
            candidate = candidate + "_" + Identifiers.normalize(node.role());
        }
        String base = candidate;
        int suffix = 2;
        while (isTaken(candidate)) {
            candidate = base + "_" + suffix++;
        }
        return candidate;
    }

    private boolean isTaken(String id) {
        return usedIds.contains(id) || prior.node(id).isPresent();
    }

    private static Node withId(Node node, String id) {
        return new Node(id, node.baseName(), node.name(), node.role(), node.parentTypes(), node.description(),
                node.adjective(), node.quantifier());
    }

    /**
     * Finds a node by the name a relation uses to reference it. Nodes of this
     * submission are searched first, matching base name, display name or id; then
     * the stored graph.
     *
     * @param name The target name as written.
     * @return The node of this submission, or empty.
     */
    public Optional<ResolvedNode> findByName(String name) {
        String normalized = Identifiers.normalize(name);
        for (ResolvedNode candidate : nodes.values()) {
            if (matches(candidate.node(), normalized)) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    /**
     * @param name The target name as written.
     * @return A stored node matching the name, or empty.
     */
    public Optional<Node> findStoredByName(String name) {
        String normalized = Identifiers.normalize(name);
        return prior.nodes().stream().filter(n -> matches(n, normalized)).findFirst();
    }

    private static boolean matches(Node node, String normalizedName) {
        return Identifiers.normalize(node.baseName()).equals(normalizedName)
                || Identifiers.normalize(node.name()).equals(normalizedName)
                || node.id().equals(normalizedName);
    }

    public Collection<ResolvedNode> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public void bind(NodeDecl decl, ResolvedNode node) {
        nodeBindings.put(decl, node);
    }

    public void bind(MorphDecl decl, ResolvedMorph morph) {
        morphBindings.put(decl, morph);
    }

    /**
     * @return The node a declaration resolved to; empty if the declaration was skipped.
     */
    public Optional<ResolvedNode> resolved(NodeDecl decl) {
        return Optional.ofNullable(nodeBindings.get(decl));
    }

    public Optional<ResolvedMorph> resolved(MorphDecl decl) {
        return Optional.ofNullable(morphBindings.get(decl));
    }

    public void protect(ProtectedScope scope) {
        protectedScopes.add(scope);
    }

    public List<ProtectedScope> protectedScopes() {
        return Collections.unmodifiableList(protectedScopes);
    }

    /**
     * Enters the scope of a node. A null node marks a skipped declaration; its
     * children are then ignored.
     */
    public void enterNode(ResolvedNode node) {
        this.currentNode = node;
        this.currentMorph = null;
    }

    public void enterMorph(ResolvedMorph morph) {
        this.currentMorph = currentNode != null ? morph : null;
    }

    public Optional<ResolvedNode> currentNode() {
        return Optional.ofNullable(currentNode);
    }

    public Optional<ResolvedMorph> currentMorph() {
        return Optional.ofNullable(currentMorph);
    }

    public void resetScope() {
        this.currentNode = null;
        this.currentMorph = null;
    }
}
