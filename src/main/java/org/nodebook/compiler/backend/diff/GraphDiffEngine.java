package org.nodebook.compiler.backend.diff;

import org.nodebook.compiler.evaluation.EvaluationKey;
import org.nodebook.compiler.evaluation.EvaluationResult;
import org.nodebook.compiler.frontend.semantics.ProtectedScope;
import org.nodebook.compiler.frontend.semantics.ResolvedDocument;
import org.nodebook.compiler.frontend.semantics.ResolvedMorph;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.Change;
import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Morph;
import org.nodebook.graph.MorphId;
import org.nodebook.graph.Node;
import org.nodebook.graph.Relation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares a resolved and evaluated submission with the stored graph and produces
 * the change list that turns one into the other.
 * <p>
 * Deletion by omission is scoped to touched morphs: the default morph of every
 * declared node and every named morph whose heading appears. Stored relations and
 * attributes of other morphs are never deleted, and a stored node the submission does
 * not mention is left alone. The one exception is an implicit target: a node that
 * never carried declared content and loses its last incoming relation in this
 * submission is deleted together with its empty morphs.
 * <p>
 * Created relations and attributes whose composed id is already taken get a numeric
 * suffix, so distinct identities never share an id.
 * <p>
 * Changes are ordered deletes (relations, attributes, morphs, nodes), then updates,
 * then creates (nodes, morphs, relations, attributes).
 */
public class GraphDiffEngine {

    private static final Logger LOG = LoggerFactory.getLogger(GraphDiffEngine.class);

    /**
     * Computes the change list.
     *
     * @param document   The resolved submission.
     * @param evaluation The derived attributes of the submission.
     * @param prior      The stored graph.
     * @return The ordered change list; empty if the submission matches the stored graph.
     */
    public ChangeList diff(ResolvedDocument document, EvaluationResult evaluation, GraphSnapshot prior) {
        Set<MorphId> touched = new HashSet<>();
        Map<String, Node> newNodes = new LinkedHashMap<>();
        List<ResolvedNode> declaredNodes = new ArrayList<>();
        List<Morph> newMorphs = new ArrayList<>();
        List<Relation> newRelations = new ArrayList<>();
        List<Attribute> newAttributes = new ArrayList<>();

        for (ResolvedNode node : document.nodes()) {
            newNodes.put(node.node().id(), node.node());
            if (node.declared()) {
                declaredNodes.add(node);
            }
            for (ResolvedMorph morph : node.morphs()) {
                if (morph.touched()) touched.add(morph.morph().morphId());
                newMorphs.add(morph.morph());
                newRelations.addAll(morph.relations());
                newAttributes.addAll(morph.attributes());
            }
        }
        newAttributes.addAll(evaluation.attributes());

        List<ProtectedScope> protectedScopes = new ArrayList<>(document.protectedScopes());
        for (EvaluationKey failed : evaluation.failed()) {
            protectedScopes.add(ProtectedScope.entry(failed.nodeId(), failed.morphId(), failed.attributeName()));
        }

        Buckets buckets = new Buckets();
        diffNodes(declaredNodes, newNodes, prior, buckets);
        diffMorphs(newMorphs, touched, prior, buckets);
        Set<String> deletedRelations = diffRelations(newRelations, touched, prior, protectedScopes, buckets);
        diffAttributes(newAttributes, touched, prior, protectedScopes, buckets);
        deleteOrphanedTargets(newNodes, newRelations, deletedRelations, prior, protectedScopes, buckets);
        buckets.assignFreeIds(prior);

        String description = document.graphDescription();
        if (description != null && description.equals(prior.description())) {
            description = null;
        }
        ChangeList changes = new ChangeList(buckets.ordered(), description);
        LOG.debug("Diff for graph '{}': {} changes", prior.graphId(), changes.changes().size());
        return changes;
    }

    private void diffNodes(List<ResolvedNode> declaredNodes, Map<String, Node> newNodes, GraphSnapshot prior,
                           Buckets buckets) {
        Set<String> declaredIds = new HashSet<>();
        for (ResolvedNode node : declaredNodes) {
            declaredIds.add(node.node().id());
        }
        for (Node node : newNodes.values()) {
            Node stored = prior.node(node.id()).orElse(null);
            if (stored == null) {
                buckets.createNodes.add(Change.create(node));
            } else if (declaredIds.contains(node.id()) && !stored.equals(node)) {
                buckets.updates.add(Change.update(stored, node));
            }
        }
    }

    private void diffMorphs(List<Morph> newMorphs, Set<MorphId> touched, GraphSnapshot prior, Buckets buckets) {
        for (Morph morph : newMorphs) {
            Morph stored = prior.morph(morph.morphId()).orElse(null);
            if (stored == null) {
                buckets.createMorphs.add(Change.create(morph));
            } else if (touched.contains(morph.morphId()) && !stored.equals(morph)) {
                buckets.updates.add(Change.update(stored, morph));
            }
        }
    }

    /**
     * @return Ids of stored relations scheduled for deletion.
     */
    private Set<String> diffRelations(List<Relation> newRelations, Set<MorphId> touched, GraphSnapshot prior,
                                      List<ProtectedScope> protectedScopes, Buckets buckets) {
        Map<String, Relation> storedByKey = new HashMap<>();
        for (Relation stored : prior.relations()) {
            storedByKey.putIfAbsent(relationKey(stored), stored);
        }

        Set<String> matched = new HashSet<>();
        for (Relation relation : newRelations) {
            String key = relationKey(relation);
            if (!matched.add(key)) continue;
            Relation stored = storedByKey.get(key);
            if (stored == null) {
                buckets.createRelations.add(Change.create(relation));
                continue;
            }
            Relation updated = new Relation(stored.id(), relation.sourceId(), relation.targetId(), relation.name(),
                    relation.morphId(), relation.adverb(), relation.modality(), relation.inferred(),
                    relation.originMorphId());
            if (!updated.equals(stored)) {
                buckets.updates.add(Change.update(stored, updated));
            }
        }

        Set<String> deleted = new HashSet<>();
        for (Relation stored : prior.relations()) {
            MorphId scope = stored.inferred() ? stored.originMorphId() : stored.morphId();
            if (scope == null || !touched.contains(scope) || matched.contains(relationKey(stored))) continue;
            if (isProtected(stored.sourceId(), stored.morphId(), stored.name(), prior, protectedScopes)) continue;
            buckets.deleteRelations.put(stored.id(), Change.delete(stored));
            deleted.add(stored.id());
        }
        return deleted;
    }

    private void diffAttributes(List<Attribute> newAttributes, Set<MorphId> touched, GraphSnapshot prior,
                                List<ProtectedScope> protectedScopes, Buckets buckets) {
        Map<String, Attribute> storedByKey = new HashMap<>();
        for (Attribute stored : prior.attributes()) {
            storedByKey.putIfAbsent(attributeKey(stored), stored);
        }

        Set<String> matched = new HashSet<>();
        for (Attribute attribute : newAttributes) {
            String key = attributeKey(attribute);
            if (!matched.add(key)) continue;
            Attribute stored = storedByKey.get(key);
            if (stored == null) {
                buckets.createAttributes.add(Change.create(attribute));
                continue;
            }
            Attribute updated = new Attribute(stored.id(), attribute.sourceId(), attribute.name(), attribute.value(),
                    attribute.unit(), attribute.modality(), attribute.quantifier(), attribute.adverb(),
                    attribute.derived(), attribute.morphId(), attribute.expression());
            if (!updated.equals(stored)) {
                buckets.updates.add(Change.update(stored, updated));
            }
        }

        for (Attribute stored : prior.attributes()) {
            if (!touched.contains(stored.morphId()) || matched.contains(attributeKey(stored))) continue;
            if (isProtected(stored.sourceId(), stored.morphId(), stored.name(), prior, protectedScopes)) continue;
            buckets.deleteAttributes.put(stored.id(), Change.delete(stored));
        }
    }

    /**
     * Deletes implicit targets whose last incoming relation is deleted by this
     * submission and that nothing in the submission mentions.
     */
    private void deleteOrphanedTargets(Map<String, Node> newNodes, List<Relation> newRelations,
                                       Set<String> deletedRelations, GraphSnapshot prior,
                                       List<ProtectedScope> protectedScopes, Buckets buckets) {
        Set<String> candidates = new LinkedHashSet<>();
        Set<String> stillTargeted = new HashSet<>();
        for (Relation relation : prior.relations()) {
            if (deletedRelations.contains(relation.id())) {
                candidates.add(relation.targetId());
            } else {
                stillTargeted.add(relation.targetId());
            }
        }
        for (Relation relation : newRelations) {
            stillTargeted.add(relation.targetId());
        }

        for (String candidate : candidates) {
            if (newNodes.containsKey(candidate) || stillTargeted.contains(candidate)) continue;
            Node stored = prior.node(candidate).orElse(null);
            if (stored == null || !isImplicit(stored, prior, deletedRelations)) continue;
            if (protectedScopes.stream().anyMatch(p -> p.coversNode(stored))) continue;
            for (Morph morph : prior.morphsOf(stored.id())) {
                buckets.deleteMorphs.put(morph.id(), Change.delete(morph));
            }
            buckets.deleteNodes.add(Change.delete(stored));
        }
    }

    /**
     * A node created as a relation target carries no type, modifiers, description
     * or content of its own. Outgoing relations already scheduled for deletion (the
     * inferred inverses of symmetric relations) do not count.
     */
    private static boolean isImplicit(Node node, GraphSnapshot prior, Set<String> deletedRelations) {
        if (!Node.UNTYPED_ROLE.equals(node.role()) || !node.parentTypes().isEmpty()) return false;
        if (!node.description().isEmpty() || node.adjective() != null || node.quantifier() != null) return false;
        if (!prior.attributesOf(node.id()).isEmpty()) return false;
        if (prior.relationsFrom(node.id()).stream().anyMatch(r -> !deletedRelations.contains(r.id()))) return false;
        return prior.morphsOf(node.id()).stream().allMatch(m -> m.isDefault() && m.description().isEmpty());
    }

    private static boolean isProtected(String nodeId, MorphId morphId, String name, GraphSnapshot prior,
                                       List<ProtectedScope> protectedScopes) {
        if (protectedScopes.isEmpty()) return false;
        Node owner = prior.node(nodeId).orElse(null);
        if (owner == null) return false;
        return protectedScopes.stream().anyMatch(p -> p.coversEntry(owner, morphId, name));
    }

    public static String relationKey(Relation relation) {
        return relation.sourceId() + "|" + relation.morphId().value() + "|" + Identifiers.normalize(relation.name())
                + "|" + relation.targetId();
    }

    public static String attributeKey(Attribute attribute) {
        String base = attribute.sourceId() + "|" + attribute.morphId().value() + "|" + Identifiers.normalize(attribute.name());
        return attribute.derived() ? "derived|" + base : base + "|" + Identifiers.normalize(attribute.value());
    }

    private static final class Buckets {
        private final Map<String, Change> deleteRelations = new LinkedHashMap<>();
        private final Map<String, Change> deleteAttributes = new LinkedHashMap<>();
        private final Map<String, Change> deleteMorphs = new LinkedHashMap<>();
        private final List<Change> deleteNodes = new ArrayList<>();
        private final List<Change> updates = new ArrayList<>();
        private final List<Change> createNodes = new ArrayList<>();
        private final List<Change> createMorphs = new ArrayList<>();
        private final List<Change> createRelations = new ArrayList<>();
        private final List<Change> createAttributes = new ArrayList<>();

        /**
         * Renames created relations and attributes whose id is held by a stored entity
         * that survives this change list, or by an earlier create.
         */
        void assignFreeIds(GraphSnapshot prior) {
            Set<String> takenRelations = new HashSet<>();
            for (Relation stored : prior.relations()) {
                if (!deleteRelations.containsKey(stored.id())) takenRelations.add(stored.id());
            }
            for (int i = 0; i < createRelations.size(); i++) {
                Relation relation = (Relation) createRelations.get(i).after();
                String id = freeId(relation.id(), takenRelations);
                if (!id.equals(relation.id())) {
                    createRelations.set(i, Change.create(new Relation(id, relation.sourceId(), relation.targetId(),
                            relation.name(), relation.morphId(), relation.adverb(), relation.modality(),
                            relation.inferred(), relation.originMorphId())));
                }
            }

            Set<String> takenAttributes = new HashSet<>();
            for (Attribute stored : prior.attributes()) {
                if (!deleteAttributes.containsKey(stored.id())) takenAttributes.add(stored.id());
            }
            for (int i = 0; i < createAttributes.size(); i++) {
                Attribute attribute = (Attribute) createAttributes.get(i).after();
                String id = freeId(attribute.id(), takenAttributes);
                if (!id.equals(attribute.id())) {
                    createAttributes.set(i, Change.create(new Attribute(id, attribute.sourceId(), attribute.name(),
                            attribute.value(), attribute.unit(), attribute.modality(), attribute.quantifier(),
                            attribute.adverb(), attribute.derived(), attribute.morphId(), attribute.expression())));
                }
            }
        }

        private static String freeId(String id, Set<String> taken) {
            String candidate = id;
            int ordinal = 2;
            while (!taken.add(candidate)) {
                candidate = Identifiers.withOrdinal(id, ordinal++);
            }
            return candidate;
        }

        List<Change> ordered() {
            List<Change> all = new ArrayList<>();
            all.addAll(deleteRelations.values());
            all.addAll(deleteAttributes.values());
            all.addAll(deleteMorphs.values());
            all.addAll(deleteNodes);
            all.addAll(updates);
            all.addAll(createNodes);
            all.addAll(createMorphs);
            all.addAll(createRelations);
            all.addAll(createAttributes);
            return all;
        }
    }
}
