package org.nodebook.compiler.emit;

import org.nodebook.compiler.frontend.semantics.TypeHierarchy;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Morph;
import org.nodebook.graph.MorphId;
import org.nodebook.graph.Node;
import org.nodebook.graph.Relation;
import org.nodebook.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes a graph back as CNL text that compiles to the same graph.
 * <p>
 * Inferred relations and derived attributes are omitted since compilation
 * recreates them. Declared types are reconstructed from the stored ancestry: the
 * role first, then every further type not already implied by an earlier one.
 */
public class CnlEmitter {

    private final TypeHierarchy hierarchy;

    public CnlEmitter(SchemaSnapshot schema) {
        this.hierarchy = new TypeHierarchy(schema);
    }

    public String emit(GraphSnapshot graph) {
        StringBuilder out = new StringBuilder();
        if (!graph.description().isEmpty()) {
            fence(out, "```graph-description", graph.description());
            out.append('\n');
        }

        Map<String, Integer> nameCounts = new HashMap<>();
        for (Node node : graph.nodes()) {
            nameCounts.merge(Identifiers.normalize(node.name()), 1, Integer::sum);
        }

        boolean first = true;
        for (Node node : graph.nodes()) {
            if (!first) out.append('\n');
            first = false;
            emitNode(out, node, graph, nameCounts);
        }
        return out.toString();
    }

    private void emitNode(StringBuilder out, Node node, GraphSnapshot graph, Map<String, Integer> nameCounts) {
        out.append("# ");
        if (node.quantifier() != null) out.append("++").append(node.quantifier()).append("++ ");
        if (node.adjective() != null) out.append("**").append(node.adjective()).append("** ");
        out.append(node.baseName());
        List<String> types = declaredTypes(node);
        if (!types.isEmpty()) {
            out.append(" [").append(String.join("; ", types)).append(']');
        }
        out.append('\n');
        if (!node.description().isEmpty()) {
            fence(out, "```description", node.description());
        }

        Map<MorphId, GraphSnapshot.MorphContents> neighborhood = graph.neighborhood(node.id());
        MorphId defaultId = Identifiers.morphId(node.id(), Morph.DEFAULT_NAME);
        GraphSnapshot.MorphContents defaults = neighborhood.get(defaultId);
        if (defaults != null) {
            emitContents(out, defaults, graph, nameCounts);
        }
        for (Map.Entry<MorphId, GraphSnapshot.MorphContents> entry : neighborhood.entrySet()) {
            if (entry.getKey().equals(defaultId)) continue;
            Morph morph = graph.morph(entry.getKey()).orElse(null);
            if (morph == null) continue;
            out.append("## ").append(morph.name()).append('\n');
            if (!morph.description().isEmpty()) {
                fence(out, "```description", morph.description());
            }
            emitContents(out, entry.getValue(), graph, nameCounts);
        }
    }

    private void emitContents(StringBuilder out, GraphSnapshot.MorphContents contents, GraphSnapshot graph,
                              Map<String, Integer> nameCounts) {
        for (Relation relation : contents.relations()) {
            if (relation.inferred()) continue;
            out.append('<').append(relation.name()).append("> ");
            if (relation.adverb() != null) out.append("**").append(relation.adverb()).append("** ");
            out.append(targetName(relation.targetId(), graph, nameCounts));
            if (relation.modality() != null) out.append(" [").append(relation.modality()).append(']');
            out.append(";\n");
        }
        for (Attribute attribute : contents.attributes()) {
            if (attribute.derived()) continue;
            out.append("has ").append(attribute.name()).append(": ");
            if (attribute.quantifier() != null) out.append("++").append(attribute.quantifier()).append("++ ");
            if (attribute.adverb() != null) out.append("**").append(attribute.adverb()).append("** ");
            out.append(attribute.value());
            if (attribute.unit() != null) out.append(" *").append(attribute.unit()).append('*');
            if (attribute.modality() != null) out.append(" [").append(attribute.modality()).append(']');
            out.append(";\n");
        }
    }

    private static String targetName(String targetId, GraphSnapshot graph, Map<String, Integer> nameCounts) {
        Node target = graph.node(targetId).orElse(null);
        if (target == null) return targetId;
        return nameCounts.getOrDefault(Identifiers.normalize(target.name()), 0) > 1 ? target.id() : target.name();
    }

    private List<String> declaredTypes(Node node) {
        List<String> types = new ArrayList<>();
        if (Node.UNTYPED_ROLE.equals(node.role())) return types;
        types.add(node.role());
        Set<String> implied = new LinkedHashSet<>(hierarchy.ancestry(node.role()));
        for (String type : node.parentTypes()) {
            if (implied.contains(type)) continue;
            types.add(type);
            implied.addAll(hierarchy.ancestry(type));
        }
        return types;
    }

    private static void fence(StringBuilder out, String opening, String text) {
        out.append(opening).append('\n').append(text).append("\n```\n");
    }
}
