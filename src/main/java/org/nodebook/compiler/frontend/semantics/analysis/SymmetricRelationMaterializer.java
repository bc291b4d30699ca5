package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;
import org.nodebook.compiler.frontend.semantics.ResolvedMorph;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.MorphId;
import org.nodebook.graph.Relation;
import org.nodebook.schema.RelationType;
import org.nodebook.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Adds the inverse of every declared symmetric relation to the default morph of its
 * target, unless the target already declares it or the stored graph has it. The
 * inverse is marked inferred and remembers the morph of the declaration it came from.
 * Runs after all declarations are analyzed so the outcome is independent of
 * declaration order.
 */
public class SymmetricRelationMaterializer {

    private final SchemaSnapshot schema;

    public SymmetricRelationMaterializer(SchemaSnapshot schema) {
        this.schema = schema;
    }

    public void materialize(NodeSymbolTable symbolTable) {
        Map<String, ResolvedNode> byId = symbolTable.nodes().stream()
                .collect(Collectors.toMap(n -> n.node().id(), Function.identity(), (a, b) -> a, LinkedHashMap::new));
        List<Relation> declared = new ArrayList<>();
        for (ResolvedNode node : byId.values()) {
            for (ResolvedMorph morph : node.morphs()) {
                morph.relations().stream().filter(r -> !r.inferred()).forEach(declared::add);
            }
        }

        for (Relation relation : declared) {
            boolean symmetric = schema.relationType(relation.name()).map(RelationType::symmetric).orElse(false);
            if (!symmetric || relation.sourceId().equals(relation.targetId())) continue;
            ResolvedNode target = byId.get(relation.targetId());
            if (target == null || hasInverse(relation, declared, symbolTable)) continue;

            MorphId morphId = target.defaultMorph().morph().morphId();
            target.defaultMorph().addRelation(new Relation(
                    Identifiers.relationId(relation.targetId(), relation.name(), relation.sourceId(), morphId),
                    relation.targetId(), relation.sourceId(), relation.name(), morphId,
                    relation.adverb(), relation.modality(), true, relation.morphId()));
        }
    }

    private static boolean hasInverse(Relation relation, List<Relation> declared, NodeSymbolTable symbolTable) {
        boolean declaredInverse = declared.stream().anyMatch(r -> isInverse(r, relation));
        if (declaredInverse) return true;
        return symbolTable.prior().relationsFrom(relation.targetId()).stream()
                .anyMatch(r -> !r.inferred() && isInverse(r, relation) && !scopeReplaced(r, symbolTable));
    }

    private static boolean isInverse(Relation candidate, Relation relation) {
        return candidate.sourceId().equals(relation.targetId())
                && candidate.targetId().equals(relation.sourceId())
                && candidate.name().equals(relation.name());
    }

    /**
     * A stored relation in a morph this submission declares is about to be replaced
     * by the declared contents of that morph, so it does not count.
     */
    private static boolean scopeReplaced(Relation stored, NodeSymbolTable symbolTable) {
        return symbolTable.nodes().stream()
                .flatMap(n -> n.morphs().stream())
                .anyMatch(m -> m.touched() && m.morph().morphId().equals(stored.morphId()));
    }
}
