package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.schema.AttributeType;
import org.nodebook.schema.FunctionType;
import org.nodebook.schema.NodeType;
import org.nodebook.schema.RelationType;
import org.nodebook.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ancestry queries over the node types of one schema snapshot.
 * <p>
 * The ancestry of a type is the type itself plus the transitive closure over its
 * parent types. Ancestry computation terminates on cyclic schemas; cycles are
 * reported by {@link #validate(DiagnosticsEngine)}.
 */
public final class TypeHierarchy {

    private final SchemaSnapshot schema;

    public TypeHierarchy(SchemaSnapshot schema) {
        this.schema = schema;
    }

    /**
     * Checks schema integrity and reports every problem found:
     * <ul>
     *   <li>{@link ErrorKind#CYCLIC_TYPE_HIERARCHY} for each cycle in the parent graph,</li>
     *   <li>{@link ErrorKind#INVALID_SCHEMA} for references to unknown node types and
     *       for symmetric relation types with a different inverse.</li>
     * </ul>
     *
     * @param diagnostics Receives the errors, all on line 0.
     * @return true if the schema is usable.
     */
    public boolean validate(DiagnosticsEngine diagnostics) {
        boolean valid = true;
        for (NodeType type : schema.nodeTypes()) {
            for (String parent : type.parentTypes()) {
                if (schema.nodeType(parent).isEmpty()) {
                    diagnostics.reportError(ErrorKind.INVALID_SCHEMA,
                            "Node type '" + type.name() + "' names unknown parent type '" + parent + "'", 0);
                    valid = false;
                }
            }
        }

        Set<String> finished = new HashSet<>();
        Set<String> reportedCycles = new HashSet<>();
        for (NodeType type : schema.nodeTypes()) {
            valid &= findCycles(type.name(), new ArrayList<>(), finished, reportedCycles, diagnostics);
        }

        for (RelationType relation : schema.relationTypes()) {
            if (relation.hasInconsistentInverse()) {
                diagnostics.reportError(ErrorKind.INVALID_SCHEMA, "Symmetric relation type '" + relation.name()
                        + "' declares a different inverse '" + relation.inverseName() + "'", 0);
                valid = false;
            }
            valid &= checkTypeReferences("Relation type '" + relation.name() + "' domain", relation.domain(), diagnostics);
            valid &= checkTypeReferences("Relation type '" + relation.name() + "' range", relation.range(), diagnostics);
        }
        for (AttributeType attribute : schema.attributeTypes()) {
            valid &= checkTypeReferences("Attribute type '" + attribute.name() + "' scope", attribute.scope(), diagnostics);
        }
        for (FunctionType function : schema.functionTypes()) {
            valid &= checkTypeReferences("Function '" + function.name() + "' scope", function.scope(), diagnostics);
        }
        return valid;
    }

    private boolean checkTypeReferences(String owner, Collection<String> typeNames, DiagnosticsEngine diagnostics) {
        boolean valid = true;
        for (String typeName : typeNames) {
            if (schema.nodeType(typeName).isEmpty()) {
                diagnostics.reportError(ErrorKind.INVALID_SCHEMA, owner + " names unknown node type '" + typeName + "'", 0);
                valid = false;
            }
        }
        return valid;
    }

    private boolean findCycles(String typeName, List<String> path, Set<String> finished,
                               Set<String> reportedCycles, DiagnosticsEngine diagnostics) {
        if (finished.contains(typeName)) return true;
        int index = path.indexOf(typeName);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
            // one report per cycle, whichever member it was entered from
            if (reportedCycles.add(String.join(",", cycle.stream().sorted().toList()))) {
                cycle.add(typeName);
                diagnostics.reportError(ErrorKind.CYCLIC_TYPE_HIERARCHY,
                        "Cyclic type hierarchy: " + String.join(" -> ", cycle), 0);
            }
            return false;
        }
        NodeType type = schema.nodeType(typeName).orElse(null);
        if (type == null) return true;

        path.add(typeName);
        boolean acyclic = true;
        for (String parent : type.parentTypes()) {
            acyclic &= findCycles(parent, path, finished, reportedCycles, diagnostics);
        }
        path.remove(path.size() - 1);
        finished.add(typeName);
        return acyclic;
    }

    /**
     * @param typeName A node type name.
     * @return true if the schema defines the type.
     */
    public boolean isKnown(String typeName) {
        return schema.nodeType(typeName).isPresent();
    }

    /**
     * Returns the type and all of its ancestors, nearest first.
     *
     * @param typeName A known node type name.
     * @return The ancestry; just the name itself if the type is unknown.
     */
    public Set<String> ancestry(String typeName) {
        Set<String> result = new LinkedHashSet<>();
        collect(typeName, result);
        return result;
    }

    /**
     * Returns the union of the ancestries of several types, in declaration order.
     */
    public Set<String> ancestry(Collection<String> typeNames) {
        Set<String> result = new LinkedHashSet<>();
        for (String typeName : typeNames) {
            collect(typeName, result);
        }
        return result;
    }

    private void collect(String typeName, Set<String> into) {
        if (!into.add(typeName)) return;
        schema.nodeType(typeName).ifPresent(t -> t.parentTypes().forEach(p -> collect(p, into)));
    }

    /**
     * @param ancestry A resolved ancestry.
     * @param allowed  Allowed types; empty means unrestricted.
     * @return true if the allowed set is empty or intersects the ancestry.
     */
    public static boolean satisfies(Collection<String> ancestry, Collection<String> allowed) {
        if (allowed.isEmpty()) return true;
        for (String type : allowed) {
            if (ancestry.contains(type)) return true;
        }
        return false;
    }
}
