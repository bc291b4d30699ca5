package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.NodeDecl;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;
import org.nodebook.compiler.frontend.semantics.ProtectedScope;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.compiler.frontend.semantics.TypeHierarchy;
import org.nodebook.graph.Node;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Resolves the declared types of a node heading and registers the node.
 * Repeated headings with the same identity merge; contradicting descriptions,
 * adjectives or quantifiers are an {@link ErrorKind#IDENTITY_CONFLICT}.
 */
public class NodeSymbolCollector implements ISymbolCollector {

    private final TypeHierarchy hierarchy;

    public NodeSymbolCollector(TypeHierarchy hierarchy) {
        this.hierarchy = hierarchy;
    }

    @Override
    public void collect(AstNode astNode, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        NodeDecl decl = (NodeDecl) astNode;

        boolean typesKnown = true;
        for (String type : decl.declaredTypes()) {
            if (!hierarchy.isKnown(type)) {
                diagnostics.reportError(ErrorKind.UNKNOWN_NODE_TYPE,
                        "Unknown node type '" + type + "' for node '" + decl.baseName() + "'", decl.line());
                typesKnown = false;
            }
        }
        if (!typesKnown) {
            symbolTable.protect(ProtectedScope.node(decl.baseName()));
            symbolTable.enterNode(null);
            return;
        }

        String role = decl.declaredTypes().isEmpty() ? Node.UNTYPED_ROLE : decl.declaredTypes().get(0);
        List<String> ancestry = new ArrayList<>(hierarchy.ancestry(decl.declaredTypes()));
        Node declared = new Node(null, decl.baseName(), displayName(decl), role, ancestry,
                decl.description(), decl.adjective(), decl.quantifier());

        ResolvedNode resolved = symbolTable.lookup(NodeSymbolTable.identityKey(decl.baseName(), role))
                .map(existing -> merge(existing, declared, decl, diagnostics))
                .orElseGet(() -> symbolTable.define(declared, true, decl.line()));
        symbolTable.bind(decl, resolved);
        symbolTable.enterNode(resolved);
    }

    private ResolvedNode merge(ResolvedNode existing, Node repeat, NodeDecl decl, DiagnosticsEngine diagnostics) {
        Node current = existing.node();
        String description = mergeField("description", current.description(), repeat.description(), decl, diagnostics);
        String adjective = mergeField("adjective", current.adjective(), repeat.adjective(), decl, diagnostics);
        String quantifier = mergeField("quantifier", current.quantifier(), repeat.quantifier(), decl, diagnostics);

        Set<String> ancestry = new LinkedHashSet<>(current.parentTypes());
        ancestry.addAll(repeat.parentTypes());
        Node merged = new Node(current.id(), current.baseName(),
                displayName(quantifier, adjective, current.baseName()), current.role(), new ArrayList<>(ancestry),
                description, adjective, quantifier);
        existing.updateNode(merged);
        return existing;
    }

    private static String mergeField(String field, String first, String repeat, NodeDecl decl,
                                     DiagnosticsEngine diagnostics) {
        if (isBlank(repeat)) return first;
        if (isBlank(first)) return repeat;
        if (!Objects.equals(first, repeat)) {
            diagnostics.reportError(ErrorKind.IDENTITY_CONFLICT, "Node '" + decl.baseName()
                    + "' is declared again with a different " + field + " ('" + first + "' vs '" + repeat + "')",
                    decl.line());
        }
        return first;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String displayName(NodeDecl decl) {
        return displayName(decl.quantifier(), decl.adjective(), decl.baseName());
    }

    static String displayName(String quantifier, String adjective, String baseName) {
        StringBuilder name = new StringBuilder();
        for (String part : new String[]{quantifier, adjective, baseName}) {
            if (isBlank(part)) continue;
            if (name.length() > 0) name.append(' ');
            name.append(part.trim());
        }
        return name.toString();
    }
}
