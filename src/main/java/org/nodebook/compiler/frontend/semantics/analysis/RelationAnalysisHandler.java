package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.ImplicitTargetPolicy;
import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.RelationDecl;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;
import org.nodebook.compiler.frontend.semantics.ProtectedScope;
import org.nodebook.compiler.frontend.semantics.ResolvedMorph;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.compiler.frontend.semantics.TypeHierarchy;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Node;
import org.nodebook.graph.Relation;
import org.nodebook.schema.RelationType;
import org.nodebook.schema.SchemaSnapshot;

import java.util.List;
import java.util.Optional;

/**
 * Checks a relation declaration: the relation type must exist, the target must
 * resolve (or be created under {@link ImplicitTargetPolicy#AUTO_CREATE}) and both
 * ends must satisfy the domain and range of the relation type.
 */
public class RelationAnalysisHandler implements IAnalysisHandler {

    private final SchemaSnapshot schema;
    private final ImplicitTargetPolicy targetPolicy;

    public RelationAnalysisHandler(SchemaSnapshot schema, ImplicitTargetPolicy targetPolicy) {
        this.schema = schema;
        this.targetPolicy = targetPolicy;
    }

    @Override
    public void analyze(AstNode astNode, NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        RelationDecl decl = (RelationDecl) astNode;
        ResolvedNode source = symbolTable.currentNode().orElse(null);
        ResolvedMorph morph = symbolTable.currentMorph().orElse(null);
        if (source == null || morph == null) return;

        ProtectedScope skipped = ProtectedScope.entry(source.node().id(), morph.morph().morphId(), decl.name());
        RelationType type = schema.relationType(decl.name()).orElse(null);
        if (type == null) {
            diagnostics.reportError(ErrorKind.UNKNOWN_RELATION_TYPE,
                    "Unknown relation type '" + decl.name() + "'", decl.line());
            symbolTable.protect(skipped);
            return;
        }

        Optional<ResolvedNode> known = symbolTable.findByName(decl.target());
        Optional<Node> stored = known.isPresent() ? Optional.empty() : symbolTable.findStoredByName(decl.target());
        if (known.isEmpty() && stored.isEmpty() && targetPolicy == ImplicitTargetPolicy.REJECT) {
            diagnostics.reportError(ErrorKind.UNKNOWN_TARGET_NODE, "Relation '" + decl.name()
                    + "' targets '" + decl.target() + "', which is not declared", decl.line());
            symbolTable.protect(skipped);
            return;
        }

        List<String> sourceTypes = source.node().parentTypes();
        List<String> targetTypes = known.map(n -> n.node().parentTypes())
                .or(() -> stored.map(Node::parentTypes))
                .orElse(List.of());
        if (!TypeHierarchy.satisfies(sourceTypes, type.domain())) {
            reportViolation(decl, "source", source.node().baseName(), type.domain(), sourceTypes, diagnostics);
            symbolTable.protect(skipped);
            return;
        }
        if (!TypeHierarchy.satisfies(targetTypes, type.range())) {
            reportViolation(decl, "target", decl.target(), type.range(), targetTypes, diagnostics);
            symbolTable.protect(skipped);
            return;
        }

        ResolvedNode target = known.orElseGet(() -> stored
                .map(n -> symbolTable.reference(n, decl.line()))
                .orElseGet(() -> symbolTable.define(implicitNode(decl.target()), false, decl.line())));

        String sourceId = source.node().id();
        String targetId = target.node().id();
        ResolvedMorph.AddOutcome outcome = morph.addRelation(new Relation(
                Identifiers.relationId(sourceId, type.name(), targetId, morph.morph().morphId()),
                sourceId, targetId, type.name(), morph.morph().morphId(),
                decl.adverb(), decl.modality(), false, null));
        if (outcome == ResolvedMorph.AddOutcome.CONFLICT) {
            diagnostics.reportError(ErrorKind.IDENTITY_CONFLICT, "Relation '" + type.name() + "' from '"
                    + source.node().baseName() + "' to '" + decl.target()
                    + "' is declared again with a different adverb or modality", decl.line());
        }
    }

    private static Node implicitNode(String name) {
        return new Node(null, name, name, Node.UNTYPED_ROLE, List.of(), "", null, null);
    }

    private static void reportViolation(RelationDecl decl, String end, String nodeName, List<String> expected,
                                        List<String> actual, DiagnosticsEngine diagnostics) {
        diagnostics.reportError(ErrorKind.DOMAIN_RANGE_VIOLATION, "Relation '" + decl.name() + "' expects a "
                + end + " of type " + expected + " but '" + nodeName + "' is "
                + (actual.isEmpty() ? "untyped" : actual.toString()), decl.line());
    }
}
