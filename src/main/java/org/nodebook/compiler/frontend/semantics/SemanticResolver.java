package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.ImplicitTargetPolicy;
import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.evaluation.DerivationPlan;
import org.nodebook.compiler.frontend.parser.ast.AstNode;
import org.nodebook.compiler.frontend.parser.ast.CnlDocument;
import org.nodebook.compiler.frontend.semantics.analysis.FunctionPlanner;
import org.nodebook.compiler.frontend.semantics.analysis.IAnalysisHandler;
import org.nodebook.compiler.frontend.semantics.analysis.ISymbolCollector;
import org.nodebook.compiler.frontend.semantics.analysis.SymmetricRelationMaterializer;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.schema.SchemaSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Resolves a parse tree against a schema snapshot.
 * <p>
 * Schema integrity is checked first; an unusable schema stops resolution. The tree
 * is then walked twice: pass 1 collects nodes and morphs so that relations may point
 * at nodes declared later, pass 2 checks each relation and attribute. Symmetric
 * inverses and function evaluations are planned once all declarations are known.
 */
public class SemanticResolver {

    private final DiagnosticsEngine diagnostics;
    private final SchemaSnapshot schema;
    private final TypeHierarchy hierarchy;
    private final AnalysisHandlerRegistry registry;

    public SemanticResolver(DiagnosticsEngine diagnostics, SchemaSnapshot schema, ImplicitTargetPolicy targetPolicy) {
        this.diagnostics = diagnostics;
        this.schema = schema;
        this.hierarchy = new TypeHierarchy(schema);
        this.registry = AnalysisHandlerRegistry.initializeWithDefaults(schema, hierarchy, targetPolicy);
    }

    /**
     * Resolves a document.
     *
     * @param document The parse tree.
     * @param prior    The stored graph, for id reuse and target lookup.
     * @return The resolved document; empty if the schema is unusable.
     */
    public ResolvedDocument resolve(CnlDocument document, GraphSnapshot prior) {
        if (!hierarchy.validate(diagnostics)) {
            return ResolvedDocument.empty();
        }

        NodeSymbolTable symbolTable = new NodeSymbolTable(prior);
        List<AstNode> statements = new ArrayList<>(document.nodes());

        collectSymbols(statements, symbolTable);
        symbolTable.resetScope();
        traverseAndAnalyze(statements, symbolTable);
        symbolTable.resetScope();

        new SymmetricRelationMaterializer(schema).materialize(symbolTable);
        List<DerivationPlan> derivations = new FunctionPlanner(schema).plan(symbolTable, diagnostics);

        return new ResolvedDocument(new ArrayList<>(symbolTable.nodes()), symbolTable.protectedScopes(),
                derivations, document.graphDescription());
    }

    private void collectSymbols(List<AstNode> nodes, NodeSymbolTable symbolTable) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<ISymbolCollector> collector = registry.resolveCollector(node.getClass());
            collector.ifPresent(c -> c.collect(node, symbolTable, diagnostics));
            collectSymbols(node.getChildren(), symbolTable);
        }
    }

    private void traverseAndAnalyze(List<AstNode> nodes, NodeSymbolTable symbolTable) {
        for (AstNode node : nodes) {
            if (node == null) continue;
            Optional<IAnalysisHandler> handler = registry.resolveHandler(node.getClass());
            handler.ifPresent(h -> h.analyze(node, symbolTable, diagnostics));
            traverseAndAnalyze(node.getChildren(), symbolTable);
        }
    }

    public AnalysisHandlerRegistry getRegistry() {
        return registry;
    }
}
