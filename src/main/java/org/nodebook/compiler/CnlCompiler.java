package org.nodebook.compiler;

import org.nodebook.compiler.api.CompileResult;
import org.nodebook.compiler.api.SkippedDeclaration;
import org.nodebook.compiler.backend.diff.GraphDiffEngine;
import org.nodebook.compiler.diagnostics.Diagnostic;
import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.evaluation.DerivedAttributeEvaluator;
import org.nodebook.compiler.evaluation.EvaluationResult;
import org.nodebook.compiler.frontend.lexer.ClassifiedLine;
import org.nodebook.compiler.frontend.lexer.LineClassifier;
import org.nodebook.compiler.frontend.parser.BlockParser;
import org.nodebook.compiler.frontend.parser.ast.CnlDocument;
import org.nodebook.compiler.frontend.semantics.ResolvedDocument;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.compiler.frontend.semantics.SemanticResolver;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.NodeRegistry;
import org.nodebook.schema.SchemaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles CNL text into a change list against a stored graph.
 * <p>
 * The pipeline is line classification, block parsing, semantic resolution,
 * derived attribute evaluation and diffing. Every stage reports into one
 * {@link DiagnosticsEngine}; the diff is only computed when the submission is not
 * aborted. A submission is aborted by any always-fatal error, and in strict mode by
 * any error at all.
 * <p>
 * Compilation is a pure function of its inputs: nothing is applied or persisted here.
 * Instances are stateless and safe for concurrent use.
 */
public class CnlCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(CnlCompiler.class);

    private final ImplicitTargetPolicy defaultTargetPolicy;

    public CnlCompiler() {
        this(ImplicitTargetPolicy.AUTO_CREATE);
    }

    public CnlCompiler(ImplicitTargetPolicy defaultTargetPolicy) {
        this.defaultTargetPolicy = Objects.requireNonNull(defaultTargetPolicy, "defaultTargetPolicy");
    }

    /**
     * Compiles a submission.
     *
     * @param graphId    The graph the submission belongs to.
     * @param cnlText    The CNL document.
     * @param strictMode Abort on any error.
     * @param schema     The pinned schema snapshot.
     * @param prior      The stored graph; null is treated as an empty graph.
     * @return The compilation result.
     */
    public CompileResult compile(String graphId, String cnlText, boolean strictMode, SchemaSnapshot schema,
                                 GraphSnapshot prior) {
        return compile(graphId, cnlText, strictMode, schema, prior, NodeRegistry.empty());
    }

    public CompileResult compile(String graphId, String cnlText, boolean strictMode, SchemaSnapshot schema,
                                 GraphSnapshot prior, NodeRegistry registry) {
        return compile(graphId, cnlText, new CompilerOptions(strictMode, defaultTargetPolicy), schema, prior, registry);
    }

    /**
     * Compiles a submission with explicit options.
     *
     * @param graphId  The graph the submission belongs to.
     * @param cnlText  The CNL document.
     * @param options  Mode and target policy.
     * @param schema   The pinned schema snapshot.
     * @param prior    The stored graph; null is treated as an empty graph.
     * @param registry Cross-graph node index, read only.
     * @return The compilation result.
     * @throws IllegalArgumentException if the stored graph belongs to a different graph id.
     */
    public CompileResult compile(String graphId, String cnlText, CompilerOptions options, SchemaSnapshot schema,
                                 GraphSnapshot prior, NodeRegistry registry) {
        Objects.requireNonNull(graphId, "graphId");
        Objects.requireNonNull(schema, "schema");
        GraphSnapshot stored = prior != null ? prior : GraphSnapshot.empty(graphId);
        if (!graphId.equals(stored.graphId())) {
            throw new IllegalArgumentException("Stored snapshot belongs to graph '" + stored.graphId()
                    + "', not '" + graphId + "'");
        }

        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<ClassifiedLine> lines = new LineClassifier(diagnostics).classify(cnlText == null ? "" : cnlText);
        CnlDocument document = new BlockParser(diagnostics).parse(lines);
        LOG.debug("Parsed {} node declarations from {} lines", document.nodes().size(), lines.size());

        ResolvedDocument resolved = new SemanticResolver(diagnostics, schema, options.implicitTargets())
                .resolve(document, stored);
        EvaluationResult evaluation = diagnostics.hasFatalErrors()
                ? EvaluationResult.empty()
                : new DerivedAttributeEvaluator(diagnostics).evaluate(resolved.derivations(), stored);

        List<Diagnostic> errors = diagnostics.getDiagnostics();
        boolean aborted = diagnostics.hasFatalErrors() || (options.strict() && diagnostics.hasErrors());
        if (aborted) {
            LOG.debug("Compilation of graph '{}' aborted with {} errors", graphId, errors.size());
            return new CompileResult(graphId, ChangeList.empty(), List.of(), stored, errors, List.of(), true,
                    Set.of(), Set.of(), Map.of());
        }

        ChangeList changes = new GraphDiffEngine().diff(resolved, evaluation, stored);
        GraphSnapshot compiled = stored.apply(changes);
        List<SkippedDeclaration> skipped = new ArrayList<>();
        for (Diagnostic error : errors) {
            skipped.add(new SkippedDeclaration(error.line(), error.kind(), error.message()));
        }
        LOG.debug("Compiled graph '{}': {} changes, {} derived values recomputed, {} reused, {} skipped",
                graphId, changes.changes().size(), evaluation.recomputed().size(), evaluation.reused().size(),
                skipped.size());

        return new CompileResult(graphId, changes, derivedIn(compiled, evaluation), compiled, errors, skipped, false,
                evaluation.recomputed(), evaluation.reused(), sharedNodes(graphId, resolved, registry));
    }

    /**
     * The derived attributes of this submission as stored, carrying the ids the diff
     * assigned.
     */
    private static List<Attribute> derivedIn(GraphSnapshot compiled, EvaluationResult evaluation) {
        Set<String> keys = new HashSet<>();
        for (Attribute attribute : evaluation.attributes()) {
            keys.add(GraphDiffEngine.attributeKey(attribute));
        }
        return compiled.attributes().stream()
                .filter(a -> a.derived() && keys.contains(GraphDiffEngine.attributeKey(a)))
                .toList();
    }

    private static Map<String, Set<String>> sharedNodes(String graphId, ResolvedDocument resolved,
                                                        NodeRegistry registry) {
        Map<String, Set<String>> shared = new LinkedHashMap<>();
        for (ResolvedNode node : resolved.nodes()) {
            if (!node.declared()) continue;
            Set<String> graphs = new LinkedHashSet<>(registry.graphsContaining(node.node().id()));
            graphs.remove(graphId);
            if (!graphs.isEmpty()) {
                shared.put(node.node().id(), graphs);
            }
        }
        return shared;
    }
}
