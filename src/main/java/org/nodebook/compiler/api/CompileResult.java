package org.nodebook.compiler.api;

import org.nodebook.compiler.diagnostics.Diagnostic;
import org.nodebook.compiler.evaluation.EvaluationKey;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one compilation produced.
 *
 * @param graphId           The compiled graph.
 * @param changes           Changes to apply to the stored graph; empty when aborted.
 * @param derivedAttributes All derived attributes of the submission, recomputed or reused.
 * @param compiledGraph     The stored graph with the changes applied; the stored graph itself when aborted.
 * @param errors            All diagnostics, ordered by line.
 * @param skipped           Declarations left out by a lenient compilation.
 * @param aborted           True if nothing may be applied.
 * @param recomputed        Derived values computed in this run.
 * @param reused            Derived values taken over from the stored graph.
 * @param sharedNodes       For declared nodes that also appear in other graphs, the ids of those graphs.
 */
public record CompileResult(String graphId, ChangeList changes, List<Attribute> derivedAttributes,
                            GraphSnapshot compiledGraph, List<Diagnostic> errors, List<SkippedDeclaration> skipped,
                            boolean aborted, Set<EvaluationKey> recomputed, Set<EvaluationKey> reused,
                            Map<String, Set<String>> sharedNodes) {

    public CompileResult {
        derivedAttributes = List.copyOf(derivedAttributes);
        errors = List.copyOf(errors);
        skipped = List.copyOf(skipped);
        recomputed = Set.copyOf(recomputed);
        reused = Set.copyOf(reused);
        sharedNodes = Map.copyOf(sharedNodes);
    }

    /**
     * @return true if the compilation completed without any error.
     */
    public boolean isSuccess() {
        return !aborted && errors.isEmpty();
    }
}
