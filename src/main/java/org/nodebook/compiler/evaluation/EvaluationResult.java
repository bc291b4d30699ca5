package org.nodebook.compiler.evaluation;

import org.nodebook.graph.Attribute;

import java.util.List;
import java.util.Set;

/**
 * Outcome of derived attribute evaluation.
 *
 * @param attributes Derived attributes that have a value, in evaluation order.
 * @param recomputed Keys whose value was computed in this run.
 * @param reused     Keys whose stored value was kept because nothing they depend on changed.
 * @param failed     Keys that could not be evaluated.
 */
public record EvaluationResult(List<Attribute> attributes, Set<EvaluationKey> recomputed,
                               Set<EvaluationKey> reused, Set<EvaluationKey> failed) {

    public EvaluationResult {
        attributes = List.copyOf(attributes);
        recomputed = Set.copyOf(recomputed);
        reused = Set.copyOf(reused);
        failed = Set.copyOf(failed);
    }

    public static EvaluationResult empty() {
        return new EvaluationResult(List.of(), Set.of(), Set.of(), Set.of());
    }
}
