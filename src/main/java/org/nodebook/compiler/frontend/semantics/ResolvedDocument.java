package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.evaluation.DerivationPlan;

import java.util.List;

/**
 * Output of semantic resolution.
 *
 * @param nodes            Declared and referenced nodes with the contents of their morphs.
 * @param protectedScopes  Stored entities that must survive because their declaration was skipped.
 * @param derivations      Planned function evaluations.
 * @param graphDescription Graph-level description, or null if the submission has none.
 */
public record ResolvedDocument(List<ResolvedNode> nodes, List<ProtectedScope> protectedScopes,
                               List<DerivationPlan> derivations, String graphDescription) {

    public ResolvedDocument {
        nodes = List.copyOf(nodes);
        protectedScopes = List.copyOf(protectedScopes);
        derivations = List.copyOf(derivations);
    }

    public static ResolvedDocument empty() {
        return new ResolvedDocument(List.of(), List.of(), List.of(), null);
    }
}
