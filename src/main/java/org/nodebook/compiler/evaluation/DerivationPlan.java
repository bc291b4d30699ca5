package org.nodebook.compiler.evaluation;

import org.nodebook.compiler.frontend.semantics.TypedValue;

import java.util.Map;

/**
 * One function evaluation planned by the resolver.
 *
 * @param key            What is computed.
 * @param expressionText The function expression as defined in the schema.
 * @param expression     The parsed expression.
 * @param baseInputs     Declared attribute values the expression reads, keyed by normalized name.
 * @param derivedInputs  Other derived values the expression reads, keyed by normalized name.
 * @param line           Line the value is attributed to in diagnostics.
 */
public record DerivationPlan(EvaluationKey key, String expressionText, Expression expression,
                             Map<String, TypedValue> baseInputs, Map<String, EvaluationKey> derivedInputs,
                             int line) {

    public DerivationPlan {
        baseInputs = Map.copyOf(baseInputs);
        derivedInputs = Map.copyOf(derivedInputs);
    }
}
