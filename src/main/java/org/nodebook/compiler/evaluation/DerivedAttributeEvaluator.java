package org.nodebook.compiler.evaluation;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.semantics.TypedValue;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Identifiers;
import org.nodebook.graph.Morph;
import org.nodebook.graph.MorphId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes derived attributes in dependency order.
 * <p>
 * A value is only recomputed when it is dirty: there is no stored value for its key,
 * the function expression changed, a declared input differs from the stored graph,
 * or a derived input was recomputed to a different value. Otherwise the stored
 * value is reused, which keeps the diff free of needless updates.
 */
public class DerivedAttributeEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(DerivedAttributeEvaluator.class);

    private final DiagnosticsEngine diagnostics;

    public DerivedAttributeEvaluator(DiagnosticsEngine diagnostics) {
        this.diagnostics = diagnostics;
    }

    /**
     * Evaluates all planned derivations.
     *
     * @param plans The plans from the resolver.
     * @param prior The stored graph, used for dirty checks and id reuse.
     * @return The derived attributes and bookkeeping of what was recomputed.
     */
    public EvaluationResult evaluate(List<DerivationPlan> plans, GraphSnapshot prior) {
        if (plans.isEmpty()) return EvaluationResult.empty();

        Map<EvaluationKey, DerivationPlan> byKey = new LinkedHashMap<>();
        Map<EvaluationKey, Set<EvaluationKey>> dependencies = new LinkedHashMap<>();
        for (DerivationPlan plan : plans) {
            byKey.put(plan.key(), plan);
            dependencies.put(plan.key(), new LinkedHashSet<>(plan.derivedInputs().values()));
        }

        DependencyGraph graph = DependencyGraph.build(dependencies);
        Set<EvaluationKey> failed = new LinkedHashSet<>();
        for (List<EvaluationKey> cycle : graph.cycles()) {
            String path = cycle.stream().map(EvaluationKey::attributeName).collect(Collectors.joining(" -> "));
            DerivationPlan first = byKey.get(cycle.get(0));
            diagnostics.reportError(ErrorKind.CIRCULAR_DERIVATION, "Circular derivation on '"
                    + cycle.get(0).morphId() + "': " + path, first.line());
        }
        failed.addAll(graph.blocked(byKey.keySet()));

        Map<EvaluationKey, String> values = new HashMap<>();
        Set<EvaluationKey> changed = new LinkedHashSet<>();
        Set<EvaluationKey> recomputed = new LinkedHashSet<>();
        Set<EvaluationKey> reused = new LinkedHashSet<>();
        List<Attribute> attributes = new ArrayList<>();
        Map<MorphId, Map<String, String>> priorInputs = new HashMap<>();

        for (EvaluationKey key : graph.topologicalOrder()) {
            DerivationPlan plan = byKey.get(key);
            if (plan.derivedInputs().values().stream().anyMatch(d -> failed.contains(d) || !byKey.containsKey(d))) {
                failed.add(key);
                continue;
            }

            Optional<Attribute> stored = storedValue(prior, key);
            Map<String, String> storedInputs = priorInputs.computeIfAbsent(key.morphId(),
                    m -> visibleDeclaredValues(prior, key.nodeId(), m));
            boolean dirty = stored.isEmpty()
                    || !Objects.equals(stored.get().expression(), plan.expressionText())
                    || plan.baseInputs().entrySet().stream()
                        .anyMatch(e -> !e.getValue().literal().equals(storedInputs.get(e.getKey())))
                    || plan.derivedInputs().values().stream().anyMatch(changed::contains);

            String value;
            if (dirty) {
                value = compute(plan, values);
                if (value == null) {
                    failed.add(key);
                    continue;
                }
                recomputed.add(key);
                if (stored.isEmpty() || !stored.get().value().equals(value)) {
                    changed.add(key);
                }
            } else {
                value = stored.get().value();
                reused.add(key);
            }
            values.put(key, value);
            String id = stored.map(Attribute::id)
                    .orElseGet(() -> Identifiers.derivedAttributeId(key.nodeId(), key.attributeName(), key.morphId()));
            attributes.add(new Attribute(id, key.nodeId(), key.attributeName(), value, null, null, null, null,
                    true, key.morphId(), plan.expressionText()));
        }

        LOG.debug("Derived attributes: {} recomputed, {} reused, {} failed", recomputed.size(), reused.size(), failed.size());
        return new EvaluationResult(attributes, recomputed, reused, failed);
    }

    /**
     * @return The formatted value, or null after reporting an evaluation failure.
     */
    private String compute(DerivationPlan plan, Map<EvaluationKey, String> values) {
        Map<String, Double> variables = new HashMap<>();
        for (Map.Entry<String, TypedValue> input : plan.baseInputs().entrySet()) {
            OptionalDouble number = input.getValue().asNumber();
            if (number.isEmpty()) {
                diagnostics.reportError(ErrorKind.EVALUATION_FAILURE, "Function '" + plan.key().attributeName()
                        + "' reads '" + input.getKey() + "', which is not numeric ('"
                        + input.getValue().literal() + "')", plan.line());
                return null;
            }
            variables.put(input.getKey(), number.getAsDouble());
        }
        for (Map.Entry<String, EvaluationKey> input : plan.derivedInputs().entrySet()) {
            variables.put(input.getKey(), Double.parseDouble(values.get(input.getValue())));
        }

        double result;
        try {
            result = plan.expression().evaluate(variables);
        } catch (ExpressionException e) {
            diagnostics.reportError(ErrorKind.EVALUATION_FAILURE, "Function '" + plan.key().attributeName()
                    + "' failed: " + e.getMessage(), plan.line());
            return null;
        }
        if (!Double.isFinite(result)) {
            diagnostics.reportError(ErrorKind.EVALUATION_FAILURE, "Function '" + plan.key().attributeName()
                    + "' produced a non-finite result", plan.line());
            return null;
        }
        return format(result);
    }

    /**
     * Formats a result as integer text when it is integral, otherwise as plain decimal.
     */
    public static String format(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static Optional<Attribute> storedValue(GraphSnapshot prior, EvaluationKey key) {
        return prior.attributesOf(key.nodeId()).stream()
                .filter(a -> a.derived() && a.morphId().equals(key.morphId())
                        && Identifiers.normalize(a.name()).equals(Identifiers.normalize(key.attributeName())))
                .findFirst();
    }

    /**
     * Declared attribute values a morph saw in the stored graph: those of the default
     * morph, overlaid with the morph's own.
     */
    private static Map<String, String> visibleDeclaredValues(GraphSnapshot prior, String nodeId, MorphId morphId) {
        MorphId defaultId = Identifiers.morphId(nodeId, Morph.DEFAULT_NAME);
        Map<String, String> visible = new HashMap<>();
        if (prior.node(nodeId).isEmpty()) return visible;
        for (Attribute attribute : prior.attributesOf(nodeId)) {
            if (!attribute.derived() && attribute.morphId().equals(defaultId)) {
                visible.putIfAbsent(Identifiers.normalize(attribute.name()), attribute.value());
            }
        }
        if (!morphId.equals(defaultId)) {
            Map<String, String> own = new HashMap<>();
            for (Attribute attribute : prior.attributesOf(nodeId)) {
                if (!attribute.derived() && attribute.morphId().equals(morphId)) {
                    own.putIfAbsent(Identifiers.normalize(attribute.name()), attribute.value());
                }
            }
            visible.putAll(own);
        }
        return visible;
    }
}
