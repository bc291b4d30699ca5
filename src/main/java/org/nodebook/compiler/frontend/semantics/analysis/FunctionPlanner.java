package org.nodebook.compiler.frontend.semantics.analysis;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.evaluation.DerivationPlan;
import org.nodebook.compiler.evaluation.EvaluationKey;
import org.nodebook.compiler.evaluation.Expression;
import org.nodebook.compiler.evaluation.ExpressionException;
import org.nodebook.compiler.evaluation.ExpressionParser;
import org.nodebook.compiler.frontend.semantics.NodeSymbolTable;
import org.nodebook.compiler.frontend.semantics.ProtectedScope;
import org.nodebook.compiler.frontend.semantics.ResolvedMorph;
import org.nodebook.compiler.frontend.semantics.ResolvedNode;
import org.nodebook.compiler.frontend.semantics.TypeHierarchy;
import org.nodebook.compiler.frontend.semantics.TypedValue;
import org.nodebook.graph.Identifiers;
import org.nodebook.schema.FunctionType;
import org.nodebook.schema.SchemaSnapshot;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Decides which functions are evaluated where, and binds their identifiers.
 * <p>
 * A function applies to a declared node when its scope is empty or intersects the
 * node's ancestry. It is evaluated in a morph of that node when the morph itself
 * declares an attribute the function reads, directly or through other functions.
 * Within a named morph the function sees the morph's attributes overlaid on those
 * of the default morph. Every identifier of an evaluated function must name a
 * visible attribute or another applicable function.
 */
public class FunctionPlanner {

    private record ParsedFunction(FunctionType type, Expression expression) {
    }

    private final SchemaSnapshot schema;

    public FunctionPlanner(SchemaSnapshot schema) {
        this.schema = schema;
    }

    /**
     * Plans all function evaluations for the declared nodes of the symbol table.
     *
     * @param symbolTable The populated symbol table.
     * @param diagnostics Receives malformed expressions and unresolved references.
     * @return The plans, in node and morph order.
     */
    public List<DerivationPlan> plan(NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics) {
        Map<String, ParsedFunction> functions = parseFunctions(diagnostics);
        List<DerivationPlan> plans = new ArrayList<>();
        if (functions.isEmpty()) return plans;

        for (ResolvedNode node : symbolTable.nodes()) {
            if (!node.declared()) continue;
            Map<String, ParsedFunction> applicable = new LinkedHashMap<>();
            functions.forEach((name, f) -> {
                if (TypeHierarchy.satisfies(node.node().parentTypes(), f.type().scope())) {
                    applicable.put(name, f);
                }
            });
            if (applicable.isEmpty()) continue;

            for (ResolvedMorph morph : node.morphs()) {
                if (morph.touched()) {
                    planMorph(node, morph, applicable, symbolTable, diagnostics, plans);
                }
            }
        }
        return plans;
    }

    private Map<String, ParsedFunction> parseFunctions(DiagnosticsEngine diagnostics) {
        Map<String, ParsedFunction> functions = new LinkedHashMap<>();
        for (FunctionType function : schema.functionTypes()) {
            try {
                functions.put(Identifiers.normalize(function.name()),
                        new ParsedFunction(function, ExpressionParser.parse(function.expression())));
            } catch (ExpressionException e) {
                diagnostics.reportError(ErrorKind.EVALUATION_FAILURE, "Function '" + function.name()
                        + "' has an invalid expression: " + e.getMessage(), 0);
            }
        }
        return functions;
    }

    private void planMorph(ResolvedNode node, ResolvedMorph morph, Map<String, ParsedFunction> applicable,
                           NodeSymbolTable symbolTable, DiagnosticsEngine diagnostics, List<DerivationPlan> plans) {
        Map<String, TypedValue> visible = new LinkedHashMap<>(node.defaultMorph().values());
        if (morph != node.defaultMorph()) {
            visible.putAll(morph.values());
        }
        Set<String> own = morph.values().keySet();

        Deque<String> queue = new ArrayDeque<>();
        for (String name : applicable.keySet()) {
            if (visible.containsKey(name)) continue;
            Set<String> reads = new HashSet<>();
            transitiveReads(name, applicable, visible, reads, new HashSet<>());
            reads.retainAll(own);
            if (!reads.isEmpty()) queue.add(name);
        }
        Set<String> planned = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String name = queue.poll();
            if (!planned.add(name)) continue;
            for (String variable : applicable.get(name).expression().variables()) {
                if (!visible.containsKey(variable) && applicable.containsKey(variable)) {
                    queue.add(variable);
                }
            }
        }

        String nodeId = node.node().id();
        for (String name : planned) {
            ParsedFunction function = applicable.get(name);
            Map<String, TypedValue> baseInputs = new LinkedHashMap<>();
            Map<String, EvaluationKey> derivedInputs = new LinkedHashMap<>();
            List<String> unresolved = new ArrayList<>();
            for (String variable : function.expression().variables()) {
                if (visible.containsKey(variable)) {
                    baseInputs.put(variable, visible.get(variable));
                } else if (applicable.containsKey(variable)) {
                    derivedInputs.put(variable, new EvaluationKey(nodeId, morph.morph().morphId(),
                            applicable.get(variable).type().name()));
                } else {
                    unresolved.add(variable);
                }
            }
            if (!unresolved.isEmpty()) {
                diagnostics.reportError(ErrorKind.UNKNOWN_ATTRIBUTE_REFERENCE, "Function '" + function.type().name()
                        + "' on '" + node.node().name() + "' references unknown attribute(s) " + unresolved,
                        morph.line());
                symbolTable.protect(ProtectedScope.entry(nodeId, morph.morph().morphId(), function.type().name()));
                continue;
            }
            plans.add(new DerivationPlan(new EvaluationKey(nodeId, morph.morph().morphId(), function.type().name()),
                    function.type().expression(), function.expression(), baseInputs, derivedInputs, morph.line()));
        }
    }

    private static void transitiveReads(String function, Map<String, ParsedFunction> applicable,
                                        Map<String, TypedValue> visible, Set<String> reads, Set<String> visited) {
        if (!visited.add(function)) return;
        for (String variable : applicable.get(function).expression().variables()) {
            if (visible.containsKey(variable)) {
                reads.add(variable);
            } else if (applicable.containsKey(variable)) {
                transitiveReads(variable, applicable, visible, reads, visited);
            }
        }
    }
}
