package org.nodebook.compiler.evaluation;

import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.compiler.frontend.semantics.TypedValue;
import org.nodebook.graph.Attribute;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.Morph;
import org.nodebook.graph.MorphId;
import org.nodebook.graph.Node;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class DerivedAttributeEvaluatorTest {

    private static final MorphId BASIC = new MorphId("rex::basic");
    private static final EvaluationKey MONTHS = new EvaluationKey("rex", BASIC, "age in months");
    private static final EvaluationKey WEEKS = new EvaluationKey("rex", BASIC, "age in weeks");

    private DiagnosticsEngine diagnostics;
    private DerivedAttributeEvaluator evaluator;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        evaluator = new DerivedAttributeEvaluator(diagnostics);
    }

    @Test
    void computesValueWithoutStoredGraph() {
        EvaluationResult result = evaluator.evaluate(List.of(monthsPlan("3")), GraphSnapshot.empty("g"));

        assertThat(result.attributes()).singleElement().satisfies(a -> {
            assertThat(a.value()).isEqualTo("36");
            assertThat(a.derived()).isTrue();
            assertThat(a.expression()).isEqualTo("age * 12");
            assertThat(a.id()).isEqualTo("attr_rex_age_in_months@basic");
        });
        assertThat(result.recomputed()).containsExactly(MONTHS);
        assertThat(result.reused()).isEmpty();
    }

    @Test
    void reusesStoredValueWhenNothingChanged() {
        GraphSnapshot prior = storedRex("3", "36", "stored-id");

        EvaluationResult result = evaluator.evaluate(List.of(monthsPlan("3")), prior);

        assertThat(result.reused()).containsExactly(MONTHS);
        assertThat(result.recomputed()).isEmpty();
        assertThat(result.attributes().get(0).id()).isEqualTo("stored-id");
    }

    @Test
    void recomputesWhenBaseInputChanged() {
        GraphSnapshot prior = storedRex("3", "36", "stored-id");

        EvaluationResult result = evaluator.evaluate(List.of(monthsPlan("4")), prior);

        assertThat(result.recomputed()).containsExactly(MONTHS);
        assertThat(result.attributes().get(0).value()).isEqualTo("48");
        assertThat(result.attributes().get(0).id()).isEqualTo("stored-id");
    }

    @Test
    void dependentIsRecomputedOnlyWhenItsInputValueChanged() {
        DerivationPlan weeks = new DerivationPlan(WEEKS, "age_in_months * 4", ExpressionParser.parse("age_in_months * 4"),
                Map.of(), Map.of("age_in_months", MONTHS), 1);
        GraphSnapshot prior = withDerived(storedRex("3", "36", "m-id"), "age in weeks", "144", "age_in_months * 4");

        EvaluationResult unchanged = evaluator.evaluate(List.of(weeks, monthsPlan("3")), prior);
        EvaluationResult changed = new DerivedAttributeEvaluator(new DiagnosticsEngine())
                .evaluate(List.of(weeks, monthsPlan("5")), prior);

        assertThat(unchanged.reused()).containsExactlyInAnyOrder(MONTHS, WEEKS);
        assertThat(changed.recomputed()).containsExactlyInAnyOrder(MONTHS, WEEKS);
        assertThat(changed.attributes()).extracting(Attribute::value).containsExactly("60", "240");
    }

    @Test
    void nonNumericInputFailsEvaluation() {
        DerivationPlan plan = new DerivationPlan(MONTHS, "age * 12", ExpressionParser.parse("age * 12"),
                Map.of("age", new TypedValue.StringValue("old")), Map.of(), 4);

        EvaluationResult result = evaluator.evaluate(List.of(plan), GraphSnapshot.empty("g"));

        assertThat(result.failed()).containsExactly(MONTHS);
        assertThat(result.attributes()).isEmpty();
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.EVALUATION_FAILURE);
            assertThat(d.line()).isEqualTo(4);
        });
    }

    @Test
    void divisionByZeroIsNotFinite() {
        DerivationPlan plan = new DerivationPlan(MONTHS, "age / 0", ExpressionParser.parse("age / 0"),
                Map.of("age", integer("3")), Map.of(), 1);

        evaluator.evaluate(List.of(plan), GraphSnapshot.empty("g"));

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("non-finite"));
    }

    @Test
    void circularDerivationIsReportedAndBothKeysFail() {
        DerivationPlan months = new DerivationPlan(MONTHS, "age_in_weeks / 4", ExpressionParser.parse("age_in_weeks / 4"),
                Map.of(), Map.of("age_in_weeks", WEEKS), 2);
        DerivationPlan weeks = new DerivationPlan(WEEKS, "age_in_months * 4", ExpressionParser.parse("age_in_months * 4"),
                Map.of(), Map.of("age_in_months", MONTHS), 2);

        EvaluationResult result = evaluator.evaluate(List.of(months, weeks), GraphSnapshot.empty("g"));

        assertThat(diagnostics.hasErrorOfKind(ErrorKind.CIRCULAR_DERIVATION)).isTrue();
        assertThat(result.failed()).containsExactlyInAnyOrder(MONTHS, WEEKS);
        assertThat(result.attributes()).isEmpty();
    }

    @Test
    void formatsIntegralResultsWithoutFraction() {
        assertThat(DerivedAttributeEvaluator.format(36.0)).isEqualTo("36");
        assertThat(DerivedAttributeEvaluator.format(-2.0)).isEqualTo("-2");
        assertThat(DerivedAttributeEvaluator.format(2.5)).isEqualTo("2.5");
        assertThat(DerivedAttributeEvaluator.format(1e-7)).isEqualTo("0.0000001");
    }

    private static DerivationPlan monthsPlan(String age) {
        return new DerivationPlan(MONTHS, "age * 12", ExpressionParser.parse("age * 12"),
                Map.of("age", integer(age)), Map.of(), 1);
    }

    private static TypedValue integer(String literal) {
        return new TypedValue.IntegerValue(literal, new BigInteger(literal));
    }

    private static GraphSnapshot storedRex(String age, String months, String monthsId) {
        Node rex = new Node("rex", "Rex", "Rex", "Dog", List.of("Dog", "Animal"), "", null, null);
        Morph basic = new Morph(BASIC, "rex", Morph.DEFAULT_NAME, "");
        Attribute ageAttr = new Attribute("attr_rex_age_" + age + "@basic", "rex", "age", age, null, null, null, null,
                false, BASIC, null);
        Attribute monthsAttr = new Attribute(monthsId, "rex", "age in months", months, null, null, null, null,
                true, BASIC, "age * 12");
        return new GraphSnapshot("g", "", List.of(rex), List.of(basic), List.of(), List.of(ageAttr, monthsAttr));
    }

    private static GraphSnapshot withDerived(GraphSnapshot snapshot, String name, String value, String expression) {
        List<Attribute> attributes = new ArrayList<>(snapshot.attributes());
        attributes.add(new Attribute("attr_rex_" + name.replace(' ', '_') + "@basic", "rex", name, value,
                null, null, null, null, true, BASIC, expression));
        return new GraphSnapshot(snapshot.graphId(), snapshot.description(), snapshot.nodes(), snapshot.morphs(),
                snapshot.relations(), attributes);
    }
}
