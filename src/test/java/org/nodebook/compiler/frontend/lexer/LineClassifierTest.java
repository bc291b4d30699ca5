package org.nodebook.compiler.frontend.lexer;

import org.nodebook.compiler.diagnostics.Diagnostic;
import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class LineClassifierTest {

    private DiagnosticsEngine diagnostics;
    private LineClassifier classifier;

    @BeforeEach
    void setUp() {
        diagnostics = new DiagnosticsEngine();
        classifier = new LineClassifier(diagnostics);
    }

    @Test
    void classifiesNodeHeadingWithTypesAndModifiers() {
        ClassifiedLine line = single("# ++all++ **young** Rex [Dog; Pet]");

        assertThat(line.kind()).isEqualTo(LineKind.NODE_HEADING);
        assertThat(line.name()).isEqualTo("Rex");
        assertThat(line.declaredTypes()).containsExactly("Dog", "Pet");
        assertThat(line.modifiers().emphasis()).isEqualTo("young");
        assertThat(line.modifiers().quantifier()).isEqualTo("all");
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void acceptsCommaAsTypeSeparator() {
        assertThat(single("# Rex [Dog, Pet]").declaredTypes()).containsExactly("Dog", "Pet");
    }

    @Test
    void classifiesMorphHeading() {
        ClassifiedLine line = single("## as a puppy");

        assertThat(line.kind()).isEqualTo(LineKind.MORPH_HEADING);
        assertThat(line.name()).isEqualTo("as a puppy");
    }

    @Test
    void classifiesRelationWithAdverbAndModality() {
        ClassifiedLine line = single("<eats> **greedily** Bone [usually];");

        assertThat(line.kind()).isEqualTo(LineKind.RELATION);
        assertThat(line.name()).isEqualTo("eats");
        assertThat(line.value()).isEqualTo("Bone");
        assertThat(line.modifiers().emphasis()).isEqualTo("greedily");
        assertThat(line.modifiers().modality()).isEqualTo("usually");
    }

    @Test
    void classifiesAttributeWithUnitAndQuantifier() {
        ClassifiedLine line = single("has weight: ++about++ 30 *kg*;");

        assertThat(line.kind()).isEqualTo(LineKind.ATTRIBUTE);
        assertThat(line.name()).isEqualTo("weight");
        assertThat(line.value()).isEqualTo("30");
        assertThat(line.modifiers().unit()).isEqualTo("kg");
        assertThat(line.modifiers().quantifier()).isEqualTo("about");
    }

    @Test
    void terminatingSemicolonIsOptional() {
        assertThat(single("has age: 5").value()).isEqualTo("5");
        assertThat(single("<eats> Bone").value()).isEqualTo("Bone");
    }

    @Test
    void linesInsideDescriptionFenceAreVerbatim() {
        List<ClassifiedLine> lines = classifier.classify("""
                ```description
                # not a heading
                <eats> nothing;
                ```""");

        assertThat(lines).extracting(ClassifiedLine::kind).containsExactly(
                LineKind.DESCRIPTION_OPEN, LineKind.VERBATIM, LineKind.VERBATIM, LineKind.FENCE_CLOSE);
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void graphDescriptionFenceIsRecognized() {
        assertThat(classifier.classify("```graph-description\ntext\n```").get(0).kind())
                .isEqualTo(LineKind.GRAPH_DESCRIPTION_OPEN);
    }

    @Test
    void unclosedFenceIsReportedAtOpeningLine() {
        classifier.classify("# Rex\n```description\nnever closed");

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> {
                    assertThat(d.kind()).isEqualTo(ErrorKind.SYNTAX);
                    assertThat(d.line()).isEqualTo(2);
                });
    }

    @Test
    void strayClosingFenceIsSyntaxError() {
        ClassifiedLine line = single("```");

        assertThat(line.kind()).isEqualTo(LineKind.INVALID);
        assertThat(diagnostics.hasErrorOfKind(ErrorKind.SYNTAX)).isTrue();
    }

    @Test
    void unrecognizedLineBecomesInvalid() {
        List<ClassifiedLine> lines = classifier.classify("# Rex\nRex likes bones\n<eats> Bone;");

        assertThat(lines).extracting(ClassifiedLine::kind)
                .containsExactly(LineKind.NODE_HEADING, LineKind.INVALID, LineKind.RELATION);
        Diagnostic error = diagnostics.getDiagnostics().get(0);
        assertThat(error.kind()).isEqualTo(ErrorKind.SYNTAX);
        assertThat(error.line()).isEqualTo(2);
    }

    @Test
    void attributeWithoutColonIsMalformed() {
        single("has age 5;");

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("Malformed attribute"));
    }

    @Test
    void duplicateModifierIsRejected() {
        ClassifiedLine line = single("<eats> **fast** **slow** Bone;");

        assertThat(line.kind()).isEqualTo(LineKind.INVALID);
        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("duplicate emphasis modifier");
    }

    @Test
    void unbalancedModifierTokenIsRejected() {
        single("has weight: 30 *kg;");

        assertThat(diagnostics.getDiagnostics().get(0).message()).contains("malformed modifier token");
    }

    @Test
    void nodeHeadingRejectsUnitModifier() {
        ClassifiedLine line = single("# Rex *kg*");

        assertThat(line.kind()).isEqualTo(LineKind.INVALID);
    }

    @ParameterizedTest
    @ValueSource(strings = {"<eats> ++some++ Bone;", "<eats> Bone *kg*;"})
    void relationRejectsQuantifierAndUnit(String text) {
        ClassifiedLine line = single(text);

        assertThat(line.kind()).isEqualTo(LineKind.INVALID);
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.SYNTAX);
            assertThat(d.message()).isEqualTo("Relation accepts only adverb and modality modifiers");
        });
    }

    @Test
    void blankLinesAreKept() {
        assertThat(classifier.classify("# Rex\n\n   \n")).extracting(ClassifiedLine::kind)
                .containsExactly(LineKind.NODE_HEADING, LineKind.BLANK, LineKind.BLANK, LineKind.BLANK);
    }

    private ClassifiedLine single(String text) {
        List<ClassifiedLine> lines = classifier.classify(text);
        assertThat(lines).hasSize(1);
        return lines.get(0);
    }
}
