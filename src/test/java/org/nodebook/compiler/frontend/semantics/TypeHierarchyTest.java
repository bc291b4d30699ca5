package org.nodebook.compiler.frontend.semantics;

import org.nodebook.compiler.diagnostics.Diagnostic;
import org.nodebook.compiler.diagnostics.DiagnosticsEngine;
import org.nodebook.compiler.diagnostics.ErrorKind;
import org.nodebook.schema.AttributeType;
import org.nodebook.schema.NodeType;
import org.nodebook.schema.RelationType;
import org.nodebook.schema.SchemaSnapshot;
import org.nodebook.schema.ValueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class TypeHierarchyTest {

    @Test
    void ancestryIsTransitive() {
        TypeHierarchy hierarchy = new TypeHierarchy(SchemaSnapshot.of(
                new NodeType("Thing"),
                new NodeType("Animal", "Thing"),
                new NodeType("Dog", "Animal")));

        assertThat(hierarchy.ancestry("Dog")).containsExactly("Dog", "Animal", "Thing");
    }

    @Test
    void multipleInheritanceMergesAncestries() {
        TypeHierarchy hierarchy = new TypeHierarchy(SchemaSnapshot.of(
                new NodeType("Animal"),
                new NodeType("Pet"),
                new NodeType("Dog", "Animal", "Pet")));

        assertThat(hierarchy.ancestry(List.of("Dog"))).containsExactlyInAnyOrder("Dog", "Animal", "Pet");
    }

    @Test
    void validSchemaPassesValidation() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TypeHierarchy hierarchy = new TypeHierarchy(SchemaSnapshot.of(
                new NodeType("Animal"),
                new NodeType("Dog", "Animal"),
                RelationType.of("eats", List.of("Animal"), List.of())));

        assertThat(hierarchy.validate(diagnostics)).isTrue();
        assertThat(diagnostics.hasErrors()).isFalse();
    }

    @Test
    void cycleIsReportedOnceAndAncestryTerminates() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TypeHierarchy hierarchy = new TypeHierarchy(SchemaSnapshot.of(
                new NodeType("A", "C"),
                new NodeType("B", "A"),
                new NodeType("C", "B")));

        assertThat(hierarchy.validate(diagnostics)).isFalse();
        assertThat(diagnostics.getDiagnostics()).singleElement().satisfies(d -> {
            assertThat(d.kind()).isEqualTo(ErrorKind.CYCLIC_TYPE_HIERARCHY);
            assertThat(d.line()).isZero();
        });
        assertThat(hierarchy.ancestry("A")).containsExactlyInAnyOrder("A", "B", "C");
    }

    @Test
    void selfParentIsACycle() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        new TypeHierarchy(SchemaSnapshot.of(new NodeType("Loop", "Loop"))).validate(diagnostics);

        assertThat(diagnostics.hasErrorOfKind(ErrorKind.CYCLIC_TYPE_HIERARCHY)).isTrue();
        assertThat(diagnostics.hasFatalErrors()).isTrue();
    }

    @Test
    void unknownReferencesAreInvalidSchema() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        TypeHierarchy hierarchy = new TypeHierarchy(SchemaSnapshot.of(
                new NodeType("Dog", "Animal"),
                RelationType.of("eats", List.of("Mammal"), List.of()),
                AttributeType.of("age", ValueType.INTEGER, "Creature")));

        assertThat(hierarchy.validate(diagnostics)).isFalse();
        assertThat(diagnostics.getDiagnostics()).hasSize(3)
                .extracting(Diagnostic::kind).containsOnly(ErrorKind.INVALID_SCHEMA);
    }

    @Test
    void symmetricRelationWithForeignInverseIsInvalid() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        RelationType broken = new RelationType("married to", "divorced from", true, false,
                List.of(), List.of(), "");

        new TypeHierarchy(SchemaSnapshot.of(broken)).validate(diagnostics);

        assertThat(diagnostics.getDiagnostics()).singleElement()
                .satisfies(d -> assertThat(d.message()).contains("married to"));
    }

    @Test
    void emptyAllowedSetIsUnrestricted() {
        assertThat(TypeHierarchy.satisfies(List.of(), List.of())).isTrue();
        assertThat(TypeHierarchy.satisfies(List.of("Dog", "Animal"), List.of("Animal"))).isTrue();
        assertThat(TypeHierarchy.satisfies(List.of("Bone"), List.of("Animal"))).isFalse();
    }
}
