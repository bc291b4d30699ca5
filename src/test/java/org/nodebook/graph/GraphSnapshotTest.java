package org.nodebook.graph;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class GraphSnapshotTest {

    private static final MorphId REX_BASIC = new MorphId("rex::basic");
    private static final MorphId REX_PUPPY = new MorphId("rex::as_a_puppy");

    private static final Node REX = new Node("rex", "Rex", "Rex", "Dog", List.of("Dog", "Animal"), "", null, null);
    private static final Node BONE = new Node("bone", "Bone", "Bone", Node.UNTYPED_ROLE, List.of(), "", null, null);
    private static final Relation EATS = new Relation("rel_rex_eats_bone@basic", "rex", "bone", "eats", REX_BASIC,
            null, null, false, null);
    private static final Attribute AGE = new Attribute("attr_rex_age_1@as_a_puppy", "rex", "age", "1", null, null,
            null, null, false, REX_PUPPY, null);

    @Test
    void applyCreatesEntitiesInOrder() {
        ChangeList changes = new ChangeList(List.of(
                Change.create(REX),
                Change.create(BONE),
                Change.create(new Morph(REX_BASIC, "rex", Morph.DEFAULT_NAME, "")),
                Change.create(new Morph(REX_PUPPY, "rex", "as a puppy", "")),
                Change.create(EATS),
                Change.create(AGE)), "Dogs");

        GraphSnapshot graph = GraphSnapshot.empty("g").apply(changes);

        assertThat(graph.description()).isEqualTo("Dogs");
        assertThat(graph.nodes()).containsExactly(REX, BONE);
        assertThat(graph.morphsOf("rex")).extracting(Morph::name).containsExactly("basic", "as a puppy");
        assertThat(graph.relationsFrom("rex")).containsExactly(EATS);
        assertThat(graph.attributesOf("rex")).containsExactly(AGE);
    }

    @Test
    void applyDoesNotModifyTheOriginal() {
        GraphSnapshot empty = GraphSnapshot.empty("g");

        empty.apply(new ChangeList(List.of(Change.create(REX)), null));

        assertThat(empty.nodes()).isEmpty();
    }

    @Test
    void updateReplacesTheEntity() {
        GraphSnapshot graph = snapshotWith(REX, BONE);
        Node renamed = new Node("rex", "Rex", "Rex", "Dog", List.of("Dog", "Animal"), "A good dog", null, null);

        GraphSnapshot updated = graph.apply(new ChangeList(List.of(Change.update(REX, renamed)), null));

        assertThat(updated.node("rex")).contains(renamed);
        assertThat(updated.description()).isEmpty();
    }

    @Test
    void rejectsChangesThatDoNotFit() {
        GraphSnapshot graph = snapshotWith(REX);

        assertThatThrownBy(() -> graph.apply(new ChangeList(List.of(Change.create(REX)), null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already exists");
        assertThatThrownBy(() -> graph.apply(new ChangeList(List.of(Change.delete(BONE)), null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void neighborhoodGroupsByMorphIncludingEmptyOnes() {
        GraphSnapshot graph = new GraphSnapshot("g", "", List.of(REX, BONE),
                List.of(new Morph(REX_BASIC, "rex", "basic", ""), new Morph(REX_PUPPY, "rex", "as a puppy", ""),
                        new Morph(new MorphId("rex::old"), "rex", "old", "")),
                List.of(EATS), List.of(AGE));

        Map<MorphId, GraphSnapshot.MorphContents> neighborhood = graph.neighborhood("rex");

        assertThat(neighborhood).containsOnlyKeys(REX_BASIC, REX_PUPPY, new MorphId("rex::old"));
        assertThat(neighborhood.get(REX_BASIC).relations()).containsExactly(EATS);
        assertThat(neighborhood.get(REX_PUPPY).attributes()).containsExactly(AGE);
        assertThat(neighborhood.get(new MorphId("rex::old")).relations()).isEmpty();
    }

    @Test
    void changeRequiresMatchingEntities() {
        assertThatThrownBy(() -> new Change(ChangeType.UPDATE, EntityKind.NODE, null, REX))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(Change.delete(EATS).entityId()).isEqualTo("rel_rex_eats_bone@basic");
    }

    private static GraphSnapshot snapshotWith(Node... nodes) {
        return new GraphSnapshot("g", "", List.of(nodes), List.of(), List.of(), List.of());
    }
}
