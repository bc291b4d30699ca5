package org.nodebook.store;

import org.nodebook.compiler.CnlCompiler;
import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.schema.RelationType;
import org.nodebook.schema.SchemaSnapshot;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InMemoryGraphStoreTest {

    private static final SchemaSnapshot SCHEMA = SchemaSnapshot.of(RelationType.of("knows", List.of(), List.of()));

    private final InMemoryGraphStore store = new InMemoryGraphStore();
    private final CnlCompiler compiler = new CnlCompiler();

    @Test
    void unknownGraphLoadsEmpty() {
        GraphSnapshot graph = store.loadGraphSnapshot("fresh");

        assertThat(graph.graphId()).isEqualTo("fresh");
        assertThat(graph.nodes()).isEmpty();
        assertThat(store.graphIds()).isEmpty();
    }

    @Test
    void emptyChangeListIsNotStored() {
        store.applyChangeList("g", ChangeList.empty());

        assertThat(store.graphIds()).isEmpty();
    }

    @Test
    void registryTracksNodesAcrossGraphs() {
        submit("zoo", "# Rex\n<knows> Fido;\n");
        submit("kennel", "# Rex\n");

        assertThat(store.nodeRegistry().graphsContaining("rex")).containsExactlyInAnyOrder("zoo", "kennel");
        assertThat(store.nodeRegistry().graphsContaining("fido")).containsExactly("zoo");

        submit("zoo", "# Rex\n");

        assertThat(store.loadGraphSnapshot("zoo").node("fido")).isEmpty();
        assertThat(store.nodeRegistry().graphsContaining("fido")).isEmpty();
        assertThat(store.graphIds()).containsExactlyInAnyOrder("zoo", "kennel");
    }

    @Test
    void rejectsIdsThatCouldEscapeTheStore() {
        assertThatThrownBy(() -> store.loadGraphSnapshot("../etc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid graph id");
        assertThatThrownBy(() -> store.loadGraphSnapshot("a..b")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.loadGraphSnapshot(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private void submit(String graphId, String text) {
        GraphSnapshot prior = store.loadGraphSnapshot(graphId);
        ChangeList changes = compiler.compile(graphId, text, true, SCHEMA, prior).changes();
        store.applyChangeList(graphId, changes);
    }
}
