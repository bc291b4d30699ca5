package org.nodebook.schema;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InMemorySchemaStoreTest {

    private final InMemorySchemaStore store = new InMemorySchemaStore();

    @Test
    void pinnedSnapshotIsUnaffectedByLaterEdits() {
        store.add(new NodeType("Animal"));
        SchemaSnapshot pinned = store.snapshot();

        store.add(new NodeType("Plant"));
        store.delete(NodeType.class, "Animal");

        assertThat(pinned.nodeTypes()).extracting(NodeType::name).containsExactly("Animal");
        assertThat(store.snapshot().nodeTypes()).extracting(NodeType::name).containsExactly("Plant");
    }

    @Test
    void rejectsDuplicateDefinition() {
        store.add(AttributeType.of("age", ValueType.INTEGER));

        assertThatThrownBy(() -> store.add(AttributeType.of("age", ValueType.FLOAT)))
                .isInstanceOf(SchemaException.class)
                .hasMessage("Attribute type 'age' already exists.");
    }

    @Test
    void sameNameIsAllowedAcrossKinds() {
        store.add(new NodeType("color"));
        store.add(AttributeType.of("color", ValueType.STRING));

        assertThat(store.snapshot().definitions()).hasSize(2);
    }

    @Test
    void updateRenamesDefinition() {
        store.add(FunctionType.of("months", "age * 12"));

        store.update("months", FunctionType.of("age in months", "age * 12"));

        assertThat(store.snapshot().functionType("months")).isEmpty();
        assertThat(store.snapshot().functionType("age in months")).isPresent();
    }

    @Test
    void updateAndDeleteRequireExistingDefinition() {
        assertThatThrownBy(() -> store.update("eats", RelationType.symmetric("eats")))
                .isInstanceOf(SchemaException.class)
                .hasMessage("Relation type 'eats' not found.");
        assertThatThrownBy(() -> store.delete(NodeType.class, "Animal"))
                .isInstanceOf(SchemaException.class);
    }

    @Test
    void replacePublishesWholeSnapshot() {
        SchemaSnapshot schema = SchemaSnapshot.of(new NodeType("Animal"), new NodeType("Dog", "Animal"));

        store.replace(schema);

        assertThat(store.snapshot()).isSameAs(schema);
    }
}
