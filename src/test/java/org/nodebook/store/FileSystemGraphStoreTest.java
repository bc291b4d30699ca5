package org.nodebook.store;

import org.nodebook.compiler.CnlCompiler;
import org.nodebook.compiler.api.CompileResult;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.schema.AttributeType;
import org.nodebook.schema.RelationType;
import org.nodebook.schema.SchemaSnapshot;
import org.nodebook.schema.ValueType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("integration")
class FileSystemGraphStoreTest {

    private static final SchemaSnapshot SCHEMA = SchemaSnapshot.of(RelationType.symmetric("friend of"),
            AttributeType.of("size", ValueType.STRING));

    private static final String TEXT = """
            ```graph-description
            A kennel.
            ```
            # Rex
            <friend of> **loyally** Fido [observed];
            ## as a puppy
            has size: ++very++ small *cm*;
            """;

    @TempDir
    Path tempDir;

    private final CnlCompiler compiler = new CnlCompiler();

    @Test
    void persistedGraphReadsBackEqual() {
        FileSystemGraphStore store = new FileSystemGraphStore(tempDir);
        CompileResult result = compiler.compile("kennel", TEXT, false, SCHEMA, store.loadGraphSnapshot("kennel"));

        GraphSnapshot written = store.applyChangeList("kennel", result.changes());
        GraphSnapshot read = new FileSystemGraphStore(tempDir).loadGraphSnapshot("kennel");

        assertThat(Files.exists(tempDir.resolve("kennel.json"))).isTrue();
        assertThat(read.description()).isEqualTo("A kennel.");
        assertThat(read.nodes()).containsExactlyElementsOf(written.nodes());
        assertThat(read.morphs()).containsExactlyElementsOf(written.morphs());
        assertThat(read.relations()).containsExactlyElementsOf(written.relations());
        assertThat(read.attributes()).containsExactlyElementsOf(written.attributes());
        assertThat(read.attributes()).singleElement().satisfies(a -> {
            assertThat(a.quantifier()).isEqualTo("very");
            assertThat(a.unit()).isEqualTo("cm");
        });
    }

    @Test
    void resubmissionAgainstReopenedStoreIsEmpty() {
        FileSystemGraphStore store = new FileSystemGraphStore(tempDir);
        store.applyChangeList("kennel", compiler.compile("kennel", TEXT, false, SCHEMA, null).changes());

        FileSystemGraphStore reopened = new FileSystemGraphStore(tempDir);
        CompileResult again = compiler.compile("kennel", TEXT, false, SCHEMA, reopened.loadGraphSnapshot("kennel"));

        assertThat(again.changes().isEmpty()).isTrue();
    }

    @Test
    void registryIsRebuiltOnOpen() {
        FileSystemGraphStore store = new FileSystemGraphStore(tempDir);
        store.applyChangeList("kennel", compiler.compile("kennel", TEXT, false, SCHEMA, null).changes());

        FileSystemGraphStore reopened = new FileSystemGraphStore(tempDir);

        assertThat(reopened.graphIds()).containsExactly("kennel");
        assertThat(reopened.nodeRegistry().graphsContaining("fido")).containsExactly("kennel");
    }

    @Test
    void leavesNoTemporaryFilesBehind() throws Exception {
        FileSystemGraphStore store = new FileSystemGraphStore(tempDir.resolve("nested/graphs"));
        store.applyChangeList("kennel", compiler.compile("kennel", TEXT, false, SCHEMA, null).changes());

        try (Stream<Path> files = Files.list(store.getRootDirectory())) {
            assertThat(files).extracting(p -> p.getFileName().toString()).containsExactly("kennel.json");
        }
    }

    @Test
    void ignoresFilesWithInvalidNames() throws Exception {
        Files.writeString(tempDir.resolve(".hidden.json"), "{}", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("notes.txt"), "x", StandardCharsets.UTF_8);

        assertThat(new FileSystemGraphStore(tempDir).graphIds()).isEmpty();
    }

    @Test
    void corruptGraphFileFailsToOpen() throws Exception {
        Files.writeString(tempDir.resolve("broken.json"), "{ not json", StandardCharsets.UTF_8);

        assertThatThrownBy(() -> new FileSystemGraphStore(tempDir))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("broken");
    }

    @Test
    void graphFileOfAnotherGraphIsRejected() throws Exception {
        FileSystemGraphStore store = new FileSystemGraphStore(tempDir);
        store.applyChangeList("kennel", compiler.compile("kennel", TEXT, false, SCHEMA, null).changes());
        Files.move(tempDir.resolve("kennel.json"), tempDir.resolve("zoo.json"));

        assertThatThrownBy(() -> store.loadGraphSnapshot("zoo"))
                .isInstanceOf(StoreException.class)
                .hasMessageContaining("contains graph 'kennel'");
    }
}
