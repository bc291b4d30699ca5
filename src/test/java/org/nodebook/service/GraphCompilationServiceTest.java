package org.nodebook.service;

import org.nodebook.compiler.CnlCompiler;
import org.nodebook.compiler.CompilerOptions;
import org.nodebook.compiler.api.CompileResult;
import org.nodebook.graph.ChangeList;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.graph.NodeRegistry;
import org.nodebook.schema.InMemorySchemaStore;
import org.nodebook.schema.NodeType;
import org.nodebook.schema.SchemaSnapshot;
import org.nodebook.store.InMemoryGraphStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

@Tag("integration")
class GraphCompilationServiceTest {

    private InMemorySchemaStore schemaStore;
    private InMemoryGraphStore graphStore;
    private CnlCompiler compiler;
    private GraphCompilationService service;

    @BeforeEach
    void setUp() {
        schemaStore = new InMemorySchemaStore(SchemaSnapshot.of(new NodeType("Dog")));
        graphStore = spy(new InMemoryGraphStore());
        compiler = spy(new CnlCompiler());
        service = new GraphCompilationService(compiler, schemaStore, graphStore, CompilerOptions.strictMode(),
                Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        service.close();
    }

    @Test
    void submitAppliesChangesToTheStore() {
        CompileResult result = service.submit("kennel", "# Rex [Dog]\n");

        assertThat(result.isSuccess()).isTrue();
        assertThat(graphStore.loadGraphSnapshot("kennel").node("rex")).isPresent();
        assertThat(service.submit("kennel", "# Rex [Dog]\n").changes().isEmpty()).isTrue();
    }

    @Test
    void abortedSubmissionAppliesNothing() {
        CompileResult result = service.submit("kennel", "# Rex [Cat]\n");

        assertThat(result.aborted()).isTrue();
        verify(graphStore, never()).applyChangeList(anyString(), any(ChangeList.class));
        assertThat(graphStore.graphIds()).isEmpty();
    }

    @Test
    void lenientSubmissionAppliesTheRest() {
        CompileResult result = service.submit("kennel", "# Rex [Dog]\n# Tom [Cat]\n", CompilerOptions.lenientMode());

        assertThat(result.skipped()).hasSize(1);
        assertThat(graphStore.loadGraphSnapshot("kennel").nodes()).hasSize(1);
    }

    @Test
    void previewDoesNotApply() {
        CompileResult result = service.preview("kennel", "# Rex [Dog]\n", CompilerOptions.strictMode());

        assertThat(result.changes().isEmpty()).isFalse();
        assertThat(graphStore.loadGraphSnapshot("kennel").nodes()).isEmpty();
    }

    @Test
    void schemaEditsApplyToLaterSubmissions() {
        assertThat(service.submit("kennel", "# Tom [Cat]\n").aborted()).isTrue();

        schemaStore.add(new NodeType("Cat"));

        assertThat(service.submit("kennel", "# Tom [Cat]\n").isSuccess()).isTrue();
    }

    @Test
    void timeoutCancelsCompilationWithoutApplying() {
        GraphCompilationService slow = new GraphCompilationService(compiler, schemaStore, graphStore,
                CompilerOptions.strictMode(), Duration.ofMillis(50));
        doAnswer(invocation -> {
            Thread.sleep(5_000);
            return invocation.callRealMethod();
        }).when(compiler).compile(anyString(), anyString(), any(CompilerOptions.class), any(SchemaSnapshot.class),
                any(GraphSnapshot.class), any(NodeRegistry.class));

        try {
            assertThatThrownBy(() -> slow.submit("kennel", "# Rex [Dog]\n"))
                    .isInstanceOf(CompilationTimeoutException.class)
                    .satisfies(e -> assertThat(((CompilationTimeoutException) e).getGraphId()).isEqualTo("kennel"));
        } finally {
            slow.close();
        }
        verify(graphStore, never()).applyChangeList(anyString(), any(ChangeList.class));
    }

    @Test
    void compilerFailurePropagatesUnchanged() {
        doThrow(new IllegalStateException("boom")).when(compiler).compile(anyString(), anyString(),
                any(CompilerOptions.class), any(SchemaSnapshot.class), any(GraphSnapshot.class),
                any(NodeRegistry.class));

        assertThatThrownBy(() -> service.submit("kennel", "# Rex [Dog]\n"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }

    @Test
    void submissionsForOneGraphAreSerialized() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        doAnswer(invocation -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
                return invocation.callRealMethod();
            } finally {
                active.decrementAndGet();
            }
        }).when(compiler).compile(eq("kennel"), anyString(), any(CompilerOptions.class), any(SchemaSnapshot.class),
                any(GraphSnapshot.class), any(NodeRegistry.class));

        ExecutorService clients = Executors.newFixedThreadPool(4);
        try {
            List<Future<CompileResult>> futures = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                futures.add(clients.submit(() -> service.submit("kennel", "# Rex [Dog]\n")));
            }
            int applied = 0;
            for (Future<CompileResult> future : futures) {
                if (!future.get(10, TimeUnit.SECONDS).changes().isEmpty()) applied++;
            }
            assertThat(maxActive.get()).isEqualTo(1);
            assertThat(applied).isEqualTo(1);
            assertThat(service.activeGraphCount()).isZero();
        } finally {
            clients.shutdownNow();
        }
    }

    @Test
    void differentGraphsCompileInParallel() throws Exception {
        CountDownLatch otherStarted = new CountDownLatch(1);
        doAnswer(invocation -> {
            assertThat(otherStarted.await(2, TimeUnit.SECONDS)).isTrue();
            return invocation.callRealMethod();
        }).when(compiler).compile(eq("kennel"), anyString(), any(CompilerOptions.class), any(SchemaSnapshot.class),
                any(GraphSnapshot.class), any(NodeRegistry.class));
        doAnswer(invocation -> {
            otherStarted.countDown();
            return invocation.callRealMethod();
        }).when(compiler).compile(eq("zoo"), anyString(), any(CompilerOptions.class), any(SchemaSnapshot.class),
                any(GraphSnapshot.class), any(NodeRegistry.class));

        ExecutorService clients = Executors.newFixedThreadPool(2);
        try {
            Future<CompileResult> kennel = clients.submit(() -> service.submit("kennel", "# Rex [Dog]\n"));
            Future<CompileResult> zoo = clients.submit(() -> service.submit("zoo", "# Fido [Dog]\n"));

            assertThat(zoo.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
            assertThat(kennel.get(5, TimeUnit.SECONDS).isSuccess()).isTrue();
        } finally {
            clients.shutdownNow();
        }
    }

    @Test
    void graphLocksAreReleasedAfterEverySubmission() {
        doThrow(new IllegalStateException("boom")).when(compiler).compile(eq("farm"), anyString(),
                any(CompilerOptions.class), any(SchemaSnapshot.class), any(GraphSnapshot.class),
                any(NodeRegistry.class));

        service.submit("kennel", "# Rex [Dog]\n");
        service.submit("zoo", "# Rex [Cat]\n");
        assertThatThrownBy(() -> service.submit("farm", "# Rex [Dog]\n")).hasMessage("boom");

        assertThat(service.activeGraphCount()).isZero();
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThatThrownBy(() -> new GraphCompilationService(compiler, schemaStore, graphStore,
                CompilerOptions.strictMode(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
