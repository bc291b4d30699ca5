package org.nodebook.service;

import org.nodebook.compiler.CnlCompiler;
import org.nodebook.compiler.CompilerOptions;
import org.nodebook.compiler.api.CompileResult;
import org.nodebook.graph.ChangeType;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.schema.SchemaSnapshot;
import org.nodebook.schema.SchemaStore;
import org.nodebook.store.GraphStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Compiles submissions and applies their change lists to the graph store.
 * <p>
 * Submissions for the same graph id are serialized by a fair per-graph lock held from
 * reading the stored snapshot until the change list is applied, so every submission
 * diffs against the state its predecessor left behind. Different graphs compile in
 * parallel. Each compilation pins the schema snapshot current at its start.
 * <p>
 * Compilation itself runs on a worker thread bounded by a timeout; on timeout the
 * worker is cancelled and nothing is applied.
 * <p>
 * A graph's lock exists only while submissions for it are running or waiting, so the
 * lock table is bounded by the number of graphs in flight.
 */
public class GraphCompilationService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(GraphCompilationService.class);

    private final CnlCompiler compiler;
    private final SchemaStore schemaStore;
    private final GraphStore graphStore;
    private final CompilerOptions defaultOptions;
    private final Duration timeout;
    private final ConcurrentHashMap<String, GraphLock> graphLocks = new ConcurrentHashMap<>();
    private final ExecutorService workers;

    public GraphCompilationService(CnlCompiler compiler, SchemaStore schemaStore, GraphStore graphStore,
                                   CompilerOptions defaultOptions, Duration timeout) {
        this.compiler = Objects.requireNonNull(compiler, "compiler");
        this.schemaStore = Objects.requireNonNull(schemaStore, "schemaStore");
        this.graphStore = Objects.requireNonNull(graphStore, "graphStore");
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        this.workers = Executors.newCachedThreadPool(new CompilerThreadFactory());
    }

    /**
     * Compiles a submission with the default options and applies the result.
     *
     * @see #submit(String, String, CompilerOptions)
     */
    public CompileResult submit(String graphId, String cnlText) {
        return submit(graphId, cnlText, defaultOptions);
    }

    /**
     * Compiles a submission and, unless it was aborted, applies its change list to the store.
     *
     * @param graphId The graph.
     * @param cnlText The CNL document.
     * @param options Mode and target policy for this submission.
     * @return The compilation result; {@code compiledGraph} is the graph as now stored.
     * @throws CompilationTimeoutException if compilation exceeds the timeout.
     * @throws org.nodebook.store.StoreException if the graph cannot be read or written.
     */
    public CompileResult submit(String graphId, String cnlText, CompilerOptions options) {
        return run(graphId, cnlText, options, true);
    }

    /**
     * Compiles a submission against the stored graph without applying anything.
     */
    public CompileResult preview(String graphId, String cnlText, CompilerOptions options) {
        return run(graphId, cnlText, options, false);
    }

    private CompileResult run(String graphId, String cnlText, CompilerOptions options, boolean apply) {
        GraphLock graphLock = acquire(graphId);
        try {
            SchemaSnapshot schema = schemaStore.snapshot();
            GraphSnapshot prior = graphStore.loadGraphSnapshot(graphId);
            long start = System.nanoTime();
            CompileResult result = compileWithTimeout(graphId, () -> compiler.compile(graphId, cnlText, options,
                    schema, prior, graphStore.nodeRegistry()));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            if (result.aborted()) {
                log.warn("Compilation of graph '{}' aborted with {} errors", graphId, result.errors().size());
                return result;
            }
            if (!apply || result.changes().isEmpty()) {
                log.debug("Compiled graph '{}' in {} ms, nothing to apply", graphId, elapsedMs);
                return result;
            }
            graphStore.applyChangeList(graphId, result.changes());
            log.info("Applied {} changes to graph '{}' in {} ms (created={}, updated={}, deleted={}, skipped={})",
                    result.changes().changes().size(), graphId, elapsedMs,
                    result.changes().count(ChangeType.CREATE), result.changes().count(ChangeType.UPDATE),
                    result.changes().count(ChangeType.DELETE), result.skipped().size());
            return result;
        } finally {
            release(graphId, graphLock);
        }
    }

    private GraphLock acquire(String graphId) {
        GraphLock graphLock = graphLocks.compute(graphId, (id, existing) -> {
            GraphLock held = existing != null ? existing : new GraphLock();
            held.users++;
            return held;
        });
        graphLock.fairLock.lock();
        return graphLock;
    }

    private void release(String graphId, GraphLock graphLock) {
        graphLock.fairLock.unlock();
        graphLocks.computeIfPresent(graphId, (id, held) -> --held.users == 0 ? null : held);
    }

    /**
     * @return Number of graphs with a running or waiting submission.
     */
    int activeGraphCount() {
        return graphLocks.size();
    }

    private CompileResult compileWithTimeout(String graphId, Callable<CompileResult> task) {
        Future<CompileResult> future = workers.submit(task);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Compilation of graph '{}' timed out after {} ms", graphId, timeout.toMillis());
            throw new CompilationTimeoutException(graphId, timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while compiling graph '" + graphId + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException("Compilation of graph '" + graphId + "' failed", cause);
        }
    }

    @Override
    public void close() {
        workers.shutdownNow();
    }

    /**
     * A fair lock and the number of submissions holding or waiting for it. The count
     * is only changed inside {@code graphLocks.compute}.
     */
    private static final class GraphLock {
        private final ReentrantLock fairLock = new ReentrantLock(true);
        private int users;
    }

    private static final class CompilerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "nodebook-compiler-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
