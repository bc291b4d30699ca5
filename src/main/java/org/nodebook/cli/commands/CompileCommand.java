package org.nodebook.cli.commands;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

import org.nodebook.cli.CommandLineInterface;
import org.nodebook.compiler.CnlCompiler;
import org.nodebook.compiler.CompilerOptions;
import org.nodebook.compiler.ImplicitTargetPolicy;
import org.nodebook.compiler.api.CompileResult;
import org.nodebook.compiler.api.SkippedDeclaration;
import org.nodebook.compiler.diagnostics.Diagnostic;
import org.nodebook.schema.InMemorySchemaStore;
import org.nodebook.schema.SchemaException;
import org.nodebook.service.CompilationTimeoutException;
import org.nodebook.service.GraphCompilationService;
import org.nodebook.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Compiles a CNL file into a graph of the store and prints the result as JSON.
 * <p>
 * Exit codes: 0 when the submission compiled without errors, 1 when it had compile
 * errors (aborted, or applied with skipped declarations in lenient mode), 2 when the
 * schema, store or configuration could not be used.
 */
@Command(
    name = "compile",
    description = "Compile a CNL document into a stored graph"
)
public class CompileCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_COMPILE_ERRORS = 1;
    static final int EXIT_INFRASTRUCTURE = 2;

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @Option(
        names = {"-f", "--file"},
        required = true,
        description = "CNL document to compile"
    )
    private Path cnlFile;

    @Option(
        names = {"-g", "--graph"},
        required = true,
        description = "Id of the target graph"
    )
    private String graphId;

    @Option(
        names = {"--lenient"},
        description = "Skip invalid declarations instead of aborting (default: nodebook.compiler.strict)"
    )
    private boolean lenient;

    @Option(
        names = {"--implicit-targets"},
        description = "Handling of undeclared relation targets: ${COMPLETION-CANDIDATES} (default: nodebook.compiler.implicit-targets)"
    )
    private ImplicitTargetPolicy implicitTargets;

    @Option(
        names = {"--dry-run"},
        description = "Compile against the stored graph without applying the changes"
    )
    private boolean dryRun;

    @Mixin
    private StoreOptions storeOptions;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    private final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        final String text;
        try {
            text = Files.readString(cnlFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            err.println("Error: cannot read " + cnlFile + ": " + e.getMessage());
            return EXIT_INFRASTRUCTURE;
        }

        try {
            final Config config = parent.getConfig();
            final CompilerOptions options = compilerOptions(config);
            final Duration timeout = config.getDuration("nodebook.compiler.timeout");
            final InMemorySchemaStore schemaStore = new InMemorySchemaStore(storeOptions.loadSchema(config));

            try (GraphCompilationService service = new GraphCompilationService(new CnlCompiler(), schemaStore,
                    storeOptions.openStore(config), options, timeout)) {
                final CompileResult result = dryRun
                        ? service.preview(graphId, text, options)
                        : service.submit(graphId, text, options);
                out.println(gson.toJson(CompileReport.of(result, dryRun)));
                out.flush();
                return result.isSuccess() ? EXIT_OK : EXIT_COMPILE_ERRORS;
            }
        } catch (SchemaException | StoreException | CompilationTimeoutException e) {
            log.error("Compilation of graph '{}' failed: {}", graphId, e.getMessage());
            err.println("Error: " + e.getMessage());
            return EXIT_INFRASTRUCTURE;
        } catch (IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_INFRASTRUCTURE;
        }
    }

    private CompilerOptions compilerOptions(Config config) {
        final boolean strict = !lenient && config.getBoolean("nodebook.compiler.strict");
        final ImplicitTargetPolicy policy = implicitTargets != null
                ? implicitTargets
                : ImplicitTargetPolicy.valueOf(
                        config.getString("nodebook.compiler.implicit-targets").toUpperCase(Locale.ROOT).replace('-', '_'));
        return new CompilerOptions(strict, policy);
    }

    record ChangeEntry(String type, String kind, String id) {
    }

    record DerivedEntry(String nodeId, String morph, String name, String value, String expression) {
    }

    record CompileReport(String graphId, boolean success, boolean aborted, boolean applied, List<ChangeEntry> changes,
                         String graphDescription, List<Diagnostic> errors, List<SkippedDeclaration> skipped,
                         List<DerivedEntry> derivedAttributes, int recomputed, int reused,
                         Map<String, Set<String>> sharedNodes) {

        static CompileReport of(CompileResult result, boolean dryRun) {
            final List<ChangeEntry> changes = result.changes().changes().stream()
                    .map(c -> new ChangeEntry(c.type().name(), c.kind().name(), c.entityId()))
                    .toList();
            final List<DerivedEntry> derived = result.derivedAttributes().stream()
                    .map(a -> new DerivedEntry(a.sourceId(), a.morphId().value(), a.name(), a.value(), a.expression()))
                    .toList();
            return new CompileReport(result.graphId(), result.isSuccess(), result.aborted(),
                    !dryRun && !result.aborted() && !result.changes().isEmpty(), changes,
                    result.changes().graphDescription(), result.errors(), result.skipped(), derived,
                    result.recomputed().size(), result.reused().size(), result.sharedNodes());
        }
    }
}
