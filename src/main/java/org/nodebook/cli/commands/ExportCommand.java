package org.nodebook.cli.commands;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

import org.nodebook.cli.CommandLineInterface;
import org.nodebook.compiler.emit.CnlEmitter;
import org.nodebook.graph.GraphSnapshot;
import org.nodebook.schema.SchemaException;
import org.nodebook.store.FileSystemGraphStore;
import org.nodebook.store.StoreException;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Prints a stored graph as CNL text.
 */
@Command(
    name = "export",
    description = "Print a stored graph as CNL"
)
public class ExportCommand implements Callable<Integer> {

    @Option(
        names = {"-g", "--graph"},
        required = true,
        description = "Id of the graph to export"
    )
    private String graphId;

    @Mixin
    private StoreOptions storeOptions;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();
        try {
            final Config config = parent.getConfig();
            final FileSystemGraphStore store = storeOptions.openStore(config);
            if (!store.graphIds().contains(graphId)) {
                err.println("Error: graph '" + graphId + "' not found in " + store.getRootDirectory());
                return 1;
            }
            final GraphSnapshot graph = store.loadGraphSnapshot(graphId);
            out.print(new CnlEmitter(storeOptions.loadSchema(config)).emit(graph));
            out.flush();
            return 0;
        } catch (SchemaException | StoreException | IllegalArgumentException | ConfigException e) {
            err.println("Error: " + e.getMessage());
            return 2;
        }
    }
}
