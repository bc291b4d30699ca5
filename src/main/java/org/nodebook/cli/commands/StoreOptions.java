package org.nodebook.cli.commands;

import java.io.File;
import java.nio.file.Path;

import org.nodebook.schema.HoconSchemaLoader;
import org.nodebook.schema.SchemaSnapshot;
import org.nodebook.store.FileSystemGraphStore;

import com.typesafe.config.Config;

import picocli.CommandLine.Option;

/**
 * Schema and store locations shared by the commands. Command line values win over
 * {@code nodebook.schema.file} and {@code nodebook.store.directory}.
 */
class StoreOptions {

    @Option(
        names = {"--schema"},
        description = "Schema file in HOCON format (default: nodebook.schema.file)"
    )
    File schemaFile;

    @Option(
        names = {"--store"},
        description = "Graph store directory (default: nodebook.store.directory)"
    )
    Path storeDirectory;

    SchemaSnapshot loadSchema(Config config) {
        if (schemaFile != null) {
            return HoconSchemaLoader.load(schemaFile);
        }
        final String configured = config.getString("nodebook.schema.file");
        return configured.isBlank() ? SchemaSnapshot.empty() : HoconSchemaLoader.load(new File(configured));
    }

    FileSystemGraphStore openStore(Config config) {
        final Path directory = storeDirectory != null
                ? storeDirectory
                : Path.of(config.getString("nodebook.store.directory"));
        return new FileSystemGraphStore(directory);
    }
}
