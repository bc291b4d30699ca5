package org.nodebook.store;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import org.nodebook.graph.GraphSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;

/**
 * Stores each graph as one pretty-printed JSON file {@code <graphId>.json} in a directory.
 * <p>
 * Writes go to a temporary file in the same directory which is then moved over the
 * target atomically, so a crash never leaves a half-written graph behind.
 * The node registry is rebuilt from all graph files on construction.
 */
public class FileSystemGraphStore extends AbstractGraphStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemGraphStore.class);
    private static final String SUFFIX = ".json";

    private final Path rootDirectory;
    private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /**
     * @param rootDirectory Directory holding the graph files; created if missing.
     * @throws StoreException if the directory cannot be created or an existing graph cannot be read.
     */
    public FileSystemGraphStore(Path rootDirectory) {
        this.rootDirectory = rootDirectory.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.rootDirectory);
        } catch (IOException e) {
            throw new StoreException("Failed to create store directory: " + this.rootDirectory, e);
        }
        for (String graphId : graphIds()) {
            GraphSnapshot snapshot = read(graphId);
            if (snapshot != null) {
                index(snapshot);
            }
        }
        log.debug("Opened graph store at {}", this.rootDirectory);
    }

    public Path getRootDirectory() {
        return rootDirectory;
    }

    @Override
    protected GraphSnapshot read(String graphId) {
        Path file = fileFor(graphId);
        if (!Files.exists(file)) {
            return null;
        }
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            StoredGraph stored = gson.fromJson(reader, StoredGraph.class);
            if (stored == null) {
                throw new StoreException("Graph file is empty: " + file);
            }
            if (!graphId.equals(stored.graphId())) {
                throw new StoreException("Graph file " + file + " contains graph '" + stored.graphId() + "'");
            }
            return stored.toSnapshot();
        } catch (IOException | JsonParseException e) {
            throw new StoreException("Failed to read graph '" + graphId + "' from " + file, e);
        }
    }

    @Override
    protected void write(GraphSnapshot snapshot) {
        Path finalFile = fileFor(snapshot.graphId());
        Path tempFile = rootDirectory.resolve(finalFile.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tempFile, StandardCharsets.UTF_8)) {
                gson.toJson(StoredGraph.from(snapshot), writer);
            }
            Files.move(tempFile, finalFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException cleanupEx) {
                log.warn("Failed to clean up temp file after write failure: {}", tempFile, cleanupEx);
            }
            throw new StoreException("Failed to write graph '" + snapshot.graphId() + "' to " + finalFile, e);
        }
    }

    @Override
    public Set<String> graphIds() {
        Set<String> ids = new TreeSet<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(rootDirectory, "*" + SUFFIX)) {
            for (Path file : files) {
                String name = file.getFileName().toString();
                String graphId = name.substring(0, name.length() - SUFFIX.length());
                if (isValidGraphId(graphId)) {
                    ids.add(graphId);
                } else {
                    log.warn("Ignoring file with invalid graph id: {}", file);
                }
            }
        } catch (IOException e) {
            throw new StoreException("Failed to list graphs in " + rootDirectory, e);
        }
        return ids;
    }

    private Path fileFor(String graphId) {
        validateGraphId(graphId);
        return rootDirectory.resolve(graphId + SUFFIX);
    }
}
