package org.nodebook.service;

import java.time.Duration;

/**
 * Thrown when a compilation does not finish within the configured timeout.
 * The stored graph is left untouched.
 */
public class CompilationTimeoutException extends RuntimeException {

    private final String graphId;

    public CompilationTimeoutException(String graphId, Duration timeout) {
        super("Compilation of graph '" + graphId + "' exceeded timeout of " + timeout.toMillis() + " ms");
        this.graphId = graphId;
    }

    public String getGraphId() {
        return graphId;
    }
}
