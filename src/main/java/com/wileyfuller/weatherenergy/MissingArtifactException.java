package com.wileyfuller.weatherenergy;

import java.nio.file.Path;

/**
 * A stage's input file is not there, usually because the upstream stage has not run yet.
 */
public class MissingArtifactException extends PipelineException {

    private final Path path;

    public MissingArtifactException(String what, Path path) {
        super(what + " not found at " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
