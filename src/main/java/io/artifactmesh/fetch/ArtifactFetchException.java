package io.artifactmesh.fetch;

import io.artifactmesh.model.CoordinationException;

public final class ArtifactFetchException extends CoordinationException {
    public ArtifactFetchException(String message) {
        super(message);
    }

    public ArtifactFetchException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean fatal() {
        return true;
    }
}
