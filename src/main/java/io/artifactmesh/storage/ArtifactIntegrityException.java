package io.artifactmesh.storage;

import io.artifactmesh.model.CoordinationException;

public final class ArtifactIntegrityException extends CoordinationException {
    public ArtifactIntegrityException(String message) {
        super(message);
    }

    public ArtifactIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean fatal() {
        return true;
    }
}
