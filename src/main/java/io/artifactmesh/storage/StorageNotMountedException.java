package io.artifactmesh.storage;

import io.artifactmesh.model.CoordinationException;

public final class StorageNotMountedException extends CoordinationException {
    public StorageNotMountedException(String message) {
        super(message);
    }

    public StorageNotMountedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean fatal() {
        return true;
    }
}
