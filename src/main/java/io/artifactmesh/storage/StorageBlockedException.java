package io.artifactmesh.storage;

import io.artifactmesh.model.CoordinationException;

public final class StorageBlockedException extends CoordinationException {
    public StorageBlockedException(String message) {
        super(message);
    }

    public StorageBlockedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean fatal() {
        return true;
    }
}
