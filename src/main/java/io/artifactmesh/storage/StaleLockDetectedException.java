package io.artifactmesh.storage;

import io.artifactmesh.model.CoordinationException;

public final class StaleLockDetectedException extends CoordinationException {
    public StaleLockDetectedException(String message) {
        super(message);
    }

    public StaleLockDetectedException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean fatal() {
        return false;
    }
}
