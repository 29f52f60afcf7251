package io.artifactmesh.storage;

import io.artifactmesh.model.CoordinationException;

/**
 * Another participant is inside the install critical section. Expected for followers.
 */
public final class LockAlreadyHeldException extends CoordinationException {
    private final String holder;

    public LockAlreadyHeldException(String message, String holder) {
        super(message);
        this.holder = holder;
    }

    public String holder() {
        return holder;
    }

    @Override
    public boolean fatal() {
        return false;
    }
}
