package io.artifactmesh.upgrade;

import io.artifactmesh.model.CoordinationException;

public final class UpgradeInProgressException extends CoordinationException {
    public UpgradeInProgressException(String message) {
        super(message);
    }

    @Override
    public boolean fatal() {
        return false;
    }
}
