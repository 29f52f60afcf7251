package io.artifactmesh.upgrade;

import io.artifactmesh.model.CoordinationException;

/**
 * The upgrade stopped in DOWNLOADING and needs an operator to fix the cause and retry.
 */
public final class UpgradeBlockedException extends CoordinationException {
    private final String targetVersion;

    public UpgradeBlockedException(String targetVersion, String message, Throwable cause) {
        super(message, cause);
        this.targetVersion = targetVersion;
    }

    public String targetVersion() {
        return targetVersion;
    }

    @Override
    public boolean fatal() {
        return true;
    }
}
