package io.artifactmesh.storage;

import io.artifactmesh.model.CoordinationException;

import java.time.Duration;

public final class ArtifactWaitTimeoutException extends CoordinationException {
    private final String expectedVersion;
    private final String observedVersion;
    private final Duration waited;

    public ArtifactWaitTimeoutException(String expectedVersion, String observedVersion, Duration waited) {
        super("Timed out after " + waited.toSeconds() + "s waiting for artifacts " + expectedVersion
                + " (installed: " + observedVersion + ")");
        this.expectedVersion = expectedVersion;
        this.observedVersion = observedVersion;
        this.waited = waited;
    }

    public String expectedVersion() {
        return expectedVersion;
    }

    public String observedVersion() {
        return observedVersion;
    }

    public Duration waited() {
        return waited;
    }

    @Override
    public boolean fatal() {
        return false;
    }
}
