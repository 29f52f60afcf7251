package io.artifactmesh.service;

import io.artifactmesh.model.CoordinationException;

import java.time.Duration;

/**
 * A start/stop/restart did not finish in time. Distinct from {@link ServiceOperationException} so
 * callers can choose between retrying and escalating.
 */
public final class ServiceOperationTimeoutException extends CoordinationException {
    private final String serviceName;
    private final String action;
    private final Duration timeout;

    public ServiceOperationTimeoutException(String serviceName, String action, Duration timeout) {
        super("Service " + serviceName + " " + action + " timed out after " + timeout.toMillis() + "ms");
        this.serviceName = serviceName;
        this.action = action;
        this.timeout = timeout;
    }

    public String serviceName() {
        return serviceName;
    }

    public String action() {
        return action;
    }

    public Duration timeout() {
        return timeout;
    }

    @Override
    public boolean fatal() {
        return false;
    }
}
