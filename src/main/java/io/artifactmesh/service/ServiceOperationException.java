package io.artifactmesh.service;

import io.artifactmesh.model.CoordinationException;

public final class ServiceOperationException extends CoordinationException {
    private final String serviceName;
    private final String action;

    public ServiceOperationException(String serviceName, String action, String message) {
        super("Service " + serviceName + " " + action + " failed: " + message);
        this.serviceName = serviceName;
        this.action = action;
    }

    public String serviceName() {
        return serviceName;
    }

    public String action() {
        return action;
    }

    @Override
    public boolean fatal() {
        return false;
    }
}
