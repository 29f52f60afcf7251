package io.artifactmesh.service;

import java.time.Duration;

/**
 * Controls the local long-running process that upgrades must pause. Every operation is idempotent:
 * stopping a stopped service or starting a running one succeeds.
 */
public interface ServiceManager {
    void stop(String serviceName, Duration timeout);

    void start(String serviceName, Duration timeout);

    void restart(String serviceName, Duration timeout);

    boolean isActive(String serviceName);
}
