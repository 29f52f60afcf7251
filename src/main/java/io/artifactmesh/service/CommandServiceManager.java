package io.artifactmesh.service;

import io.artifactmesh.util.CommandRunner;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs a supervisor command per operation, {@code systemctl {action} {service}} by default.
 */
public final class CommandServiceManager implements ServiceManager {
    public static final List<String> SYSTEMCTL = List.of("systemctl", "{action}", "{service}");
    private static final Duration STATUS_TIMEOUT = Duration.ofSeconds(10);

    private final List<String> commandTemplate;

    public CommandServiceManager() {
        this(SYSTEMCTL);
    }

    public CommandServiceManager(List<String> commandTemplate) {
        if (commandTemplate == null || commandTemplate.isEmpty()) {
            throw new IllegalArgumentException("service command template cannot be empty");
        }
        this.commandTemplate = List.copyOf(commandTemplate);
    }

    @Override
    public void stop(String serviceName, Duration timeout) {
        run("stop", serviceName, timeout);
    }

    @Override
    public void start(String serviceName, Duration timeout) {
        run("start", serviceName, timeout);
    }

    @Override
    public void restart(String serviceName, Duration timeout) {
        run("restart", serviceName, timeout);
    }

    @Override
    public boolean isActive(String serviceName) {
        CommandRunner.Result result = CommandRunner.run(resolve("is-active", serviceName), Map.of(), STATUS_TIMEOUT);
        if (result.timedOut()) {
            throw new ServiceOperationTimeoutException(serviceName, "is-active", STATUS_TIMEOUT);
        }
        return result.exitCode() == 0;
    }

    private void run(String action, String serviceName, Duration timeout) {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be blank");
        }
        CommandRunner.Result result = CommandRunner.run(resolve(action, serviceName), Map.of(), timeout);
        if (result.timedOut()) {
            throw new ServiceOperationTimeoutException(serviceName, action, timeout);
        }
        if (!result.ok()) {
            throw new ServiceOperationException(serviceName, action,
                    "exit=" + result.exitCode() + " output=" + result.output());
        }
    }

    List<String> resolve(String action, String serviceName) {
        List<String> out = new ArrayList<>(commandTemplate.size());
        for (String part : commandTemplate) {
            out.add(part.replace("{action}", action).replace("{service}", serviceName));
        }
        return out;
    }
}
