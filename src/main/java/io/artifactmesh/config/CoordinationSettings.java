package io.artifactmesh.config;

import io.artifactmesh.model.NodeRole;
import io.artifactmesh.service.CommandServiceManager;
import io.artifactmesh.storage.LockCoordinator;
import io.artifactmesh.storage.StorageCoordinator;
import io.artifactmesh.upgrade.UpgradeCoordinator;
import io.artifactmesh.util.Jsons;

import java.io.IOException;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Resolved node settings. Fields missing from {@code artifactmesh-settings.json} fall back to
 * {@link #defaults()}.
 */
public record CoordinationSettings(
        String nodeId,
        NodeRole role,
        String sharedRoot,
        boolean sharedMode,
        String expectedFilesystemId,
        String targetVersion,
        String serviceName,
        long staleAfterMs,
        long pollInitialMs,
        long pollMaxMs,
        long waitTimeoutMs,
        long readyTimeoutMs,
        long completeGraceMs,
        long serviceOpTimeoutMs,
        List<String> fetchCommand,
        long fetchTimeoutMs,
        List<String> serviceCommand,
        String relationDb
) {
    public static final String DEFAULT_SHARED_ROOT = "/var/lib/artifactmesh";
    public static final String DEFAULT_SERVICE_NAME = "artifactmesh-node.service";
    public static final long DEFAULT_FETCH_TIMEOUT_MS = 600_000L;

    public CoordinationSettings {
        fetchCommand = fetchCommand == null ? List.of() : List.copyOf(fetchCommand);
        serviceCommand = serviceCommand == null || serviceCommand.isEmpty()
                ? CommandServiceManager.SYSTEMCTL
                : List.copyOf(serviceCommand);
    }

    public static CoordinationSettings defaults() {
        return new CoordinationSettings(
                localHostName(),
                NodeRole.FOLLOWER,
                DEFAULT_SHARED_ROOT,
                false,
                null,
                null,
                DEFAULT_SERVICE_NAME,
                LockCoordinator.DEFAULT_STALE_AFTER.toMillis(),
                StorageCoordinator.DEFAULT_POLL_INITIAL.toMillis(),
                StorageCoordinator.DEFAULT_POLL_MAX.toMillis(),
                StorageCoordinator.DEFAULT_WAIT_TIMEOUT.toMillis(),
                UpgradeCoordinator.DEFAULT_READY_TIMEOUT.toMillis(),
                UpgradeCoordinator.DEFAULT_COMPLETE_GRACE.toMillis(),
                UpgradeCoordinator.DEFAULT_SERVICE_TIMEOUT.toMillis(),
                List.of(),
                DEFAULT_FETCH_TIMEOUT_MS,
                CommandServiceManager.SYSTEMCTL,
                null
        );
    }

    public static CoordinationSettings load(Path settingsFile) {
        CoordinationSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load coordination settings: " + settingsFile, e);
        }
    }

    static CoordinationSettings fromFile(SettingsFile file, CoordinationSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new CoordinationSettings(
                text(file.nodeId(), defaults.nodeId()),
                file.role() == null || file.role().isBlank() ? defaults.role() : NodeRole.fromString(file.role()),
                text(file.sharedRoot(), defaults.sharedRoot()),
                file.sharedMode() == null ? defaults.sharedMode() : file.sharedMode(),
                text(file.expectedFilesystemId(), defaults.expectedFilesystemId()),
                text(file.targetVersion(), defaults.targetVersion()),
                text(file.serviceName(), defaults.serviceName()),
                positive(file.staleAfterMs(), defaults.staleAfterMs()),
                positive(file.pollInitialMs(), defaults.pollInitialMs()),
                positive(file.pollMaxMs(), defaults.pollMaxMs()),
                positive(file.waitTimeoutMs(), defaults.waitTimeoutMs()),
                positive(file.readyTimeoutMs(), defaults.readyTimeoutMs()),
                positive(file.completeGraceMs(), defaults.completeGraceMs()),
                positive(file.serviceOpTimeoutMs(), defaults.serviceOpTimeoutMs()),
                file.fetchCommand() == null ? defaults.fetchCommand() : file.fetchCommand(),
                positive(file.fetchTimeoutMs(), defaults.fetchTimeoutMs()),
                file.serviceCommand() == null ? defaults.serviceCommand() : file.serviceCommand(),
                text(file.relationDb(), defaults.relationDb())
        );
    }

    /**
     * Applies CLI overrides; null or blank values keep the current setting.
     */
    public CoordinationSettings withOverrides(String node, String roleName, String shared, String version) {
        return new CoordinationSettings(
                text(node, nodeId),
                roleName == null || roleName.isBlank() ? role : NodeRole.fromString(roleName),
                text(shared, sharedRoot),
                sharedMode,
                expectedFilesystemId,
                text(version, targetVersion),
                serviceName,
                staleAfterMs,
                pollInitialMs,
                pollMaxMs,
                waitTimeoutMs,
                readyTimeoutMs,
                completeGraceMs,
                serviceOpTimeoutMs,
                fetchCommand,
                fetchTimeoutMs,
                serviceCommand,
                relationDb
        );
    }

    public Path sharedRootPath() {
        return Path.of(sharedRoot);
    }

    public StorageCoordinator.Settings storageSettings() {
        return new StorageCoordinator.Settings(
                Duration.ofMillis(pollInitialMs),
                Duration.ofMillis(Math.max(pollInitialMs, pollMaxMs)),
                Duration.ofMillis(waitTimeoutMs)
        );
    }

    public UpgradeCoordinator.Settings upgradeSettings() {
        return new UpgradeCoordinator.Settings(
                serviceName,
                Duration.ofMillis(serviceOpTimeoutMs),
                Duration.ofMillis(readyTimeoutMs),
                Duration.ofMillis(completeGraceMs),
                Duration.ofMillis(pollInitialMs),
                Duration.ofMillis(Math.max(pollInitialMs, pollMaxMs))
        );
    }

    public Duration staleAfter() {
        return Duration.ofMillis(staleAfterMs);
    }

    public Duration fetchTimeout() {
        return Duration.ofMillis(fetchTimeoutMs);
    }

    private static String text(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static long positive(Long value, long fallback) {
        return value == null || value <= 0L ? fallback : value;
    }

    private static String localHostName() {
        String env = System.getenv("HOSTNAME");
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "node-" + ProcessHandle.current().pid();
        }
    }

    record SettingsFile(
            String nodeId,
            String role,
            String sharedRoot,
            Boolean sharedMode,
            String expectedFilesystemId,
            String targetVersion,
            String serviceName,
            Long staleAfterMs,
            Long pollInitialMs,
            Long pollMaxMs,
            Long waitTimeoutMs,
            Long readyTimeoutMs,
            Long completeGraceMs,
            Long serviceOpTimeoutMs,
            List<String> fetchCommand,
            Long fetchTimeoutMs,
            List<String> serviceCommand,
            String relationDb
    ) {
    }
}
