package io.artifactmesh.storage;

import io.artifactmesh.fetch.ArtifactFetchException;
import io.artifactmesh.fetch.ArtifactFetcher;
import io.artifactmesh.fetch.FetchedArtifacts;
import io.artifactmesh.model.NodeRole;
import io.artifactmesh.observability.AuditLogger;
import io.artifactmesh.util.Backoff;
import io.artifactmesh.util.Hashing;
import io.artifactmesh.util.Sleeper;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Brings this node to a target artifact version. The primary downloads once under the install
 * lock; followers only wait for the version marker. Both end with their own worker directory.
 */
public final class StorageCoordinator {
    public static final Duration DEFAULT_POLL_INITIAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_POLL_MAX = Duration.ofSeconds(20);
    public static final Duration DEFAULT_WAIT_TIMEOUT = Duration.ofMinutes(5);
    private static final String STAGING_DIR = ".staging";

    private final SharedVolume volume;
    private final LockCoordinator lockCoordinator;
    private final ArtifactFetcher fetcher;
    private final ArtifactVerifier verifier;
    private final AuditLogger auditLogger;
    private final String nodeId;
    private final Settings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    public StorageCoordinator(
            SharedVolume volume,
            LockCoordinator lockCoordinator,
            ArtifactFetcher fetcher,
            AuditLogger auditLogger,
            String nodeId,
            Settings settings,
            Clock clock,
            Sleeper sleeper
    ) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must not be blank");
        }
        this.volume = volume;
        this.lockCoordinator = lockCoordinator;
        this.fetcher = fetcher;
        this.verifier = new ArtifactVerifier();
        this.auditLogger = auditLogger;
        this.nodeId = nodeId;
        this.settings = settings == null ? Settings.defaults() : settings;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public SharedVolume volume() {
        return volume;
    }

    public StorageOutcome ensureArtifacts(String targetVersion, NodeRole role) {
        if (targetVersion == null || targetVersion.isBlank()) {
            throw new IllegalArgumentException("targetVersion must not be blank");
        }
        String target = targetVersion.trim();
        return role == NodeRole.PRIMARY ? runPrimary(target) : runFollower(target);
    }

    public boolean isInstalled(String version) {
        return version.equals(volume.readInstalledVersion()) && verifier.verify(volume, version).ok();
    }

    private StorageOutcome runPrimary(String target) {
        if (isInstalled(target)) {
            WorkerDirectory dir = ensureWorkerDirectory();
            auditLogger.log("storage.primary", "artifacts/" + target, "already_installed", Map.of());
            return new StorageOutcome(NodeRole.PRIMARY, target, false, 0, 0L, dir.path().toString());
        }
        if (lockCoordinator.isStale()) {
            reclaim("stale_before_acquire");
        }
        LockCoordinator.LockHandle handle = acquireAsPrimary(target);
        if (handle.reclaimedOwnMarker()) {
            auditLogger.log("storage.lock", "install-lock", "own_marker_reclaimed", Map.of("holder", nodeId));
        }
        try (handle) {
            handle.markInProgress(target);
            auditLogger.log("storage.download", "artifacts/" + target, "started", AuditLogger.LOCKED,
                    Map.of("previous", volume.readInstalledVersion()));
            install(target);
            volume.writeInstalledVersion(target);
            auditLogger.log("storage.download", "artifacts/" + target, "installed", AuditLogger.LOCKED, Map.of());
        } catch (RuntimeException e) {
            auditLogger.log("storage.download", "artifacts/" + target, "failed", AuditLogger.LOCKED,
                    Map.of("error", String.valueOf(e.getMessage())));
            throw e;
        }
        WorkerDirectory dir = ensureWorkerDirectory();
        return new StorageOutcome(NodeRole.PRIMARY, target, true, 0, 0L, dir.path().toString());
    }

    private LockCoordinator.LockHandle acquireAsPrimary(String target) {
        try {
            try {
                return lockCoordinator.tryAcquire(nodeId);
            } catch (StaleLockDetectedException e) {
                reclaim("stale_on_acquire");
                return lockCoordinator.tryAcquire(nodeId);
            }
        } catch (LockAlreadyHeldException e) {
            auditLogger.log("storage.lock", "install-lock", "held_by_other", Map.of("holder", e.holder()));
            throw new StorageBlockedException("Node " + nodeId + " is primary for " + target
                    + " but the install lock is held by " + e.holder() + "; more than one primary is configured", e);
        } catch (StaleLockDetectedException e) {
            throw new StorageBlockedException("Stale install marker could not be reclaimed for " + target, e);
        }
    }

    private void reclaim(String reason) {
        String previous = lockCoordinator.readHolder().orElse("unknown");
        if (lockCoordinator.reclaimStale()) {
            auditLogger.log("storage.lock", "install-lock", "stale_reclaimed",
                    Map.of("previous_holder", previous, "reason", reason));
        }
    }

    private void install(String target) {
        Path staging = volume.rootPath().resolve(STAGING_DIR).resolve(target + "-" + UUID.randomUUID());
        try {
            Files.createDirectories(staging);
            FetchedArtifacts fetched;
            try {
                fetched = fetcher.fetch(target, staging);
            } catch (ArtifactFetchException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ArtifactFetchException("Fetch of " + target + " failed: " + e.getMessage(), e);
            }
            if (fetched == null || !target.equals(fetched.version())) {
                throw new ArtifactFetchException("Fetcher returned " + (fetched == null ? "nothing" : fetched.version())
                        + " for requested version " + target);
            }
            checkUpstreamChecksums(staging, fetched);
            publish(staging);
            ArtifactManifest manifest = withDeclaredExecutables(
                    ArtifactManifest.scan(volume.artifactDir(), target, clock.instant()), fetched.executables());
            ArtifactVerifier.Verification verification = verifier.verify(volume.artifactDir(), manifest, target);
            if (!verification.ok()) {
                throw new ArtifactIntegrityException("Installed artifacts for " + target + " failed verification: "
                        + verification.reason());
            }
            manifest.write(volume.manifestPath());
        } catch (IOException e) {
            throw new RuntimeException("Failed to stage artifacts for " + target, e);
        } finally {
            deleteRecursively(staging);
        }
    }

    private static void checkUpstreamChecksums(Path staging, FetchedArtifacts fetched) {
        for (Map.Entry<String, String> expected : fetched.expectedSha256().entrySet()) {
            Path file = staging.resolve(expected.getKey()).normalize();
            if (!file.startsWith(staging) || !Files.isRegularFile(file)) {
                throw new ArtifactIntegrityException("Checksum listed for missing artifact: " + expected.getKey());
            }
            if (!expected.getValue().equalsIgnoreCase(Hashing.sha256Hex(file))) {
                throw new ArtifactIntegrityException("Checksum mismatch for fetched artifact: " + expected.getKey());
            }
        }
    }

    private static ArtifactManifest withDeclaredExecutables(ArtifactManifest scanned, List<String> executables) {
        List<ArtifactManifest.Entry> entries = new ArrayList<>(scanned.entries().size());
        for (ArtifactManifest.Entry entry : scanned.entries()) {
            boolean executable = entry.executable() || executables.contains(entry.path());
            entries.add(new ArtifactManifest.Entry(entry.path(), entry.sha256(), executable));
        }
        for (String declared : executables) {
            if (entries.stream().noneMatch(entry -> entry.path().equals(declared))) {
                throw new ArtifactIntegrityException("Declared executable was not installed: " + declared);
            }
        }
        return new ArtifactManifest(scanned.version(), scanned.installedAt(), entries);
    }

    /**
     * Replaces the artifact directory content with the staged tree. Only runs under the install lock.
     */
    private void publish(Path staging) throws IOException {
        Path artifactDir = volume.artifactDir();
        Files.createDirectories(artifactDir);
        Files.deleteIfExists(volume.manifestPath());
        try (DirectoryStream<Path> existing = Files.newDirectoryStream(artifactDir)) {
            for (Path path : existing) {
                deleteRecursively(path);
            }
        }
        boolean empty = true;
        try (DirectoryStream<Path> staged = Files.newDirectoryStream(staging)) {
            for (Path item : staged) {
                empty = false;
                Files.move(item, artifactDir.resolve(item.getFileName().toString()), StandardCopyOption.REPLACE_EXISTING);
            }
        }
        if (empty) {
            throw new ArtifactFetchException("Fetcher produced no artifacts");
        }
    }

    private StorageOutcome runFollower(String target) {
        Instant start = clock.instant();
        if (isInstalled(target)) {
            WorkerDirectory dir = ensureWorkerDirectory();
            auditLogger.log("storage.follower", "artifacts/" + target, "already_installed", Map.of());
            return new StorageOutcome(NodeRole.FOLLOWER, target, false, 0, 0L, dir.path().toString());
        }
        Instant deadline = start.plus(settings.waitTimeout());
        Backoff backoff = new Backoff(settings.pollInitial(), settings.pollMax());
        int polls = 0;
        auditLogger.log("storage.follower", "artifacts/" + target, "waiting",
                Map.of("installed", volume.readInstalledVersion(), "timeout_ms", settings.waitTimeout().toMillis()));
        while (true) {
            Instant now = clock.instant();
            if (!now.isBefore(deadline)) {
                String observed = volume.readInstalledVersion();
                auditLogger.log("storage.follower", "artifacts/" + target, "timeout",
                        Map.of("installed", observed, "polls", polls));
                throw new ArtifactWaitTimeoutException(target, observed, Duration.between(start, now));
            }
            Duration remaining = Duration.between(now, deadline);
            Duration interval = backoff.next();
            sleeper.sleep(interval.compareTo(remaining) > 0 ? remaining : interval);
            polls++;
            if (isInstalled(target)) {
                break;
            }
        }
        long waitedMs = Duration.between(start, clock.instant()).toMillis();
        WorkerDirectory dir = ensureWorkerDirectory();
        auditLogger.log("storage.follower", "artifacts/" + target, "available",
                Map.of("polls", polls, "waited_ms", waitedMs));
        return new StorageOutcome(NodeRole.FOLLOWER, target, false, polls, waitedMs, dir.path().toString());
    }

    private WorkerDirectory ensureWorkerDirectory() {
        boolean existed = WorkerDirectory.exists(volume, nodeId);
        WorkerDirectory dir = WorkerDirectory.forOwner(volume, nodeId);
        if (!existed) {
            auditLogger.log("storage.worker_dir", dir.path().toString(), "created", Map.of());
        }
        return dir;
    }

    private static void deleteRecursively(Path root) {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to delete " + root, e);
        }
    }

    public record Settings(Duration pollInitial, Duration pollMax, Duration waitTimeout) {
        public static Settings defaults() {
            return new Settings(DEFAULT_POLL_INITIAL, DEFAULT_POLL_MAX, DEFAULT_WAIT_TIMEOUT);
        }
    }

    public record StorageOutcome(
            NodeRole role,
            String version,
            boolean downloaded,
            int polls,
            long waitedMs,
            String workerDirectory
    ) {
        public Map<String, Object> toDetails() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("role", role.label());
            out.put("version", version);
            out.put("downloaded", downloaded);
            out.put("polls", polls);
            out.put("waited_ms", waitedMs);
            return out;
        }
    }
}
