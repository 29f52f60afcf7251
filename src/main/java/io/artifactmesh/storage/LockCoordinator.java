package io.artifactmesh.storage;

import com.fasterxml.jackson.databind.JsonNode;
import io.artifactmesh.util.Jsons;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Non-blocking advisory lock over the install critical section. The OS lock lives on
 * {@code .install.lock}; the holder additionally keeps {@code .download_in_progress} whose mtime
 * tells other nodes how long the section has been occupied.
 */
public final class LockCoordinator {
    public static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(10);

    private final Path lockPath;
    private final Path progressMarkerPath;
    private final Duration staleAfter;
    private final Clock clock;

    public LockCoordinator(SharedVolume volume) {
        this(volume, DEFAULT_STALE_AFTER, Clock.systemUTC());
    }

    public LockCoordinator(SharedVolume volume, Duration staleAfter, Clock clock) {
        this(volume.lockPath(), volume.progressMarkerPath(), staleAfter, clock);
    }

    LockCoordinator(Path lockPath, Path progressMarkerPath, Duration staleAfter, Clock clock) {
        if (staleAfter == null || staleAfter.isNegative() || staleAfter.isZero()) {
            throw new IllegalArgumentException("staleAfter must be positive");
        }
        this.lockPath = lockPath;
        this.progressMarkerPath = progressMarkerPath;
        this.staleAfter = staleAfter;
        this.clock = clock;
    }

    public Duration staleAfter() {
        return staleAfter;
    }

    public LockHandle tryAcquire(String holderId) {
        if (holderId == null || holderId.isBlank()) {
            throw new IllegalArgumentException("holderId must not be blank");
        }
        FileChannel channel;
        try {
            channel = FileChannel.open(lockPath, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new RuntimeException("Failed to open lock file: " + lockPath, e);
        }
        FileLock lock;
        try {
            lock = channel.tryLock();
        } catch (OverlappingFileLockException e) {
            closeQuietly(channel);
            throw alreadyHeld();
        } catch (IOException e) {
            closeQuietly(channel);
            throw new RuntimeException("Failed to lock " + lockPath, e);
        }
        if (lock == null) {
            closeQuietly(channel);
            throw alreadyHeld();
        }
        if (Files.exists(progressMarkerPath)) {
            // We own the OS lock but a marker survived: either its holder died or the filesystem
            // does not propagate locks between hosts.
            boolean stale = isStale();
            String previous = readHolder().orElse("unknown");
            if (previous.equals(holderId)) {
                // Left by this holder before a crash.
                try {
                    Files.deleteIfExists(progressMarkerPath);
                } catch (IOException e) {
                    release(lock, channel);
                    throw new RuntimeException("Failed to remove own leftover marker: " + progressMarkerPath, e);
                }
                return new LockHandle(holderId, clock.instant(), lock, channel, true);
            }
            release(lock, channel);
            if (stale) {
                throw new StaleLockDetectedException("Stale install marker left by " + previous
                        + " (older than " + staleAfter.toMinutes() + "m) at " + progressMarkerPath);
            }
            throw new LockAlreadyHeldException("Install in progress by " + previous
                    + " according to " + progressMarkerPath, previous);
        }
        return new LockHandle(holderId, clock.instant(), lock, channel, false);
    }

    private LockAlreadyHeldException alreadyHeld() {
        String holder = readHolder().orElse("unknown");
        return new LockAlreadyHeldException("Install lock " + lockPath + " is held by " + holder, holder);
    }

    public boolean isStale() {
        Optional<Duration> age = progressMarkerAge();
        return age.isPresent() && age.get().compareTo(staleAfter) > 0;
    }

    /**
     * Removes a stale progress marker. Only call immediately before {@link #tryAcquire(String)}:
     * between the two calls another node may still race in, the lock is advisory.
     */
    public boolean reclaimStale() {
        if (!isStale()) {
            return false;
        }
        try {
            return Files.deleteIfExists(progressMarkerPath);
        } catch (IOException e) {
            throw new RuntimeException("Failed to remove stale marker: " + progressMarkerPath, e);
        }
    }

    public Optional<Duration> progressMarkerAge() {
        try {
            FileTime mtime = Files.getLastModifiedTime(progressMarkerPath);
            Duration age = Duration.between(mtime.toInstant(), clock.instant());
            return Optional.of(age.isNegative() ? Duration.ZERO : age);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new RuntimeException("Failed to stat progress marker: " + progressMarkerPath, e);
        }
    }

    public Optional<String> readHolder() {
        try {
            String raw = Files.readString(progressMarkerPath, StandardCharsets.UTF_8);
            JsonNode node = Jsons.mapper().readTree(raw);
            String holder = node == null ? "" : node.path("holder").asText("");
            return holder.isBlank() ? Optional.empty() : Optional.of(holder);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            // Marker content is informational only; mtime is authoritative.
            return Optional.empty();
        }
    }

    public LockStatus status() {
        Optional<Duration> age = progressMarkerAge();
        return new LockStatus(
                lockPath.toString(),
                Files.exists(lockPath),
                age.isPresent(),
                age.map(Duration::toMillis).orElse(-1L),
                age.isPresent() && age.get().compareTo(staleAfter) > 0,
                readHolder().orElse(null)
        );
    }

    private static void release(FileLock lock, FileChannel channel) {
        try {
            lock.release();
        } catch (IOException e) {
            throw new RuntimeException("Failed to release install lock", e);
        } finally {
            closeQuietly(channel);
        }
    }

    private static void closeQuietly(FileChannel channel) {
        try {
            channel.close();
        } catch (IOException ignored) {
            // Closing drops any lock the channel held; nothing else to undo.
        }
    }

    public final class LockHandle implements AutoCloseable {
        private final String holderId;
        private final Instant acquiredAt;
        private final FileLock lock;
        private final FileChannel channel;
        private final boolean reclaimedOwnMarker;
        private boolean released;

        private LockHandle(String holderId, Instant acquiredAt, FileLock lock, FileChannel channel, boolean reclaimedOwnMarker) {
            this.holderId = holderId;
            this.acquiredAt = acquiredAt;
            this.lock = lock;
            this.channel = channel;
            this.reclaimedOwnMarker = reclaimedOwnMarker;
        }

        public String holderId() {
            return holderId;
        }

        public Instant acquiredAt() {
            return acquiredAt;
        }

        /**
         * True when a progress marker written by this same holder was found and removed on acquire.
         */
        public boolean reclaimedOwnMarker() {
            return reclaimedOwnMarker;
        }

        public boolean isValid() {
            return !released && lock.isValid();
        }

        /**
         * Must be called before any long-running work under the lock.
         */
        public void markInProgress(String version) {
            if (released) {
                throw new IllegalStateException("Install lock already released");
            }
            Map<String, Object> marker = new LinkedHashMap<>();
            marker.put("holder", holderId);
            marker.put("version", version);
            marker.put("started_at", clock.instant().toString());
            try {
                Files.writeString(progressMarkerPath, Jsons.toCompactJson(marker), StandardCharsets.UTF_8);
                Files.setLastModifiedTime(progressMarkerPath, FileTime.from(clock.instant()));
            } catch (IOException e) {
                throw new RuntimeException("Failed to create progress marker: " + progressMarkerPath, e);
            }
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            try {
                Files.deleteIfExists(progressMarkerPath);
            } catch (IOException e) {
                release(lock, channel);
                throw new RuntimeException("Failed to remove progress marker: " + progressMarkerPath, e);
            }
            release(lock, channel);
        }
    }

    public record LockStatus(
            String lockPath,
            boolean lockFilePresent,
            boolean inProgress,
            long progressAgeMs,
            boolean stale,
            String holder
    ) {
    }
}
