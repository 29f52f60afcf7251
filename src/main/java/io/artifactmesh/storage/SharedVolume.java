package io.artifactmesh.storage;

import io.artifactmesh.util.AtomicFiles;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Optional;

public final class SharedVolume {
    private final Path rootPath;
    private final boolean sharedModeRequested;

    private SharedVolume(Path rootPath, boolean sharedModeRequested) {
        this.rootPath = rootPath;
        this.sharedModeRequested = sharedModeRequested;
    }

    public static SharedVolume open(Path rootPath, boolean sharedModeRequested) {
        return open(rootPath, sharedModeRequested, null);
    }

    /**
     * Opens the volume and creates the artifact and key directories. A missing root is fatal when
     * shared mode was requested; otherwise the root is created as plain local storage.
     */
    public static SharedVolume open(Path rootPath, boolean sharedModeRequested, String expectedFilesystemId) {
        if (rootPath == null) {
            throw new IllegalArgumentException("rootPath must not be null");
        }
        Path root = rootPath.toAbsolutePath().normalize();
        if (!Files.isDirectory(root)) {
            if (sharedModeRequested) {
                throw new StorageNotMountedException(Files.exists(root)
                        ? "Shared storage root is not a directory: " + root
                        : "Shared storage not mounted at " + root + "; attach the shared volume");
            }
            try {
                Files.createDirectories(root);
            } catch (IOException e) {
                throw new RuntimeException("Failed to create local storage root: " + root, e);
            }
        }
        SharedVolume volume = new SharedVolume(root, sharedModeRequested);
        if (sharedModeRequested && expectedFilesystemId != null && !expectedFilesystemId.isBlank()
                && !volume.validateSharedMount(expectedFilesystemId)) {
            throw new StorageNotMountedException("Storage at " + root + " has filesystem id "
                    + volume.filesystemIdentity() + ", expected " + expectedFilesystemId.trim());
        }
        if (sharedModeRequested && !volume.isWritable()) {
            throw new StorageNotMountedException("Shared storage at " + root + " is mounted read-only");
        }
        volume.ensureLayout();
        return volume;
    }

    private void ensureLayout() {
        try {
            Files.createDirectories(artifactDir());
            Files.createDirectories(keysDir());
            Path marker = rootPath.resolve(VolumeLayout.SHARED_STORAGE_MARKER);
            if (sharedModeRequested && !Files.exists(marker)) {
                AtomicFiles.writeString(marker, filesystemIdentity() + "\n");
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize storage layout under " + rootPath, e);
        }
    }

    public Path rootPath() {
        return rootPath;
    }

    public Path artifactDir() {
        return rootPath.resolve(VolumeLayout.ARTIFACT_DIR);
    }

    public Path keysDir() {
        return rootPath.resolve(VolumeLayout.KEYS_DIR);
    }

    public Path workerRoot() {
        return rootPath.resolve(VolumeLayout.WORKER_DIR);
    }

    public Path lockPath() {
        return rootPath.resolve(VolumeLayout.LOCK_FILE);
    }

    public Path versionMarkerPath() {
        return rootPath.resolve(VolumeLayout.VERSION_MARKER);
    }

    public Path progressMarkerPath() {
        return rootPath.resolve(VolumeLayout.PROGRESS_MARKER);
    }

    public Path manifestPath() {
        return artifactDir().resolve(VolumeLayout.MANIFEST_FILE);
    }

    public boolean sharedModeRequested() {
        return sharedModeRequested;
    }

    public boolean isShared() {
        return sharedModeRequested || Files.exists(rootPath.resolve(VolumeLayout.SHARED_STORAGE_MARKER));
    }

    public String readInstalledVersion() {
        try {
            String raw = Files.readString(versionMarkerPath(), StandardCharsets.UTF_8).trim();
            return raw.isEmpty() ? VolumeLayout.NO_VERSION : raw;
        } catch (NoSuchFileException e) {
            return VolumeLayout.NO_VERSION;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read version marker: " + versionMarkerPath(), e);
        }
    }

    public void writeInstalledVersion(String version) {
        if (version == null || version.isBlank() || VolumeLayout.NO_VERSION.equals(version.trim())) {
            throw new IllegalArgumentException("version must be a concrete version string");
        }
        try {
            AtomicFiles.writeString(versionMarkerPath(), version.trim() + "\n");
        } catch (IOException e) {
            throw new RuntimeException("Failed to write version marker: " + versionMarkerPath(), e);
        }
    }

    /**
     * Device and inode of the root. Nodes compare it to check they see the same mount; it is a
     * sanity check only.
     */
    public String filesystemIdentity() {
        try {
            Object dev = Files.getAttribute(rootPath, "unix:dev");
            Object ino = Files.getAttribute(rootPath, "unix:ino");
            return dev + ":" + ino;
        } catch (UnsupportedOperationException | IllegalArgumentException e) {
            return fileStoreIdentity();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read filesystem identity of " + rootPath, e);
        }
    }

    private String fileStoreIdentity() {
        try {
            Object key = Files.readAttributes(rootPath, BasicFileAttributes.class).fileKey();
            String store = Files.getFileStore(rootPath).name();
            return key == null ? store : store + ":" + key;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read file store of " + rootPath, e);
        }
    }

    public boolean validateSharedMount(String expectedFilesystemId) {
        return expectedFilesystemId != null && expectedFilesystemId.trim().equals(filesystemIdentity());
    }

    public boolean isWritable() {
        return Files.isWritable(rootPath);
    }

    public Optional<ArtifactManifest> readManifest() {
        Path manifest = manifestPath();
        if (!Files.exists(manifest)) {
            return Optional.empty();
        }
        return Optional.of(ArtifactManifest.read(manifest));
    }

    public StorageStats stats() {
        UsageVisitor usage = new UsageVisitor();
        try {
            Files.walkFileTree(rootPath, usage);
        } catch (IOException e) {
            throw new RuntimeException("Failed to measure storage usage: " + rootPath, e);
        }
        return new StorageStats(
                rootPath.toString(),
                usage.bytes(),
                countEntries(artifactDir(), false),
                countEntries(workerRoot(), true),
                isShared(),
                readInstalledVersion()
        );
    }

    /**
     * Sums regular file sizes. Entries removed while another node rewrites the artifact set are
     * skipped.
     */
    static final class UsageVisitor extends SimpleFileVisitor<Path> {
        private long bytes;

        long bytes() {
            return bytes;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile()) {
                bytes += attrs.size();
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
            if (exc instanceof NoSuchFileException) {
                return FileVisitResult.CONTINUE;
            }
            throw exc;
        }

        @Override
        public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
            if (exc == null || exc instanceof NoSuchFileException) {
                return FileVisitResult.CONTINUE;
            }
            throw exc;
        }
    }

    private static int countEntries(Path dir, boolean directoriesOnly) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        int count = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
            for (Path path : stream) {
                if (path.getFileName().toString().startsWith(".")) {
                    continue;
                }
                if (!directoriesOnly || Files.isDirectory(path)) {
                    count++;
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to list " + dir, e);
        }
        return count;
    }

    public record StorageStats(
            String root,
            long diskUsageBytes,
            int artifactCount,
            int workerCount,
            boolean sharedStorage,
            String installedVersion
    ) {
    }
}
