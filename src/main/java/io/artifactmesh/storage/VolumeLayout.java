package io.artifactmesh.storage;

public final class VolumeLayout {
    public static final String ARTIFACT_DIR = "bin";
    public static final String KEYS_DIR = "keys";
    public static final String WORKER_DIR = "worker";
    public static final String LOCK_FILE = ".install.lock";
    public static final String VERSION_MARKER = ".installed_version";
    public static final String PROGRESS_MARKER = ".download_in_progress";
    public static final String SHARED_STORAGE_MARKER = ".shared_storage";
    public static final String MANIFEST_FILE = ".manifest.json";
    public static final String NO_VERSION = "none";

    private VolumeLayout() {
    }
}
