package io.artifactmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Node-local state directory. The shared volume lives elsewhere and is described by
 * {@link CoordinationSettings#sharedRoot()}.
 */
public final class ArtifactMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "artifactmesh-settings.json";

    private final Path rootDir;

    public ArtifactMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ArtifactMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ArtifactMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path relationRoot() {
        return rootDir.resolve("relation");
    }

    public Path relationDbFile() {
        return relationRoot().resolve("relation.db");
    }
}
