package io.artifactmesh.fetch;

import java.nio.file.Path;

/**
 * Obtains the artifact set for a version and extracts it into an empty staging directory. How the
 * bytes arrive (HTTP, mirror, local cache) is up to the implementation.
 */
@FunctionalInterface
public interface ArtifactFetcher {
    FetchedArtifacts fetch(String version, Path stagingDir);
}
