package io.artifactmesh.fetch;

import java.util.List;
import java.util.Map;

/**
 * @param expectedSha256 upstream checksums by relative path, empty when the source publishes none
 * @param executables    relative paths that must be executable once installed
 */
public record FetchedArtifacts(String version, Map<String, String> expectedSha256, List<String> executables) {
    public FetchedArtifacts {
        expectedSha256 = expectedSha256 == null ? Map.of() : Map.copyOf(expectedSha256);
        executables = executables == null ? List.of() : List.copyOf(executables);
    }

    public static FetchedArtifacts unchecked(String version, List<String> executables) {
        return new FetchedArtifacts(version, Map.of(), executables);
    }
}
