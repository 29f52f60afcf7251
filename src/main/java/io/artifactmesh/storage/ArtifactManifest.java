package io.artifactmesh.storage;

import io.artifactmesh.util.AtomicFiles;
import io.artifactmesh.util.Hashing;
import io.artifactmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * What the primary installed: one entry per artifact file with its checksum and whether it must be
 * executable. Stored next to the artifacts as {@code .manifest.json}.
 */
public record ArtifactManifest(String version, Instant installedAt, List<Entry> entries) {
    public ArtifactManifest {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    public static ArtifactManifest scan(Path artifactDir, String version, Instant installedAt) {
        List<Entry> out = new ArrayList<>();
        try (Stream<Path> walk = Files.walk(artifactDir)) {
            List<Path> files = walk.filter(Files::isRegularFile)
                    .filter(path -> !isBookkeeping(artifactDir.relativize(path)))
                    .sorted(Comparator.comparing(Path::toString))
                    .toList();
            for (Path file : files) {
                out.add(new Entry(
                        artifactDir.relativize(file).toString().replace('\\', '/'),
                        Hashing.sha256Hex(file),
                        Files.isExecutable(file)
                ));
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to scan artifact directory: " + artifactDir, e);
        }
        return new ArtifactManifest(version, installedAt, out);
    }

    private static boolean isBookkeeping(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) {
                return true;
            }
        }
        return false;
    }

    public static ArtifactManifest read(Path file) {
        try {
            return Jsons.mapper().readValue(file.toFile(), ArtifactManifest.class);
        } catch (IOException e) {
            throw new ArtifactIntegrityException("Unreadable artifact manifest: " + file, e);
        }
    }

    public void write(Path file) {
        try {
            AtomicFiles.writeString(file, Jsons.toJson(this));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write artifact manifest: " + file, e);
        }
    }

    public record Entry(String path, String sha256, boolean executable) {
    }
}
