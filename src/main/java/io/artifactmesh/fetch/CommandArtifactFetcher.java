package io.artifactmesh.fetch;

import io.artifactmesh.util.CommandRunner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Delegates the download to an operator-supplied command. {@code {version}} and {@code {target}}
 * in the command are substituted; the same values are exported as {@code ARTIFACT_VERSION} and
 * {@code ARTIFACT_TARGET}. A {@code SHA256SUMS} file left in the target is read and removed.
 */
public final class CommandArtifactFetcher implements ArtifactFetcher {
    static final String CHECKSUM_FILE = "SHA256SUMS";

    private final List<String> command;
    private final Duration timeout;

    public CommandArtifactFetcher(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("fetch command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout == null || timeout.isNegative() || timeout.isZero() ? Duration.ofMinutes(10) : timeout;
    }

    @Override
    public FetchedArtifacts fetch(String version, Path stagingDir) {
        List<String> resolved = new ArrayList<>(command.size());
        for (String part : command) {
            resolved.add(part.replace("{version}", version).replace("{target}", stagingDir.toString()));
        }
        CommandRunner.Result result = CommandRunner.run(
                resolved,
                Map.of("ARTIFACT_VERSION", version, "ARTIFACT_TARGET", stagingDir.toString()),
                timeout
        );
        if (result.timedOut()) {
            throw new ArtifactFetchException("Fetch of " + version + " timed out after " + timeout.toSeconds() + "s");
        }
        if (!result.ok()) {
            throw new ArtifactFetchException("Fetch of " + version + " failed: exit=" + result.exitCode()
                    + " output=" + result.output());
        }
        Map<String, String> checksums = readChecksums(stagingDir.resolve(CHECKSUM_FILE));
        return new FetchedArtifacts(version, checksums, listExecutables(stagingDir));
    }

    static Map<String, String> readChecksums(Path file) {
        if (!Files.exists(file)) {
            return Map.of();
        }
        Map<String, String> out = new LinkedHashMap<>();
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                String trimmed = line.trim();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) {
                    continue;
                }
                String[] parts = trimmed.split("\\s+", 2);
                if (parts.length != 2) {
                    throw new ArtifactFetchException("Malformed checksum line in " + file + ": " + trimmed);
                }
                String name = parts[1].startsWith("*") ? parts[1].substring(1) : parts[1];
                if (name.startsWith("./")) {
                    name = name.substring(2);
                }
                out.put(name, parts[0].toLowerCase());
            }
            Files.delete(file);
        } catch (IOException e) {
            throw new ArtifactFetchException("Failed to read checksums: " + file, e);
        }
        return out;
    }

    private static List<String> listExecutables(Path stagingDir) {
        try (Stream<Path> walk = Files.walk(stagingDir)) {
            return walk.filter(Files::isRegularFile)
                    .filter(Files::isExecutable)
                    .map(path -> stagingDir.relativize(path).toString().replace('\\', '/'))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new ArtifactFetchException("Failed to list fetched artifacts in " + stagingDir, e);
        }
    }
}
