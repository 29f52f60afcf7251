package io.artifactmesh.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import io.artifactmesh.util.AtomicFiles;
import io.artifactmesh.util.Jsons;
import io.artifactmesh.util.Names;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-node subtree {@code worker/{owner}/} on the shared volume. Only the owning node writes here;
 * {@link #inspect(SharedVolume, String)} gives everyone else a read-only view.
 */
public final class WorkerDirectory {
    private static final String STATE_FILE = "state";
    private static final String WORK_DIR = "work";

    private final String ownerId;
    private final Path path;
    private final boolean owned;

    private WorkerDirectory(String ownerId, Path path, boolean owned) {
        this.ownerId = ownerId;
        this.path = path;
        this.owned = owned;
    }

    public static WorkerDirectory forOwner(SharedVolume volume, String ownerId) {
        WorkerDirectory dir = new WorkerDirectory(ownerId, pathFor(volume, ownerId), true);
        try {
            Files.createDirectories(dir.workDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to create worker directory: " + dir.path, e);
        }
        return dir;
    }

    public static WorkerDirectory inspect(SharedVolume volume, String ownerId) {
        return new WorkerDirectory(ownerId, pathFor(volume, ownerId), false);
    }

    public static boolean exists(SharedVolume volume, String ownerId) {
        return Files.isDirectory(pathFor(volume, ownerId));
    }

    private static Path pathFor(SharedVolume volume, String ownerId) {
        return volume.workerRoot().resolve(Names.pathSegment(ownerId));
    }

    public String ownerId() {
        return ownerId;
    }

    public Path path() {
        return path;
    }

    public Path stateFile() {
        return path.resolve(STATE_FILE);
    }

    public Path workDir() {
        return path.resolve(WORK_DIR);
    }

    public boolean owned() {
        return owned;
    }

    public Map<String, String> readState() {
        Path file = stateFile();
        if (!Files.exists(file)) {
            return Map.of();
        }
        try {
            Map<String, String> state = Jsons.mapper().readValue(file.toFile(), new TypeReference<LinkedHashMap<String, String>>() {
            });
            return state == null ? Map.of() : state;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read worker state: " + file, e);
        }
    }

    public void writeState(Map<String, String> state) {
        requireOwned();
        try {
            AtomicFiles.writeString(stateFile(), Jsons.toJson(new TreeMap<>(state)));
        } catch (IOException e) {
            throw new RuntimeException("Failed to write worker state: " + stateFile(), e);
        }
    }

    public Map<String, String> updateState(Map<String, String> changes) {
        requireOwned();
        Map<String, String> merged = new LinkedHashMap<>(readState());
        changes.forEach((key, value) -> {
            if (value == null) {
                merged.remove(key);
            } else {
                merged.put(key, value);
            }
        });
        writeState(merged);
        return merged;
    }

    private void requireOwned() {
        if (!owned) {
            throw new IllegalStateException("Worker directory of " + ownerId + " is read-only for this node");
        }
    }
}
