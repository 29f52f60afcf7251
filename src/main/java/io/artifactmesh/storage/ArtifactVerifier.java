package io.artifactmesh.storage;

import io.artifactmesh.util.Hashing;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public final class ArtifactVerifier {

    public Verification verify(SharedVolume volume, String version) {
        Optional<ArtifactManifest> manifest;
        try {
            manifest = volume.readManifest();
        } catch (ArtifactIntegrityException e) {
            return Verification.failed(e.getMessage());
        }
        if (manifest.isEmpty()) {
            return Verification.failed("artifact manifest missing");
        }
        return verify(volume.artifactDir(), manifest.get(), version);
    }

    public Verification verify(Path artifactDir, ArtifactManifest manifest, String version) {
        if (!version.equals(manifest.version())) {
            return Verification.failed("manifest is for version " + manifest.version());
        }
        if (manifest.entries().isEmpty()) {
            return Verification.failed("artifact set is empty");
        }
        for (ArtifactManifest.Entry entry : manifest.entries()) {
            Path file = artifactDir.resolve(entry.path()).normalize();
            if (!file.startsWith(artifactDir)) {
                return Verification.failed("entry escapes artifact directory: " + entry.path());
            }
            if (!Files.isRegularFile(file)) {
                return Verification.failed("missing artifact: " + entry.path());
            }
            if (entry.executable() && !Files.isExecutable(file)) {
                return Verification.failed("not executable: " + entry.path());
            }
            if (!entry.sha256().equalsIgnoreCase(Hashing.sha256Hex(file))) {
                return Verification.failed("checksum mismatch: " + entry.path());
            }
        }
        return Verification.passed(manifest.entries().size());
    }

    public record Verification(boolean ok, int checkedFiles, String reason) {
        static Verification passed(int checkedFiles) {
            return new Verification(true, checkedFiles, "ok");
        }

        static Verification failed(String reason) {
            return new Verification(false, 0, reason);
        }
    }
}
