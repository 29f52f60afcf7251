package io.artifactmesh;

import io.artifactmesh.cli.ArtifactMeshCommand;
import picocli.CommandLine;

public final class Main {
    private Main() {
    }

    public static void main(String[] args) {
        int code = new CommandLine(new ArtifactMeshCommand()).execute(args);
        System.exit(code);
    }
}
