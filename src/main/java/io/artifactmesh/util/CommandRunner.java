package io.artifactmesh.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

public final class CommandRunner {
    private static final int MAX_OUTPUT_CHARS = 512;

    private CommandRunner() {
    }

    /**
     * Runs a command to completion or until the timeout, killing it on expiry. Output goes through a
     * temp file so a chatty child cannot block on a full pipe.
     */
    public static Result run(List<String> command, Map<String, String> environment, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command cannot be empty");
        }
        Path output;
        try {
            output = Files.createTempFile("artifactmesh-cmd-", ".log");
        } catch (IOException e) {
            throw new RuntimeException("Failed to create command output file", e);
        }
        try {
            ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
            pb.redirectErrorStream(true);
            pb.redirectOutput(output.toFile());
            if (environment != null) {
                pb.environment().putAll(environment);
            }
            Process process;
            try {
                process = pb.start();
            } catch (IOException e) {
                return new Result(-1, false, "spawn failed: " + e.getMessage());
            }
            boolean finished;
            try {
                process.getOutputStream().close();
                finished = process.waitFor(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            } catch (IOException e) {
                process.destroyForcibly();
                return new Result(-1, false, "stdin close failed: " + e.getMessage());
            } catch (InterruptedException e) {
                process.destroyForcibly();
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted while running " + command.get(0), e);
            }
            if (!finished) {
                process.destroyForcibly();
                try {
                    process.waitFor(1, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return new Result(-1, true, truncate(readOutput(output)));
            }
            return new Result(process.exitValue(), false, truncate(readOutput(output)));
        } finally {
            try {
                Files.deleteIfExists(output);
            } catch (IOException ignored) {
                // Temp file cleanup is best effort.
            }
        }
    }

    private static String readOutput(Path output) {
        try {
            return Files.readString(output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    private static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_OUTPUT_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_OUTPUT_CHARS) + "...";
    }

    public record Result(int exitCode, boolean timedOut, String output) {
        public boolean ok() {
            return !timedOut && exitCode == 0;
        }
    }
}
