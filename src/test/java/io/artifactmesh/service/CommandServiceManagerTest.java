package io.artifactmesh.service;

import io.artifactmesh.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class CommandServiceManagerTest {

    @Test
    void placeholdersAreSubstituted() {
        CommandServiceManager manager = new CommandServiceManager();
        Assertions.assertEquals(
                List.of("systemctl", "restart", "artifactmesh-node.service"),
                manager.resolve("restart", "artifactmesh-node.service")
        );
    }

    @Test
    void successfulCommandsRunInOrder() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-service-");
        try {
            Path log = root.resolve("calls.log");
            CommandServiceManager manager = new CommandServiceManager(List.of(
                    "sh", "-c", "echo {action} {service} >> " + log
            ));
            manager.stop("demo", Duration.ofSeconds(10));
            manager.stop("demo", Duration.ofSeconds(10));
            manager.start("demo", Duration.ofSeconds(10));

            Assertions.assertEquals(
                    List.of("stop demo", "stop demo", "start demo"),
                    Files.readAllLines(log, StandardCharsets.UTF_8)
            );
            Assertions.assertTrue(manager.isActive("demo"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failureAndTimeoutAreDistinct() {
        CommandServiceManager failing = new CommandServiceManager(List.of("sh", "-c", "echo nope; exit 3"));
        ServiceOperationException failed = Assertions.assertThrows(
                ServiceOperationException.class,
                () -> failing.restart("demo", Duration.ofSeconds(10))
        );
        Assertions.assertEquals("restart", failed.action());
        Assertions.assertTrue(failed.getMessage().contains("exit=3"));
        Assertions.assertFalse(failing.isActive("demo"));

        CommandServiceManager slow = new CommandServiceManager(List.of("sleep", "5"));
        ServiceOperationTimeoutException timedOut = Assertions.assertThrows(
                ServiceOperationTimeoutException.class,
                () -> slow.stop("demo", Duration.ofMillis(200))
        );
        Assertions.assertEquals("stop", timedOut.action());
        Assertions.assertEquals(Duration.ofMillis(200), timedOut.timeout());
        Assertions.assertFalse(timedOut.fatal());
    }
}
