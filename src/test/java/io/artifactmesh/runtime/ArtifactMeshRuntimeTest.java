package io.artifactmesh.runtime;

import io.artifactmesh.config.ArtifactMeshConfig;
import io.artifactmesh.config.CoordinationSettings;
import io.artifactmesh.model.NodeStatus;
import io.artifactmesh.storage.ArtifactWaitTimeoutException;
import io.artifactmesh.storage.StorageCoordinator;
import io.artifactmesh.storage.StorageNotMountedException;
import io.artifactmesh.support.FakeFetcher;
import io.artifactmesh.support.InMemoryRelation;
import io.artifactmesh.support.ManualClock;
import io.artifactmesh.support.RecordingServiceManager;
import io.artifactmesh.support.RecordingSleeper;
import io.artifactmesh.support.TestFiles;
import io.artifactmesh.upgrade.StepOutcome;
import io.artifactmesh.upgrade.UpgradeBlockedException;
import io.artifactmesh.upgrade.UpgradePhase;
import io.artifactmesh.upgrade.UpgradeState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class ArtifactMeshRuntimeTest {

    @Test
    void primaryInstallRecordsActiveStatus() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-runtime-primary-");
        try {
            Harness harness = new Harness(root);
            FakeFetcher fetcher = new FakeFetcher();
            ArtifactMeshRuntime runtime = harness.runtime("node-a", "primary", "1.2.0", fetcher, new RecordingServiceManager());

            ArtifactMeshRuntime.InitOutcome init = runtime.init();
            Assertions.assertEquals("primary", init.role());
            Assertions.assertEquals(1, init.relationMembers());

            StorageCoordinator.StorageOutcome outcome = runtime.ensureArtifacts();
            Assertions.assertTrue(outcome.downloaded());
            Assertions.assertEquals(NodeStatus.State.ACTIVE, runtime.currentStatus().state());
            Map<String, String> state = runtime.workerState("node-a");
            Assertions.assertEquals("ensure-artifacts", state.get("last_action"));

            ArtifactMeshRuntime.StatusView status = runtime.status();
            Assertions.assertEquals("1.2.0", status.installedVersion());
            Assertions.assertTrue(status.writable());
            Assertions.assertEquals("ACTIVE", status.status());
            Assertions.assertFalse(status.lock().inProgress());
            Assertions.assertEquals("idle", status.upgradePhase());
            Assertions.assertEquals(2, runtime.stats().artifactCount());
            Assertions.assertTrue(runtime.auditLogger().verify().ok());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void followerTimeoutIsRecordedAsWaiting() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-runtime-waiting-");
        try {
            Harness harness = new Harness(root);
            ArtifactMeshRuntime follower = harness.runtime("node-b", "follower", "1.2.0", new FakeFetcher(), new RecordingServiceManager());
            follower.init();

            Assertions.assertThrows(ArtifactWaitTimeoutException.class, follower::ensureArtifacts);

            NodeStatus status = follower.currentStatus();
            Assertions.assertEquals(NodeStatus.State.WAITING, status.state());
            Assertions.assertTrue(status.message().contains("1.2.0"));
            Assertions.assertThrows(IllegalStateException.class, () -> follower.upgrade(false));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void blockedUpgradeStaysBlockedAcrossRestartUntilRetried() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-runtime-blocked-");
        try {
            Harness harness = new Harness(root);
            FakeFetcher fetcher = new FakeFetcher();
            harness.runtime("node-a", "primary", "1.2.0", fetcher, new RecordingServiceManager()).ensureArtifacts();

            fetcher.failing(true);
            ArtifactMeshRuntime upgrading = harness.runtime("node-a", "primary", "1.3.0", fetcher, new RecordingServiceManager());
            Assertions.assertThrows(UpgradeBlockedException.class, () -> upgrading.upgrade(false));
            Assertions.assertEquals(NodeStatus.State.BLOCKED, upgrading.currentStatus().state());

            fetcher.failing(false);
            ArtifactMeshRuntime restarted = harness.runtime("node-a", "primary", "1.3.0", fetcher, new RecordingServiceManager());
            StepOutcome held = restarted.upgrade(false);
            Assertions.assertEquals("blocked", held.action());
            Assertions.assertEquals(UpgradePhase.DOWNLOADING, held.observedPhase());
            Assertions.assertEquals(2, fetcher.fetchCount());

            StepOutcome retried = restarted.upgrade(true);
            Assertions.assertEquals("retried", retried.action());
            Assertions.assertEquals(UpgradePhase.COMPLETE, retried.observedPhase());
            Assertions.assertEquals(NodeStatus.State.ACTIVE, restarted.currentStatus().state());
            Assertions.assertEquals("1.3.0", restarted.status().installedVersion());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void followerStepsFollowThePrimary() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-runtime-follow-");
        try {
            Harness harness = new Harness(root);
            FakeFetcher fetcher = new FakeFetcher();
            RecordingServiceManager followerServices = new RecordingServiceManager();
            ArtifactMeshRuntime primary = harness.runtime("node-a", "primary", "1.2.0", fetcher, new RecordingServiceManager());
            ArtifactMeshRuntime follower = harness.runtime("node-b", "follower", "1.2.0", new FakeFetcher(), followerServices);
            primary.init();
            follower.init();
            Assertions.assertEquals("installed", primary.upgrade(false).action());
            Assertions.assertEquals("idle", follower.follow().action());

            ArtifactMeshRuntime upgrading = harness.runtime("node-a", "primary", "1.3.0", fetcher, new RecordingServiceManager());
            // Another leader tick already announced the upgrade.
            harness.relation.unit("node-a", true).setApplicationData(new UpgradeState(
                    UpgradePhase.PREPARE, "1.3.0", "node-a", harness.clock.instant(), 0, 1).toRelationData());
            Assertions.assertEquals("acknowledged", follower.follow().action());
            Assertions.assertEquals(NodeStatus.State.MAINTENANCE, follower.currentStatus().state());

            Assertions.assertEquals("upgraded", upgrading.upgrade(false).action());
            Assertions.assertEquals("started", follower.follow().action());
            Assertions.assertEquals(NodeStatus.State.ACTIVE, follower.currentStatus().state());
            Assertions.assertTrue(followerServices.isActive("artifactmesh-node.service"));
            @SuppressWarnings("unchecked")
            Map<String, String> acks = (Map<String, String>) upgrading.upgradeState().get("followers");
            Assertions.assertEquals("false", acks.get("node-b"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void unmountedSharedVolumeFailsInit() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-runtime-unmounted-");
        try {
            ArtifactMeshConfig config = ArtifactMeshConfig.fromRoot(root.resolve("local").toString());
            Files.createDirectories(config.rootDir());
            Files.writeString(config.settingsFile(), "{\"nodeId\":\"node-a\",\"sharedMode\":true,\"sharedRoot\":\""
                    + root.resolve("missing-mount") + "\"}", StandardCharsets.UTF_8);
            CoordinationSettings settings = CoordinationSettings.load(config.settingsFile());
            ManualClock clock = ManualClock.startingAt("2026-03-01T10:00:00Z");
            ArtifactMeshRuntime runtime = new ArtifactMeshRuntime(config, settings, new FakeFetcher(),
                    new RecordingServiceManager(), new InMemoryRelation().unit("node-a", false), clock, new RecordingSleeper(clock));

            StorageNotMountedException error = Assertions.assertThrows(StorageNotMountedException.class, runtime::init);
            Assertions.assertTrue(error.getMessage().contains("missing-mount"));
            Assertions.assertFalse(Files.exists(root.resolve("missing-mount")));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    private static final class Harness {
        final Path root;
        final ManualClock clock = ManualClock.startingAt("2026-03-01T10:00:00Z");
        final InMemoryRelation relation = new InMemoryRelation();

        Harness(Path root) {
            this.root = root;
        }

        ArtifactMeshRuntime runtime(String nodeId, String role, String version, FakeFetcher fetcher, RecordingServiceManager services) {
            ArtifactMeshConfig config = ArtifactMeshConfig.fromRoot(root.resolve("local-" + nodeId).toString());
            CoordinationSettings settings = CoordinationSettings.defaults()
                    .withOverrides(nodeId, role, root.resolve("shared").toString(), version);
            return new ArtifactMeshRuntime(
                    config,
                    settings,
                    fetcher,
                    services,
                    relation.unit(nodeId, "primary".equals(role)),
                    clock,
                    new RecordingSleeper(clock)
            );
        }
    }
}
