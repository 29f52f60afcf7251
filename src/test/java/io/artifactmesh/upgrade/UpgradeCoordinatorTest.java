package io.artifactmesh.upgrade;

import com.fasterxml.jackson.databind.JsonNode;
import io.artifactmesh.model.NodeRole;
import io.artifactmesh.observability.AuditLogger;
import io.artifactmesh.relation.RelationDataAccessor;
import io.artifactmesh.storage.LockCoordinator;
import io.artifactmesh.storage.SharedVolume;
import io.artifactmesh.storage.StorageCoordinator;
import io.artifactmesh.support.FakeFetcher;
import io.artifactmesh.support.InMemoryRelation;
import io.artifactmesh.support.ManualClock;
import io.artifactmesh.support.RecordingServiceManager;
import io.artifactmesh.support.RecordingSleeper;
import io.artifactmesh.support.TestFiles;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class UpgradeCoordinatorTest {
    private static final String SERVICE = "artifactmesh-node.service";

    @Test
    void fullCycleWalksEveryPhaseInOrder() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-cycle-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            Node c = cluster.node("node-c", NodeRole.FOLLOWER);
            List<UpgradePhase> observed = new ArrayList<>();

            StepOutcome initial = primary.upgrades.primaryStep("1.2.0");
            Assertions.assertEquals("installed", initial.action());
            Assertions.assertEquals("idle", primary.upgrades.primaryStep("1.2.0").action());

            observed.add(b.observe());
            primary.upgrades.initiateUpgrade("1.3.0");
            observed.add(b.observe());
            Assertions.assertEquals("acknowledged", b.upgrades.followerStep().action());
            Assertions.assertEquals("acknowledged", c.upgrades.followerStep().action());
            Assertions.assertEquals(List.of("stop:" + SERVICE), b.services.calls());

            UpgradeOutcome outcome = primary.upgrades.runPrimaryUpgrade("1.3.0");
            Assertions.assertEquals(UpgradePhase.COMPLETE, outcome.phase());
            Assertions.assertEquals(2, outcome.readiness().readyCount());
            Assertions.assertFalse(outcome.readiness().timedOut());
            Assertions.assertTrue(primary.sleeper.sleeps().isEmpty());
            Assertions.assertEquals(List.of("restart:" + SERVICE), primary.services.calls());
            Assertions.assertEquals("1.3.0", cluster.volume.readInstalledVersion());

            observed.add(b.observe());
            Assertions.assertEquals("started", b.upgrades.followerStep().action());
            Assertions.assertEquals("started", c.upgrades.followerStep().action());
            Assertions.assertEquals(List.of("stop:" + SERVICE, "start:" + SERVICE), c.services.calls());
            Assertions.assertEquals("false", b.relation.getUnitData("node-b", RelationKeys.UPGRADE_READY).orElseThrow());

            Assertions.assertTrue(primary.upgrades.resetIfSettled());
            observed.add(b.observe());
            Assertions.assertEquals(
                    List.of(UpgradePhase.IDLE, UpgradePhase.PREPARE, UpgradePhase.COMPLETE, UpgradePhase.IDLE),
                    observed
            );
            Assertions.assertEquals(1, primary.fetcher.fetchedVersions().stream().filter("1.3.0"::equals).count());
            Assertions.assertEquals(0, b.fetcher.fetchCount());
            Assertions.assertEquals("idle", b.upgrades.followerStep().action());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void silentFollowerDoesNotBlockTheUpgrade() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-straggler-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            Node c = cluster.node("node-c", NodeRole.FOLLOWER);
            cluster.node("node-d", NodeRole.FOLLOWER);
            primary.upgrades.primaryStep("1.2.0");

            UpgradeState prepared = primary.upgrades.initiateUpgrade("1.3.0");
            Assertions.assertEquals(3, prepared.expectedCount());
            b.upgrades.followerStep();
            c.upgrades.followerStep();

            UpgradeOutcome outcome = primary.upgrades.runPrimaryUpgrade("1.3.0");

            ReadinessResult readiness = outcome.readiness();
            Assertions.assertTrue(readiness.timedOut());
            Assertions.assertEquals(2, readiness.readyCount());
            Assertions.assertEquals(3, readiness.expectedCount());
            Assertions.assertEquals(List.of("node-d"), readiness.stragglers());
            Assertions.assertEquals(Duration.ofMinutes(2), primary.sleeper.total());
            Assertions.assertEquals(UpgradePhase.COMPLETE, primary.upgrades.currentState().phase());
            Assertions.assertEquals(2, primary.upgrades.currentState().readyCount());

            JsonNode timeoutRow = null;
            for (JsonNode row : primary.audit.tail(100)) {
                if ("upgrade.readiness".equals(row.path("action").asText()) && "timeout".equals(row.path("result").asText())) {
                    timeoutRow = row;
                }
            }
            Assertions.assertNotNull(timeoutRow);
            Assertions.assertEquals("node-d", timeoutRow.path("details").path("stragglers").get(0).asText());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void restartedFollowerTrustsVersionMarkerOverRelation() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-restart-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            primary.upgrades.primaryStep("1.2.0");
            primary.upgrades.initiateUpgrade("1.3.0");
            b.upgrades.followerStep();
            primary.upgrades.awaitFollowersReady();
            primary.upgrades.markDownloading();

            Node restarted = cluster.node("node-b", NodeRole.FOLLOWER);
            StepOutcome waiting = restarted.upgrades.followerStep();
            Assertions.assertEquals("waiting", waiting.action());
            Assertions.assertEquals("1.2.0", cluster.volume.readInstalledVersion());
            Assertions.assertTrue(restarted.services.calls().isEmpty());

            // The relation runs ahead of the shared volume: COMPLETE is visible, the marker is not.
            primary.relation.setApplicationData(RelationKeys.UPGRADE_STATE, UpgradePhase.COMPLETE.wireValue());
            restarted.sleeper.onSleep(() -> {
                if (!primary.storage.isInstalled("1.3.0")) {
                    primary.storage.ensureArtifacts("1.3.0", NodeRole.PRIMARY);
                }
            });

            StepOutcome started = restarted.upgrades.followerStep();

            Assertions.assertEquals("started", started.action());
            Assertions.assertFalse(restarted.sleeper.sleeps().isEmpty());
            Assertions.assertEquals("1.3.0", cluster.volume.readInstalledVersion());
            Assertions.assertEquals(List.of("start:" + SERVICE), restarted.services.calls());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failedDownloadBlocksInDownloadingUntilRetried() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-download-fail-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            primary.upgrades.primaryStep("1.2.0");
            primary.upgrades.initiateUpgrade("1.3.0");
            b.upgrades.followerStep();

            primary.fetcher.failing(true);
            UpgradeBlockedException blocked = Assertions.assertThrows(
                    UpgradeBlockedException.class,
                    () -> primary.upgrades.runPrimaryUpgrade("1.3.0")
            );
            Assertions.assertTrue(blocked.fatal());
            Assertions.assertEquals("1.3.0", blocked.targetVersion());
            Assertions.assertEquals(UpgradePhase.DOWNLOADING, primary.upgrades.currentState().phase());
            Assertions.assertEquals("1.2.0", cluster.volume.readInstalledVersion());
            Assertions.assertTrue(primary.services.calls().isEmpty());

            Assertions.assertEquals("waiting", b.upgrades.followerStep().action());
            Assertions.assertEquals(List.of("stop:" + SERVICE), b.services.calls());

            primary.fetcher.failing(false);
            UpgradeOutcome retried = primary.upgrades.retryBlockedUpgrade();
            Assertions.assertEquals(UpgradePhase.COMPLETE, retried.phase());
            Assertions.assertEquals("1.3.0", cluster.volume.readInstalledVersion());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failedRestartAfterDownloadIsFatal() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-restart-fail-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            primary.upgrades.primaryStep("1.2.0");
            primary.services.failOn("restart");

            Assertions.assertThrows(UpgradeBlockedException.class, () -> primary.upgrades.runPrimaryUpgrade("1.3.0"));
            Assertions.assertEquals(UpgradePhase.DOWNLOADING, primary.upgrades.currentState().phase());
            Assertions.assertEquals("1.3.0", cluster.volume.readInstalledVersion());

            primary.services.clearFailures();
            StepOutcome resumed = primary.upgrades.primaryStep("1.3.0");
            Assertions.assertEquals("upgraded", resumed.action());
            Assertions.assertEquals(UpgradePhase.COMPLETE, primary.upgrades.currentState().phase());
            Assertions.assertEquals(1, primary.fetcher.fetchedVersions().stream().filter("1.3.0"::equals).count());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void secondUpgradeIsRejectedWhileOneIsInProgress() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-in-progress-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            cluster.node("node-b", NodeRole.FOLLOWER);
            UpgradeState first = primary.upgrades.initiateUpgrade("1.3.0");

            UpgradeInProgressException error = Assertions.assertThrows(
                    UpgradeInProgressException.class,
                    () -> primary.upgrades.initiateUpgrade("1.4.0")
            );
            Assertions.assertFalse(error.fatal());
            Assertions.assertEquals(first, primary.upgrades.initiateUpgrade("1.3.0"));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void phasesOnlyMoveForward() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-monotonic-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);

            Assertions.assertThrows(IllegalStateException.class, () -> primary.upgrades.markDownloading());
            primary.upgrades.initiateUpgrade("1.3.0");
            Assertions.assertThrows(IllegalStateException.class, () -> primary.upgrades.completeUpgrade());
            Assertions.assertFalse(primary.upgrades.resetIfSettled());
            primary.upgrades.markDownloading();
            Assertions.assertEquals(UpgradePhase.DOWNLOADING, primary.upgrades.markDownloading().phase());

            Assertions.assertThrows(IllegalStateException.class, () -> b.upgrades.initiateUpgrade("1.5.0"));
            Assertions.assertThrows(IllegalStateException.class, () -> primary.upgrades.handlePrepareSignal());
            Assertions.assertThrows(IllegalStateException.class, () -> b.relation.setApplicationData(RelationKeys.UPGRADE_STATE, "idle"));
            Assertions.assertTrue(UpgradePhase.DOWNLOADING.canAdvanceTo(UpgradePhase.COMPLETE));
            Assertions.assertFalse(UpgradePhase.PREPARE.canAdvanceTo(UpgradePhase.IDLE));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void acknowledgementFromEarlierCycleIsIgnored() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-old-ack-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            b.relation.setUnitData(RelationKeys.UPGRADE_READY, "true");
            b.relation.setUnitData(RelationKeys.TIMESTAMP, cluster.clock.instant().toString());
            cluster.clock.advance(Duration.ofMinutes(30));

            primary.upgrades.initiateUpgrade("1.3.0");
            ReadinessResult readiness = primary.upgrades.awaitFollowersReady();

            Assertions.assertTrue(readiness.timedOut());
            Assertions.assertEquals(0, readiness.readyCount());
            Assertions.assertEquals(List.of("node-b"), readiness.stragglers());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void failedStopIsNotAcknowledged() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-stop-fail-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            b.services.failOn("stop");
            primary.upgrades.initiateUpgrade("1.3.0");

            StepOutcome step = b.upgrades.followerStep();

            Assertions.assertEquals("stop_failed", step.action());
            Assertions.assertTrue(b.relation.getUnitData("node-b", RelationKeys.UPGRADE_READY).isEmpty());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void resetWaitsForPendingFollowersUntilGraceExpires() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-grace-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            primary.upgrades.primaryStep("1.2.0");
            primary.upgrades.initiateUpgrade("1.3.0");
            b.upgrades.followerStep();
            primary.upgrades.runPrimaryUpgrade("1.3.0");

            StepOutcome pending = primary.upgrades.primaryStep("1.3.0");
            Assertions.assertEquals("waiting_followers", pending.action());
            cluster.clock.advance(Duration.ofMinutes(5));
            Assertions.assertEquals("reset", primary.upgrades.primaryStep("1.3.0").action());
            Assertions.assertEquals(UpgradePhase.IDLE, primary.upgrades.currentState().phase());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void followerThatMissedCompleteIsStartedAfterReset() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-missed-complete-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node b = cluster.node("node-b", NodeRole.FOLLOWER);
            primary.upgrades.primaryStep("1.2.0");
            primary.upgrades.initiateUpgrade("1.3.0");
            Assertions.assertEquals("acknowledged", b.upgrades.followerStep().action());
            primary.upgrades.runPrimaryUpgrade("1.3.0");

            // node-b is down for the whole grace period.
            cluster.clock.advance(Duration.ofMinutes(6));
            Assertions.assertEquals("reset", primary.upgrades.primaryStep("1.3.0").action());
            Assertions.assertEquals(UpgradePhase.IDLE, b.observe());
            Assertions.assertFalse(b.services.isActive(SERVICE));

            StepOutcome recovered = b.upgrades.followerStep();

            Assertions.assertEquals("recovered", recovered.action());
            Assertions.assertEquals("1.3.0", recovered.targetVersion());
            Assertions.assertTrue(b.services.isActive(SERVICE));
            Assertions.assertEquals(List.of("stop:" + SERVICE, "start:" + SERVICE), b.services.calls());
            Assertions.assertEquals("false", b.relation.getUnitData("node-b", RelationKeys.UPGRADE_READY).orElseThrow());
            Assertions.assertEquals(0, b.fetcher.fetchCount());
            Assertions.assertEquals("idle", b.upgrades.followerStep().action());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void stragglerStillRunningIsRestartedOnComplete() throws Exception {
        Path root = Files.createTempDirectory("artifactmesh-test-upgrade-straggler-restart-");
        try {
            Cluster cluster = new Cluster(root);
            Node primary = cluster.node("node-a", NodeRole.PRIMARY);
            Node d = cluster.node("node-d", NodeRole.FOLLOWER);
            primary.upgrades.primaryStep("1.2.0");
            primary.upgrades.runPrimaryUpgrade("1.3.0");
            Assertions.assertEquals(UpgradePhase.COMPLETE, d.observe());
            Assertions.assertTrue(d.services.isActive(SERVICE));

            StepOutcome step = d.upgrades.followerStep();

            Assertions.assertEquals("restarted", step.action());
            Assertions.assertEquals(List.of("restart:" + SERVICE), d.services.calls());
            Assertions.assertEquals("idle", d.upgrades.followerStep().action());
            Assertions.assertEquals(List.of("restart:" + SERVICE), d.services.calls());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void relationStateRoundTripsThroughStringValues() {
        UpgradeState state = new UpgradeState(UpgradePhase.PREPARE, "1.3.0", "node-a",
                Instant.parse("2026-03-01T10:00:00Z"), 5, 3);
        Assertions.assertEquals(3, state.readyCount());
        Assertions.assertEquals(state, UpgradeState.fromRelationData(state.toRelationData()));
        Assertions.assertEquals(UpgradeState.idle(), UpgradeState.fromRelationData(Map.of()));
        Assertions.assertThrows(IllegalStateException.class,
                () -> UpgradeState.fromRelationData(Map.of(RelationKeys.UPGRADE_STATE, "rolling")));
    }

    private static final class Cluster {
        final Path root;
        final ManualClock clock = ManualClock.startingAt("2026-03-01T10:00:00Z");
        final InMemoryRelation relation = new InMemoryRelation();
        final SharedVolume volume;

        Cluster(Path root) {
            this.root = root;
            this.volume = SharedVolume.open(root.resolve("shared"), false);
        }

        Node node(String nodeId, NodeRole role) {
            RelationDataAccessor view = relation.unit(nodeId, role == NodeRole.PRIMARY);
            FakeFetcher fetcher = new FakeFetcher();
            RecordingServiceManager services = new RecordingServiceManager();
            RecordingSleeper sleeper = new RecordingSleeper(clock);
            AuditLogger audit = new AuditLogger(root.resolve("audit").resolve(nodeId + ".log"), nodeId, clock);
            StorageCoordinator storage = new StorageCoordinator(
                    volume,
                    new LockCoordinator(volume, LockCoordinator.DEFAULT_STALE_AFTER, clock),
                    fetcher,
                    audit,
                    nodeId,
                    StorageCoordinator.Settings.defaults(),
                    clock,
                    sleeper
            );
            UpgradeCoordinator upgrades = new UpgradeCoordinator(
                    view,
                    storage,
                    services,
                    audit,
                    role,
                    UpgradeCoordinator.Settings.defaults(SERVICE),
                    clock,
                    sleeper
            );
            return new Node(view, storage, upgrades, fetcher, services, sleeper, audit);
        }
    }

    private record Node(
            RelationDataAccessor relation,
            StorageCoordinator storage,
            UpgradeCoordinator upgrades,
            FakeFetcher fetcher,
            RecordingServiceManager services,
            RecordingSleeper sleeper,
            AuditLogger audit
    ) {
        UpgradePhase observe() {
            return upgrades.currentState().phase();
        }
    }
}
