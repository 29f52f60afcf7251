package io.artifactmesh.upgrade;

import io.artifactmesh.model.NodeRole;
import io.artifactmesh.observability.AuditLogger;
import io.artifactmesh.relation.RelationDataAccessor;
import io.artifactmesh.service.ServiceManager;
import io.artifactmesh.service.ServiceOperationException;
import io.artifactmesh.service.ServiceOperationTimeoutException;
import io.artifactmesh.storage.StorageCoordinator;
import io.artifactmesh.storage.VolumeLayout;
import io.artifactmesh.util.Backoff;
import io.artifactmesh.util.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives IDLE, PREPARE, DOWNLOADING, COMPLETE and back to IDLE across the group. The primary owns
 * every phase change; followers only react and publish their own {@code upgrade-ready} flag. State
 * is re-read from the relation on every call and the version marker on the shared volume stays the
 * source of truth for whether artifacts are in place.
 */
public final class UpgradeCoordinator {
    public static final Duration DEFAULT_READY_TIMEOUT = Duration.ofMinutes(2);
    public static final Duration DEFAULT_COMPLETE_GRACE = Duration.ofMinutes(5);
    public static final Duration DEFAULT_SERVICE_TIMEOUT = Duration.ofSeconds(30);

    private final RelationDataAccessor relation;
    private final StorageCoordinator storage;
    private final ServiceManager serviceManager;
    private final AuditLogger auditLogger;
    private final NodeRole role;
    private final Settings settings;
    private final Clock clock;
    private final Sleeper sleeper;

    public UpgradeCoordinator(
            RelationDataAccessor relation,
            StorageCoordinator storage,
            ServiceManager serviceManager,
            AuditLogger auditLogger,
            NodeRole role,
            Settings settings,
            Clock clock,
            Sleeper sleeper
    ) {
        this.relation = relation;
        this.storage = storage;
        this.serviceManager = serviceManager;
        this.auditLogger = auditLogger;
        this.role = role;
        this.settings = settings;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public NodeRole role() {
        return role;
    }

    public UpgradeState currentState() {
        return UpgradeState.fromRelationData(relation.applicationData());
    }

    public UpgradeState initiateUpgrade(String targetVersion) {
        requirePrimary("initiate an upgrade");
        if (targetVersion == null || targetVersion.isBlank()) {
            throw new IllegalArgumentException("targetVersion must not be blank");
        }
        String target = targetVersion.trim();
        UpgradeState state = currentState();
        if (state.inProgress()) {
            if (target.equals(state.targetVersion())) {
                return state;
            }
            throw new UpgradeInProgressException("Upgrade to " + state.targetVersion() + " is in phase "
                    + state.phase().wireValue() + "; cannot start upgrade to " + target);
        }
        List<String> followers = followers();
        UpgradeState prepared = new UpgradeState(
                UpgradePhase.PREPARE,
                target,
                relation.localUnit(),
                clock.instant(),
                0,
                followers.size()
        );
        relation.setApplicationData(prepared.toRelationData());
        auditLogger.log("upgrade.phase", "upgrade/" + target, UpgradePhase.PREPARE.wireValue(), Map.of(
                "from", storage.volume().readInstalledVersion(),
                "expected_followers", followers.size()
        ));
        return prepared;
    }

    public ReadinessResult awaitFollowersReady() {
        requirePrimary("wait for follower readiness");
        UpgradeState state = currentState();
        if (state.phase() != UpgradePhase.PREPARE) {
            throw new IllegalStateException("Readiness wait needs phase prepare, found " + state.phase().wireValue());
        }
        Instant start = clock.instant();
        Instant prepareAt = state.timestamp() == null ? start : state.timestamp();
        Instant deadline = prepareAt.plus(settings.readyTimeout());
        Backoff backoff = new Backoff(settings.pollInitial(), settings.pollMax());
        int published = state.readyCount();
        while (true) {
            List<String> pending = new ArrayList<>();
            int ready = 0;
            for (String unit : followers()) {
                if (acknowledged(unit, prepareAt)) {
                    ready++;
                } else {
                    pending.add(unit);
                }
            }
            int clamped = Math.min(ready, state.expectedCount());
            if (clamped != published) {
                relation.setApplicationData(RelationKeys.WORKER_READY_COUNT, Integer.toString(clamped));
                published = clamped;
            }
            Instant now = clock.instant();
            long waitedMs = Duration.between(start, now).toMillis();
            if (ready >= state.expectedCount()) {
                auditLogger.log("upgrade.readiness", "upgrade/" + state.targetVersion(), "all_ready",
                        Map.of("ready", clamped, "expected", state.expectedCount(), "waited_ms", waitedMs));
                return new ReadinessResult(clamped, state.expectedCount(), List.of(), false, waitedMs);
            }
            if (!now.isBefore(deadline)) {
                auditLogger.log("upgrade.readiness", "upgrade/" + state.targetVersion(), "timeout", Map.of(
                        "ready", clamped,
                        "expected", state.expectedCount(),
                        "stragglers", List.copyOf(pending),
                        "waited_ms", waitedMs
                ));
                return new ReadinessResult(clamped, state.expectedCount(), pending, true, waitedMs);
            }
            Duration remaining = Duration.between(now, deadline);
            Duration interval = backoff.next();
            sleeper.sleep(interval.compareTo(remaining) > 0 ? remaining : interval);
        }
    }

    public UpgradeState markDownloading() {
        requirePrimary("start the download phase");
        return advance(UpgradePhase.PREPARE, UpgradePhase.DOWNLOADING);
    }

    public UpgradeState completeUpgrade() {
        requirePrimary("complete an upgrade");
        return advance(UpgradePhase.DOWNLOADING, UpgradePhase.COMPLETE);
    }

    /**
     * Returns to IDLE once no follower still holds an acknowledgement, or once the grace period
     * after COMPLETE has passed.
     */
    public boolean resetIfSettled() {
        requirePrimary("reset upgrade state");
        UpgradeState state = currentState();
        if (state.phase() != UpgradePhase.COMPLETE) {
            return false;
        }
        List<String> pending = new ArrayList<>();
        for (String unit : followers()) {
            if (readyFlag(unit)) {
                pending.add(unit);
            }
        }
        Instant completedAt = state.timestamp() == null ? clock.instant() : state.timestamp();
        boolean graceOver = !clock.instant().isBefore(completedAt.plus(settings.completeGrace()));
        if (!pending.isEmpty() && !graceOver) {
            return false;
        }
        advance(UpgradePhase.COMPLETE, UpgradePhase.IDLE);
        auditLogger.log("upgrade.reset", "upgrade/" + state.targetVersion(), pending.isEmpty() ? "settled" : "grace_expired",
                Map.of("pending", List.copyOf(pending)));
        return true;
    }

    /**
     * Full primary sequence. On a failed download or restart the phase stays DOWNLOADING so
     * followers remain stopped, and {@link UpgradeBlockedException} is raised.
     */
    public UpgradeOutcome runPrimaryUpgrade(String targetVersion) {
        UpgradeState prepared = initiateUpgrade(targetVersion);
        ReadinessResult readiness = switch (prepared.phase()) {
            case PREPARE -> awaitFollowersReady();
            default -> ReadinessResult.resumed(prepared);
        };
        if (prepared.phase() == UpgradePhase.COMPLETE) {
            return new UpgradeOutcome(prepared.targetVersion(), UpgradePhase.COMPLETE, readiness, null);
        }
        markDownloading();
        return finishDownloadPhase(prepared.targetVersion(), readiness);
    }

    public UpgradeOutcome retryBlockedUpgrade() {
        requirePrimary("retry an upgrade");
        UpgradeState state = currentState();
        if (state.phase() != UpgradePhase.DOWNLOADING) {
            throw new IllegalStateException("Nothing to retry, upgrade phase is " + state.phase().wireValue());
        }
        auditLogger.log("upgrade.retry", "upgrade/" + state.targetVersion(), "started", Map.of());
        return finishDownloadPhase(state.targetVersion(), ReadinessResult.resumed(state));
    }

    private UpgradeOutcome finishDownloadPhase(String target, ReadinessResult readiness) {
        StorageCoordinator.StorageOutcome installed;
        try {
            installed = storage.ensureArtifacts(target, NodeRole.PRIMARY);
        } catch (RuntimeException e) {
            auditLogger.log("upgrade.download", "upgrade/" + target, "failed",
                    Map.of("error", String.valueOf(e.getMessage())));
            throw new UpgradeBlockedException(target, "Download of " + target + " failed, upgrade blocked in phase "
                    + UpgradePhase.DOWNLOADING.wireValue() + ": " + e.getMessage(), e);
        }
        try {
            serviceManager.restart(settings.serviceName(), settings.serviceTimeout());
        } catch (ServiceOperationTimeoutException | ServiceOperationException e) {
            auditLogger.log("upgrade.restart", "service/" + settings.serviceName(), "failed",
                    Map.of("error", String.valueOf(e.getMessage()), "version", target));
            throw new UpgradeBlockedException(target, "Restart of " + settings.serviceName() + " after installing "
                    + target + " failed, upgrade blocked: " + e.getMessage(), e);
        }
        completeUpgrade();
        return new UpgradeOutcome(target, UpgradePhase.COMPLETE, readiness, installed);
    }

    /**
     * One leader tick: first install, new upgrade, resume after a restart, or reset after COMPLETE.
     */
    public StepOutcome primaryStep(String configuredTarget) {
        requirePrimary("run a primary step");
        UpgradeState state = currentState();
        switch (state.phase()) {
            case IDLE -> {
                if (configuredTarget == null || configuredTarget.isBlank()) {
                    return new StepOutcome("idle", state.phase(), null, "no target version configured");
                }
                String target = configuredTarget.trim();
                String installed = storage.volume().readInstalledVersion();
                if (VolumeLayout.NO_VERSION.equals(installed)) {
                    storage.ensureArtifacts(target, NodeRole.PRIMARY);
                    return new StepOutcome("installed", state.phase(), target, "initial install");
                }
                if (storage.isInstalled(target)) {
                    return new StepOutcome("idle", state.phase(), target, "already at " + target);
                }
                UpgradeOutcome outcome = runPrimaryUpgrade(target);
                return new StepOutcome("upgraded", outcome.phase(), target,
                        "ready " + outcome.readiness().readyCount() + "/" + outcome.readiness().expectedCount());
            }
            case PREPARE -> {
                ReadinessResult readiness = awaitFollowersReady();
                markDownloading();
                UpgradeOutcome outcome = finishDownloadPhase(state.targetVersion(), readiness);
                return new StepOutcome("upgraded", outcome.phase(), state.targetVersion(), "resumed from prepare");
            }
            case DOWNLOADING -> {
                UpgradeOutcome outcome = finishDownloadPhase(state.targetVersion(), ReadinessResult.resumed(state));
                return new StepOutcome("upgraded", outcome.phase(), state.targetVersion(), "resumed from downloading");
            }
            case COMPLETE -> {
                boolean reset = resetIfSettled();
                return new StepOutcome(reset ? "reset" : "waiting_followers", state.phase(), state.targetVersion(),
                        reset ? "back to idle" : "followers still restarting");
            }
            default -> throw new IllegalStateException("Unhandled phase " + state.phase());
        }
    }

    /**
     * Stops the local service and acknowledges. A failed stop is tolerated: the node does not
     * acknowledge and the primary's readiness timeout carries the upgrade forward.
     */
    public boolean handlePrepareSignal() {
        requireFollower("handle prepare");
        UpgradeState state = currentState();
        if (state.phase() != UpgradePhase.PREPARE && state.phase() != UpgradePhase.DOWNLOADING) {
            throw new IllegalStateException("Prepare signal needs phase prepare, found " + state.phase().wireValue());
        }
        try {
            serviceManager.stop(settings.serviceName(), settings.serviceTimeout());
        } catch (ServiceOperationTimeoutException | ServiceOperationException e) {
            auditLogger.log("upgrade.prepare", "service/" + settings.serviceName(), "stop_failed",
                    Map.of("error", String.valueOf(e.getMessage()), "version", String.valueOf(state.targetVersion())));
            return false;
        }
        relation.setUnitData(RelationKeys.UPGRADE_READY, "true");
        relation.setUnitData(RelationKeys.TIMESTAMP, clock.instant().toString());
        auditLogger.log("upgrade.prepare", "upgrade/" + state.targetVersion(), "acknowledged", Map.of());
        return true;
    }

    /**
     * Waits for the version marker itself (never the relation alone), then starts the service and
     * clears the acknowledgement.
     */
    public StorageCoordinator.StorageOutcome handleCompleteSignal() {
        requireFollower("handle complete");
        UpgradeState state = currentState();
        if (state.phase() != UpgradePhase.COMPLETE) {
            throw new IllegalStateException("Complete signal needs phase complete, found " + state.phase().wireValue());
        }
        return bringUp(state.targetVersion(), false, "started");
    }

    public StepOutcome followerStep() {
        requireFollower("run a follower step");
        UpgradeState state = currentState();
        String local = relation.localUnit();
        return switch (state.phase()) {
            case IDLE -> {
                if (!readyFlag(local)) {
                    yield new StepOutcome("idle", state.phase(), state.targetVersion(), "no upgrade in progress");
                }
                // Stopped for an upgrade whose COMPLETE was missed; the marker decides what to start.
                String target = state.targetVersion() == null
                        ? storage.volume().readInstalledVersion()
                        : state.targetVersion();
                if (VolumeLayout.NO_VERSION.equals(target)) {
                    yield new StepOutcome("idle", state.phase(), null, "no version installed");
                }
                StorageCoordinator.StorageOutcome outcome = bringUp(target, false, "recovered");
                yield new StepOutcome("recovered", state.phase(), target, describePolls(outcome));
            }
            case PREPARE, DOWNLOADING -> {
                Instant prepareAt = state.phase() == UpgradePhase.PREPARE ? state.timestamp() : null;
                if (acknowledged(local, prepareAt)) {
                    yield new StepOutcome("waiting", state.phase(), state.targetVersion(), "acknowledged, service stopped");
                }
                boolean acked = handlePrepareSignal();
                yield new StepOutcome(acked ? "acknowledged" : "stop_failed", state.phase(), state.targetVersion(),
                        acked ? "service stopped" : "service stop failed, not acknowledged");
            }
            case COMPLETE -> {
                if (readyFlag(local)) {
                    StorageCoordinator.StorageOutcome outcome = handleCompleteSignal();
                    yield new StepOutcome("started", state.phase(), state.targetVersion(), describePolls(outcome));
                }
                if (startedSince(local, state.timestamp()) && serviceManager.isActive(settings.serviceName())
                        && storage.isInstalled(state.targetVersion())) {
                    yield new StepOutcome("idle", state.phase(), state.targetVersion(), "already running " + state.targetVersion());
                }
                // Never acknowledged this cycle: a running service still holds the old binaries.
                boolean running = serviceManager.isActive(settings.serviceName());
                StorageCoordinator.StorageOutcome outcome = bringUp(state.targetVersion(), running, running ? "restarted" : "started");
                yield new StepOutcome(running ? "restarted" : "started", state.phase(), state.targetVersion(),
                        describePolls(outcome));
            }
        };
    }

    private StorageCoordinator.StorageOutcome bringUp(String target, boolean restart, String result) {
        StorageCoordinator.StorageOutcome outcome = storage.ensureArtifacts(target, NodeRole.FOLLOWER);
        if (restart) {
            serviceManager.restart(settings.serviceName(), settings.serviceTimeout());
        } else {
            serviceManager.start(settings.serviceName(), settings.serviceTimeout());
        }
        relation.setUnitData(RelationKeys.UPGRADE_READY, "false");
        relation.setUnitData(RelationKeys.TIMESTAMP, clock.instant().toString());
        auditLogger.log("upgrade.complete", "upgrade/" + target, result, outcome.toDetails());
        return outcome;
    }

    private boolean readyFlag(String unit) {
        return "true".equalsIgnoreCase(relation.getUnitData(unit, RelationKeys.UPGRADE_READY).orElse("false"));
    }

    private boolean startedSince(String unit, Instant completedAt) {
        Instant at = UpgradeState.parseInstant(relation.getUnitData(unit, RelationKeys.TIMESTAMP).orElse(""));
        return at != null && (completedAt == null || !at.isBefore(completedAt));
    }

    private static String describePolls(StorageCoordinator.StorageOutcome outcome) {
        return outcome.polls() == 0 ? "artifacts present" : "artifacts appeared after " + outcome.polls() + " polls";
    }

    public Map<String, Object> describe() {
        UpgradeState state = currentState();
        Map<String, Object> out = new LinkedHashMap<>(state.toRelationData());
        Map<String, String> acks = new LinkedHashMap<>();
        for (String unit : followers()) {
            acks.put(unit, relation.getUnitData(unit, RelationKeys.UPGRADE_READY).orElse("false"));
        }
        out.put("followers", acks);
        return out;
    }

    private boolean acknowledged(String unit, Instant notBefore) {
        if (!readyFlag(unit)) {
            return false;
        }
        if (notBefore == null) {
            return true;
        }
        Instant ackAt = UpgradeState.parseInstant(relation.getUnitData(unit, RelationKeys.TIMESTAMP).orElse(""));
        // An acknowledgement left over from an earlier cycle does not count.
        return ackAt != null && !ackAt.isBefore(notBefore);
    }

    private UpgradeState advance(UpgradePhase from, UpgradePhase to) {
        UpgradeState state = currentState();
        if (state.phase() == to) {
            return state;
        }
        if (state.phase() != from || !from.canAdvanceTo(to)) {
            throw new IllegalStateException("Cannot move upgrade from " + state.phase().wireValue() + " to " + to.wireValue());
        }
        UpgradeState next = state.withPhase(to, clock.instant());
        Map<String, String> changes = new LinkedHashMap<>();
        changes.put(RelationKeys.UPGRADE_STATE, to.wireValue());
        changes.put(RelationKeys.TIMESTAMP, next.timestamp().toString());
        relation.setApplicationData(changes);
        auditLogger.log("upgrade.phase", "upgrade/" + state.targetVersion(), to.wireValue(),
                Map.of("from", from.wireValue()));
        return next;
    }

    private List<String> followers() {
        String local = relation.localUnit();
        return relation.allUnits().stream()
                .filter(unit -> !unit.equals(local))
                .toList();
    }

    private void requirePrimary(String action) {
        if (role != NodeRole.PRIMARY) {
            throw new IllegalStateException("Only the primary may " + action);
        }
    }

    private void requireFollower(String action) {
        if (role != NodeRole.FOLLOWER) {
            throw new IllegalStateException("Only followers " + action);
        }
    }

    public record Settings(
            String serviceName,
            Duration serviceTimeout,
            Duration readyTimeout,
            Duration completeGrace,
            Duration pollInitial,
            Duration pollMax
    ) {
        public static Settings defaults(String serviceName) {
            return new Settings(
                    serviceName,
                    DEFAULT_SERVICE_TIMEOUT,
                    DEFAULT_READY_TIMEOUT,
                    DEFAULT_COMPLETE_GRACE,
                    StorageCoordinator.DEFAULT_POLL_INITIAL,
                    StorageCoordinator.DEFAULT_POLL_MAX
            );
        }
    }
}
