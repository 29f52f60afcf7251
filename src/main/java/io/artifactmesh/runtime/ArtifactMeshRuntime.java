package io.artifactmesh.runtime;

import io.artifactmesh.config.ArtifactMeshConfig;
import io.artifactmesh.config.CoordinationSettings;
import io.artifactmesh.fetch.ArtifactFetchException;
import io.artifactmesh.fetch.ArtifactFetcher;
import io.artifactmesh.fetch.CommandArtifactFetcher;
import io.artifactmesh.model.CoordinationException;
import io.artifactmesh.model.NodeRole;
import io.artifactmesh.model.NodeStatus;
import io.artifactmesh.observability.AuditLogger;
import io.artifactmesh.relation.RelationDataAccessor;
import io.artifactmesh.relation.RelationDatabase;
import io.artifactmesh.relation.SqliteRelationDataAccessor;
import io.artifactmesh.service.CommandServiceManager;
import io.artifactmesh.service.ServiceManager;
import io.artifactmesh.storage.LockCoordinator;
import io.artifactmesh.storage.SharedVolume;
import io.artifactmesh.storage.StorageCoordinator;
import io.artifactmesh.storage.WorkerDirectory;
import io.artifactmesh.upgrade.StepOutcome;
import io.artifactmesh.upgrade.UpgradeCoordinator;
import io.artifactmesh.upgrade.UpgradeOutcome;
import io.artifactmesh.upgrade.UpgradePhase;
import io.artifactmesh.upgrade.UpgradeState;
import io.artifactmesh.util.Sleeper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Wires one node: shared volume, install lock, storage and upgrade coordinators, relation channel
 * and audit log. Every lifecycle entry point records the resulting {@link NodeStatus} in the node's
 * worker directory so a blocked node stays blocked across restarts.
 */
public final class ArtifactMeshRuntime {
    private static final String LAST_ACTION_KEY = "last_action";
    private static final String UPDATED_AT_KEY = "updated_at";

    private final ArtifactMeshConfig config;
    private final CoordinationSettings settings;
    private final ArtifactFetcher fetcher;
    private final ServiceManager serviceManager;
    private final Clock clock;
    private final Sleeper sleeper;
    private final AuditLogger auditLogger;
    private RelationDataAccessor relation;
    private SharedVolume volume;
    private StorageCoordinator storageCoordinator;
    private UpgradeCoordinator upgradeCoordinator;

    public ArtifactMeshRuntime(ArtifactMeshConfig config, CoordinationSettings settings) {
        this(config, settings, null, null, null, Clock.systemUTC(), Sleeper.SYSTEM);
    }

    /**
     * Null collaborators are built from the settings: a command fetcher, a command service manager
     * and the SQLite relation channel.
     */
    public ArtifactMeshRuntime(
            ArtifactMeshConfig config,
            CoordinationSettings settings,
            ArtifactFetcher fetcher,
            ServiceManager serviceManager,
            RelationDataAccessor relation,
            Clock clock,
            Sleeper sleeper
    ) {
        this.config = config;
        this.settings = settings;
        this.fetcher = fetcher == null ? defaultFetcher(settings) : fetcher;
        this.serviceManager = serviceManager == null ? new CommandServiceManager(settings.serviceCommand()) : serviceManager;
        this.relation = relation;
        this.clock = clock;
        this.sleeper = sleeper;
        this.auditLogger = new AuditLogger(config.auditFile(), settings.nodeId(), clock);
    }

    public ArtifactMeshConfig config() {
        return config;
    }

    public CoordinationSettings settings() {
        return settings;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public InitOutcome init() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize local state under " + config.rootDir(), e);
        }
        SharedVolume opened = volume();
        RelationDataAccessor channel = relation();
        WorkerDirectory.forOwner(opened, settings.nodeId());
        auditLogger.log("runtime.init", "node/" + settings.nodeId(), "ok", Map.of(
                "role", settings.role().label(),
                "shared_root", opened.rootPath().toString(),
                "shared", opened.isShared()
        ));
        return new InitOutcome(
                settings.nodeId(),
                settings.role().label(),
                config.rootDir().toString(),
                opened.rootPath().toString(),
                opened.isShared(),
                opened.filesystemIdentity(),
                channel.allUnits().size()
        );
    }

    public StorageCoordinator.StorageOutcome ensureArtifacts() {
        String target = requireTargetVersion();
        return guarded("ensure-artifacts", () -> {
            StorageCoordinator.StorageOutcome outcome = storage().ensureArtifacts(target, settings.role());
            recordStatus(NodeStatus.active("artifacts " + target + " ready"), "ensure-artifacts");
            return outcome;
        });
    }

    /**
     * One primary tick. A node that recorded a blocked upgrade does not resume it until
     * {@code retry} is requested.
     */
    public StepOutcome upgrade(boolean retry) {
        requireRole(NodeRole.PRIMARY, "upgrade");
        return guarded("upgrade", () -> {
            UpgradeCoordinator coordinator = upgrades();
            UpgradeState state = coordinator.currentState();
            NodeStatus previous = currentStatus();
            if (retry) {
                UpgradeOutcome outcome = coordinator.retryBlockedUpgrade();
                recordStatus(NodeStatus.active("upgraded to " + outcome.targetVersion()), "upgrade-retry");
                return new StepOutcome("retried", outcome.phase(), outcome.targetVersion(), "download and restart succeeded");
            }
            if (previous != null && previous.state() == NodeStatus.State.BLOCKED
                    && state.phase() == UpgradePhase.DOWNLOADING) {
                return new StepOutcome("blocked", state.phase(), state.targetVersion(), previous.message());
            }
            StepOutcome step = coordinator.primaryStep(settings.targetVersion());
            recordStatus(NodeStatus.active(step.detail()), "upgrade:" + step.action());
            return step;
        });
    }

    public StepOutcome follow() {
        requireRole(NodeRole.FOLLOWER, "follow");
        return guarded("follow", () -> {
            StepOutcome step = upgrades().followerStep();
            NodeStatus status = switch (step.action()) {
                case "acknowledged", "waiting" -> NodeStatus.maintenance("upgrade to " + step.targetVersion() + " in progress");
                case "stop_failed" -> NodeStatus.waiting(step.detail());
                default -> NodeStatus.active(step.detail());
            };
            recordStatus(status, "follow:" + step.action());
            return step;
        });
    }

    public Map<String, Object> upgradeState() {
        return upgrades().describe();
    }

    public StatusView status() {
        SharedVolume opened = volume();
        NodeStatus status = currentStatus();
        return new StatusView(
                settings.nodeId(),
                settings.role().label(),
                opened.rootPath().toString(),
                opened.isShared(),
                opened.isWritable(),
                opened.readInstalledVersion(),
                settings.targetVersion(),
                status == null ? null : status.state().name(),
                status == null ? null : status.message(),
                lockCoordinator().status(),
                upgrades().currentState().phase().wireValue()
        );
    }

    public SharedVolume.StorageStats stats() {
        return volume().stats();
    }

    public Map<String, String> workerState(String ownerId) {
        String owner = ownerId == null || ownerId.isBlank() ? settings.nodeId() : ownerId.trim();
        if (!WorkerDirectory.exists(volume(), owner)) {
            throw new IllegalArgumentException("No worker directory for " + owner);
        }
        return WorkerDirectory.inspect(volume(), owner).readState();
    }

    public NodeStatus currentStatus() {
        if (!WorkerDirectory.exists(volume(), settings.nodeId())) {
            return null;
        }
        return NodeStatus.fromStateEntries(WorkerDirectory.inspect(volume(), settings.nodeId()).readState());
    }

    private <T> T guarded(String action, Supplier<T> body) {
        try {
            return body.get();
        } catch (CoordinationException e) {
            NodeStatus status = NodeStatus.fromFailure(e);
            auditLogger.log("runtime." + action, "node/" + settings.nodeId(), status.state().name().toLowerCase(), Map.of(
                    "error", e.getClass().getSimpleName(),
                    "message", String.valueOf(e.getMessage()),
                    "fatal", e.fatal()
            ));
            recordStatus(status, action);
            throw e;
        }
    }

    private void recordStatus(NodeStatus status, String action) {
        Map<String, String> changes = new LinkedHashMap<>(status.toStateEntries());
        changes.put(LAST_ACTION_KEY, action);
        changes.put(UPDATED_AT_KEY, clock.instant().toString());
        WorkerDirectory.forOwner(volume(), settings.nodeId()).updateState(changes);
    }

    private String requireTargetVersion() {
        String target = settings.targetVersion();
        if (target == null || target.isBlank()) {
            throw new IllegalArgumentException("No target version configured; set targetVersion or pass --target-version");
        }
        return target;
    }

    private void requireRole(NodeRole expected, String command) {
        if (settings.role() != expected) {
            throw new IllegalStateException(command + " must run on a " + expected.label() + " node, "
                    + settings.nodeId() + " is " + settings.role().label());
        }
    }

    private synchronized SharedVolume volume() {
        if (volume == null) {
            volume = SharedVolume.open(settings.sharedRootPath(), settings.sharedMode(), settings.expectedFilesystemId());
        }
        return volume;
    }

    private LockCoordinator lockCoordinator() {
        return new LockCoordinator(volume(), settings.staleAfter(), clock);
    }

    private synchronized StorageCoordinator storage() {
        if (storageCoordinator == null) {
            storageCoordinator = new StorageCoordinator(
                    volume(),
                    lockCoordinator(),
                    fetcher,
                    auditLogger,
                    settings.nodeId(),
                    settings.storageSettings(),
                    clock,
                    sleeper
            );
        }
        return storageCoordinator;
    }

    private synchronized UpgradeCoordinator upgrades() {
        if (upgradeCoordinator == null) {
            upgradeCoordinator = new UpgradeCoordinator(
                    relation(),
                    storage(),
                    serviceManager,
                    auditLogger,
                    settings.role(),
                    settings.upgradeSettings(),
                    clock,
                    sleeper
            );
        }
        return upgradeCoordinator;
    }

    private synchronized RelationDataAccessor relation() {
        if (relation == null) {
            Path dbFile = settings.relationDb() == null ? config.relationDbFile() : Path.of(settings.relationDb());
            RelationDatabase database = new RelationDatabase(dbFile);
            database.init();
            SqliteRelationDataAccessor sqlite = new SqliteRelationDataAccessor(
                    database, settings.nodeId(), settings.role() == NodeRole.PRIMARY, clock);
            sqlite.join();
            relation = sqlite;
        }
        return relation;
    }

    private static ArtifactFetcher defaultFetcher(CoordinationSettings settings) {
        if (settings.fetchCommand().isEmpty()) {
            return (version, stagingDir) -> {
                throw new ArtifactFetchException("No fetch command configured; cannot download " + version);
            };
        }
        return new CommandArtifactFetcher(settings.fetchCommand(), settings.fetchTimeout());
    }

    public record InitOutcome(
            String nodeId,
            String role,
            String localRoot,
            String sharedRoot,
            boolean sharedStorage,
            String filesystemId,
            int relationMembers
    ) {
    }

    public record StatusView(
            String nodeId,
            String role,
            String sharedRoot,
            boolean sharedStorage,
            boolean writable,
            String installedVersion,
            String targetVersion,
            String status,
            String statusMessage,
            LockCoordinator.LockStatus lock,
            String upgradePhase
    ) {
    }
}
