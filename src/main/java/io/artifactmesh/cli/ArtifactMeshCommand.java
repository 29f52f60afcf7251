package io.artifactmesh.cli;

import io.artifactmesh.config.ArtifactMeshConfig;
import io.artifactmesh.config.CoordinationSettings;
import io.artifactmesh.model.CoordinationException;
import io.artifactmesh.observability.AuditLogger;
import io.artifactmesh.runtime.ArtifactMeshRuntime;
import io.artifactmesh.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "artifactmesh",
        mixinStandardHelpOptions = true,
        description = "Shared-volume artifact coordination for one node",
        subcommands = {
                ArtifactMeshCommand.InitCommand.class,
                ArtifactMeshCommand.EnsureArtifactsCommand.class,
                ArtifactMeshCommand.UpgradeCommand.class,
                ArtifactMeshCommand.FollowCommand.class,
                ArtifactMeshCommand.UpgradeStateCommand.class,
                ArtifactMeshCommand.StatusCommand.class,
                ArtifactMeshCommand.StorageStatsCommand.class,
                ArtifactMeshCommand.WorkerStateCommand.class,
                ArtifactMeshCommand.AuditVerifyCommand.class
        }
)
public final class ArtifactMeshCommand implements Runnable {
    static final int EXIT_FATAL = 1;
    static final int EXIT_RECOVERABLE = 2;

    @Option(names = {"--root"}, description = "Node-local state directory", defaultValue = ArtifactMeshConfig.DEFAULT_ROOT)
    String root;

    @Option(names = {"--node"}, description = "Node id (defaults to settings, then host name)")
    String node;

    @Option(names = {"--role"}, description = "Node role: primary|follower")
    String role;

    @Option(names = {"--shared-root"}, description = "Shared volume mount point")
    String sharedRoot;

    @Option(names = {"--target-version"}, description = "Target artifact version")
    String version;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | ensure-artifacts | upgrade | follow | upgrade-state | status | storage-stats | worker-state | audit-verify");
    }

    ArtifactMeshRuntime runtime() {
        ArtifactMeshConfig config = ArtifactMeshConfig.fromRoot(root);
        CoordinationSettings settings = CoordinationSettings.load(config.settingsFile())
                .withOverrides(node, role, sharedRoot, version);
        return new ArtifactMeshRuntime(config, settings);
    }

    static int failure(CoordinationException e) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("error", e.getClass().getSimpleName());
        out.put("message", e.getMessage());
        out.put("fatal", e.fatal());
        System.out.println(Jsons.toJson(out));
        return e.fatal() ? EXIT_FATAL : EXIT_RECOVERABLE;
    }

    @Command(name = "init", description = "Open the shared volume, create local state and join the relation")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().init()));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "ensure-artifacts", description = "Download (primary) or wait for (follower) the target version")
    static final class EnsureArtifactsCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            try {
                ArtifactMeshRuntime runtime = parent.runtime();
                runtime.init();
                System.out.println(Jsons.toJson(runtime.ensureArtifacts()));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "upgrade", description = "Run one primary coordination step")
    static final class UpgradeCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Option(names = {"--retry"}, description = "Retry a blocked download/restart")
        boolean retry;

        @Override
        public Integer call() {
            try {
                ArtifactMeshRuntime runtime = parent.runtime();
                runtime.init();
                System.out.println(Jsons.toJson(runtime.upgrade(retry)));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "follow", description = "Run one follower coordination step")
    static final class FollowCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            try {
                ArtifactMeshRuntime runtime = parent.runtime();
                runtime.init();
                System.out.println(Jsons.toJson(runtime.follow()));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "upgrade-state", description = "Show upgrade state and follower acknowledgements")
    static final class UpgradeStateCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            ArtifactMeshRuntime runtime = parent.runtime();
            runtime.init();
            System.out.println(Jsons.toJson(runtime.upgradeState()));
            return 0;
        }
    }

    @Command(name = "status", description = "Show node status, installed version and lock state")
    static final class StatusCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().status()));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "storage-stats", description = "Show shared volume usage")
    static final class StorageStatsCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().stats()));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "worker-state", description = "Show the state file of a worker directory")
    static final class WorkerStateCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Option(names = {"--owner"}, description = "Owner node id (defaults to this node)")
        String owner;

        @Override
        public Integer call() {
            try {
                System.out.println(Jsons.toJson(parent.runtime().workerState(owner)));
                return 0;
            } catch (CoordinationException e) {
                return failure(e);
            }
        }
    }

    @Command(name = "audit-verify", description = "Verify the hash chain of the local audit log")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        ArtifactMeshCommand parent;

        @Override
        public Integer call() {
            ArtifactMeshConfig config = ArtifactMeshConfig.fromRoot(parent.root);
            CoordinationSettings settings = CoordinationSettings.load(config.settingsFile()).withOverrides(parent.node, null, null, null);
            AuditLogger.IntegrityOutcome outcome = new AuditLogger(config.auditFile(), settings.nodeId()).verify();
            System.out.println(Jsons.toJson(outcome));
            return outcome.ok() ? 0 : EXIT_FATAL;
        }
    }
}
