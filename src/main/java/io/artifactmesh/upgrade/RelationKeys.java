package io.artifactmesh.upgrade;

public final class RelationKeys {
    public static final String UPGRADE_STATE = "upgrade-state";
    public static final String TARGET_VERSION = "target-version";
    public static final String INITIATED_BY = "initiated-by";
    public static final String TIMESTAMP = "timestamp";
    public static final String WORKER_READY_COUNT = "worker-ready-count";
    public static final String EXPECTED_WORKER_COUNT = "expected-worker-count";
    public static final String UPGRADE_READY = "upgrade-ready";

    private RelationKeys() {
    }
}
