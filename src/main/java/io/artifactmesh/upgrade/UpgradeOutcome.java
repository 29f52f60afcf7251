package io.artifactmesh.upgrade;

import io.artifactmesh.storage.StorageCoordinator;

public record UpgradeOutcome(
        String targetVersion,
        UpgradePhase phase,
        ReadinessResult readiness,
        StorageCoordinator.StorageOutcome storage
) {
}
