package io.artifactmesh.upgrade;

/**
 * What a single coordination step did, for status output.
 */
public record StepOutcome(String action, UpgradePhase observedPhase, String targetVersion, String detail) {
}
