package io.artifactmesh.upgrade;

import java.util.List;

/**
 * Outcome of the PREPARE wait. A timeout is a policy result, not an error: the primary proceeds
 * and the stragglers are recorded.
 */
public record ReadinessResult(int readyCount, int expectedCount, List<String> stragglers, boolean timedOut, long waitedMs) {
    public ReadinessResult {
        stragglers = stragglers == null ? List.of() : List.copyOf(stragglers);
    }

    static ReadinessResult resumed(UpgradeState state) {
        return new ReadinessResult(state.readyCount(), state.expectedCount(), List.of(), false, 0L);
    }
}
