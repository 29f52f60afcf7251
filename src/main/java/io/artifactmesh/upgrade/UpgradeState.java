package io.artifactmesh.upgrade;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Upgrade coordination state as stored in the relation's application data. Rebuilt on every read.
 */
public record UpgradeState(
        UpgradePhase phase,
        String targetVersion,
        String initiatedBy,
        Instant timestamp,
        int readyCount,
        int expectedCount
) {
    public UpgradeState {
        phase = phase == null ? UpgradePhase.IDLE : phase;
        expectedCount = Math.max(0, expectedCount);
        readyCount = Math.min(Math.max(0, readyCount), expectedCount);
    }

    public static UpgradeState idle() {
        return new UpgradeState(UpgradePhase.IDLE, null, null, null, 0, 0);
    }

    public UpgradeState withPhase(UpgradePhase next, Instant at) {
        return new UpgradeState(next, targetVersion, initiatedBy, at, readyCount, expectedCount);
    }

    public boolean inProgress() {
        return phase != UpgradePhase.IDLE;
    }

    public Map<String, String> toRelationData() {
        Map<String, String> out = new LinkedHashMap<>();
        out.put(RelationKeys.UPGRADE_STATE, phase.wireValue());
        out.put(RelationKeys.TARGET_VERSION, targetVersion == null ? "" : targetVersion);
        out.put(RelationKeys.INITIATED_BY, initiatedBy == null ? "" : initiatedBy);
        out.put(RelationKeys.TIMESTAMP, timestamp == null ? "" : timestamp.toString());
        out.put(RelationKeys.WORKER_READY_COUNT, Integer.toString(readyCount));
        out.put(RelationKeys.EXPECTED_WORKER_COUNT, Integer.toString(expectedCount));
        return out;
    }

    public static UpgradeState fromRelationData(Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            return idle();
        }
        return new UpgradeState(
                UpgradePhase.fromWire(data.get(RelationKeys.UPGRADE_STATE)),
                blankToNull(data.get(RelationKeys.TARGET_VERSION)),
                blankToNull(data.get(RelationKeys.INITIATED_BY)),
                parseInstant(data.get(RelationKeys.TIMESTAMP)),
                parseInt(data.get(RelationKeys.WORKER_READY_COUNT)),
                parseInt(data.get(RelationKeys.EXPECTED_WORKER_COUNT))
        );
    }

    static Instant parseInstant(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalStateException("Malformed timestamp in relation data: " + raw, e);
        }
    }

    private static int parseInt(String raw) {
        if (raw == null || raw.isBlank()) {
            return 0;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Malformed counter in relation data: " + raw, e);
        }
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }
}
