package io.artifactmesh.upgrade;

public enum UpgradePhase {
    IDLE("idle"),
    PREPARE("prepare"),
    DOWNLOADING("downloading"),
    COMPLETE("complete");

    private final String wireValue;

    UpgradePhase(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * One step forward per cycle, plus the reset from COMPLETE back to IDLE.
     */
    public boolean canAdvanceTo(UpgradePhase next) {
        if (this == COMPLETE) {
            return next == IDLE;
        }
        return next.ordinal() == ordinal() + 1;
    }

    public static UpgradePhase fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return IDLE;
        }
        for (UpgradePhase value : values()) {
            if (value.wireValue.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalStateException("Unknown upgrade phase in relation data: " + raw);
    }
}
