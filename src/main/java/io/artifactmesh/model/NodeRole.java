package io.artifactmesh.model;

public enum NodeRole {
    PRIMARY("primary"),
    FOLLOWER("follower");

    private final String label;

    NodeRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static NodeRole fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return FOLLOWER;
        }
        for (NodeRole value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim()) || value.label.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        if ("leader".equalsIgnoreCase(raw.trim()) || "web".equalsIgnoreCase(raw.trim())) {
            return PRIMARY;
        }
        if ("worker".equalsIgnoreCase(raw.trim())) {
            return FOLLOWER;
        }
        throw new IllegalArgumentException("Unknown role: " + raw);
    }
}
