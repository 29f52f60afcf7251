package io.artifactmesh.model;

import java.util.Map;

public record NodeStatus(State state, String message) {
    public enum State {
        ACTIVE,
        WAITING,
        MAINTENANCE,
        BLOCKED
    }

    public static NodeStatus active(String message) {
        return new NodeStatus(State.ACTIVE, message);
    }

    public static NodeStatus waiting(String message) {
        return new NodeStatus(State.WAITING, message);
    }

    public static NodeStatus maintenance(String message) {
        return new NodeStatus(State.MAINTENANCE, message);
    }

    public static NodeStatus blocked(String message) {
        return new NodeStatus(State.BLOCKED, message);
    }

    public static NodeStatus fromFailure(CoordinationException e) {
        return e.fatal() ? blocked(e.getMessage()) : waiting(e.getMessage());
    }

    public Map<String, String> toStateEntries() {
        return Map.of("status", state.name(), "status_message", message == null ? "" : message);
    }

    public static NodeStatus fromStateEntries(Map<String, String> state) {
        String raw = state.get("status");
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return new NodeStatus(State.valueOf(raw), state.getOrDefault("status_message", ""));
    }
}
