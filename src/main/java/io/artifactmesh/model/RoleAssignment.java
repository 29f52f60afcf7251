package io.artifactmesh.model;

/**
 * Tells a node whether it is the primary. Provided by the surrounding orchestration, e.g. leader
 * election; the coordination core only consumes it.
 */
@FunctionalInterface
public interface RoleAssignment {
    NodeRole roleOf(String nodeId);

    static RoleAssignment fixed(NodeRole role) {
        return nodeId -> role;
    }
}
