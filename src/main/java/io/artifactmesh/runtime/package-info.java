/**
 * Node wiring package.
 *
 * <p>{@link io.artifactmesh.runtime.ArtifactMeshRuntime} builds the volume, lock, storage and
 * upgrade coordinators from settings and persists the node status after every lifecycle step.
 */
package io.artifactmesh.runtime;
