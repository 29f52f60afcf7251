/**
 * ArtifactMesh source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.artifactmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.artifactmesh.cli.ArtifactMeshCommand} maps commands to runtime APIs.</li>
 *   <li>{@code io.artifactmesh.runtime.ArtifactMeshRuntime} wires one node and records its status.</li>
 *   <li>{@code io.artifactmesh.storage.StorageCoordinator} installs or waits for the shared artifact set.</li>
 *   <li>{@code io.artifactmesh.upgrade.UpgradeCoordinator} drives the rolling upgrade phases.</li>
 * </ul>
 */
package io.artifactmesh;
