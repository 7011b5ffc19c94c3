/**
 * LinkMesh CLI source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.linkmesh.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.linkmesh.cli.LinkMeshCommand} maps commands to the upgrade pipeline.</li>
 *   <li>{@code io.linkmesh.upgrade.UpgradeReconciler} merges stored state with the current flags and
 *   resolves the control plane identity.</li>
 *   <li>{@code io.linkmesh.cluster.ClusterStore} is the only way cluster state is read.</li>
 * </ul>
 */
package io.linkmesh;
