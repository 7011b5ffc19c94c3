package io.linkmesh.upgrade;

/**
 * Options that shape a run but are never recorded in the install record.
 *
 * @param ignoreCluster render without reading cluster state; only meaningful for a fresh
 *                      install and must never be set for an upgrade
 */
public record UpgradeOptions(boolean ignoreCluster) {
    public static UpgradeOptions defaults() {
        return new UpgradeOptions(false);
    }
}
