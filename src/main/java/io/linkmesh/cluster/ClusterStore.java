package io.linkmesh.cluster;

import io.linkmesh.upgrade.UpgradeException;

import java.util.Map;

/**
 * Lowest-level read access to control plane objects. Implementations go straight to the
 * storage primitive (config maps and secrets), never through the control plane's own API,
 * so a broken control plane can still be upgraded.
 */
public interface ClusterStore extends AutoCloseable {

    /**
     * @return the config map's string data
     * @throws UpgradeException kind {@code FETCH} when the object is missing or unreadable
     */
    Map<String, String> readConfigMap(String namespace, String name) throws UpgradeException;

    /**
     * @return the secret's decoded byte fields
     * @throws UpgradeException kind {@code FETCH} when the object is missing or unreadable
     */
    Map<String, byte[]> readSecret(String namespace, String name) throws UpgradeException;

    /**
     * Where reads come from, for diagnostics.
     */
    String describe();

    @Override
    default void close() {
    }
}
