package io.linkmesh.model;

import java.util.Objects;

/**
 * The three sections of the control plane config map, as read from the cluster.
 */
public record ControlPlaneConfigs(
        GlobalConfig global,
        ProxyConfig proxy,
        InstallRecord install
) {
    public ControlPlaneConfigs {
        Objects.requireNonNull(global, "global");
        Objects.requireNonNull(proxy, "proxy");
        install = install == null ? InstallRecord.empty() : install;
    }

    public ControlPlaneConfigs withGlobal(GlobalConfig value) {
        return new ControlPlaneConfigs(value, proxy, install);
    }

    public ControlPlaneConfigs withProxy(ProxyConfig value) {
        return new ControlPlaneConfigs(global, value, install);
    }

    public ControlPlaneConfigs withInstall(InstallRecord value) {
        return new ControlPlaneConfigs(global, proxy, value);
    }
}
