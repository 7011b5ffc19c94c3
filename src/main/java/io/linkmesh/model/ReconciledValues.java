package io.linkmesh.model;

import java.util.List;
import java.util.Objects;

/**
 * Everything the renderer needs, assembled once per upgrade run. Immutable.
 */
public record ReconciledValues(
        String namespace,
        InstallRecord install,
        GlobalConfig global,
        ProxyConfig proxy,
        ResolvedIdentity identity,
        int controllerReplicas,
        List<String> warnings
) {
    public ReconciledValues {
        Objects.requireNonNull(namespace, "namespace");
        Objects.requireNonNull(install, "install");
        Objects.requireNonNull(global, "global");
        Objects.requireNonNull(proxy, "proxy");
        Objects.requireNonNull(identity, "identity");
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
