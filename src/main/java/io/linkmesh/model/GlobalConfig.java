package io.linkmesh.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record GlobalConfig(
        String namespace,
        boolean cniEnabled,
        String version,
        IdentityContext identityContext,
        AutoInjectContext autoInjectContext,
        boolean omitWebhookSideEffects,
        String clusterDomain
) {
    public GlobalConfig {
        namespace = namespace == null ? "" : namespace;
        version = version == null ? "" : version;
        clusterDomain = clusterDomain == null || clusterDomain.isBlank() ? "cluster.local" : clusterDomain;
    }

    public GlobalConfig withIdentityContext(IdentityContext value) {
        return new GlobalConfig(namespace, cniEnabled, version, value, autoInjectContext, omitWebhookSideEffects, clusterDomain);
    }

    public GlobalConfig withAutoInjectContext(AutoInjectContext value) {
        return new GlobalConfig(namespace, cniEnabled, version, identityContext, value, omitWebhookSideEffects, clusterDomain);
    }

    public GlobalConfig withOverrides(String newNamespace, String newVersion, boolean newOmitWebhookSideEffects) {
        return new GlobalConfig(
                newNamespace,
                cniEnabled,
                newVersion,
                identityContext,
                autoInjectContext,
                newOmitWebhookSideEffects,
                clusterDomain
        );
    }
}
