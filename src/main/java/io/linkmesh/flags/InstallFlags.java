package io.linkmesh.flags;

import java.util.List;
import java.util.Map;

/**
 * The recordable flag schema shared by every command that persists its flags into the install
 * record.
 */
public final class InstallFlags {
    public static final String CONTROLLER_REPLICAS = "controller-replicas";
    public static final String HA = "ha";
    public static final String CONTROL_PLANE_VERSION = "control-plane-version";
    public static final String PROXY_VERSION = "proxy-version";
    public static final String PROXY_LOG_LEVEL = "proxy-log-level";
    public static final String PROXY_UID = "proxy-uid";
    public static final String IMAGE_PULL_POLICY = "image-pull-policy";
    public static final String PROXY_AUTO_INJECT = "proxy-auto-inject";
    public static final String OMIT_WEBHOOK_SIDE_EFFECTS = "omit-webhook-side-effects";
    public static final String IDENTITY_TRUST_DOMAIN = "identity-trust-domain";
    public static final String IDENTITY_ISSUANCE_LIFETIME = "identity-issuance-lifetime";
    public static final String IDENTITY_CLOCK_SKEW_ALLOWANCE = "identity-clock-skew-allowance";
    public static final String IDENTITY_ISSUER_CERTIFICATE_LIFETIME = "identity-issuer-certificate-lifetime";

    public static final int DEFAULT_CONTROLLER_REPLICAS = 1;
    public static final int DEFAULT_HA_CONTROLLER_REPLICAS = 3;
    public static final String DEFAULT_PROXY_LOG_LEVEL = "warn,linkmesh_proxy=info";
    public static final long DEFAULT_PROXY_UID = 2102L;
    public static final String DEFAULT_IMAGE_PULL_POLICY = "IfNotPresent";
    public static final String DEFAULT_TRUST_DOMAIN = "cluster.local";
    public static final String DEFAULT_ISSUANCE_LIFETIME = "24h";
    public static final String DEFAULT_CLOCK_SKEW_ALLOWANCE = "20s";
    public static final String DEFAULT_ISSUER_CERTIFICATE_LIFETIME = "8760h";

    private InstallFlags() {
    }

    public static List<FlagDefinition> definitions(String toolVersion) {
        return List.of(
                new FlagDefinition(CONTROLLER_REPLICAS, String.valueOf(DEFAULT_CONTROLLER_REPLICAS),
                        "Replicas of each control plane component"),
                new FlagDefinition(HA, "false",
                        "Enable HA deployment config for the control plane"),
                new FlagDefinition(CONTROL_PLANE_VERSION, toolVersion,
                        "Tag to be used for control plane container images"),
                new FlagDefinition(PROXY_VERSION, toolVersion,
                        "Tag to be used for the proxy container image"),
                new FlagDefinition(PROXY_LOG_LEVEL, DEFAULT_PROXY_LOG_LEVEL,
                        "Log level for the proxy"),
                new FlagDefinition(PROXY_UID, String.valueOf(DEFAULT_PROXY_UID),
                        "Run the proxy under this user ID"),
                new FlagDefinition(IMAGE_PULL_POLICY, DEFAULT_IMAGE_PULL_POLICY,
                        "Docker image pull policy"),
                new FlagDefinition(PROXY_AUTO_INJECT, "false",
                        "Enable proxy sidecar auto-injection via a webhook"),
                new FlagDefinition(OMIT_WEBHOOK_SIDE_EFFECTS, "false",
                        "Omit the sideEffects flag in the webhook manifests"),
                new FlagDefinition(IDENTITY_TRUST_DOMAIN, DEFAULT_TRUST_DOMAIN,
                        "Configures the name suffix used for identities"),
                new FlagDefinition(IDENTITY_ISSUANCE_LIFETIME, DEFAULT_ISSUANCE_LIFETIME,
                        "The amount of time for which the identity issuer should certify identity"),
                new FlagDefinition(IDENTITY_CLOCK_SKEW_ALLOWANCE, DEFAULT_CLOCK_SKEW_ALLOWANCE,
                        "The amount of time to allow for clock skew within a control plane"),
                new FlagDefinition(IDENTITY_ISSUER_CERTIFICATE_LIFETIME, DEFAULT_ISSUER_CERTIFICATE_LIFETIME,
                        "Validity of a newly generated issuer certificate")
        );
    }

    public static FlagSet flagSet(String toolVersion, Map<String, String> explicitValues) {
        return FlagSet.of(definitions(toolVersion), explicitValues);
    }
}
