package io.linkmesh.config;

import java.util.Locale;

/**
 * Settings for one CLI invocation. Built fresh by the command and passed to every stage;
 * nothing reads process-wide defaults.
 */
public final class LinkMeshConfig {
    public static final String DEFAULT_NAMESPACE = "linkmesh";
    public static final String CONFIG_MAP_NAME = "linkmesh-config";
    public static final String CONFIG_GLOBAL_KEY = "global";
    public static final String CONFIG_PROXY_KEY = "proxy";
    public static final String CONFIG_INSTALL_KEY = "install";
    public static final String ISSUER_SECRET_NAME = "linkmesh-identity-issuer";
    public static final String ISSUER_KEY_NAME = "key.pem";
    public static final String ISSUER_CRT_NAME = "crt.pem";
    public static final String ISSUER_EXPIRY_ANNOTATION = "linkmesh.io/identity-issuer-expiry";
    public static final String IDENTITY_DEPLOYMENT_NAME = "linkmesh-identity";
    public static final String UPGRADE_NEXT_STEPS_URL = "https://linkmesh.io/upgrade/#nextsteps";
    public static final String UPGRADE_TROUBLESHOOTING_URL = "https://linkmesh.io/upgrade/#troubleshooting";

    private final String namespace;
    private final String toolVersion;

    public LinkMeshConfig(String namespace, String toolVersion) {
        this.namespace = sanitizeNamespace(namespace);
        this.toolVersion = toolVersion == null || toolVersion.isBlank() ? ToolVersion.UNKNOWN : toolVersion.trim();
    }

    public static LinkMeshConfig defaults() {
        return new LinkMeshConfig(DEFAULT_NAMESPACE, ToolVersion.current());
    }

    public static LinkMeshConfig forNamespace(String namespace) {
        return new LinkMeshConfig(namespace, ToolVersion.current());
    }

    private static String sanitizeNamespace(String raw) {
        String normalized = raw == null || raw.isBlank() ? DEFAULT_NAMESPACE : raw.trim().toLowerCase(Locale.ROOT);
        for (int i = 0; i < normalized.length(); i++) {
            char ch = normalized.charAt(i);
            boolean ok = (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9') || ch == '-';
            if (!ok) {
                throw new IllegalArgumentException("Invalid control plane namespace: " + raw);
            }
        }
        return normalized;
    }

    public String namespace() {
        return namespace;
    }

    public String toolVersion() {
        return toolVersion;
    }

    public String configMapName() {
        return CONFIG_MAP_NAME;
    }

    public String issuerSecretName() {
        return ISSUER_SECRET_NAME;
    }
}
