package io.linkmesh.cluster;

import io.fabric8.kubernetes.api.model.ConfigMap;
import io.fabric8.kubernetes.api.model.Secret;
import io.fabric8.kubernetes.client.Config;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientBuilder;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.linkmesh.upgrade.ErrorKind;
import io.linkmesh.upgrade.UpgradeException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Reads control plane objects from a live cluster through the Kubernetes API server.
 */
public final class KubernetesClusterStore implements ClusterStore {
    private final KubernetesClient client;

    public KubernetesClusterStore(KubernetesClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    /**
     * @param kubeconfigPath explicit kubeconfig file, or blank for the usual discovery
     *                       ({@code KUBECONFIG}, {@code ~/.kube/config}, in-cluster)
     * @param context        kubeconfig context name, or blank for the current context
     */
    public static KubernetesClusterStore connect(String kubeconfigPath, String context) throws UpgradeException {
        String ctx = context == null || context.isBlank() ? null : context.trim();
        Config config;
        try {
            if (kubeconfigPath == null || kubeconfigPath.isBlank()) {
                config = Config.autoConfigure(ctx);
            } else {
                Path path = Path.of(kubeconfigPath);
                String contents = Files.readString(path, StandardCharsets.UTF_8);
                config = Config.fromKubeconfig(ctx, contents, path.toAbsolutePath().toString());
            }
        } catch (IOException | RuntimeException e) {
            throw new UpgradeException(ErrorKind.FETCH, "Failed to get kubernetes config: " + e.getMessage(), e);
        }
        try {
            return new KubernetesClusterStore(new KubernetesClientBuilder().withConfig(config).build());
        } catch (KubernetesClientException e) {
            throw new UpgradeException(ErrorKind.FETCH, "Failed to create a kubernetes client: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, String> readConfigMap(String namespace, String name) throws UpgradeException {
        ConfigMap configMap;
        try {
            configMap = client.configMaps().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new UpgradeException(ErrorKind.FETCH, describeFailure("configmap", namespace, name, e), e);
        }
        if (configMap == null) {
            throw new UpgradeException(ErrorKind.FETCH, "configmaps \"" + name + "\" not found in namespace " + namespace);
        }
        return configMap.getData() == null ? Map.of() : Map.copyOf(configMap.getData());
    }

    @Override
    public Map<String, byte[]> readSecret(String namespace, String name) throws UpgradeException {
        Secret secret;
        try {
            secret = client.secrets().inNamespace(namespace).withName(name).get();
        } catch (KubernetesClientException e) {
            throw new UpgradeException(ErrorKind.FETCH, describeFailure("secret", namespace, name, e), e);
        }
        if (secret == null) {
            throw new UpgradeException(ErrorKind.FETCH, "secrets \"" + name + "\" not found in namespace " + namespace);
        }
        Map<String, byte[]> out = new LinkedHashMap<>();
        if (secret.getData() != null) {
            for (Map.Entry<String, String> entry : secret.getData().entrySet()) {
                try {
                    out.put(entry.getKey(), Base64.getDecoder().decode(entry.getValue() == null ? "" : entry.getValue()));
                } catch (IllegalArgumentException e) {
                    throw new UpgradeException(ErrorKind.FETCH,
                            "secret " + namespace + "/" + name + " field " + entry.getKey() + " is not base64", e);
                }
            }
        }
        if (secret.getStringData() != null) {
            for (Map.Entry<String, String> entry : secret.getStringData().entrySet()) {
                String value = entry.getValue() == null ? "" : entry.getValue();
                out.put(entry.getKey(), value.getBytes(StandardCharsets.UTF_8));
            }
        }
        return out;
    }

    @Override
    public String describe() {
        return "kubernetes " + client.getMasterUrl();
    }

    @Override
    public void close() {
        client.close();
    }

    private static String describeFailure(String kind, String namespace, String name, KubernetesClientException e) {
        int code = e.getCode();
        String reason = switch (code) {
            case 401 -> "unauthorized";
            case 403 -> "forbidden";
            case 404 -> "not found";
            default -> e.getMessage();
        };
        return "failed to read " + kind + " " + namespace + "/" + name + ": " + reason;
    }
}
