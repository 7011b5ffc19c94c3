package io.linkmesh.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.model.ReconciledValues;
import io.linkmesh.model.ResolvedIdentity;
import io.linkmesh.upgrade.ErrorKind;
import io.linkmesh.upgrade.UpgradeException;
import io.linkmesh.util.Durations;
import io.linkmesh.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Objects;

/**
 * Renders the objects an upgrade owns: the control plane config map, the identity issuer
 * secret, and the identity deployment. The config map and secret use the same layout the
 * stores read, so the output can be fed back through {@code --from-manifests}.
 */
public final class YamlManifestRenderer implements ManifestRenderer {
    private static final String COMPONENT_LABEL = "linkmesh.io/control-plane-component";
    private static final String NAMESPACE_LABEL = "linkmesh.io/control-plane-ns";
    private static final String CREATED_BY_ANNOTATION = "linkmesh.io/created-by";
    private static final String CONTROLLER_IMAGE = "ghcr.io/linkmesh/controller";

    private final String toolVersion;

    public YamlManifestRenderer(String toolVersion) {
        this.toolVersion = Objects.requireNonNull(toolVersion, "toolVersion");
    }

    @Override
    public String render(ReconciledValues values) throws UpgradeException {
        try {
            StringBuilder out = new StringBuilder();
            for (ObjectNode doc : List.of(configMap(values), issuerSecret(values), identityDeployment(values))) {
                out.append("---\n");
                out.append(Jsons.yamlMapper().writeValueAsString(doc));
            }
            return out.toString();
        } catch (JsonProcessingException | RuntimeException e) {
            throw new UpgradeException(ErrorKind.RENDER, "could not render upgrade configuration: " + e.getMessage(), e);
        }
    }

    private ObjectNode configMap(ReconciledValues values) {
        ObjectNode doc = object("v1", "ConfigMap", LinkMeshConfig.CONFIG_MAP_NAME, values.namespace(), "controller");
        ObjectNode data = doc.putObject("data");
        data.put(LinkMeshConfig.CONFIG_GLOBAL_KEY, Jsons.toCompactJson(values.global()));
        data.put(LinkMeshConfig.CONFIG_PROXY_KEY, Jsons.toCompactJson(values.proxy()));
        data.put(LinkMeshConfig.CONFIG_INSTALL_KEY, Jsons.toCompactJson(values.install()));
        return doc;
    }

    private ObjectNode issuerSecret(ReconciledValues values) {
        ResolvedIdentity identity = values.identity();
        ObjectNode doc = object("v1", "Secret", LinkMeshConfig.ISSUER_SECRET_NAME, values.namespace(), "identity");
        ((ObjectNode) doc.path("metadata").path("annotations"))
                .put(LinkMeshConfig.ISSUER_EXPIRY_ANNOTATION, identity.issuer().notAfter().toString());
        doc.put("type", "Opaque");
        ObjectNode data = doc.putObject("data");
        data.put(LinkMeshConfig.ISSUER_CRT_NAME, base64(identity.issuer().crtPem()));
        data.put(LinkMeshConfig.ISSUER_KEY_NAME, base64(identity.issuer().keyPem()));
        return doc;
    }

    private ObjectNode identityDeployment(ReconciledValues values) {
        ResolvedIdentity identity = values.identity();
        ObjectNode doc = object("apps/v1", "Deployment", LinkMeshConfig.IDENTITY_DEPLOYMENT_NAME, values.namespace(), "identity");
        ObjectNode spec = doc.putObject("spec");
        spec.put("replicas", identity.replicas());
        spec.putObject("selector").putObject("matchLabels").put(COMPONENT_LABEL, "identity");
        ObjectNode template = spec.putObject("template");
        template.putObject("metadata").putObject("labels").put(COMPONENT_LABEL, "identity");
        ObjectNode podSpec = template.putObject("spec");
        podSpec.put("serviceAccountName", "linkmesh-identity");
        ArrayNode containers = podSpec.putArray("containers");
        ObjectNode container = containers.addObject();
        container.put("name", "identity");
        container.put("image", CONTROLLER_IMAGE + ":" + values.global().version());
        container.put("imagePullPolicy", values.proxy().proxyImage() == null
                ? "IfNotPresent"
                : values.proxy().proxyImage().pullPolicy());
        ArrayNode args = container.putArray("args");
        args.add("identity");
        args.add("-trust-domain=" + identity.context().trustDomain());
        args.add("-issuance-lifetime=" + Durations.toProtoJson(identity.context().issuanceLifetime()));
        args.add("-clock-skew-allowance=" + Durations.toProtoJson(identity.context().clockSkewAllowance()));
        ObjectNode volumeMount = container.putArray("volumeMounts").addObject();
        volumeMount.put("name", "identity-issuer");
        volumeMount.put("mountPath", "/var/run/linkmesh/identity/issuer");
        ObjectNode volume = podSpec.putArray("volumes").addObject();
        volume.put("name", "identity-issuer");
        volume.putObject("secret").put("secretName", LinkMeshConfig.ISSUER_SECRET_NAME);
        return doc;
    }

    private ObjectNode object(String apiVersion, String kind, String name, String namespace, String component) {
        ObjectNode doc = Jsons.mapper().createObjectNode();
        doc.put("apiVersion", apiVersion);
        doc.put("kind", kind);
        ObjectNode metadata = doc.putObject("metadata");
        metadata.put("name", name);
        metadata.put("namespace", namespace);
        ObjectNode labels = metadata.putObject("labels");
        labels.put(COMPONENT_LABEL, component);
        labels.put(NAMESPACE_LABEL, namespace);
        metadata.putObject("annotations").put(CREATED_BY_ANNOTATION, "linkmesh/cli " + toolVersion);
        return doc;
    }

    private static String base64(String value) {
        return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
    }
}
