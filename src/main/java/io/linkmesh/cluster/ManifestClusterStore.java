package io.linkmesh.cluster;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import io.linkmesh.upgrade.ErrorKind;
import io.linkmesh.upgrade.UpgradeException;
import io.linkmesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * In-memory stand-in for a cluster, built from a previously rendered multi-document YAML
 * bundle. Only {@code ConfigMap} and {@code Secret} documents are kept; everything else in
 * the bundle is ignored. Reads behave like the live store: a missing object is a fetch error.
 */
public final class ManifestClusterStore implements ClusterStore {
    private static final String DEFAULT_OBJECT_NAMESPACE = "default";

    private final String source;
    private final Map<String, Map<String, String>> configMaps;
    private final Map<String, Map<String, byte[]>> secrets;

    private ManifestClusterStore(
            String source,
            Map<String, Map<String, String>> configMaps,
            Map<String, Map<String, byte[]>> secrets
    ) {
        this.source = source;
        this.configMaps = Collections.unmodifiableMap(configMaps);
        this.secrets = Collections.unmodifiableMap(secrets);
    }

    /**
     * @param location a file path, or {@code -} for standard input
     */
    public static ManifestClusterStore fromLocation(String location, InputStream stdin) throws UpgradeException {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("manifest location must not be blank");
        }
        String text;
        try {
            if ("-".equals(location.trim())) {
                text = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            } else {
                text = Files.readString(Path.of(location), StandardCharsets.UTF_8);
            }
        } catch (IOException | InvalidPathException e) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "Failed to read manifests from " + location + ": " + e.getMessage(), e);
        }
        return fromYaml(location, text);
    }

    public static ManifestClusterStore fromYaml(String source, String yaml) throws UpgradeException {
        Map<String, Map<String, String>> configMaps = new LinkedHashMap<>();
        Map<String, Map<String, byte[]>> secrets = new LinkedHashMap<>();
        try (MappingIterator<JsonNode> docs = Jsons.yamlMapper().readerFor(JsonNode.class).readValues(yaml)) {
            while (docs.hasNextValue()) {
                JsonNode doc = docs.nextValue();
                collect(doc, configMaps, secrets);
            }
        } catch (IOException | IllegalArgumentException e) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "Failed to parse Kubernetes objects from manifest " + source + ": " + e.getMessage(), e);
        }
        return new ManifestClusterStore(source, configMaps, secrets);
    }

    @Override
    public Map<String, String> readConfigMap(String namespace, String name) throws UpgradeException {
        Map<String, String> data = configMaps.get(key(namespace, name));
        if (data == null) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "configmaps \"" + name + "\" not found in namespace " + namespace + " (" + source + ")");
        }
        return data;
    }

    @Override
    public Map<String, byte[]> readSecret(String namespace, String name) throws UpgradeException {
        Map<String, byte[]> data = secrets.get(key(namespace, name));
        if (data == null) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "secrets \"" + name + "\" not found in namespace " + namespace + " (" + source + ")");
        }
        Map<String, byte[]> copy = new LinkedHashMap<>();
        for (Map.Entry<String, byte[]> entry : data.entrySet()) {
            copy.put(entry.getKey(), entry.getValue().clone());
        }
        return copy;
    }

    @Override
    public String describe() {
        return "manifests " + source;
    }

    private static void collect(
            JsonNode doc,
            Map<String, Map<String, String>> configMaps,
            Map<String, Map<String, byte[]>> secrets
    ) {
        if (doc == null || doc.isNull() || doc.isMissingNode()) {
            return;
        }
        String kind = doc.path("kind").asText("");
        if ("List".equals(kind) || kind.endsWith("List")) {
            for (JsonNode item : doc.path("items")) {
                collect(item, configMaps, secrets);
            }
            return;
        }
        JsonNode metadata = doc.path("metadata");
        String name = metadata.path("name").asText("");
        if (name.isBlank()) {
            return;
        }
        String namespace = metadata.path("namespace").asText(DEFAULT_OBJECT_NAMESPACE);
        if ("ConfigMap".equals(kind)) {
            Map<String, String> data = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = doc.path("data").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                data.put(entry.getKey(), entry.getValue().asText(""));
            }
            configMaps.put(key(namespace, name), Collections.unmodifiableMap(data));
        } else if ("Secret".equals(kind)) {
            Map<String, byte[]> data = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> it = doc.path("data").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                // Rendered YAML may fold long base64 values; the decoder must not see the breaks.
                String encoded = entry.getValue().asText("").replaceAll("\\s", "");
                data.put(entry.getKey(), Base64.getDecoder().decode(encoded));
            }
            it = doc.path("stringData").fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                data.put(entry.getKey(), entry.getValue().asText("").getBytes(StandardCharsets.UTF_8));
            }
            secrets.put(key(namespace, name), data);
        }
    }

    private static String key(String namespace, String name) {
        return namespace + "/" + name;
    }
}
