package io.linkmesh.testing;

import io.linkmesh.cluster.ClusterStore;
import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.model.GlobalConfig;
import io.linkmesh.model.IdentityContext;
import io.linkmesh.model.InstallFlag;
import io.linkmesh.model.InstallRecord;
import io.linkmesh.model.ProxyConfig;
import io.linkmesh.security.BouncyCastleIdentityGenerator;
import io.linkmesh.security.BouncyCastlePemCodec;
import io.linkmesh.security.GeneratedIdentity;
import io.linkmesh.security.IdentityOptions;
import io.linkmesh.upgrade.ErrorKind;
import io.linkmesh.upgrade.UpgradeException;
import io.linkmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

public final class ControlPlaneFixtures {
    public static final String NAMESPACE = LinkMeshConfig.DEFAULT_NAMESPACE;
    public static final String TOOL_VERSION = "stable-9.9.9";

    private ControlPlaneFixtures() {
    }

    public static LinkMeshConfig config() {
        return new LinkMeshConfig(NAMESPACE, TOOL_VERSION);
    }

    public static IdentityOptions identityOptions(String trustDomain) {
        return new IdentityOptions(trustDomain, Duration.ofHours(24), Duration.ofSeconds(20), Duration.ofDays(365));
    }

    public static GeneratedIdentity generateIdentity(String trustDomain) throws Exception {
        return generateIdentity(trustDomain, Clock.systemUTC(), Duration.ofDays(365));
    }

    public static GeneratedIdentity generateIdentity(String trustDomain, Clock clock, Duration lifetime) throws Exception {
        BouncyCastleIdentityGenerator generator =
                new BouncyCastleIdentityGenerator(NAMESPACE, new BouncyCastlePemCodec(), clock);
        return generator.generate(new IdentityOptions(trustDomain, Duration.ofHours(24), Duration.ofSeconds(20), lifetime));
    }

    public static Clock fixedClock(Instant instant) {
        return Clock.fixed(instant, ZoneOffset.UTC);
    }

    public static IdentityContext context(GeneratedIdentity identity) {
        return new IdentityContext(identity.trustDomain(), identity.trustAnchorsPem(), Duration.ofHours(24), Duration.ofSeconds(20));
    }

    public static GlobalConfig global(IdentityContext identity) {
        return new GlobalConfig(NAMESPACE, false, "stable-1.0.0", identity, null, false, "cluster.local");
    }

    public static ProxyConfig proxy() {
        return new ProxyConfig(
                new ProxyConfig.Image("ghcr.io/linkmesh/proxy", "IfNotPresent"),
                new ProxyConfig.Image("ghcr.io/linkmesh/proxy-init", "IfNotPresent"),
                new ProxyConfig.Port(4190),
                new ProxyConfig.Port(4143),
                new ProxyConfig.Port(4191),
                new ProxyConfig.Port(4140),
                List.of(),
                List.of(),
                2102L,
                new ProxyConfig.LogLevel("warn,linkmesh_proxy=info"),
                true,
                "stable-1.0.0"
        );
    }

    public static Map<String, String> configData(GlobalConfig global, ProxyConfig proxy, InstallRecord install) {
        Map<String, String> data = new LinkedHashMap<>();
        data.put(LinkMeshConfig.CONFIG_GLOBAL_KEY, Jsons.toCompactJson(global));
        data.put(LinkMeshConfig.CONFIG_PROXY_KEY, Jsons.toCompactJson(proxy));
        if (install != null) {
            data.put(LinkMeshConfig.CONFIG_INSTALL_KEY, Jsons.toCompactJson(install));
        }
        return data;
    }

    public static InstallRecord install(String uuid, String cliVersion, InstallFlag... flags) {
        return new InstallRecord(uuid, cliVersion, List.of(flags));
    }

    public static Map<String, byte[]> issuerSecret(String keyPem, String crtPem) {
        Map<String, byte[]> data = new LinkedHashMap<>();
        data.put(LinkMeshConfig.ISSUER_KEY_NAME, keyPem.getBytes(StandardCharsets.UTF_8));
        data.put(LinkMeshConfig.ISSUER_CRT_NAME, crtPem.getBytes(StandardCharsets.UTF_8));
        return data;
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    /**
     * Store backed by plain maps that records which objects were read.
     */
    public static final class MapClusterStore implements ClusterStore {
        private final Map<String, Map<String, String>> configMaps = new LinkedHashMap<>();
        private final Map<String, Map<String, byte[]>> secrets = new LinkedHashMap<>();
        private final List<String> reads = new ArrayList<>();

        public MapClusterStore withConfigMap(String name, Map<String, String> data) {
            configMaps.put(NAMESPACE + "/" + name, data);
            return this;
        }

        public MapClusterStore withSecret(String name, Map<String, byte[]> data) {
            secrets.put(NAMESPACE + "/" + name, data);
            return this;
        }

        public List<String> reads() {
            return reads;
        }

        @Override
        public Map<String, String> readConfigMap(String namespace, String name) throws UpgradeException {
            reads.add("configmap/" + name);
            Map<String, String> data = configMaps.get(namespace + "/" + name);
            if (data == null) {
                throw new UpgradeException(ErrorKind.FETCH, "configmaps \"" + name + "\" not found");
            }
            return data;
        }

        @Override
        public Map<String, byte[]> readSecret(String namespace, String name) throws UpgradeException {
            reads.add("secret/" + name);
            Map<String, byte[]> data = secrets.get(namespace + "/" + name);
            if (data == null) {
                throw new UpgradeException(ErrorKind.FETCH, "secrets \"" + name + "\" not found");
            }
            return data;
        }

        @Override
        public String describe() {
            return "test store";
        }
    }
}
