package io.linkmesh.upgrade;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.linkmesh.cluster.ClusterStore;
import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.model.ControlPlaneConfigs;
import io.linkmesh.model.GlobalConfig;
import io.linkmesh.model.InstallRecord;
import io.linkmesh.model.ProxyConfig;
import io.linkmesh.util.Jsons;

import java.util.Map;
import java.util.Objects;

/**
 * Reads the persisted control plane configuration straight from the config map. Every failure
 * is fatal: there is no fallback to defaults.
 */
public final class ConfigFetcher {
    private final LinkMeshConfig config;

    public ConfigFetcher(LinkMeshConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public ControlPlaneConfigs fetch(ClusterStore store) throws UpgradeException {
        Map<String, String> data;
        try {
            data = store.readConfigMap(config.namespace(), config.configMapName());
        } catch (UpgradeException e) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "could not fetch configs from " + store.describe() + ": " + e.getMessage(), e);
        }
        GlobalConfig global = decode(data, LinkMeshConfig.CONFIG_GLOBAL_KEY, GlobalConfig.class, true);
        ProxyConfig proxy = decode(data, LinkMeshConfig.CONFIG_PROXY_KEY, ProxyConfig.class, true);
        // Installs that predate the install record have no such key; repair fills it in.
        InstallRecord install = decode(data, LinkMeshConfig.CONFIG_INSTALL_KEY, InstallRecord.class, false);
        return new ControlPlaneConfigs(global, proxy, install);
    }

    private <T> T decode(Map<String, String> data, String key, Class<T> type, boolean required) throws UpgradeException {
        String raw = data.get(key);
        if (raw == null || raw.isBlank()) {
            if (required) {
                throw new UpgradeException(ErrorKind.FETCH,
                        "config map " + config.namespace() + "/" + config.configMapName() + " is missing key: " + key);
            }
            return null;
        }
        try {
            T value = Jsons.mapper().readValue(raw, type);
            if (value == null && required) {
                throw new UpgradeException(ErrorKind.FETCH, "config key " + key + " is null");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "config key " + key + " is not valid: " + e.getOriginalMessage(), e);
        }
    }
}
