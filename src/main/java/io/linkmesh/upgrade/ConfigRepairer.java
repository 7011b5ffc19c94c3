package io.linkmesh.upgrade;

import io.linkmesh.model.InstallRecord;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Fills in structural fields an older or partial install record may lack. Repairing twice is
 * the same as repairing once; flags are left to {@link io.linkmesh.flags.FlagReconciler}.
 */
public final class ConfigRepairer {
    private final Supplier<String> uuidGenerator;
    private final String toolVersion;

    public ConfigRepairer(Supplier<String> uuidGenerator, String toolVersion) {
        this.uuidGenerator = Objects.requireNonNull(uuidGenerator, "uuidGenerator");
        this.toolVersion = Objects.requireNonNull(toolVersion, "toolVersion");
    }

    public InstallRecord repair(InstallRecord install) {
        InstallRecord repaired = install == null ? InstallRecord.empty() : install;
        if (!repaired.hasUuid()) {
            String uuid = uuidGenerator.get();
            if (uuid == null || uuid.isBlank()) {
                throw new IllegalStateException("uuid generator returned a blank identifier");
            }
            repaired = repaired.withUuid(uuid);
        }
        // Always stamp the version of the CLI doing the upgrade.
        return repaired.withCliVersion(toolVersion);
    }
}
