package io.linkmesh.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Persisted description of how the control plane was installed: a stable install id, the CLI
 * version that last touched it, and the flags that were set explicitly at that time.
 */
public record InstallRecord(
        String uuid,
        String cliVersion,
        List<InstallFlag> flags
) {
    public InstallRecord {
        uuid = uuid == null ? "" : uuid;
        cliVersion = cliVersion == null ? "" : cliVersion;
        flags = flags == null ? List.of() : List.copyOf(flags);
    }

    public static InstallRecord empty() {
        return new InstallRecord("", "", List.of());
    }

    @JsonIgnore
    public boolean hasUuid() {
        return !uuid.isBlank();
    }

    public InstallRecord withUuid(String value) {
        return new InstallRecord(value, cliVersion, flags);
    }

    public InstallRecord withCliVersion(String value) {
        return new InstallRecord(uuid, value, flags);
    }

    public InstallRecord withFlags(List<InstallFlag> value) {
        return new InstallRecord(uuid, cliVersion, value);
    }
}
