package io.linkmesh.model;

public record InstallFlag(String name, String value) {
    public InstallFlag {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("install flag name must not be blank");
        }
        value = value == null ? "" : value;
    }
}
