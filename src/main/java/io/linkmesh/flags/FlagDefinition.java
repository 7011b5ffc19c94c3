package io.linkmesh.flags;

public record FlagDefinition(String name, String defaultValue, String description) {
    public FlagDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("flag name must not be blank");
        }
        defaultValue = defaultValue == null ? "" : defaultValue;
        description = description == null ? "" : description;
    }
}
