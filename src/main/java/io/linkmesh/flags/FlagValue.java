package io.linkmesh.flags;

import java.util.Objects;

public record FlagValue(String value, FlagSource source) {
    public FlagValue {
        value = value == null ? "" : value;
        Objects.requireNonNull(source, "source");
    }

    public static FlagValue defaultValue(String value) {
        return new FlagValue(value, FlagSource.DEFAULT);
    }

    public static FlagValue recorded(String value) {
        return new FlagValue(value, FlagSource.RECORDED);
    }

    public static FlagValue explicit(String value) {
        return new FlagValue(value, FlagSource.EXPLICIT);
    }

    public boolean isDefault() {
        return source == FlagSource.DEFAULT;
    }
}
