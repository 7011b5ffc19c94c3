package io.linkmesh.flags;

import io.linkmesh.model.InstallFlag;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable view of the recordable flags for one invocation. Each entry carries its
 * value and the source that value came from; "changed" means any source other than
 * {@link FlagSource#DEFAULT}.
 */
public final class FlagSet {
    private final Map<String, FlagValue> values;

    private FlagSet(Map<String, FlagValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Builds a set from definitions, marking every name present in {@code explicitValues} as set
     * on the current command line. Names in {@code explicitValues} without a definition are
     * rejected.
     */
    public static FlagSet of(List<FlagDefinition> definitions, Map<String, String> explicitValues) {
        Map<String, FlagValue> out = new LinkedHashMap<>();
        for (FlagDefinition definition : definitions) {
            if (out.containsKey(definition.name())) {
                throw new IllegalArgumentException("Duplicate flag definition: " + definition.name());
            }
            out.put(definition.name(), FlagValue.defaultValue(definition.defaultValue()));
        }
        if (explicitValues != null) {
            for (Map.Entry<String, String> entry : explicitValues.entrySet()) {
                if (!out.containsKey(entry.getKey())) {
                    throw new IllegalArgumentException("Unknown flag: " + entry.getKey());
                }
                out.put(entry.getKey(), FlagValue.explicit(entry.getValue()));
            }
        }
        return new FlagSet(out);
    }

    public Optional<FlagValue> lookup(String name) {
        return Optional.ofNullable(values.get(name));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public String value(String name) {
        return require(name).value();
    }

    public FlagSource source(String name) {
        return require(name).source();
    }

    public FlagSet with(String name, FlagValue value) {
        require(name);
        Map<String, FlagValue> copy = new LinkedHashMap<>(values);
        copy.put(name, value);
        return new FlagSet(copy);
    }

    public List<String> names() {
        return List.copyOf(values.keySet());
    }

    /**
     * Flags that should be persisted with the install record: every flag not at its default,
     * in definition order.
     */
    public List<InstallFlag> recordable() {
        List<InstallFlag> out = new ArrayList<>();
        for (Map.Entry<String, FlagValue> entry : values.entrySet()) {
            if (!entry.getValue().isDefault()) {
                out.add(new InstallFlag(entry.getKey(), entry.getValue().value()));
            }
        }
        return out;
    }

    public Map<String, FlagValue> asMap() {
        return values;
    }

    private FlagValue require(String name) {
        FlagValue value = values.get(name);
        if (value == null) {
            throw new IllegalArgumentException("Unknown flag: " + name);
        }
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlagSet other)) {
            return false;
        }
        return new ArrayList<>(values.entrySet()).equals(new ArrayList<>(other.values.entrySet()));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "FlagSet" + values;
    }
}
