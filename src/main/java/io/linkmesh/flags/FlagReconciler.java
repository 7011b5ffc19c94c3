package io.linkmesh.flags;

import io.linkmesh.model.InstallFlag;

import java.util.ArrayList;
import java.util.List;

/**
 * Merges flags recorded at a previous install/upgrade into the current invocation's flags.
 *
 * <p>Precedence is explicit (current command line) over recorded over compiled-in default. A
 * recorded flag only replaces a value whose source is still {@link FlagSource#DEFAULT} or
 * {@link FlagSource#RECORDED}; explicit values are never touched. Recorded names the current
 * CLI no longer defines are skipped.
 */
public final class FlagReconciler {
    private FlagReconciler() {
    }

    public static FlagSet reconcile(List<InstallFlag> recordedFlags, FlagSet currentFlags) {
        FlagSet merged = currentFlags;
        if (recordedFlags == null) {
            return merged;
        }
        for (InstallFlag recorded : recordedFlags) {
            if (recorded == null) {
                continue;
            }
            FlagValue current = merged.lookup(recorded.name()).orElse(null);
            if (current == null || current.source() == FlagSource.EXPLICIT) {
                continue;
            }
            merged = merged.with(recorded.name(), FlagValue.recorded(recorded.value()));
        }
        return merged;
    }

    public static List<String> unknownFlags(List<InstallFlag> recordedFlags, FlagSet currentFlags) {
        List<String> out = new ArrayList<>();
        if (recordedFlags == null) {
            return out;
        }
        for (InstallFlag recorded : recordedFlags) {
            if (recorded != null && !currentFlags.contains(recorded.name()) && !out.contains(recorded.name())) {
                out.add(recorded.name());
            }
        }
        return out;
    }
}
