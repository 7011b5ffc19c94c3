package io.linkmesh.flags;

import io.linkmesh.security.IdentityOptions;
import io.linkmesh.util.Durations;

import java.util.Locale;
import java.util.Set;

/**
 * Typed view of a reconciled {@link FlagSet}.
 */
public record InstallOptions(
        int controllerReplicas,
        boolean controllerReplicasSet,
        boolean ha,
        String controlPlaneVersion,
        String proxyVersion,
        String proxyLogLevel,
        long proxyUid,
        String imagePullPolicy,
        boolean proxyAutoInject,
        boolean omitWebhookSideEffects,
        IdentityOptions identity
) {
    private static final Set<String> PULL_POLICIES = Set.of("Always", "IfNotPresent", "Never");

    /**
     * @throws IllegalArgumentException when a flag value does not parse or is out of range
     */
    public static InstallOptions fromFlags(FlagSet flags) {
        int replicas = parseInt(flags, InstallFlags.CONTROLLER_REPLICAS);
        if (replicas < 1) {
            throw new IllegalArgumentException("--" + InstallFlags.CONTROLLER_REPLICAS + " must be >= 1: " + replicas);
        }
        long uid = parseLong(flags, InstallFlags.PROXY_UID);
        if (uid < 0) {
            throw new IllegalArgumentException("--" + InstallFlags.PROXY_UID + " must be >= 0: " + uid);
        }
        String pullPolicy = flags.value(InstallFlags.IMAGE_PULL_POLICY).trim();
        if (!PULL_POLICIES.contains(pullPolicy)) {
            throw new IllegalArgumentException("--" + InstallFlags.IMAGE_PULL_POLICY
                    + " must be one of Always|IfNotPresent|Never: " + pullPolicy);
        }
        IdentityOptions identity;
        try {
            identity = new IdentityOptions(
                    flags.value(InstallFlags.IDENTITY_TRUST_DOMAIN),
                    Durations.parse(flags.value(InstallFlags.IDENTITY_ISSUANCE_LIFETIME)),
                    Durations.parse(flags.value(InstallFlags.IDENTITY_CLOCK_SKEW_ALLOWANCE)),
                    Durations.parse(flags.value(InstallFlags.IDENTITY_ISSUER_CERTIFICATE_LIFETIME))
            );
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid identity flags: " + e.getMessage(), e);
        }
        return new InstallOptions(
                replicas,
                !flags.lookup(InstallFlags.CONTROLLER_REPLICAS).orElseThrow().isDefault(),
                parseBoolean(flags, InstallFlags.HA),
                requireNonBlank(flags, InstallFlags.CONTROL_PLANE_VERSION),
                requireNonBlank(flags, InstallFlags.PROXY_VERSION),
                requireNonBlank(flags, InstallFlags.PROXY_LOG_LEVEL),
                uid,
                pullPolicy,
                parseBoolean(flags, InstallFlags.PROXY_AUTO_INJECT),
                parseBoolean(flags, InstallFlags.OMIT_WEBHOOK_SIDE_EFFECTS),
                identity
        );
    }

    /**
     * HA raises the replica count unless replicas were chosen explicitly or recorded.
     */
    public int effectiveControllerReplicas() {
        if (ha && !controllerReplicasSet) {
            return InstallFlags.DEFAULT_HA_CONTROLLER_REPLICAS;
        }
        return controllerReplicas;
    }

    private static int parseInt(FlagSet flags, String name) {
        String raw = flags.value(name).trim();
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + raw, e);
        }
    }

    private static long parseLong(FlagSet flags, String name) {
        String raw = flags.value(name).trim();
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer: " + raw, e);
        }
    }

    private static boolean parseBoolean(FlagSet flags, String name) {
        String raw = flags.value(name).trim().toLowerCase(Locale.ROOT);
        return switch (raw) {
            case "true", "1", "t" -> true;
            case "false", "0", "f", "" -> false;
            default -> throw new IllegalArgumentException("--" + name + " must be true or false: " + raw);
        };
    }

    private static String requireNonBlank(FlagSet flags, String name) {
        String raw = flags.value(name).trim();
        if (raw.isEmpty()) {
            throw new IllegalArgumentException("--" + name + " must not be blank");
        }
        return raw;
    }
}
