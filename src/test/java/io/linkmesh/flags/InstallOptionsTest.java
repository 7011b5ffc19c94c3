package io.linkmesh.flags;

import io.linkmesh.model.InstallFlag;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class InstallOptionsTest {
    @Test
    void defaultsParseToTypedValues() {
        InstallOptions options = InstallOptions.fromFlags(InstallFlags.flagSet("stable-2.0.0", Map.of()));

        assertEquals(1, options.effectiveControllerReplicas());
        assertFalse(options.ha());
        assertEquals("stable-2.0.0", options.controlPlaneVersion());
        assertEquals("stable-2.0.0", options.proxyVersion());
        assertEquals(2102L, options.proxyUid());
        assertEquals("cluster.local", options.identity().trustDomain());
        assertEquals(Duration.ofHours(24), options.identity().issuanceLifetime());
        assertEquals(Duration.ofSeconds(20), options.identity().clockSkewAllowance());
        assertEquals(Duration.ofDays(365), options.identity().issuerCertificateLifetime());
    }

    @Test
    void haRaisesReplicasOnlyWhenReplicasWereNotChosen() {
        InstallOptions haOnly = InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.HA, "true")));
        assertTrue(haOnly.ha());
        assertEquals(3, haOnly.effectiveControllerReplicas());

        FlagSet recordedReplicas = FlagReconciler.reconcile(
                List.of(new InstallFlag(InstallFlags.CONTROLLER_REPLICAS, "2")),
                InstallFlags.flagSet("v", Map.of(InstallFlags.HA, "true"))
        );
        assertEquals(2, InstallOptions.fromFlags(recordedReplicas).effectiveControllerReplicas());
    }

    @Test
    void invalidValuesAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.CONTROLLER_REPLICAS, "zero"))));
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.CONTROLLER_REPLICAS, "0"))));
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.HA, "maybe"))));
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.IMAGE_PULL_POLICY, "Sometimes"))));
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.IDENTITY_ISSUANCE_LIFETIME, "soon"))));
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v", Map.of(InstallFlags.IDENTITY_TRUST_DOMAIN, " "))));
        assertThrows(IllegalArgumentException.class,
                () -> InstallOptions.fromFlags(InstallFlags.flagSet("v",
                        Map.of(InstallFlags.IDENTITY_ISSUER_CERTIFICATE_LIFETIME, "99999999999999999999h"))));
    }
}
