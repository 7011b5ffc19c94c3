package io.linkmesh.upgrade;

import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.flags.InstallFlags;
import io.linkmesh.model.InstallFlag;
import io.linkmesh.model.ReconciledValues;
import io.linkmesh.model.ResolvedIdentity;
import io.linkmesh.security.BouncyCastleIdentityGenerator;
import io.linkmesh.security.BouncyCastlePemCodec;
import io.linkmesh.security.GeneratedIdentity;
import io.linkmesh.testing.ControlPlaneFixtures;
import io.linkmesh.testing.ControlPlaneFixtures.MapClusterStore;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class UpgradeReconcilerTest {
    private static final String TOOL_VERSION = ControlPlaneFixtures.TOOL_VERSION;

    @Test
    void upgradeKeepsRecordedFlagsAndReusesTheIdentity() throws Exception {
        GeneratedIdentity existing = ControlPlaneFixtures.generateIdentity("example.org");
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(ControlPlaneFixtures.context(existing)),
                        ControlPlaneFixtures.proxy(),
                        ControlPlaneFixtures.install("install-1", "stable-1.0.0",
                                new InstallFlag(InstallFlags.HA, "true"),
                                new InstallFlag(InstallFlags.PROXY_LOG_LEVEL, "debug"))))
                .withSecret(LinkMeshConfig.ISSUER_SECRET_NAME,
                        ControlPlaneFixtures.issuerSecret(existing.issuer().keyPem(), existing.issuer().crtPem()));

        ReconciledValues values = reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of(InstallFlags.PROXY_UID, "3000")), UpgradeOptions.defaults());

        assertEquals("install-1", values.install().uuid());
        assertEquals(TOOL_VERSION, values.install().cliVersion());
        assertEquals(List.of(
                new InstallFlag(InstallFlags.HA, "true"),
                new InstallFlag(InstallFlags.PROXY_LOG_LEVEL, "debug"),
                new InstallFlag(InstallFlags.PROXY_UID, "3000")
        ), values.install().flags());
        assertEquals(3, values.controllerReplicas());
        assertEquals(3, values.identity().replicas());
        assertEquals("debug", values.proxy().logLevel().level());
        assertEquals(3000L, values.proxy().proxyUid());
        assertEquals(TOOL_VERSION, values.proxy().proxyVersion());
        assertEquals(TOOL_VERSION, values.global().version());
        assertEquals(ResolvedIdentity.Origin.REUSED, values.identity().origin());
        assertEquals(existing.trustAnchorsPem(), values.global().identityContext().trustAnchorsPem());
        assertEquals(existing.issuer().keyPem(), values.identity().issuer().keyPem());
        assertTrue(values.warnings().isEmpty());
        assertEquals(List.of("configmap/" + LinkMeshConfig.CONFIG_MAP_NAME, "secret/" + LinkMeshConfig.ISSUER_SECRET_NAME),
                store.reads());
    }

    @Test
    void freshInstallRecordWithRecordedHaGetsUuidVersionAndNewIdentity() throws Exception {
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(null), ControlPlaneFixtures.proxy(),
                        ControlPlaneFixtures.install("", "v0", new InstallFlag(InstallFlags.HA, "true"))));

        ReconciledValues values = reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), UpgradeOptions.defaults());

        assertEquals("generated-uuid", values.install().uuid());
        assertEquals(TOOL_VERSION, values.install().cliVersion());
        assertEquals(List.of(new InstallFlag(InstallFlags.HA, "true")), values.install().flags());
        assertEquals(ResolvedIdentity.Origin.GENERATED, values.identity().origin());
        assertEquals(InstallFlags.DEFAULT_TRUST_DOMAIN, values.identity().context().trustDomain());
        assertEquals(values.identity().context(), values.global().identityContext());
        assertEquals(values.identity().issuer().crtPem(), values.global().identityContext().trustAnchorsPem());
    }

    @Test
    void missingInstallRecordAndIdentityAreFilledIn() throws Exception {
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(null), ControlPlaneFixtures.proxy(), null));

        ReconciledValues values = reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), UpgradeOptions.defaults());

        assertEquals("generated-uuid", values.install().uuid());
        assertTrue(values.install().flags().isEmpty());
        assertEquals(ResolvedIdentity.Origin.GENERATED, values.identity().origin());
        assertEquals(InstallFlags.DEFAULT_TRUST_DOMAIN, values.global().identityContext().trustDomain());
        assertEquals(values.identity().context(), values.global().identityContext());
        assertEquals(Duration.ofHours(24), values.global().identityContext().issuanceLifetime());
        assertEquals(1, values.controllerReplicas());
        assertEquals(List.of("configmap/" + LinkMeshConfig.CONFIG_MAP_NAME), store.reads());
    }

    @Test
    void unsupportedRecordedFlagsBecomeWarnings() throws Exception {
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(null), ControlPlaneFixtures.proxy(),
                        ControlPlaneFixtures.install("install-1", "stable-1.0.0",
                                new InstallFlag("registry", "example.io/mirror"))));

        ReconciledValues values = reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), UpgradeOptions.defaults());

        assertEquals(1, values.warnings().size());
        assertTrue(values.warnings().get(0).contains("registry"));
        assertTrue(values.install().flags().isEmpty());
    }

    @Test
    void autoInjectFlagAddsTheAutoInjectContext() throws Exception {
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(null), ControlPlaneFixtures.proxy(), null));

        ReconciledValues withoutFlag = reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), UpgradeOptions.defaults());
        ReconciledValues withFlag = reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of(InstallFlags.PROXY_AUTO_INJECT, "true")), UpgradeOptions.defaults());

        assertNull(withoutFlag.global().autoInjectContext());
        assertNotNull(withFlag.global().autoInjectContext());
    }

    @Test
    void invalidRecordedFlagValueIsAFlagsError() {
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(null), ControlPlaneFixtures.proxy(),
                        ControlPlaneFixtures.install("install-1", "stable-1.0.0",
                                new InstallFlag(InstallFlags.CONTROLLER_REPLICAS, "zero"))));

        UpgradeException e = assertThrows(UpgradeException.class, () -> reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), UpgradeOptions.defaults()));

        assertEquals(ErrorKind.FLAGS, e.kind());
        assertFalse(store.reads().contains("secret/" + LinkMeshConfig.ISSUER_SECRET_NAME));
    }

    @Test
    void outOfRangeIssuerLifetimeIsAFlagsError() {
        MapClusterStore store = new MapClusterStore()
                .withConfigMap(LinkMeshConfig.CONFIG_MAP_NAME, ControlPlaneFixtures.configData(
                        ControlPlaneFixtures.global(null), ControlPlaneFixtures.proxy(), null));

        UpgradeException e = assertThrows(UpgradeException.class, () -> reconciler().reconcile(store,
                InstallFlags.flagSet(TOOL_VERSION,
                        Map.of(InstallFlags.IDENTITY_ISSUER_CERTIFICATE_LIFETIME, "99999999999999999999h")),
                UpgradeOptions.defaults()));

        assertEquals(ErrorKind.FLAGS, e.kind());
        assertTrue(e.getMessage().contains("out of range"));
    }

    @Test
    void missingConfigMapIsAFetchError() {
        UpgradeException e = assertThrows(UpgradeException.class, () -> reconciler().reconcile(new MapClusterStore(),
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), UpgradeOptions.defaults()));

        assertEquals(ErrorKind.FETCH, e.kind());
    }

    @Test
    void ignoringTheClusterIsACallerError() {
        assertThrows(IllegalStateException.class, () -> reconciler().reconcile(new MapClusterStore(),
                InstallFlags.flagSet(TOOL_VERSION, Map.of()), new UpgradeOptions(true)));
    }

    private static UpgradeReconciler reconciler() {
        BouncyCastlePemCodec pemCodec = new BouncyCastlePemCodec();
        return new UpgradeReconciler(
                ControlPlaneFixtures.config(),
                () -> "generated-uuid",
                pemCodec,
                new BouncyCastleIdentityGenerator(ControlPlaneFixtures.NAMESPACE, pemCodec, Clock.systemUTC()),
                Clock.systemUTC()
        );
    }
}
