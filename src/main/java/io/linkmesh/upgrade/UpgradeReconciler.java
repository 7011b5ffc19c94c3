package io.linkmesh.upgrade;

import io.linkmesh.cluster.ClusterStore;
import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.flags.FlagReconciler;
import io.linkmesh.flags.FlagSet;
import io.linkmesh.flags.InstallOptions;
import io.linkmesh.model.ControlPlaneConfigs;
import io.linkmesh.model.InstallRecord;
import io.linkmesh.model.ReconciledValues;
import io.linkmesh.model.ResolvedIdentity;
import io.linkmesh.security.IdentityGenerator;
import io.linkmesh.security.PemCodec;
import io.linkmesh.util.Preconditions;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Runs one upgrade reconciliation: fetch, repair, flag merge, overrides, identity, values.
 * Each stage works on the previous stage's output; the cluster is read once for the config
 * map and once for the issuer secret, and never written.
 */
public final class UpgradeReconciler {
    private final LinkMeshConfig config;
    private final ConfigFetcher fetcher;
    private final ConfigRepairer repairer;
    private final IdentityReconciler identityReconciler;

    public UpgradeReconciler(
            LinkMeshConfig config,
            Supplier<String> uuidGenerator,
            PemCodec pemCodec,
            IdentityGenerator identityGenerator,
            Clock clock
    ) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = new ConfigFetcher(config);
        this.repairer = new ConfigRepairer(uuidGenerator, config.toolVersion());
        this.identityReconciler = new IdentityReconciler(config, pemCodec, identityGenerator, clock);
    }

    public ReconciledValues reconcile(ClusterStore store, FlagSet flags, UpgradeOptions options) throws UpgradeException {
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(flags, "flags");
        Preconditions.checkState(options == null || !options.ignoreCluster(),
                "ignore cluster must be unset for an upgrade");

        ControlPlaneConfigs configs = fetcher.fetch(store);
        InstallRecord install = repairer.repair(configs.install());

        // Recorded flags act as defaults for this run unless overridden on the command line.
        FlagSet merged = FlagReconciler.reconcile(install.flags(), flags);
        List<String> warnings = new ArrayList<>();
        for (String unknown : FlagReconciler.unknownFlags(install.flags(), flags)) {
            warnings.add("ignoring recorded flag no longer supported by this CLI: " + unknown);
        }

        InstallOptions installOptions;
        try {
            installOptions = InstallOptions.fromFlags(merged);
        } catch (IllegalArgumentException e) {
            throw new UpgradeException(ErrorKind.FLAGS, "invalid flags: " + e.getMessage(), e);
        }

        configs = configs.withInstall(install.withFlags(merged.recordable()));
        configs = ConfigOverrides.apply(configs, installOptions, config.namespace());

        int replicas = installOptions.effectiveControllerReplicas();
        ResolvedIdentity identity = identityReconciler.resolve(
                store,
                IdentityState.from(configs.global().identityContext()),
                installOptions.identity(),
                replicas
        );
        return ValuesBuilder.build(config.namespace(), configs, identity, replicas, warnings);
    }
}
