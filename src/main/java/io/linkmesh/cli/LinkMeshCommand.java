package io.linkmesh.cli;

import io.linkmesh.cluster.ClusterStore;
import io.linkmesh.cluster.KubernetesClusterStore;
import io.linkmesh.cluster.ManifestClusterStore;
import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.config.ToolVersion;
import io.linkmesh.flags.FlagSet;
import io.linkmesh.flags.InstallFlags;
import io.linkmesh.model.ReconciledValues;
import io.linkmesh.observability.AuditLogger;
import io.linkmesh.render.YamlManifestRenderer;
import io.linkmesh.security.BouncyCastleIdentityGenerator;
import io.linkmesh.security.BouncyCastlePemCodec;
import io.linkmesh.security.PemCodec;
import io.linkmesh.upgrade.UpgradeException;
import io.linkmesh.upgrade.UpgradeOptions;
import io.linkmesh.upgrade.UpgradeReconciler;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

@Command(
        name = "linkmesh",
        mixinStandardHelpOptions = true,
        description = "LinkMesh control plane CLI",
        subcommands = {
                LinkMeshCommand.UpgradeCommand.class,
                LinkMeshCommand.VersionCommand.class
        }
)
public final class LinkMeshCommand implements Runnable {
    static final String OK_STATUS = "[ok]";
    static final String FAIL_STATUS = "[x]";
    static final String OK_MESSAGE = "You're on your way to upgrading LinkMesh!\n"
            + "Visit this URL for further instructions: " + LinkMeshConfig.UPGRADE_NEXT_STEPS_URL;
    static final String FAIL_MESSAGE = "For troubleshooting help, visit: " + LinkMeshConfig.UPGRADE_TROUBLESHOOTING_URL;
    static final String AUDIT_SIGNING_SECRET_ENV = "LINKMESH_AUDIT_SIGNING_SECRET";

    @Spec
    CommandSpec spec;

    @Option(names = {"--namespace"}, description = "Namespace in which the control plane is installed",
            defaultValue = LinkMeshConfig.DEFAULT_NAMESPACE)
    String namespace;

    @Override
    public void run() {
        spec.commandLine().getOut().println("Use subcommands: upgrade | version");
    }

    LinkMeshConfig config() {
        return LinkMeshConfig.forNamespace(namespace);
    }

    @Command(
            name = "upgrade",
            description = {
                    "Output Kubernetes configs to upgrade an existing LinkMesh control plane.",
                    "Default flag values come from the control plane's recorded install flags;"
                            + " the defaults listed here only apply when nothing was recorded."
            }
    )
    static final class UpgradeCommand implements Callable<Integer> {
        @ParentCommand
        LinkMeshCommand parent;

        @Spec
        CommandSpec spec;

        // Not recordable: these select where state comes from and must never be persisted.
        @Option(names = {"--from-manifests"}, description = "Read config from a LinkMesh install YAML (or - for stdin) rather than from Kubernetes")
        String fromManifests;

        @Option(names = {"--kubeconfig"}, description = "Path to the kubeconfig file to use for CLI requests")
        String kubeconfig;

        @Option(names = {"--context"}, description = "Name of the kubeconfig context to use")
        String kubeContext;

        @Option(names = {"--audit-log"}, description = "Append an audit record of this run to the given JSON-lines file")
        String auditLog;

        @Option(names = {"--controller-replicas"}, description = "Replicas of each control plane component (default: 1)")
        Integer controllerReplicas;

        @Option(names = {"--ha"}, arity = "0..1", fallbackValue = "true",
                description = "Enable HA deployment config for the control plane (default: false)")
        Boolean ha;

        @Option(names = {"--control-plane-version"}, description = "Tag to be used for control plane images (default: CLI version)")
        String controlPlaneVersion;

        @Option(names = {"--proxy-version"}, description = "Tag to be used for the proxy image (default: CLI version)")
        String proxyVersion;

        @Option(names = {"--proxy-log-level"}, description = "Log level for the proxy (default: " + InstallFlags.DEFAULT_PROXY_LOG_LEVEL + ")")
        String proxyLogLevel;

        @Option(names = {"--proxy-uid"}, description = "Run the proxy under this user ID (default: 2102)")
        Long proxyUid;

        @Option(names = {"--image-pull-policy"}, description = "Image pull policy: Always|IfNotPresent|Never (default: IfNotPresent)")
        String imagePullPolicy;

        @Option(names = {"--proxy-auto-inject"}, arity = "0..1", fallbackValue = "true",
                description = "Enable proxy sidecar auto-injection via a webhook (default: false)")
        Boolean proxyAutoInject;

        @Option(names = {"--omit-webhook-side-effects"}, arity = "0..1", fallbackValue = "true",
                description = "Omit the sideEffects flag in the webhook manifests (default: false)")
        Boolean omitWebhookSideEffects;

        @Option(names = {"--identity-trust-domain"}, description = "Name suffix used for identities (default: " + InstallFlags.DEFAULT_TRUST_DOMAIN + ")")
        String identityTrustDomain;

        @Option(names = {"--identity-issuance-lifetime"}, description = "How long the identity issuer certifies identities (default: 24h)")
        String identityIssuanceLifetime;

        @Option(names = {"--identity-clock-skew-allowance"}, description = "Allowed clock skew within the control plane (default: 20s)")
        String identityClockSkewAllowance;

        @Option(names = {"--identity-issuer-certificate-lifetime"}, description = "Validity of a newly generated issuer certificate (default: 8760h)")
        String identityIssuerCertificateLifetime;

        @Override
        public Integer call() {
            PrintWriter out = spec.commandLine().getOut();
            PrintWriter err = spec.commandLine().getErr();
            LinkMeshConfig config;
            try {
                config = parent.config();
            } catch (IllegalArgumentException e) {
                return fail(err, e.getMessage());
            }
            AuditLogger audit;
            try {
                audit = openAuditLog(config);
            } catch (RuntimeException e) {
                return fail(err, "unable to open audit log: " + e.getMessage());
            }

            ReconciledValues values;
            String manifest;
            try (ClusterStore store = openStore()) {
                PemCodec pemCodec = new BouncyCastlePemCodec();
                UpgradeReconciler reconciler = new UpgradeReconciler(
                        config,
                        () -> UUID.randomUUID().toString(),
                        pemCodec,
                        new BouncyCastleIdentityGenerator(config.namespace(), pemCodec, Clock.systemUTC()),
                        Clock.systemUTC()
                );
                FlagSet flags = InstallFlags.flagSet(config.toolVersion(), explicitFlags());
                values = reconciler.reconcile(store, flags, UpgradeOptions.defaults());
                // Render fully before writing anything so a failure leaves stdout empty.
                manifest = new YamlManifestRenderer(config.toolVersion()).render(values);
            } catch (UpgradeException e) {
                int code = fail(err, e.getMessage());
                try {
                    audit(audit, "failed", details(e));
                } catch (RuntimeException auditError) {
                    err.println("[warn] unable to write audit log: " + auditError.getMessage());
                    err.flush();
                }
                return code;
            }

            // The audit row goes first: a run that cannot be audited prints no manifest.
            try {
                audit(audit, "ok", details(values));
            } catch (RuntimeException e) {
                return fail(err, "unable to write audit log: " + e.getMessage());
            }
            for (String warning : values.warnings()) {
                err.println("[warn] " + warning);
            }
            out.print(manifest);
            out.flush();
            err.printf("%n%s %s%n", OK_STATUS, OK_MESSAGE);
            err.flush();
            return 0;
        }

        private AuditLogger openAuditLog(LinkMeshConfig config) {
            if (auditLog == null || auditLog.isBlank()) {
                return null;
            }
            return new AuditLogger(Path.of(auditLog), config.namespace(),
                    System.getenv(AUDIT_SIGNING_SECRET_ENV), Clock.systemUTC());
        }

        private static int fail(PrintWriter err, String message) {
            err.printf("%s %s%n%s%n", FAIL_STATUS, message, FAIL_MESSAGE);
            err.flush();
            return 1;
        }

        private ClusterStore openStore() throws UpgradeException {
            if (fromManifests != null && !fromManifests.isBlank()) {
                return ManifestClusterStore.fromLocation(fromManifests, System.in);
            }
            return KubernetesClusterStore.connect(kubeconfig, kubeContext);
        }

        /**
         * Only flags given on this command line; everything else stays at its default until
         * the recorded flags are merged in.
         */
        Map<String, String> explicitFlags() {
            Map<String, String> out = new LinkedHashMap<>();
            put(out, InstallFlags.CONTROLLER_REPLICAS, controllerReplicas);
            put(out, InstallFlags.HA, ha);
            put(out, InstallFlags.CONTROL_PLANE_VERSION, controlPlaneVersion);
            put(out, InstallFlags.PROXY_VERSION, proxyVersion);
            put(out, InstallFlags.PROXY_LOG_LEVEL, proxyLogLevel);
            put(out, InstallFlags.PROXY_UID, proxyUid);
            put(out, InstallFlags.IMAGE_PULL_POLICY, imagePullPolicy);
            put(out, InstallFlags.PROXY_AUTO_INJECT, proxyAutoInject);
            put(out, InstallFlags.OMIT_WEBHOOK_SIDE_EFFECTS, omitWebhookSideEffects);
            put(out, InstallFlags.IDENTITY_TRUST_DOMAIN, identityTrustDomain);
            put(out, InstallFlags.IDENTITY_ISSUANCE_LIFETIME, identityIssuanceLifetime);
            put(out, InstallFlags.IDENTITY_CLOCK_SKEW_ALLOWANCE, identityClockSkewAllowance);
            put(out, InstallFlags.IDENTITY_ISSUER_CERTIFICATE_LIFETIME, identityIssuerCertificateLifetime);
            return out;
        }

        private static void put(Map<String, String> out, String name, Object value) {
            if (value != null) {
                out.put(name, String.valueOf(value));
            }
        }

        private static Map<String, Object> details(ReconciledValues values) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("uuid", values.install().uuid());
            details.put("cli_version", values.install().cliVersion());
            details.put("identity", values.identity().origin().name().toLowerCase(Locale.ROOT));
            details.put("trust_domain", values.identity().context().trustDomain());
            details.put("issuer_not_after", values.identity().issuer().notAfter().toString());
            details.put("recorded_flags", values.install().flags());
            details.put("warnings", values.warnings());
            return details;
        }

        private static Map<String, Object> details(UpgradeException e) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error_kind", e.kind().name());
            details.put("error", e.getMessage());
            return details;
        }

        private static void audit(AuditLogger audit, String result, Map<String, Object> details) {
            if (audit != null) {
                audit.log(AuditLogger.AuditEvent.of("upgrade.reconcile", LinkMeshConfig.CONFIG_MAP_NAME, result, details));
            }
        }
    }

    @Command(name = "version", description = "Print the CLI version")
    static final class VersionCommand implements Callable<Integer> {
        @Spec
        CommandSpec spec;

        @Override
        public Integer call() {
            spec.commandLine().getOut().println(ToolVersion.current());
            return 0;
        }
    }
}
