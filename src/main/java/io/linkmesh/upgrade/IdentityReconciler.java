package io.linkmesh.upgrade;

import io.linkmesh.cluster.ClusterStore;
import io.linkmesh.config.LinkMeshConfig;
import io.linkmesh.model.IdentityContext;
import io.linkmesh.model.IssuerCredential;
import io.linkmesh.model.ResolvedIdentity;
import io.linkmesh.security.CredentialVerificationException;
import io.linkmesh.security.GeneratedIdentity;
import io.linkmesh.security.IdentityGenerationException;
import io.linkmesh.security.IdentityGenerator;
import io.linkmesh.security.IdentityOptions;
import io.linkmesh.security.IssuerCredentialVerifier;
import io.linkmesh.security.PemCodec;
import io.linkmesh.security.PemFormatException;

import java.nio.charset.StandardCharsets;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decides the identity an upgrade renders.
 *
 * <p>When the stored config has no complete identity context, a new trust anchor and issuer
 * are generated. Otherwise the existing issuer secret is read and must validate against the
 * stored trust anchors; it is returned unchanged. A present identity that fails any check is
 * an error and is never regenerated.
 */
public final class IdentityReconciler {
    private final LinkMeshConfig config;
    private final PemCodec pemCodec;
    private final IdentityGenerator generator;
    private final Clock clock;

    public IdentityReconciler(LinkMeshConfig config, PemCodec pemCodec, IdentityGenerator generator, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.pemCodec = Objects.requireNonNull(pemCodec, "pemCodec");
        this.generator = Objects.requireNonNull(generator, "generator");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ResolvedIdentity resolve(
            ClusterStore store,
            IdentityState state,
            IdentityOptions options,
            int replicas
    ) throws UpgradeException {
        if (!state.isPresent()) {
            return generate(options, replicas);
        }
        IdentityContext context = state.context();
        return new ResolvedIdentity(context, fetchIssuer(store, context), replicas, ResolvedIdentity.Origin.REUSED);
    }

    private ResolvedIdentity generate(IdentityOptions options, int replicas) throws UpgradeException {
        GeneratedIdentity generated;
        try {
            generated = generator.generate(options);
        } catch (IdentityGenerationException | RuntimeException e) {
            throw new UpgradeException(ErrorKind.GENERATION,
                    "unable to generate issuer credentials: " + e.getMessage(), e);
        }
        IdentityContext context = new IdentityContext(
                generated.trustDomain(),
                generated.trustAnchorsPem(),
                options.issuanceLifetime(),
                options.clockSkewAllowance()
        );
        return new ResolvedIdentity(context, generated.issuer(), replicas, ResolvedIdentity.Origin.GENERATED);
    }

    private IssuerCredential fetchIssuer(ClusterStore store, IdentityContext context) throws UpgradeException {
        List<X509Certificate> anchors;
        try {
            anchors = pemCodec.decodeCertificates(context.trustAnchorsPem());
        } catch (PemFormatException e) {
            throw new UpgradeException(ErrorKind.MALFORMED_TRUST_ANCHORS,
                    "unable to decode the trust anchors: " + e.getMessage(), e);
        }

        Map<String, byte[]> secret;
        try {
            secret = store.readSecret(config.namespace(), config.issuerSecretName());
        } catch (UpgradeException e) {
            throw new UpgradeException(ErrorKind.FETCH,
                    "unable to fetch the existing issuer credentials from " + store.describe() + ": " + e.getMessage(), e);
        }
        String keyPem = field(secret, LinkMeshConfig.ISSUER_KEY_NAME);
        String crtPem = field(secret, LinkMeshConfig.ISSUER_CRT_NAME);

        PrivateKey key;
        X509Certificate certificate;
        try {
            key = pemCodec.decodePrivateKey(keyPem);
        } catch (PemFormatException e) {
            throw new UpgradeException(ErrorKind.MALFORMED_ISSUER_CREDENTIAL,
                    "unable to decode the issuer key: " + e.getMessage(), e);
        }
        try {
            certificate = pemCodec.decodeCertificate(crtPem);
        } catch (PemFormatException e) {
            throw new UpgradeException(ErrorKind.MALFORMED_ISSUER_CREDENTIAL,
                    "unable to decode the issuer certificate: " + e.getMessage(), e);
        }

        try {
            IssuerCredentialVerifier.verify(key, certificate, anchors, clock.instant());
        } catch (CredentialVerificationException e) {
            throw new UpgradeException(ErrorKind.INVALID_ISSUER_CREDENTIAL,
                    "invalid issuer credentials: " + e.getMessage(), e);
        }
        return new IssuerCredential(keyPem, crtPem, certificate.getNotAfter().toInstant());
    }

    private static String field(Map<String, byte[]> secret, String name) {
        byte[] value = secret.get(name);
        return value == null ? "" : new String(value, StandardCharsets.UTF_8);
    }
}
