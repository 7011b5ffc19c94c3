package io.linkmesh.security;

import io.linkmesh.model.IssuerCredential;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509ExtensionUtils;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.math.BigInteger;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * Generates a self-signed ECDSA P-256 root that serves both as the trust anchor and as the
 * issuer credential. The certificate is backdated by the clock skew allowance and expires
 * {@link IdentityOptions#issuerCertificateLifetime()} after generation.
 */
public final class BouncyCastleIdentityGenerator implements IdentityGenerator {
    private static final String CURVE = "secp256r1";
    private static final String SIGNATURE_ALGORITHM = "SHA256withECDSA";

    private final String namespace;
    private final PemCodec pemCodec;
    private final Clock clock;
    private final SecureRandom random;

    public BouncyCastleIdentityGenerator(String namespace, PemCodec pemCodec, Clock clock) {
        this(namespace, pemCodec, clock, new SecureRandom());
    }

    public BouncyCastleIdentityGenerator(String namespace, PemCodec pemCodec, Clock clock, SecureRandom random) {
        this.namespace = Objects.requireNonNull(namespace, "namespace");
        this.pemCodec = Objects.requireNonNull(pemCodec, "pemCodec");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.random = Objects.requireNonNull(random, "random");
    }

    public static String issuerName(String namespace, String trustDomain) {
        return "identity." + namespace + "." + trustDomain;
    }

    @Override
    public GeneratedIdentity generate(IdentityOptions options) throws IdentityGenerationException {
        Objects.requireNonNull(options, "options");
        try {
            KeyPairGenerator keyPairGenerator = KeyPairGenerator.getInstance("EC");
            keyPairGenerator.initialize(new ECGenParameterSpec(CURVE), random);
            KeyPair keyPair = keyPairGenerator.generateKeyPair();

            Instant now = clock.instant();
            X500Name subject = new X500Name("CN=" + issuerName(namespace, options.trustDomain()));
            // Positive, non-zero 127-bit serial.
            BigInteger serial = new BigInteger(127, random).add(BigInteger.ONE);
            X509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    subject,
                    serial,
                    Date.from(now.minus(options.clockSkewAllowance())),
                    Date.from(now.plus(options.issuerCertificateLifetime())),
                    subject,
                    keyPair.getPublic()
            );
            JcaX509ExtensionUtils extensionUtils = new JcaX509ExtensionUtils();
            builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
            builder.addExtension(Extension.keyUsage, true,
                    new KeyUsage(KeyUsage.keyCertSign | KeyUsage.cRLSign | KeyUsage.digitalSignature));
            builder.addExtension(Extension.subjectKeyIdentifier, false,
                    extensionUtils.createSubjectKeyIdentifier(keyPair.getPublic()));

            ContentSigner signer = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).build(keyPair.getPrivate());
            X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(builder.build(signer));

            String crtPem = pemCodec.encodeCertificate(certificate);
            String keyPem = pemCodec.encodePrivateKey(keyPair.getPrivate());
            return new GeneratedIdentity(
                    options.trustDomain(),
                    crtPem,
                    new IssuerCredential(keyPem, crtPem, certificate.getNotAfter().toInstant())
            );
        } catch (Exception e) {
            throw new IdentityGenerationException("failed to generate issuer credentials: " + e.getMessage(), e);
        }
    }
}
