package io.linkmesh.security;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.cert.CertPath;
import java.security.cert.CertPathValidator;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateFactory;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.PKIXParameters;
import java.security.cert.TrustAnchor;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks that an issuer key/certificate pair is usable under a set of trust anchors: the key
 * belongs to the certificate, the certificate is inside its validity window, and it chains to
 * one of the anchors. No hostname or revocation checks; these are service identities.
 */
public final class IssuerCredentialVerifier {
    private static final byte[] PROBE = "linkmesh-issuer-key-probe".getBytes(StandardCharsets.UTF_8);

    private IssuerCredentialVerifier() {
    }

    public static void verify(
            PrivateKey key,
            X509Certificate certificate,
            List<X509Certificate> trustAnchors,
            Instant now
    ) throws CredentialVerificationException {
        if (key == null || certificate == null) {
            throw new CredentialVerificationException("issuer key and certificate are required");
        }
        if (trustAnchors == null || trustAnchors.isEmpty()) {
            throw new CredentialVerificationException("no trust anchors to verify against");
        }
        verifyKeyMatches(key, certificate.getPublicKey());
        try {
            certificate.checkValidity(Date.from(now));
        } catch (CertificateExpiredException e) {
            throw new CredentialVerificationException(
                    "issuer certificate expired at " + certificate.getNotAfter().toInstant(), e);
        } catch (CertificateNotYetValidException e) {
            throw new CredentialVerificationException(
                    "issuer certificate not valid before " + certificate.getNotBefore().toInstant(), e);
        }
        // The issuer may itself be one of the anchors (self-signed root used as issuer).
        if (trustAnchors.contains(certificate)) {
            return;
        }
        Set<TrustAnchor> anchors = new LinkedHashSet<>();
        for (X509Certificate anchor : trustAnchors) {
            anchors.add(new TrustAnchor(anchor, null));
        }
        try {
            PKIXParameters params = new PKIXParameters(anchors);
            params.setRevocationEnabled(false);
            params.setDate(Date.from(now));
            CertPath path = CertificateFactory.getInstance("X.509").generateCertPath(List.of(certificate));
            CertPathValidator.getInstance("PKIX").validate(path, params);
        } catch (GeneralSecurityException e) {
            throw new CredentialVerificationException(
                    "issuer certificate does not chain to the trust anchors: " + e.getMessage(), e);
        }
    }

    private static void verifyKeyMatches(PrivateKey key, PublicKey publicKey) throws CredentialVerificationException {
        String algorithm = signatureAlgorithm(key);
        try {
            Signature signer = Signature.getInstance(algorithm);
            signer.initSign(key);
            signer.update(PROBE);
            byte[] signature = signer.sign();

            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(publicKey);
            verifier.update(PROBE);
            if (!verifier.verify(signature)) {
                throw new CredentialVerificationException("issuer private key does not match certificate");
            }
        } catch (GeneralSecurityException e) {
            throw new CredentialVerificationException(
                    "issuer private key does not match certificate: " + e.getMessage(), e);
        }
    }

    private static String signatureAlgorithm(PrivateKey key) throws CredentialVerificationException {
        String algorithm = key.getAlgorithm() == null ? "" : key.getAlgorithm().toUpperCase(Locale.ROOT);
        return switch (algorithm) {
            case "EC", "ECDSA" -> "SHA256withECDSA";
            case "RSA" -> "SHA256withRSA";
            case "ED25519", "EDDSA" -> "Ed25519";
            default -> throw new CredentialVerificationException("unsupported issuer key algorithm: " + algorithm);
        };
    }
}
