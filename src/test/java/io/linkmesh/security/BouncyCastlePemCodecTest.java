package io.linkmesh.security;

import io.linkmesh.testing.ControlPlaneFixtures;
import org.junit.jupiter.api.Test;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class BouncyCastlePemCodecTest {
    private final BouncyCastlePemCodec codec = new BouncyCastlePemCodec();

    @Test
    void decodesEveryCertificateInABundle() throws Exception {
        GeneratedIdentity first = ControlPlaneFixtures.generateIdentity("one.org");
        GeneratedIdentity second = ControlPlaneFixtures.generateIdentity("two.org");

        List<X509Certificate> certificates = codec.decodeCertificates(first.trustAnchorsPem() + second.trustAnchorsPem());

        assertEquals(2, certificates.size());
        assertEquals("CN=identity.linkmesh.one.org", certificates.get(0).getSubjectX500Principal().getName());
        assertEquals("CN=identity.linkmesh.two.org", certificates.get(1).getSubjectX500Principal().getName());
    }

    @Test
    void decodedKeyIsUsableWithItsCertificate() throws Exception {
        GeneratedIdentity identity = ControlPlaneFixtures.generateIdentity("example.org");

        PrivateKey key = codec.decodePrivateKey(identity.issuer().keyPem());
        X509Certificate certificate = codec.decodeCertificate(identity.issuer().crtPem());

        assertEquals("EC", key.getAlgorithm());
        assertTrue(identity.issuer().keyPem().contains("PRIVATE KEY-----"));
        IssuerCredentialVerifier.verify(key, certificate, List.of(certificate), java.time.Instant.now());
    }

    @Test
    void rejectsInputWithoutTheExpectedBlock() throws Exception {
        GeneratedIdentity identity = ControlPlaneFixtures.generateIdentity("example.org");

        assertThrows(PemFormatException.class, () -> codec.decodeCertificates(""));
        assertThrows(PemFormatException.class, () -> codec.decodeCertificates("hello"));
        assertThrows(PemFormatException.class, () -> codec.decodeCertificates(identity.issuer().keyPem()));
        assertThrows(PemFormatException.class, () -> codec.decodePrivateKey(identity.issuer().crtPem()));
        assertThrows(PemFormatException.class, () -> codec.decodePrivateKey(null));
    }

    @Test
    void rejectsCorruptedBase64() {
        String corrupted = "-----BEGIN CERTIFICATE-----\n!!!notbase64!!!\n-----END CERTIFICATE-----\n";

        assertThrows(PemFormatException.class, () -> codec.decodeCertificate(corrupted));
    }
}
