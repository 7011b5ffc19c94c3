package io.linkmesh.security;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.security.PrivateKey;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * BouncyCastle-backed PEM handling. Decoded certificates and keys are produced by the default
 * JCA providers so they can be handed straight to the JDK's PKIX validator.
 */
public final class BouncyCastlePemCodec implements PemCodec {
    private final JcaX509CertificateConverter certificateConverter = new JcaX509CertificateConverter();
    private final JcaPEMKeyConverter keyConverter = new JcaPEMKeyConverter();

    @Override
    public List<X509Certificate> decodeCertificates(String pem) throws PemFormatException {
        if (pem == null || pem.isBlank()) {
            throw new PemFormatException("no PEM certificate data");
        }
        List<X509Certificate> out = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof X509CertificateHolder holder) {
                    out.add(certificateConverter.getCertificate(holder));
                }
            }
        } catch (IOException | CertificateException | RuntimeException e) {
            throw new PemFormatException("failed to decode PEM certificate: " + e.getMessage(), e);
        }
        if (out.isEmpty()) {
            throw new PemFormatException("no certificate found in PEM data");
        }
        return out;
    }

    @Override
    public X509Certificate decodeCertificate(String pem) throws PemFormatException {
        return decodeCertificates(pem).get(0);
    }

    @Override
    public PrivateKey decodePrivateKey(String pem) throws PemFormatException {
        if (pem == null || pem.isBlank()) {
            throw new PemFormatException("no PEM private key data");
        }
        try (PEMParser parser = new PEMParser(new StringReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof PEMKeyPair keyPair) {
                    return keyConverter.getKeyPair(keyPair).getPrivate();
                }
                if (object instanceof PrivateKeyInfo info) {
                    return keyConverter.getPrivateKey(info);
                }
                if (object instanceof PEMEncryptedKeyPair) {
                    throw new PemFormatException("encrypted private keys are not supported");
                }
            }
        } catch (IOException | RuntimeException e) {
            throw new PemFormatException("failed to decode PEM private key: " + e.getMessage(), e);
        }
        throw new PemFormatException("no private key found in PEM data");
    }

    @Override
    public String encodeCertificate(X509Certificate certificate) {
        return write(certificate);
    }

    @Override
    public String encodePrivateKey(PrivateKey key) {
        return write(key);
    }

    private static String write(Object object) {
        StringWriter out = new StringWriter();
        try (JcaPEMWriter writer = new JcaPEMWriter(out)) {
            writer.writeObject(object);
        } catch (IOException e) {
            throw new RuntimeException("Failed to encode PEM object", e);
        }
        return out.toString();
    }
}
