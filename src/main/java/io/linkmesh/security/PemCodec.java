package io.linkmesh.security;

import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;

/**
 * PEM and X.509 primitives used by identity reconciliation.
 */
public interface PemCodec {

    /**
     * Decodes every certificate block in {@code pem}. Fails when there is none.
     */
    List<X509Certificate> decodeCertificates(String pem) throws PemFormatException;

    /**
     * Decodes the first certificate block in {@code pem}.
     */
    X509Certificate decodeCertificate(String pem) throws PemFormatException;

    PrivateKey decodePrivateKey(String pem) throws PemFormatException;

    String encodeCertificate(X509Certificate certificate);

    String encodePrivateKey(PrivateKey key);
}
