package io.linkmesh.security;

import java.time.Duration;

/**
 * Inputs for minting a new trust anchor and issuer credential.
 */
public record IdentityOptions(
        String trustDomain,
        Duration issuanceLifetime,
        Duration clockSkewAllowance,
        Duration issuerCertificateLifetime
) {
    public IdentityOptions {
        if (trustDomain == null || trustDomain.isBlank()) {
            throw new IllegalArgumentException("identity trust domain must not be blank");
        }
        trustDomain = trustDomain.trim();
        requirePositive(issuanceLifetime, "identity issuance lifetime");
        requireNonNegative(clockSkewAllowance, "identity clock skew allowance");
        requirePositive(issuerCertificateLifetime, "identity issuer certificate lifetime");
    }

    private static void requirePositive(Duration value, String field) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }

    private static void requireNonNegative(Duration value, String field) {
        if (value == null || value.isNegative()) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
