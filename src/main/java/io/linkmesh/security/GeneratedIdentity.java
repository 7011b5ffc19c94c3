package io.linkmesh.security;

import io.linkmesh.model.IssuerCredential;

import java.util.Objects;

public record GeneratedIdentity(
        String trustDomain,
        String trustAnchorsPem,
        IssuerCredential issuer
) {
    public GeneratedIdentity {
        if (trustDomain == null || trustDomain.isBlank()) {
            throw new IllegalArgumentException("generated trust domain must not be blank");
        }
        if (trustAnchorsPem == null || trustAnchorsPem.isBlank()) {
            throw new IllegalArgumentException("generated trust anchors must not be blank");
        }
        Objects.requireNonNull(issuer, "issuer");
    }
}
