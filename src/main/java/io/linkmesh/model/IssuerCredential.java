package io.linkmesh.model;

import java.time.Instant;
import java.util.Objects;

public record IssuerCredential(
        String keyPem,
        String crtPem,
        Instant notAfter
) {
    public IssuerCredential {
        Objects.requireNonNull(keyPem, "keyPem");
        Objects.requireNonNull(crtPem, "crtPem");
        Objects.requireNonNull(notAfter, "notAfter");
    }

    // Keep private key material out of diagnostics.
    @Override
    public String toString() {
        return "IssuerCredential[notAfter=" + notAfter + "]";
    }
}
