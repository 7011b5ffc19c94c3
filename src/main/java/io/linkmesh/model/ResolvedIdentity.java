package io.linkmesh.model;

import java.util.Objects;

public record ResolvedIdentity(
        IdentityContext context,
        IssuerCredential issuer,
        int replicas,
        Origin origin
) {
    public ResolvedIdentity {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(issuer, "issuer");
        Objects.requireNonNull(origin, "origin");
        if (replicas < 1) {
            throw new IllegalArgumentException("identity replicas must be >= 1: " + replicas);
        }
    }

    public enum Origin {
        REUSED,
        GENERATED
    }
}
