package io.linkmesh.security;

/**
 * Mints a brand-new trust anchor and issuer credential.
 */
public interface IdentityGenerator {
    GeneratedIdentity generate(IdentityOptions options) throws IdentityGenerationException;
}
