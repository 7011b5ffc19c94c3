package io.linkmesh.security;

public final class IdentityGenerationException extends Exception {
    public IdentityGenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
