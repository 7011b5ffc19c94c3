package io.linkmesh.security;

public final class CredentialVerificationException extends Exception {
    public CredentialVerificationException(String message) {
        super(message);
    }

    public CredentialVerificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
