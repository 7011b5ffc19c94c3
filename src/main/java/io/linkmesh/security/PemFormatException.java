package io.linkmesh.security;

public final class PemFormatException extends Exception {
    public PemFormatException(String message) {
        super(message);
    }

    public PemFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
