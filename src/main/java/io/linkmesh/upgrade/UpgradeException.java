package io.linkmesh.upgrade;

import java.util.Objects;

/**
 * An environment or input condition that stops an upgrade run. Caller bugs are reported with
 * {@link IllegalStateException} instead.
 */
public final class UpgradeException extends Exception {
    private final ErrorKind kind;

    public UpgradeException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public UpgradeException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind kind() {
        return kind;
    }
}
