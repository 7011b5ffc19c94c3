package io.linkmesh.util;

public final class Preconditions {
    private Preconditions() {
    }

    public static void checkState(boolean condition, String message) {
        if (!condition) {
            throw new IllegalStateException(message);
        }
    }
}
