package io.linkmesh.flags;

/**
 * Where a flag's current value came from, in increasing precedence.
 */
public enum FlagSource {
    DEFAULT,
    RECORDED,
    EXPLICIT
}
