package io.linkmesh.model;

/**
 * Marker section; its presence in the global config enables proxy auto-injection.
 */
public record AutoInjectContext() {
}
