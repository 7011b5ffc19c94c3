package io.linkmesh.upgrade;

import io.linkmesh.model.IdentityContext;

import java.util.Objects;

/**
 * Either no usable identity ({@link #absent()}) or a context whose trust domain and trust
 * anchors are both non-empty. A partially populated context can only be absent. Values are
 * kept exactly as stored; whitespace-only anchors are present and fail to decode later.
 */
public final class IdentityState {
    private static final IdentityState ABSENT = new IdentityState(null);

    private final IdentityContext context;

    private IdentityState(IdentityContext context) {
        this.context = context;
    }

    public static IdentityState absent() {
        return ABSENT;
    }

    public static IdentityState present(IdentityContext context) {
        Objects.requireNonNull(context, "context");
        if (!isComplete(context)) {
            throw new IllegalArgumentException("identity context needs both a trust domain and trust anchors");
        }
        return new IdentityState(context);
    }

    public static IdentityState from(IdentityContext context) {
        return isComplete(context) ? present(context) : ABSENT;
    }

    public boolean isPresent() {
        return context != null;
    }

    public IdentityContext context() {
        if (context == null) {
            throw new IllegalStateException("identity is absent");
        }
        return context;
    }

    private static boolean isComplete(IdentityContext context) {
        return context != null
                && !context.trustDomain().isEmpty()
                && !context.trustAnchorsPem().isEmpty();
    }

    @Override
    public String toString() {
        return context == null ? "IdentityState[absent]" : "IdentityState[present, trustDomain=" + context.trustDomain() + "]";
    }
}
