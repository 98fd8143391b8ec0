package com.ethnicthv.flux.core;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Opaque disposal handle returned by every subscribe-style call in Flux
 * (property subscribers, deferred subscriptions, event handlers, monitors).
 * <p>
 * Disposing runs the removal action exactly once, no matter how many threads call
 * {@link #dispose()} or how often. {@link #close()} is an alias so handles can be
 * scoped with try-with-resources.
 */
public final class Subscription implements AutoCloseable {

    private static final Subscription EMPTY = new Subscription(null);

    private final AtomicReference<Runnable> onDispose;

    private Subscription(Runnable onDispose) {
        this.onDispose = new AtomicReference<>(onDispose);
    }

    /**
     * Create a handle that runs {@code onDispose} the first time it is disposed.
     */
    public static Subscription of(Runnable onDispose) {
        return new Subscription(Objects.requireNonNull(onDispose, "onDispose"));
    }

    /**
     * A handle that has nothing to release (already disposed).
     */
    public static Subscription empty() {
        return EMPTY;
    }

    public void dispose() {
        Runnable action = onDispose.getAndSet(null);
        if (action != null) {
            action.run();
        }
    }

    public boolean isDisposed() {
        return onDispose.get() == null;
    }

    @Override
    public void close() {
        dispose();
    }
}
