package com.ethnicthv.flux.core.system;

import com.ethnicthv.flux.core.threading.MainThreadMarshaller;

import java.util.Objects;

/**
 * Drains the {@link MainThreadMarshaller} once per frame. Registered by {@code Flux} in the
 * {@link SystemGroup#INPUT} group, the first variable phase, so notifications marshalled during
 * the fixed steps are delivered within the same frame.
 */
public final class MainThreadDispatchSystem extends BaseSystem {

    private final MainThreadMarshaller marshaller;
    private long executedActions;

    public MainThreadDispatchSystem(MainThreadMarshaller marshaller) {
        this.marshaller = Objects.requireNonNull(marshaller, "marshaller");
    }

    @Override
    public void onUpdate(float deltaTime) {
        executedActions += marshaller.drain();
    }

    /** Total number of actions drained since registration. */
    public long getExecutedActions() {
        return executedActions;
    }
}
