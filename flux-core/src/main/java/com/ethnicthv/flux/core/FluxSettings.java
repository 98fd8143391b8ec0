package com.ethnicthv.flux.core;

import java.util.Objects;

/**
 * Immutable runtime settings of one Flux instance, produced by {@code Flux.Builder}.
 *
 * @param maxMainThreadActionsPerTick upper bound of queued main-thread actions executed per tick
 * @param eventSubscriberSoftLimit    per event type subscriber count above which a leak warning is logged
 * @param tickRate                    fixed update rate of the game loop in Hz
 * @param threadingMode               how notifications reach the main execution context
 * @param converterDiscovery          whether generated converter indices are loaded through ServiceLoader
 */
public record FluxSettings(int maxMainThreadActionsPerTick,
                           int eventSubscriberSoftLimit,
                           float tickRate,
                           ThreadingMode threadingMode,
                           boolean converterDiscovery) {

    public static final int DEFAULT_MAX_MAIN_THREAD_ACTIONS_PER_TICK = 100;
    public static final int DEFAULT_EVENT_SUBSCRIBER_SOFT_LIMIT = 100;
    public static final float DEFAULT_TICK_RATE = 60.0f;

    public FluxSettings {
        Objects.requireNonNull(threadingMode, "threadingMode");
        if (maxMainThreadActionsPerTick <= 0) {
            throw new IllegalArgumentException("maxMainThreadActionsPerTick must be > 0, got " + maxMainThreadActionsPerTick);
        }
        if (eventSubscriberSoftLimit <= 0) {
            throw new IllegalArgumentException("eventSubscriberSoftLimit must be > 0, got " + eventSubscriberSoftLimit);
        }
        if (!(tickRate > 0f)) {
            throw new IllegalArgumentException("tickRate must be > 0, got " + tickRate);
        }
    }

    public static FluxSettings defaults() {
        return new FluxSettings(
                DEFAULT_MAX_MAIN_THREAD_ACTIONS_PER_TICK,
                DEFAULT_EVENT_SUBSCRIBER_SOFT_LIMIT,
                DEFAULT_TICK_RATE,
                ThreadingMode.MAIN_THREAD_QUEUE,
                true
        );
    }

    /**
     * Defines how work submitted from other threads reaches the main execution context.
     */
    public enum ThreadingMode {
        /**
         * Off-thread work is queued and drained once per tick by the owning thread.
         * Use for: running games, anything driven by a {@code GameLoop}.
         */
        MAIN_THREAD_QUEUE,

        /**
         * Everything runs inline on the calling thread.
         * Use for: unit tests and tools without a loop.
         */
        IMMEDIATE
    }
}
