package com.ethnicthv.flux.core.threading;

/**
 * Routes work onto the single main execution context (the thread that ticks the game loop).
 * <p>
 * Reactive properties and the event bus deliver notifications through a marshaller so that
 * subscribers always observe changes on the main thread, whichever thread produced them.
 */
public interface ThreadMarshaller {

    /**
     * Run {@code action} on the main execution context. Implementations may run it inline
     * when the caller already is on that context.
     */
    void executeOnMainThread(Runnable action);

    /** Whether the calling thread is the main execution context. */
    boolean isMainThread();

    /**
     * Make the calling thread the main execution context. Called by the game loop when it
     * starts on its own thread. No-op for marshallers without a notion of thread ownership.
     */
    default void bindToCurrentThread() {
    }
}
