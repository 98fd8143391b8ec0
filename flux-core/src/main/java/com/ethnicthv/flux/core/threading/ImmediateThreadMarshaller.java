package com.ethnicthv.flux.core.threading;

import java.util.Objects;

/**
 * Marshaller that treats every thread as the main thread and runs actions inline.
 * Intended for tests and tools that have no loop.
 */
public final class ImmediateThreadMarshaller implements ThreadMarshaller {

    @Override
    public void executeOnMainThread(Runnable action) {
        Objects.requireNonNull(action, "action").run();
    }

    @Override
    public boolean isMainThread() {
        return true;
    }
}
