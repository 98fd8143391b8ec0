package com.ethnicthv.flux.core;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class SubscriptionTest {

    @Test
    void disposeRunsActionExactlyOnce() {
        AtomicInteger calls = new AtomicInteger();
        Subscription subscription = Subscription.of(calls::incrementAndGet);

        assertFalse(subscription.isDisposed());
        subscription.dispose();
        subscription.dispose();
        subscription.close();

        assertTrue(subscription.isDisposed());
        assertEquals(1, calls.get());
    }

    @Test
    void tryWithResourcesDisposes() {
        AtomicInteger calls = new AtomicInteger();
        try (Subscription ignored = Subscription.of(calls::incrementAndGet)) {
            assertEquals(0, calls.get());
        }
        assertEquals(1, calls.get());
    }

    @Test
    void emptyIsAlreadyDisposed() {
        Subscription empty = Subscription.empty();
        assertTrue(empty.isDisposed());
        assertDoesNotThrow(empty::dispose);
    }
}
