package com.ethnicthv.flux.core.properties;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ComputedProperty")
public class ComputedPropertyTest {

    @Test
    @DisplayName("Sum of two cells is recomputed lazily after a source changes")
    void lazySum() {
        ReactiveProperty<Integer> a = ReactiveProperty.of(2);
        ReactiveProperty<Integer> b = ReactiveProperty.of(3);
        AtomicInteger computations = new AtomicInteger();
        ComputedProperty<Integer> sum = new ComputedProperty<>(Integer.class, () -> {
            computations.incrementAndGet();
            return a.getValue() + b.getValue();
        }).dependsOn(a, b);

        assertEquals(0, computations.get(), "Nothing computed before the first read");
        assertEquals(5, sum.getValue());
        assertEquals(5, sum.getValue());
        assertEquals(1, computations.get());

        a.setValue(4);
        assertTrue(sum.isDirty());
        assertEquals(1, computations.get(), "Invalidation does not recompute eagerly");
        assertEquals(7, sum.getValue());
        assertEquals(2, computations.get());
    }

    @Test
    @DisplayName("Subscribers are notified on changed recomputations only, never for the baseline")
    void notifiesOnlyOnChange() {
        ReactiveProperty<Integer> x = ReactiveProperty.of(3);
        ComputedProperty<Boolean> positive = new ComputedProperty<>(Boolean.class, () -> x.getValue() > 0).dependsOn(x);
        List<String> pairs = new ArrayList<>();
        positive.subscribe((oldValue, newValue) -> pairs.add(oldValue + "->" + newValue));

        assertTrue(positive.getValue());
        assertTrue(pairs.isEmpty(), "First computation establishes the baseline silently");

        x.setValue(5);
        assertTrue(positive.recompute());
        assertTrue(pairs.isEmpty(), "Equal result does not notify");

        x.setValue(-1);
        assertFalse(positive.getValue());
        assertEquals(List.of("true->false"), pairs);
    }

    @Test
    @DisplayName("Fire-on-subscribe triggers the first computation and delivers it")
    void fireOnSubscribeComputes() {
        ComputedProperty<String> greeting = new ComputedProperty<>(String.class, () -> "hello");
        List<Object> received = new ArrayList<>();
        greeting.subscribeObject(v -> received.add(v), true);
        assertEquals(List.of("hello"), received);
    }

    @Test
    @DisplayName("Writes are rejected")
    void readOnly() {
        ComputedProperty<Integer> constant = new ComputedProperty<>(Integer.class, () -> 1);
        assertThrows(UnsupportedOperationException.class, () -> constant.setBoxedValue(2));
        assertThrows(UnsupportedOperationException.class, () -> constant.setBoxedValue(2, true));
    }

    @Test
    @DisplayName("A failing computation propagates and leaves the cached value untouched")
    void computationFaults() {
        ReactiveProperty<Integer> divisor = ReactiveProperty.of(2);
        ComputedProperty<Integer> half = new ComputedProperty<>(Integer.class, () -> 10 / divisor.getValue())
                .dependsOn(divisor);
        assertEquals(5, half.getValue());

        divisor.setValue(0);
        ComputationException ex = assertThrows(ComputationException.class, half::getValue);
        assertInstanceOf(ArithmeticException.class, ex.getCause());
        assertTrue(half.isDirty());

        divisor.setValue(5);
        assertEquals(2, half.getValue());
    }

    @Test
    @DisplayName("Dispose releases the subscriptions on the sources")
    void disposeReleasesSources() {
        ReactiveProperty<Integer> a = ReactiveProperty.of(1);
        ComputedProperty<Integer> doubled = new ComputedProperty<>(Integer.class, () -> a.getValue() * 2).dependsOn(a);
        assertEquals(1, a.getSubscriberCount());

        doubled.dispose();
        assertEquals(0, a.getSubscriberCount());
        assertTrue(doubled.isDisposed());
    }

    @Test
    @DisplayName("An invalidation racing a computation keeps the cell dirty")
    void invalidationDuringComputation() throws Exception {
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        ComputedProperty<Integer> slow = new ComputedProperty<>(Integer.class, () -> {
            int run = runs.incrementAndGet();
            if (run == 1) {
                computing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return run;
        });

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> first = executor.submit(slow::getValue);
            assertTrue(computing.await(5, TimeUnit.SECONDS));
            slow.invalidate();
            release.countDown();

            assertEquals(1, first.get(5, TimeUnit.SECONDS));
            assertTrue(slow.isDirty(), "Result of the stale computation must not clear the dirty flag");
            assertEquals(2, slow.getValue());
            assertFalse(slow.isDirty());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A computation overtaken by a newer one neither overwrites the cache nor notifies")
    void staleComputationFinishingLast() throws Exception {
        ReactiveProperty<Integer> source = ReactiveProperty.of(1);
        CountDownLatch computing = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger runs = new AtomicInteger();
        ComputedProperty<Integer> mirror = new ComputedProperty<>(Integer.class, () -> {
            int seen = source.getValue();
            if (runs.incrementAndGet() == 1) {
                computing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            return seen;
        }).dependsOn(source);
        List<String> changes = new ArrayList<>();
        mirror.subscribe((oldValue, newValue) -> changes.add(oldValue + "->" + newValue));

        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> slow = executor.submit(mirror::getValue);
            assertTrue(computing.await(5, TimeUnit.SECONDS));

            source.setValue(2);
            assertEquals(2, mirror.getValue());
            assertFalse(mirror.isDirty());

            release.countDown();
            assertEquals(1, slow.get(5, TimeUnit.SECONDS));

            assertEquals(2, mirror.getValue());
            assertFalse(mirror.isDirty());
            assertEquals(2, runs.get());
            assertTrue(changes.isEmpty(), "No reverse change may be reported: " + changes);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("A failing computation during fire-on-subscribe leaves no registration behind")
    void failingComputationOnSubscribe() {
        ComputedProperty<Integer> broken = new ComputedProperty<>(Integer.class, () -> {
            throw new ArithmeticException("/ by zero");
        });
        List<Integer> seen = new ArrayList<>();

        assertThrows(ComputationException.class, () -> broken.subscribe(v -> seen.add(v), true));
        assertThrows(ComputationException.class, () -> broken.subscribeObject(v -> seen.add((Integer) v), true));

        assertEquals(0, broken.getSubscriberCount());
        assertTrue(broken.isDirty());
        assertTrue(seen.isEmpty());
    }
}
