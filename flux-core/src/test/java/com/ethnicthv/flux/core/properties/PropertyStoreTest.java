package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.Subscription;
import com.ethnicthv.flux.core.events.EventBus;
import com.ethnicthv.flux.core.events.PropertyChangedEvent;
import com.ethnicthv.flux.core.threading.ImmediateThreadMarshaller;
import com.ethnicthv.flux.core.threading.MainThreadMarshaller;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PropertyStore")
public class PropertyStoreTest {

    private EventBus bus;
    private PropertyStore store;

    @BeforeEach
    void setUp() {
        ImmediateThreadMarshaller marshaller = new ImmediateThreadMarshaller();
        bus = new EventBus(marshaller);
        store = new PropertyStore(marshaller, bus);
    }

    @Test
    @DisplayName("Health scenario: typed and old+new subscribers plus a PropertyChangedEvent")
    void healthScenario() {
        ReactiveProperty<Integer> health = store.getOrCreateProperty("health", 100);
        List<Integer> typed = new ArrayList<>();
        List<String> pairs = new ArrayList<>();
        List<PropertyChangedEvent> events = new ArrayList<>();
        health.subscribe(v -> typed.add(v));
        health.subscribe((oldValue, newValue) -> pairs.add(oldValue + "->" + newValue));
        bus.subscribe(PropertyChangedEvent.class, e -> events.add(e));

        health.setValue(80);

        assertEquals(List.of(80), typed);
        assertEquals(List.of("100->80"), pairs);
        assertEquals(1, events.size());
        PropertyChangedEvent event = events.get(0);
        assertEquals("health", event.getPropertyKey());
        assertEquals(100, event.getOldValue());
        assertEquals(80, event.getNewValue());
        assertEquals(Integer.class, event.getValueType());
        assertEquals(PropertyChangedEvent.SOURCE, event.getSource());
    }

    @Test
    @DisplayName("getOrCreateProperty returns the existing cell and rejects other types")
    void getOrCreate() {
        ReactiveProperty<Integer> first = store.getOrCreateProperty("score", Integer.class, 0);
        ReactiveProperty<Integer> second = store.getOrCreateProperty("score", Integer.class, 99);

        assertSame(first, second);
        assertEquals(0, second.getValue());

        PropertyTypeMismatchException ex = assertThrows(PropertyTypeMismatchException.class,
                () -> store.getOrCreateProperty("score", "zero"));
        assertEquals("score", ex.getKey());
        assertEquals(String.class, ex.getExpectedType());
        assertEquals(Integer.class, ex.getActualType());
    }

    @Test
    @DisplayName("getOrCreateProperty refuses to hand out a computed cell as mutable")
    void getOrCreateRejectsComputed() {
        store.registerProperty("total", new ComputedProperty<>(Integer.class, () -> 3), false);
        assertThrows(PropertyTypeMismatchException.class, () -> store.getOrCreateProperty("total", Integer.class, 0));
    }

    @Test
    @DisplayName("Lookups: null on miss, typed lookup fails with dedicated exceptions")
    void lookups() {
        assertNull(store.getProperty("missing"));
        assertThrows(PropertyNotFoundException.class, () -> store.getProperty("missing", Integer.class));

        ReactiveProperty<String> name = ReactiveProperty.of("Ada");
        store.registerProperty("name", name, true);

        assertSame(name, store.getProperty("name"));
        assertSame(name, store.getProperty("name", String.class));
        assertThrows(PropertyTypeMismatchException.class, () -> store.getProperty("name", Integer.class));
        assertTrue(store.hasProperty("name"));
        assertTrue(store.isPersistent("name"));
        assertEquals("name", store.getKey(name));
    }

    @Test
    @DisplayName("Deferred subscription resolves exactly once at the next registration")
    void deferredResolution() {
        List<IReactiveProperty<?>> resolved = new ArrayList<>();
        store.subscribeDeferred("mana", p -> resolved.add(p));
        assertTrue(resolved.isEmpty());

        ReactiveProperty<Integer> mana = ReactiveProperty.of(50);
        store.registerProperty("mana", mana, false);
        store.registerProperty("mana", ReactiveProperty.of(10), false);

        assertEquals(1, resolved.size());
        assertSame(mana, resolved.get(0));
    }

    @Test
    @DisplayName("Deferred subscription on a present key runs immediately")
    void deferredImmediate() {
        ReactiveProperty<Integer> mana = store.getOrCreateProperty("mana", 50);
        List<IReactiveProperty<?>> resolved = new ArrayList<>();

        Subscription subscription = store.subscribeDeferred("mana", p -> resolved.add(p));

        assertEquals(List.of(mana), resolved);
        assertTrue(subscription.isDisposed());
    }

    @Test
    @DisplayName("Disposing a pending deferred subscription cancels it")
    void deferredCancellation() {
        AtomicInteger calls = new AtomicInteger();
        Subscription subscription = store.subscribeDeferred("later", p -> calls.incrementAndGet());
        subscription.dispose();

        store.registerProperty("later", ReactiveProperty.of(1), false);
        assertEquals(0, calls.get());
    }

    @Test
    @DisplayName("A failing deferred callback does not affect registration or other callbacks")
    void deferredFaultIsolation() {
        AtomicInteger calls = new AtomicInteger();
        store.subscribeDeferred("k", p -> {
            throw new IllegalStateException("callback bug");
        });
        store.subscribeDeferred("k", p -> calls.incrementAndGet());

        assertDoesNotThrow(() -> store.registerProperty("k", ReactiveProperty.of(1), false));
        assertEquals(1, calls.get());
        assertTrue(store.hasProperty("k"));
    }

    @Test
    @DisplayName("Registration listeners see every registration before deferred callbacks")
    void registrationListeners() {
        List<String> order = new ArrayList<>();
        Subscription listener = store.addRegistrationListener((key, p) -> order.add("listener:" + key));
        store.subscribeDeferred("a", p -> order.add("deferred:a"));

        store.registerProperty("a", ReactiveProperty.of(1), false);
        store.getOrCreateProperty("b", 2);
        store.getOrCreateProperty("b", 3);
        listener.dispose();
        store.registerProperty("c", ReactiveProperty.of(1), false);

        assertEquals(List.of("listener:a", "deferred:a", "listener:b"), order);
    }

    @Test
    @DisplayName("Re-registration replaces the record and detaches the previous cell")
    void reRegistrationReplaces() {
        ReactiveProperty<Integer> oldCell = ReactiveProperty.of(1);
        ReactiveProperty<Integer> newCell = ReactiveProperty.of(2);
        List<String> keys = new ArrayList<>();
        bus.subscribe(PropertyChangedEvent.class, e -> keys.add(e.getPropertyKey() + "=" + e.getNewValue()));

        store.registerProperty("slot", oldCell, true);
        store.registerProperty("slot", newCell, false);

        assertSame(newCell, store.getProperty("slot"));
        assertFalse(store.isPersistent("slot"));
        assertNull(store.getKey(oldCell));

        oldCell.setValue(10);
        newCell.setValue(20);
        assertEquals(List.of("slot=20"), keys);
    }

    @Test
    @DisplayName("Unregistering stops change events for the cell")
    void unregister() {
        ReactiveProperty<Integer> cell = store.getOrCreateProperty("gold", 0);
        AtomicInteger events = new AtomicInteger();
        bus.subscribe(PropertyChangedEvent.class, e -> events.incrementAndGet());

        cell.setValue(1);
        assertTrue(store.unregisterProperty("gold"));
        assertFalse(store.unregisterProperty("gold"));
        cell.setValue(2);

        assertEquals(1, events.get());
        assertNull(store.getKey(cell));
        assertFalse(store.hasProperty("gold"));
    }

    @Test
    @DisplayName("clearNonPersistentProperties keeps persistent entries only")
    void clearNonPersistent() {
        store.registerProperty("settings.volume", ReactiveProperty.of(0.8f), true);
        store.registerProperty("level.timer", ReactiveProperty.of(30), false);
        store.registerProperty("level.enemies", ReactiveProperty.of(5), false);

        assertEquals(2, store.clearNonPersistentProperties());

        assertEquals(Set.of("settings.volume"), store.getAllPropertyKeys());
        assertEquals(Set.of("settings.volume"), store.getPersistentPropertyKeys());
        assertEquals(1, store.getPropertyCount());

        store.clear();
        assertEquals(0, store.getPropertyCount());
    }

    @Test
    @DisplayName("Attached cells notify through the store's marshaller when written off the main thread")
    void attachedCellsAreMarshalled() throws Exception {
        MainThreadMarshaller marshaller = new MainThreadMarshaller();
        EventBus liveBus = new EventBus(marshaller);
        PropertyStore liveStore = new PropertyStore(marshaller, liveBus);
        ReactiveProperty<Integer> health = liveStore.getOrCreateProperty("health", 100);
        List<Thread> subscriberThreads = Collections.synchronizedList(new ArrayList<>());
        List<Thread> handlerThreads = Collections.synchronizedList(new ArrayList<>());
        health.subscribe(v -> subscriberThreads.add(Thread.currentThread()));
        liveBus.subscribe(PropertyChangedEvent.class, e -> handlerThreads.add(Thread.currentThread()));

        Thread writer = new Thread(() -> health.setValue(80), "writer");
        writer.start();
        writer.join(5_000);

        assertEquals(80, health.getValue(), "Value is visible immediately");
        assertTrue(subscriberThreads.isEmpty());
        assertTrue(handlerThreads.isEmpty());

        assertEquals(2, marshaller.drain());
        assertEquals(List.of(Thread.currentThread()), subscriberThreads);
        assertEquals(List.of(Thread.currentThread()), handlerThreads);
    }

    @Test
    @DisplayName("A disposed cell still registered ignores writes and publishes nothing")
    void disposedCellIgnoresWrites() {
        ReactiveProperty<Integer> ammo = store.getOrCreateProperty("ammo", 30);
        List<PropertyChangedEvent> events = new ArrayList<>();
        bus.subscribe(PropertyChangedEvent.class, e -> events.add(e));

        ammo.dispose();
        ammo.setValue(29);
        ammo.setValue(29, true);

        assertFalse(ammo.setBoxedValue(28));
        assertEquals(30, ammo.getValue());
        assertTrue(events.isEmpty());
        assertTrue(store.hasProperty("ammo"));
    }
}
