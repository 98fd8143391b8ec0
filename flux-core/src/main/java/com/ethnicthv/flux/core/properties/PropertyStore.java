package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.Subscription;
import com.ethnicthv.flux.core.events.EventBus;
import com.ethnicthv.flux.core.events.PropertyChangedEvent;
import com.ethnicthv.flux.core.threading.ThreadMarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Thread-safe keyed registry of reactive properties.
 * <p>
 * The store owns both directions of the mapping: key to {@link PropertyRecord} and cell to key.
 * Registered cells are attached to the store, which routes their notifications through the
 * store's {@link ThreadMarshaller} and publishes a {@link PropertyChangedEvent} for every change.
 * <p>
 * Registration, unregistration and deferred-subscription bookkeeping are serialized by a single
 * registration lock, so a deferred subscription is resolved exactly once by the registration
 * that follows it. Registration listeners and deferred callbacks always run after that lock
 * has been released. Lookups are lock-free.
 */
public class PropertyStore {

    private static final Logger log = LoggerFactory.getLogger(PropertyStore.class);

    private final ThreadMarshaller marshaller;
    private final EventBus eventBus;

    private final ConcurrentHashMap<String, PropertyRecord> records = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<IReactiveProperty<?>, String> keysByProperty = new ConcurrentHashMap<>();
    // guarded by registrationLock
    private final Map<String, List<DeferredSubscription>> pending = new HashMap<>();
    private final CopyOnWriteArrayList<ListenerSlot> registrationListeners = new CopyOnWriteArrayList<>();

    private final Object registrationLock = new Object();

    public PropertyStore(ThreadMarshaller marshaller, EventBus eventBus) {
        this.marshaller = Objects.requireNonNull(marshaller, "marshaller");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
    }

    /**
     * Register {@code property} under {@code key}, replacing whatever was registered there.
     * Pending deferred subscriptions for {@code key} are resolved with the new property.
     */
    public void registerProperty(String key, IReactiveProperty<?> property, boolean persistent) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(property, "property");
        List<DeferredSubscription> resolved;
        synchronized (registrationLock) {
            resolved = registerLocked(key, property, persistent);
        }
        afterRegistration(key, property, resolved);
    }

    public void registerProperty(String key, IReactiveProperty<?> property) {
        registerProperty(key, property, false);
    }

    /**
     * Return the {@link ReactiveProperty} registered under {@code key}, or register a new one
     * holding {@code defaultValue}. Check and creation are atomic.
     *
     * @throws PropertyTypeMismatchException if {@code key} holds a property of another value type
     *                                       or a read-only property
     */
    public <T> ReactiveProperty<T> getOrCreateProperty(String key, Class<T> valueType, T defaultValue) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(valueType, "valueType");

        PropertyRecord existing = records.get(key);
        if (existing != null) {
            return asMutable(key, existing.property(), valueType);
        }

        ReactiveProperty<T> created;
        List<DeferredSubscription> resolved;
        synchronized (registrationLock) {
            existing = records.get(key);
            if (existing != null) {
                return asMutable(key, existing.property(), valueType);
            }
            created = new ReactiveProperty<>(valueType, defaultValue);
            resolved = registerLocked(key, created, false);
        }
        afterRegistration(key, created, resolved);
        return created;
    }

    /**
     * Variant of {@link #getOrCreateProperty(String, Class, Object)} taking the value type from
     * the runtime class of {@code defaultValue}.
     */
    @SuppressWarnings("unchecked")
    public <T> ReactiveProperty<T> getOrCreateProperty(String key, T defaultValue) {
        Objects.requireNonNull(defaultValue, "defaultValue");
        return getOrCreateProperty(key, (Class<T>) defaultValue.getClass(), defaultValue);
    }

    /**
     * @return the property registered under {@code key}, or {@code null}
     */
    public IReactiveProperty<?> getProperty(String key) {
        PropertyRecord record = records.get(key);
        return record == null ? null : record.property();
    }

    /**
     * Typed lookup.
     *
     * @throws PropertyNotFoundException     if nothing is registered under {@code key}
     * @throws PropertyTypeMismatchException if the property's value type is not {@code valueType}
     */
    @SuppressWarnings("unchecked")
    public <T> IReactiveProperty<T> getProperty(String key, Class<T> valueType) {
        Objects.requireNonNull(valueType, "valueType");
        PropertyRecord record = records.get(key);
        if (record == null) {
            throw new PropertyNotFoundException(key);
        }
        IReactiveProperty<?> property = record.property();
        if (property.getValueType() != valueType) {
            throw new PropertyTypeMismatchException(key, valueType, property.getValueType(), null);
        }
        return (IReactiveProperty<T>) property;
    }

    public boolean hasProperty(String key) {
        return records.containsKey(key);
    }

    public boolean isPersistent(String key) {
        PropertyRecord record = records.get(key);
        return record != null && record.persistent();
    }

    /**
     * Reverse lookup.
     *
     * @return the key {@code property} is registered under, or {@code null}
     */
    public String getKey(IReactiveProperty<?> property) {
        return property == null ? null : keysByProperty.get(property);
    }

    /**
     * Wait for {@code key} to be registered. If it already is, {@code callback} runs right away
     * on the calling thread and an already disposed handle is returned. Otherwise it runs exactly
     * once, on the registering thread, when the key is next registered.
     *
     * @return handle that cancels the callback if it has not run yet
     */
    public Subscription subscribeDeferred(String key, Consumer<IReactiveProperty<?>> callback) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(callback, "callback");

        IReactiveProperty<?> present;
        DeferredSubscription deferred = null;
        synchronized (registrationLock) {
            PropertyRecord record = records.get(key);
            present = record == null ? null : record.property();
            if (present == null) {
                deferred = new DeferredSubscription(key, callback);
                pending.computeIfAbsent(key, k -> new ArrayList<>()).add(deferred);
            }
        }
        if (present != null) {
            callback.accept(present);
            return Subscription.empty();
        }
        DeferredSubscription waiting = deferred;
        return Subscription.of(() -> cancel(waiting));
    }

    /**
     * @return {@code true} if something was registered under {@code key}
     */
    public boolean unregisterProperty(String key) {
        if (key == null) {
            return false;
        }
        synchronized (registrationLock) {
            PropertyRecord removed = records.remove(key);
            if (removed == null) {
                return false;
            }
            release(removed);
        }
        log.debug("Unregistered property '{}'", key);
        return true;
    }

    /**
     * Remove every property that was not registered as persistent.
     *
     * @return number of removed properties
     */
    public int clearNonPersistentProperties() {
        int removed = 0;
        synchronized (registrationLock) {
            for (PropertyRecord record : List.copyOf(records.values())) {
                if (!record.persistent() && records.remove(record.key(), record)) {
                    release(record);
                    removed++;
                }
            }
        }
        log.debug("Cleared {} non-persistent properties, {} remain", removed, records.size());
        return removed;
    }

    /**
     * Remove every property. Pending deferred subscriptions stay pending.
     */
    public void clear() {
        synchronized (registrationLock) {
            for (PropertyRecord record : List.copyOf(records.values())) {
                records.remove(record.key(), record);
                release(record);
            }
        }
        log.debug("PropertyStore cleared");
    }

    public Set<String> getAllPropertyKeys() {
        return Set.copyOf(records.keySet());
    }

    public Set<String> getPersistentPropertyKeys() {
        Set<String> keys = new HashSet<>();
        for (PropertyRecord record : records.values()) {
            if (record.persistent()) {
                keys.add(record.key());
            }
        }
        return Set.copyOf(keys);
    }

    public int getPropertyCount() {
        return records.size();
    }

    /**
     * Observe registrations. The listener is called with the key and the property after every
     * successful {@link #registerProperty} or creating {@link #getOrCreateProperty}.
     */
    public Subscription addRegistrationListener(BiConsumer<String, IReactiveProperty<?>> listener) {
        ListenerSlot slot = new ListenerSlot(Objects.requireNonNull(listener, "listener"));
        registrationListeners.add(slot);
        return Subscription.of(() -> registrationListeners.remove(slot));
    }

    ThreadMarshaller getMarshaller() {
        return marshaller;
    }

    void publishChange(IReactiveProperty<?> property, Object oldValue, Object newValue) {
        String key = keysByProperty.get(property);
        if (key == null) {
            return;
        }
        eventBus.publish(new PropertyChangedEvent(key, oldValue, newValue, property.getValueType()));
    }

    // Caller holds registrationLock
    private List<DeferredSubscription> registerLocked(String key, IReactiveProperty<?> property, boolean persistent) {
        PropertyRecord previous = records.put(key, new PropertyRecord(key, property, persistent));
        if (previous != null && previous.property() != property) {
            release(previous);
        }
        keysByProperty.put(property, key);
        if (property instanceof AbstractReactiveProperty<?> cell) {
            cell.attach(this);
        }
        List<DeferredSubscription> waiting = pending.remove(key);
        return waiting == null ? List.of() : waiting;
    }

    // Caller holds registrationLock
    private void release(PropertyRecord record) {
        IReactiveProperty<?> property = record.property();
        keysByProperty.remove(property, record.key());
        if (!keysByProperty.containsKey(property) && property instanceof AbstractReactiveProperty<?> cell) {
            cell.detach(this);
        }
    }

    private void afterRegistration(String key, IReactiveProperty<?> property, List<DeferredSubscription> resolved) {
        log.debug("Registered property '{}' ({}), resolving {} deferred subscriptions",
                key, property.getValueType().getSimpleName(), resolved.size());
        for (ListenerSlot slot : registrationListeners) {
            try {
                slot.listener().accept(key, property);
            } catch (RuntimeException e) {
                log.error("Registration listener failed for property '{}'", key, e);
            }
        }
        for (DeferredSubscription deferred : resolved) {
            deferred.resolve(property);
        }
    }

    private void cancel(DeferredSubscription deferred) {
        synchronized (registrationLock) {
            List<DeferredSubscription> waiting = pending.get(deferred.key);
            if (waiting != null && waiting.remove(deferred) && waiting.isEmpty()) {
                pending.remove(deferred.key);
            }
        }
        deferred.done.set(true);
    }

    private static <T> ReactiveProperty<T> asMutable(String key, IReactiveProperty<?> property, Class<T> valueType) {
        if (!(property instanceof ReactiveProperty<?> mutable)) {
            throw new PropertyTypeMismatchException(key, valueType, property.getValueType(),
                    "registered property is read-only " + property.getClass().getSimpleName());
        }
        if (mutable.getValueType() != valueType) {
            throw new PropertyTypeMismatchException(key, valueType, mutable.getValueType(), null);
        }
        @SuppressWarnings("unchecked")
        ReactiveProperty<T> typed = (ReactiveProperty<T>) mutable;
        return typed;
    }

    private static final class DeferredSubscription {
        private final String key;
        private final Consumer<IReactiveProperty<?>> callback;
        private final AtomicBoolean done = new AtomicBoolean();

        DeferredSubscription(String key, Consumer<IReactiveProperty<?>> callback) {
            this.key = key;
            this.callback = callback;
        }

        void resolve(IReactiveProperty<?> property) {
            if (!done.compareAndSet(false, true)) {
                return;
            }
            try {
                callback.accept(property);
            } catch (RuntimeException e) {
                log.error("Deferred subscription for '{}' failed", key, e);
            }
        }
    }

    private static final class ListenerSlot {
        private final BiConsumer<String, IReactiveProperty<?>> listener;

        ListenerSlot(BiConsumer<String, IReactiveProperty<?>> listener) {
            this.listener = listener;
        }

        BiConsumer<String, IReactiveProperty<?>> listener() {
            return listener;
        }
    }
}
