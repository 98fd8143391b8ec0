package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.Subscription;
import com.ethnicthv.flux.core.threading.ThreadMarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * Shared machinery of reactive cells: one lock, one insertion-ordered subscriber table in
 * which every subscriber shape is stored as an {@code (old, new)} listener, the owned
 * dependent subscriptions and the store the cell is attached to.
 * <p>
 * Subclasses mutate their state while holding {@link #lock}, take a
 * {@link #snapshotListeners()} under that same lock and call {@link #dispatch} after
 * releasing it.
 */
public abstract class AbstractReactiveProperty<T> implements IReactiveProperty<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractReactiveProperty.class);

    protected final Object lock = new Object();
    protected final Class<T> valueType;

    private final Map<Long, ChangeListener> listeners = new LinkedHashMap<>();
    private final List<Subscription> dependents = new ArrayList<>();
    private final AtomicReference<PropertyStore> owner = new AtomicReference<>();
    private long nextListenerId;
    private boolean disposed;

    protected AbstractReactiveProperty(Class<T> valueType) {
        this.valueType = Objects.requireNonNull(valueType, "valueType");
    }

    @Override
    public Class<T> getValueType() {
        return valueType;
    }

    @Override
    @SuppressWarnings("unchecked")
    public final Subscription subscribe(Consumer<? super T> callback, boolean fireOnSubscribe) {
        Objects.requireNonNull(callback, "callback");
        Subscription subscription = addListener((oldValue, newValue) -> callback.accept((T) newValue));
        if (fireOnSubscribe) {
            fireOrRelease(subscription, () -> callback.accept(getValue()));
        }
        return subscription;
    }

    @Override
    @SuppressWarnings("unchecked")
    public final Subscription subscribe(BiConsumer<? super T, ? super T> callback, boolean fireOnSubscribe) {
        Objects.requireNonNull(callback, "callback");
        Subscription subscription = addListener((oldValue, newValue) -> callback.accept((T) oldValue, (T) newValue));
        if (fireOnSubscribe) {
            fireOrRelease(subscription, () -> {
                T current = getValue();
                callback.accept(current, current);
            });
        }
        return subscription;
    }

    @Override
    public final Subscription subscribeObject(Consumer<Object> callback, boolean fireOnSubscribe) {
        Objects.requireNonNull(callback, "callback");
        Subscription subscription = addListener((oldValue, newValue) -> callback.accept(newValue));
        if (fireOnSubscribe) {
            fireOrRelease(subscription, () -> callback.accept(getValue()));
        }
        return subscription;
    }

    @Override
    public void addDependentSubscription(Subscription subscription) {
        Objects.requireNonNull(subscription, "subscription");
        synchronized (lock) {
            if (!disposed) {
                dependents.add(subscription);
                return;
            }
        }
        subscription.dispose();
    }

    @Override
    public int getSubscriberCount() {
        synchronized (lock) {
            return listeners.size();
        }
    }

    @Override
    public boolean hasSubscribers() {
        return getSubscriberCount() > 0;
    }

    @Override
    public boolean isDisposed() {
        synchronized (lock) {
            return disposed;
        }
    }

    @Override
    public void dispose() {
        List<Subscription> owned;
        synchronized (lock) {
            if (disposed) {
                return;
            }
            disposed = true;
            listeners.clear();
            owned = new ArrayList<>(dependents);
            dependents.clear();
        }
        for (Subscription subscription : owned) {
            subscription.dispose();
        }
    }

    /** Caller must hold {@link #lock}. */
    protected final boolean isDisposedLocked() {
        return disposed;
    }

    /** Copy of the current listeners, in subscription order. Caller must hold {@link #lock}. */
    protected final List<ChangeListener> snapshotListeners() {
        return listeners.isEmpty() ? List.of() : new ArrayList<>(listeners.values());
    }

    /**
     * Deliver a change to {@code snapshot}. Runs inline when the cell is detached or the caller
     * is on the main thread, otherwise goes through the owning store's marshaller.
     * Must not be called while holding {@link #lock}.
     */
    protected final void dispatch(List<ChangeListener> snapshot, T oldValue, T newValue) {
        if (snapshot.isEmpty()) {
            return;
        }
        runOnMainContext(() -> deliver(snapshot, oldValue, newValue));
    }

    /**
     * Run {@code delivery} inline when the cell is detached or the caller is on the main thread,
     * otherwise through the owning store's marshaller. Must not be called while holding {@link #lock}.
     */
    protected final void runOnMainContext(Runnable delivery) {
        PropertyStore store = owner.get();
        ThreadMarshaller marshaller = store == null ? null : store.getMarshaller();
        if (marshaller == null || marshaller.isMainThread()) {
            delivery.run();
        } else {
            marshaller.executeOnMainThread(delivery);
        }
    }

    /** Store the cell is currently attached to, or {@code null}. */
    protected final PropertyStore getOwner() {
        return owner.get();
    }

    final void attach(PropertyStore store) {
        PropertyStore previous = owner.getAndSet(store);
        if (previous != null && previous != store) {
            log.warn("Property of type {} moved to another store; its old store no longer routes its changes",
                    valueType.getSimpleName());
        }
    }

    final void detach(PropertyStore store) {
        owner.compareAndSet(store, null);
    }

    private Subscription addListener(ChangeListener listener) {
        long id;
        synchronized (lock) {
            if (disposed) {
                throw new IllegalStateException("Cannot subscribe to a disposed property of type " + valueType.getName());
            }
            id = nextListenerId++;
            listeners.put(id, listener);
        }
        return Subscription.of(() -> {
            synchronized (lock) {
                listeners.remove(id);
            }
        });
    }

    /** Runs the initial delivery; if it throws, the new registration is removed before rethrowing. */
    private static void fireOrRelease(Subscription subscription, Runnable initialDelivery) {
        try {
            initialDelivery.run();
        } catch (RuntimeException e) {
            subscription.dispose();
            throw e;
        }
    }

    private void deliver(List<ChangeListener> snapshot, T oldValue, T newValue) {
        for (ChangeListener listener : snapshot) {
            try {
                listener.onChange(oldValue, newValue);
            } catch (RuntimeException e) {
                log.error("Subscriber of {} property failed", valueType.getSimpleName(), e);
            }
        }
    }

    /**
     * Unified subscriber channel every public subscriber shape is adapted into.
     */
    @FunctionalInterface
    protected interface ChangeListener {
        void onChange(Object oldValue, Object newValue);
    }
}
