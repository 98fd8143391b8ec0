package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Base of cells whose value is an immutable container snapshot. Every edit builds a new
 * snapshot under {@link #lock} and swaps it in; item listeners receive the fine-grained
 * change first, then value subscribers receive {@code (oldSnapshot, newSnapshot)}.
 *
 * @param <C> container type
 * @param <L> item listener type
 */
public abstract class AbstractReactiveContainer<C, L> extends ReactiveProperty<C> {

    private static final Logger log = LoggerFactory.getLogger(AbstractReactiveContainer.class);

    private final Map<Long, L> itemListeners = new LinkedHashMap<>();
    private long nextItemListenerId;

    protected AbstractReactiveContainer(Class<C> valueType, C initialSnapshot) {
        super(valueType, initialSnapshot);
    }

    /**
     * Register a listener for item level changes. Whole-value writes through
     * {@link #setValue(Object, boolean)} only reach value subscribers.
     */
    public Subscription subscribeItems(L listener) {
        Objects.requireNonNull(listener, "listener");
        long id;
        synchronized (lock) {
            if (isDisposedLocked()) {
                throw new IllegalStateException("Cannot subscribe to a disposed " + getClass().getSimpleName());
            }
            id = nextItemListenerId++;
            itemListeners.put(id, listener);
        }
        return Subscription.of(() -> {
            synchronized (lock) {
                itemListeners.remove(id);
            }
        });
    }

    public int getItemSubscriberCount() {
        synchronized (lock) {
            return itemListeners.size();
        }
    }

    @Override
    public void dispose() {
        super.dispose();
        synchronized (lock) {
            itemListeners.clear();
        }
    }

    /**
     * Apply {@code edit} to the current snapshot under the lock. A {@code null} edit means nothing
     * changed: no swap, no notification.
     *
     * @return whether the value changed
     */
    protected final boolean commit(Function<C, Edit<C, L>> edit) {
        C oldValue;
        Edit<C, L> change;
        List<ChangeListener> valueSnapshot;
        List<L> itemSnapshot;
        synchronized (lock) {
            if (isDisposedLocked()) {
                log.debug("Ignoring edit of disposed {}", getClass().getSimpleName());
                return false;
            }
            oldValue = getValue();
            change = edit.apply(oldValue);
            if (change == null) {
                return false;
            }
            valueSnapshot = swapLocked(change.snapshot());
            itemSnapshot = itemListeners.isEmpty() ? List.of() : new ArrayList<>(itemListeners.values());
        }
        if (!itemSnapshot.isEmpty()) {
            runOnMainContext(() -> deliverItems(itemSnapshot, change.notification()));
        }
        notifyChanged(valueSnapshot, oldValue, change.snapshot());
        return true;
    }

    private void deliverItems(List<L> snapshot, Consumer<L> notification) {
        for (L listener : snapshot) {
            try {
                notification.accept(listener);
            } catch (RuntimeException e) {
                log.error("Item listener of {} failed", getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * Result of an edit: the new snapshot and how to tell an item listener about it.
     */
    protected record Edit<C, L>(C snapshot, Consumer<L> notification) {
    }
}
