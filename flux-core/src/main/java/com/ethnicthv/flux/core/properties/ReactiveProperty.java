package com.ethnicthv.flux.core.properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Mutable reactive cell.
 * <p>
 * A write compares the new value with the current one using {@link Objects#equals}; subscribers
 * are only notified when the value actually changed or the write is forced. When the cell is
 * registered in a {@link PropertyStore} each notification is followed by a
 * {@link com.ethnicthv.flux.core.events.PropertyChangedEvent} on the store's event bus.
 * Writes after {@link #dispose()} are dropped.
 *
 * @param <T> value type, {@code null} values are allowed
 */
public class ReactiveProperty<T> extends AbstractReactiveProperty<T> {

    private static final Logger log = LoggerFactory.getLogger(ReactiveProperty.class);

    private T value;

    public ReactiveProperty(Class<T> valueType) {
        this(valueType, null);
    }

    public ReactiveProperty(Class<T> valueType, T initialValue) {
        super(valueType);
        if (initialValue != null && !valueType.isInstance(initialValue)) {
            throw new IllegalArgumentException("Initial value of type " + initialValue.getClass().getName()
                    + " is not a " + valueType.getName());
        }
        this.value = initialValue;
    }

    /**
     * Create a cell whose value type is the runtime class of {@code initialValue}.
     * Use the {@link #ReactiveProperty(Class, Object)} constructor when the declared type is
     * an interface or supertype of the initial value.
     */
    @SuppressWarnings("unchecked")
    public static <T> ReactiveProperty<T> of(T initialValue) {
        Objects.requireNonNull(initialValue, "initialValue");
        return new ReactiveProperty<>((Class<T>) initialValue.getClass(), initialValue);
    }

    @Override
    public T getValue() {
        synchronized (lock) {
            return value;
        }
    }

    public void setValue(T newValue) {
        setValue(newValue, false);
    }

    /**
     * @param forceNotify notify subscribers even when {@code newValue} equals the current value
     */
    public void setValue(T newValue, boolean forceNotify) {
        T oldValue;
        List<ChangeListener> snapshot;
        synchronized (lock) {
            if (isDisposedLocked()) {
                log.debug("Ignoring write to disposed {} property", valueType.getSimpleName());
                return;
            }
            oldValue = value;
            boolean changed = !Objects.equals(oldValue, newValue);
            if (!changed && !forceNotify) {
                return;
            }
            snapshot = swapLocked(newValue);
        }
        notifyChanged(snapshot, oldValue, newValue);
    }

    /** Replace the value and snapshot the subscribers. Caller must hold {@link #lock}. */
    protected final List<ChangeListener> swapLocked(T newValue) {
        value = newValue;
        return snapshotListeners();
    }

    /**
     * Notify {@code snapshot} and publish the change through the owning store, if any.
     * Must not be called while holding {@link #lock}.
     */
    protected final void notifyChanged(List<ChangeListener> snapshot, T oldValue, T newValue) {
        dispatch(snapshot, oldValue, newValue);
        PropertyStore store = getOwner();
        if (store != null) {
            store.publishChange(this, oldValue, newValue);
        }
    }

    @Override
    public boolean setBoxedValue(Object newValue, boolean forceNotify) {
        if (isDisposed()) {
            return false;
        }
        if (newValue != null && !valueType.isInstance(newValue)) {
            log.error("Type mismatch: cannot assign {} to property of type {}",
                    newValue.getClass().getName(), valueType.getName());
            return false;
        }
        setValue(valueType.cast(newValue), forceNotify);
        return true;
    }

    @Override
    public String toString() {
        return "ReactiveProperty<" + valueType.getSimpleName() + ">{" + getValue() + '}';
    }
}
