package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.Subscription;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * A thread-safe observable value.
 * <p>
 * Subscribers come in three shapes (typed value, boxed {@code Object}, old and new value)
 * and are notified in subscription order, outside of the property's lock and on the main
 * execution context when the property is attached to a {@link PropertyStore}.
 *
 * @param <T> value type
 */
public interface IReactiveProperty<T> {

    Class<T> getValueType();

    T getValue();

    /**
     * Untyped write used by bindings that only know the property as {@code IReactiveProperty<?>}.
     *
     * @return {@code false} if {@code value} is not an instance of {@link #getValueType()} or the
     * property is disposed, in which case the write is dropped
     * @throws UnsupportedOperationException if the property is read-only
     */
    boolean setBoxedValue(Object value, boolean forceNotify);

    default boolean setBoxedValue(Object value) {
        return setBoxedValue(value, false);
    }

    Subscription subscribe(Consumer<? super T> callback, boolean fireOnSubscribe);

    default Subscription subscribe(Consumer<? super T> callback) {
        return subscribe(callback, false);
    }

    /**
     * Subscribe with an {@code (oldValue, newValue)} callback. When {@code fireOnSubscribe}
     * is set the callback immediately receives {@code (current, current)}.
     */
    Subscription subscribe(BiConsumer<? super T, ? super T> callback, boolean fireOnSubscribe);

    default Subscription subscribe(BiConsumer<? super T, ? super T> callback) {
        return subscribe(callback, false);
    }

    Subscription subscribeObject(Consumer<Object> callback, boolean fireOnSubscribe);

    default Subscription subscribeObject(Consumer<Object> callback) {
        return subscribeObject(callback, false);
    }

    /**
     * Hand ownership of {@code subscription} to this property: it is disposed together with
     * the property.
     */
    void addDependentSubscription(Subscription subscription);

    int getSubscriberCount();

    boolean hasSubscribers();

    boolean isDisposed();

    /**
     * Drop all subscribers and dispose the dependent subscriptions. Idempotent.
     * Writes to a disposed property are ignored.
     */
    void dispose();
}
