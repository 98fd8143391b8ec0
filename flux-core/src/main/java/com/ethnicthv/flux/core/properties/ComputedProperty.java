package com.ethnicthv.flux.core.properties;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Read-only reactive cell whose value is derived from a pure computation.
 * <p>
 * The value is computed lazily: {@link #invalidate()} only marks the cell dirty and the next
 * {@link #getValue()} recomputes. Subscribers are notified when a recomputation yields a value
 * that differs from the previous one; the very first computation only establishes the baseline.
 * The computation itself runs outside the lock. A computation overtaken by an invalidation returns
 * its result to its caller but neither caches it nor notifies, and the cell stays dirty.
 *
 * @param <T> value type
 */
public class ComputedProperty<T> extends AbstractReactiveProperty<T> {

    private final Supplier<? extends T> computation;

    private T cachedValue;
    private boolean computed;
    private boolean dirty = true;
    // bumped on every invalidation
    private long generation;

    public ComputedProperty(Class<T> valueType, Supplier<? extends T> computation) {
        super(valueType);
        this.computation = Objects.requireNonNull(computation, "computation");
    }

    /**
     * Register {@code sources} as inputs: any change of a source invalidates this cell.
     * The source subscriptions are owned by this cell and released by {@link #dispose()}.
     *
     * @return this
     */
    public ComputedProperty<T> dependsOn(IReactiveProperty<?>... sources) {
        for (IReactiveProperty<?> source : sources) {
            Objects.requireNonNull(source, "source");
            addDependentSubscription(source.subscribeObject(ignored -> invalidate()));
        }
        return this;
    }

    @Override
    public T getValue() {
        long startGeneration;
        synchronized (lock) {
            if (!dirty) {
                return cachedValue;
            }
            startGeneration = generation;
        }
        return store(compute(), startGeneration);
    }

    public void invalidate() {
        synchronized (lock) {
            dirty = true;
            generation++;
        }
    }

    /**
     * Invalidate and compute right away.
     */
    public T recompute() {
        invalidate();
        return getValue();
    }

    public boolean isDirty() {
        synchronized (lock) {
            return dirty;
        }
    }

    @Override
    public boolean setBoxedValue(Object value, boolean forceNotify) {
        throw new UnsupportedOperationException("ComputedProperty<" + valueType.getSimpleName() + "> is read-only");
    }

    private T compute() {
        try {
            return computation.get();
        } catch (RuntimeException e) {
            throw new ComputationException("Computation of " + valueType.getSimpleName() + " property failed", e);
        }
    }

    private T store(T newValue, long startGeneration) {
        T oldValue;
        List<ChangeListener> snapshot;
        synchronized (lock) {
            if (generation != startGeneration) {
                // invalidated while computing: the result goes to this caller only
                return newValue;
            }
            oldValue = cachedValue;
            boolean notify = computed && !Objects.equals(oldValue, newValue);
            cachedValue = newValue;
            computed = true;
            dirty = false;
            if (!notify) {
                return newValue;
            }
            snapshot = snapshotListeners();
        }
        dispatch(snapshot, oldValue, newValue);
        return newValue;
    }

    @Override
    public String toString() {
        synchronized (lock) {
            return "ComputedProperty<" + valueType.getSimpleName() + ">{"
                    + (computed ? cachedValue : "<not computed>") + (dirty ? ", dirty" : "") + '}';
        }
    }
}
