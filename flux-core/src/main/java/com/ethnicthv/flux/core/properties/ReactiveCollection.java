package com.ethnicthv.flux.core.properties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reactive list. The value is an unmodifiable snapshot replaced on every edit, so a snapshot
 * handed to a subscriber never changes under it.
 *
 * @param <T> element type, {@code null} elements are allowed
 */
public class ReactiveCollection<T> extends AbstractReactiveContainer<List<T>, CollectionListener<T>> {

    public ReactiveCollection() {
        this(List.of());
    }

    public ReactiveCollection(Collection<? extends T> initialItems) {
        super(listType(), freeze(initialItems));
    }

    public void add(T item) {
        commit(current -> {
            List<T> next = new ArrayList<>(current);
            next.add(item);
            List<T> added = Collections.singletonList(item);
            return new Edit<>(freeze(next), l -> l.onItemsAdded(added));
        });
    }

    /**
     * Append {@code items} in iteration order. An empty collection is a no-op.
     */
    public void addAll(Collection<? extends T> items) {
        Objects.requireNonNull(items, "items");
        List<T> added = freeze(items);
        if (added.isEmpty()) {
            return;
        }
        commit(current -> {
            List<T> next = new ArrayList<>(current);
            next.addAll(added);
            return new Edit<>(freeze(next), l -> l.onItemsAdded(added));
        });
    }

    /**
     * Remove the first occurrence of {@code item}.
     *
     * @return whether the item was present
     */
    public boolean remove(Object item) {
        return commit(current -> {
            int index = current.indexOf(item);
            return index < 0 ? null : removeAt(current, index);
        });
    }

    /**
     * Remove the element at {@code index}; out of range indices are ignored.
     *
     * @return whether an element was removed
     */
    public boolean removeAt(int index) {
        return commit(current -> index < 0 || index >= current.size() ? null : removeAt(current, index));
    }

    /**
     * Replace the element at {@code index}. Replacing an element with an equal one is a no-op.
     *
     * @throws IndexOutOfBoundsException if {@code index} is out of range
     */
    public void set(int index, T item) {
        commit(current -> {
            Objects.checkIndex(index, current.size());
            T previous = current.get(index);
            if (Objects.equals(previous, item)) {
                return null;
            }
            List<T> next = new ArrayList<>(current);
            next.set(index, item);
            List<T> removed = Collections.singletonList(previous);
            List<T> added = Collections.singletonList(item);
            return new Edit<>(freeze(next), l -> {
                l.onItemsRemoved(removed);
                l.onItemsAdded(added);
            });
        });
    }

    /**
     * Remove every element. Clearing an empty collection is a no-op.
     */
    public void clear() {
        commit(current -> current.isEmpty() ? null : new Edit<>(List.<T>of(), CollectionListener::onCleared));
    }

    public T get(int index) {
        return getValue().get(index);
    }

    public int size() {
        return getValue().size();
    }

    public boolean isEmpty() {
        return getValue().isEmpty();
    }

    public boolean contains(Object item) {
        return getValue().contains(item);
    }

    public int indexOf(Object item) {
        return getValue().indexOf(item);
    }

    /**
     * Replace the whole list. Item listeners are not told about whole-value writes.
     */
    @Override
    public void setValue(List<T> newValue, boolean forceNotify) {
        super.setValue(freeze(newValue), forceNotify);
    }

    @Override
    public String toString() {
        return "ReactiveCollection" + getValue();
    }

    private Edit<List<T>, CollectionListener<T>> removeAt(List<T> current, int index) {
        List<T> next = new ArrayList<>(current);
        List<T> removed = Collections.singletonList(next.remove(index));
        return new Edit<>(freeze(next), l -> l.onItemsRemoved(removed));
    }

    private static <T> List<T> freeze(Collection<? extends T> items) {
        if (items == null || items.isEmpty()) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(items));
    }

    @SuppressWarnings("unchecked")
    private static <T> Class<List<T>> listType() {
        return (Class<List<T>>) (Class<?>) List.class;
    }
}
