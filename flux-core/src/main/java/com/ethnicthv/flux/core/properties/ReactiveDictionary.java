package com.ethnicthv.flux.core.properties;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * Reactive map keeping insertion order. Like {@link ReactiveCollection} its value is an
 * unmodifiable snapshot replaced on every edit.
 *
 * @param <K> key type
 * @param <V> value type
 */
public class ReactiveDictionary<K, V> extends AbstractReactiveContainer<Map<K, V>, DictionaryListener<K, V>> {

    public ReactiveDictionary() {
        this(Map.of());
    }

    public ReactiveDictionary(Map<? extends K, ? extends V> initialEntries) {
        super(mapType(), freeze(initialEntries));
    }

    /**
     * Associate {@code value} with {@code key}. A new key is reported as added, a different value
     * for an existing key as changed; an equal value is a no-op.
     */
    public void put(K key, V value) {
        commit(current -> {
            boolean present = current.containsKey(key);
            if (present && Objects.equals(current.get(key), value)) {
                return null;
            }
            Map<K, V> next = new LinkedHashMap<>(current);
            next.put(key, value);
            Consumer<DictionaryListener<K, V>> notification = present
                    ? l -> l.onItemChanged(key, value)
                    : l -> l.onItemAdded(key, value);
            return new Edit<>(freeze(next), notification);
        });
    }

    /**
     * Add a new entry.
     *
     * @throws IllegalArgumentException if {@code key} is already present
     */
    public void add(K key, V value) {
        commit(current -> {
            if (current.containsKey(key)) {
                throw new IllegalArgumentException("Key already present: " + key);
            }
            Map<K, V> next = new LinkedHashMap<>(current);
            next.put(key, value);
            return new Edit<>(freeze(next), l -> l.onItemAdded(key, value));
        });
    }

    /**
     * @return whether {@code key} was present
     */
    public boolean remove(K key) {
        return commit(current -> {
            if (!current.containsKey(key)) {
                return null;
            }
            Map<K, V> next = new LinkedHashMap<>(current);
            next.remove(key);
            return new Edit<>(freeze(next), l -> l.onItemRemoved(key));
        });
    }

    public void clear() {
        commit(current -> current.isEmpty() ? null : new Edit<>(Map.<K, V>of(), DictionaryListener::onCleared));
    }

    public V get(K key) {
        return getValue().get(key);
    }

    public boolean containsKey(K key) {
        return getValue().containsKey(key);
    }

    public int size() {
        return getValue().size();
    }

    public Set<K> keySet() {
        return getValue().keySet();
    }

    /**
     * Replace the whole map. Item listeners are not told about whole-value writes.
     */
    @Override
    public void setValue(Map<K, V> newValue, boolean forceNotify) {
        super.setValue(freeze(newValue), forceNotify);
    }

    @Override
    public String toString() {
        return "ReactiveDictionary" + getValue();
    }

    private static <K, V> Map<K, V> freeze(Map<? extends K, ? extends V> entries) {
        if (entries == null || entries.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(entries));
    }

    @SuppressWarnings("unchecked")
    private static <K, V> Class<Map<K, V>> mapType() {
        return (Class<Map<K, V>>) (Class<?>) Map.class;
    }
}
