package com.ethnicthv.flux.core.properties;

/**
 * Item level notifications of a {@link ReactiveDictionary}.
 */
public interface DictionaryListener<K, V> {

    default void onItemAdded(K key, V value) {
    }

    default void onItemRemoved(K key) {
    }

    default void onItemChanged(K key, V value) {
    }

    default void onCleared() {
    }
}
