package com.ethnicthv.flux.core.properties;

import java.util.List;

/**
 * Item level notifications of a {@link ReactiveCollection}. Replacing an element reports the old
 * element as removed and the new one as added.
 */
public interface CollectionListener<T> {

    default void onItemsAdded(List<T> items) {
    }

    default void onItemsRemoved(List<T> items) {
    }

    default void onCleared() {
    }
}
