package com.ethnicthv.flux.core.properties;

import java.util.Objects;

/**
 * Entry of the {@link PropertyStore}: a key, the cell registered under it and whether the
 * cell survives {@link PropertyStore#clearNonPersistentProperties()}.
 */
public record PropertyRecord(String key, IReactiveProperty<?> property, boolean persistent) {

    public PropertyRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(property, "property");
    }
}
