package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.FluxException;

public class PropertyNotFoundException extends FluxException {

    private final String key;

    public PropertyNotFoundException(String key) {
        super("Property '" + key + "' is not registered");
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
