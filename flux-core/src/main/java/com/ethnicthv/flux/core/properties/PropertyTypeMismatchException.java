package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.FluxException;

/**
 * A property exists under the requested key but is not a property of the requested type.
 */
public class PropertyTypeMismatchException extends FluxException {

    private final String key;
    private final Class<?> expectedType;
    private final Class<?> actualType;

    public PropertyTypeMismatchException(String key, Class<?> expectedType, Class<?> actualType, String detail) {
        super("Property '" + key + "' was requested as " + expectedType.getName()
                + " but holds " + actualType.getName() + (detail == null ? "" : " (" + detail + ")"));
        this.key = key;
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public String getKey() {
        return key;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
