package com.ethnicthv.flux.core.events;

/**
 * Published on the bus whenever a registered reactive property changes value
 * (or is force-notified).
 */
public final class PropertyChangedEvent extends FluxEventBase {

    public static final String SOURCE = "PropertyStore";

    private final String propertyKey;
    private final Object oldValue;
    private final Object newValue;
    private final Class<?> valueType;

    public PropertyChangedEvent(String propertyKey, Object oldValue, Object newValue, Class<?> valueType) {
        super(SOURCE);
        this.propertyKey = propertyKey;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.valueType = valueType;
    }

    public String getPropertyKey() {
        return propertyKey;
    }

    public Object getOldValue() {
        return oldValue;
    }

    public Object getNewValue() {
        return newValue;
    }

    public Class<?> getValueType() {
        return valueType;
    }

    @Override
    public String toString() {
        return "PropertyChangedEvent{key='" + propertyKey + "', " + oldValue + " -> " + newValue
                + ", type=" + (valueType == null ? "?" : valueType.getSimpleName()) + '}';
    }
}
