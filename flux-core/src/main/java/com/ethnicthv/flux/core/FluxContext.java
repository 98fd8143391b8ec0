package com.ethnicthv.flux.core;

import com.ethnicthv.flux.core.convert.ConverterRegistry;
import com.ethnicthv.flux.core.events.EventBus;
import com.ethnicthv.flux.core.properties.PropertyStore;
import com.ethnicthv.flux.core.threading.ThreadMarshaller;

import java.util.Objects;

/**
 * Explicit bundle of the services one Flux instance is made of.
 * Handed to systems on registration instead of a process-wide locator, so independent
 * instances (e.g. one per test) never share state.
 */
public final class FluxContext {

    private final FluxSettings settings;
    private final ThreadMarshaller marshaller;
    private final EventBus eventBus;
    private final PropertyStore properties;
    private final ConverterRegistry converters;

    public FluxContext(FluxSettings settings,
                       ThreadMarshaller marshaller,
                       EventBus eventBus,
                       PropertyStore properties,
                       ConverterRegistry converters) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.marshaller = Objects.requireNonNull(marshaller, "marshaller");
        this.eventBus = Objects.requireNonNull(eventBus, "eventBus");
        this.properties = Objects.requireNonNull(properties, "properties");
        this.converters = Objects.requireNonNull(converters, "converters");
    }

    public FluxSettings getSettings() {
        return settings;
    }

    public ThreadMarshaller getMarshaller() {
        return marshaller;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public PropertyStore getProperties() {
        return properties;
    }

    public ConverterRegistry getConverters() {
        return converters;
    }
}
