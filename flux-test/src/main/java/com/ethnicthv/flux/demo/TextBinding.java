package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.Subscription;
import com.ethnicthv.flux.core.convert.ConverterRegistry;
import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.properties.IReactiveProperty;
import com.ethnicthv.flux.core.properties.PropertyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Minimal stand-in for a text widget binding.
 * <p>
 * Binds to a property key, possibly before the property exists, shows the value as text through
 * the {@link ConverterRegistry} (falling back to {@link String#valueOf}) and writes user edits back
 * through the untyped setter.
 */
public class TextBinding implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TextBinding.class);

    private final ConverterRegistry converters;
    private final Consumer<String> display;

    private volatile String text = "";
    private volatile IReactiveProperty<?> property;
    private IValueConverter<?, String> converter;
    private Subscription pendingLookup = Subscription.empty();
    private Subscription valueSubscription = Subscription.empty();

    public TextBinding(ConverterRegistry converters, Consumer<String> display) {
        this.converters = Objects.requireNonNull(converters, "converters");
        this.display = Objects.requireNonNull(display, "display");
    }

    /**
     * Bind to {@code key}. If the key is not registered yet the binding activates on its
     * registration.
     */
    public void bind(PropertyStore store, String key) {
        unbind();
        pendingLookup = store.subscribeDeferred(key, this::activate);
    }

    public void unbind() {
        pendingLookup.dispose();
        valueSubscription.dispose();
        property = null;
        converter = null;
    }

    public boolean isActive() {
        return property != null;
    }

    public String getText() {
        return text;
    }

    /**
     * Push an edit made in the widget to the bound property.
     *
     * @return {@code false} if the binding is inactive or the text does not fit the property type
     */
    public boolean submit(String edited) {
        IReactiveProperty<?> target = property;
        if (target == null) {
            return false;
        }
        Object value = converter != null ? converter.convertBackObject(edited) : edited;
        return target.setBoxedValue(value, false);
    }

    @Override
    public void close() {
        unbind();
    }

    private void activate(IReactiveProperty<?> bound) {
        valueSubscription.dispose();
        property = bound;
        converter = lookupConverter(bound.getValueType());
        valueSubscription = bound.subscribeObject(this::render, true);
        log.debug("Text binding active on {} property", bound.getValueType().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    private IValueConverter<?, String> lookupConverter(Class<?> valueType) {
        return converters.createConverter((Class<Object>) valueType, String.class).orElse(null);
    }

    private void render(Object value) {
        String rendered = converter != null ? (String) converter.convertObject(value) : String.valueOf(value);
        text = rendered;
        display.accept(rendered);
    }
}
