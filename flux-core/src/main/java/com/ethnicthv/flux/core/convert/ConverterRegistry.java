package com.ethnicthv.flux.core.convert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Modifier;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Lookup of converter classes by exact (source type, target type) pair.
 * <p>
 * The table is built lazily on first lookup from the {@link ConverterIndex} services generated
 * for {@link ValueConverter} classes, merged with the pairs registered explicitly through
 * {@link #register}. Explicit registrations win over discovered ones.
 */
public class ConverterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConverterRegistry.class);

    private final ConcurrentHashMap<ConverterKey, Class<? extends IValueConverter<?, ?>>> converters = new ConcurrentHashMap<>();
    private final boolean discoverIndices;
    private final ClassLoader classLoader;
    private final Object initLock = new Object();
    private volatile boolean initialized;

    public ConverterRegistry() {
        this(true);
    }

    public ConverterRegistry(boolean discoverIndices) {
        this(discoverIndices, ConverterRegistry.class.getClassLoader());
    }

    public ConverterRegistry(boolean discoverIndices, ClassLoader classLoader) {
        this.discoverIndices = discoverIndices;
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    /**
     * Build the table. Runs once; later calls return immediately.
     */
    public void initialize() {
        if (initialized) {
            return;
        }
        synchronized (initLock) {
            if (initialized) {
                return;
            }
            if (discoverIndices) {
                discover();
            }
            initialized = true;
        }
        log.info("ConverterRegistry initialized with {} converters", converters.size());
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Register {@code converterType} for the pair, replacing any previous registration.
     */
    public void register(Class<?> sourceType, Class<?> targetType, Class<? extends IValueConverter<?, ?>> converterType) {
        Objects.requireNonNull(sourceType, "sourceType");
        Objects.requireNonNull(targetType, "targetType");
        validate(converterType);
        Class<?> previous = converters.put(new ConverterKey(sourceType, targetType), converterType);
        if (previous != null && previous != converterType) {
            log.debug("Converter for {} -> {} replaced: {} -> {}", sourceType.getSimpleName(),
                    targetType.getSimpleName(), previous.getName(), converterType.getName());
        }
    }

    /**
     * Exact pair lookup, no widening or boxing.
     */
    public Optional<Class<? extends IValueConverter<?, ?>>> findConverterType(Class<?> sourceType, Class<?> targetType) {
        if (sourceType == null || targetType == null) {
            return Optional.empty();
        }
        initialize();
        return Optional.ofNullable(converters.get(new ConverterKey(sourceType, targetType)));
    }

    /**
     * Instantiate the converter registered for the pair.
     *
     * @throws IllegalStateException if the converter class cannot be instantiated
     */
    @SuppressWarnings("unchecked")
    public <S, D> Optional<IValueConverter<S, D>> createConverter(Class<S> sourceType, Class<D> targetType) {
        return findConverterType(sourceType, targetType).map(type -> {
            try {
                return (IValueConverter<S, D>) type.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException("Failed to instantiate converter " + type.getName(), e);
            }
        });
    }

    public int getConverterCount() {
        initialize();
        return converters.size();
    }

    private void discover() {
        int indices = 0;
        try {
            for (ConverterIndex index : ServiceLoader.load(ConverterIndex.class, classLoader)) {
                ConverterRegistry staging = new ConverterRegistry(false, classLoader);
                index.registerAll(staging);
                staging.converters.forEach(converters::putIfAbsent);
                indices++;
                log.debug("Loaded converter index {} ({} converters)", index.getClass().getName(), staging.converters.size());
            }
        } catch (ServiceConfigurationError e) {
            throw new IllegalStateException("Failed to load generated converter indices", e);
        }
        if (indices == 0) {
            log.warn("No generated converter index found. Ensure annotation processing is enabled for modules declaring @ValueConverter classes");
        }
    }

    private static void validate(Class<?> converterType) {
        Objects.requireNonNull(converterType, "converterType");
        if (!IValueConverter.class.isAssignableFrom(converterType)) {
            throw new IllegalArgumentException(converterType.getName() + " does not implement IValueConverter");
        }
        if (converterType.isInterface() || Modifier.isAbstract(converterType.getModifiers())) {
            throw new IllegalArgumentException(converterType.getName() + " is not a concrete class");
        }
    }

    private record ConverterKey(Class<?> sourceType, Class<?> targetType) {
    }
}
