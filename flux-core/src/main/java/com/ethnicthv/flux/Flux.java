package com.ethnicthv.flux;

import com.ethnicthv.flux.core.FluxContext;
import com.ethnicthv.flux.core.FluxSettings;
import com.ethnicthv.flux.core.FluxSettings.ThreadingMode;
import com.ethnicthv.flux.core.convert.ConverterRegistry;
import com.ethnicthv.flux.core.convert.IValueConverter;
import com.ethnicthv.flux.core.events.EventBus;
import com.ethnicthv.flux.core.properties.PropertyStore;
import com.ethnicthv.flux.core.system.GameLoop;
import com.ethnicthv.flux.core.system.ISystem;
import com.ethnicthv.flux.core.system.MainThreadDispatchSystem;
import com.ethnicthv.flux.core.system.SystemGroup;
import com.ethnicthv.flux.core.system.SystemManager;
import com.ethnicthv.flux.core.threading.ImmediateThreadMarshaller;
import com.ethnicthv.flux.core.threading.MainThreadMarshaller;
import com.ethnicthv.flux.core.threading.ThreadMarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Flux - the single entry point (Facade) of the reactive core.
 * <p>
 * Wires a {@link ThreadMarshaller}, {@link EventBus}, {@link PropertyStore},
 * {@link ConverterRegistry} and {@link SystemManager} into one isolated instance.
 * Several instances can live side by side; nothing is shared through static state.
 * <pre>{@code
 * try (Flux flux = Flux.builder().addSystem(new HealthSystem()).build()) {
 *     ReactiveProperty<Integer> health = flux.getProperties().getOrCreateProperty("health", 100);
 *     health.subscribe(v -> hud.show(v));
 *     flux.run();
 * }
 * }</pre>
 */
public final class Flux implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Flux.class);

    private final FluxContext context;
    private final SystemManager systemManager;
    private final GameLoop gameLoop;

    private Flux(FluxContext context, SystemManager systemManager) {
        this.context = context;
        this.systemManager = systemManager;
        this.gameLoop = new GameLoop(systemManager, context.getMarshaller(), context.getSettings().tickRate());
    }

    public static Builder builder() {
        return new Builder();
    }

    public FluxContext getContext() {
        return context;
    }

    public PropertyStore getProperties() {
        return context.getProperties();
    }

    public EventBus getEventBus() {
        return context.getEventBus();
    }

    public ThreadMarshaller getMarshaller() {
        return context.getMarshaller();
    }

    public ConverterRegistry getConverters() {
        return context.getConverters();
    }

    public SystemManager getSystemManager() {
        return systemManager;
    }

    public FluxSettings getSettings() {
        return context.getSettings();
    }

    /**
     * Start the game loop on the calling thread (blocking). That thread becomes the main thread.
     */
    public void run() {
        gameLoop.run();
    }

    /**
     * Stop the game loop gracefully.
     */
    public void stop() {
        gameLoop.stop();
    }

    /**
     * Run every group once with {@code deltaTime}: fixed groups, then variable groups.
     * For hosts and tests that drive their own loop from the main thread.
     */
    public void update(float deltaTime) {
        systemManager.update(deltaTime);
    }

    /**
     * Run a single system group once with the given deltaTime.
     */
    public void updateGroup(SystemGroup group, float deltaTime) {
        systemManager.updateGroup(group, deltaTime);
    }

    /**
     * Create an extra {@link GameLoop} over this instance's systems. Caller runs and stops it.
     */
    public GameLoop createGameLoop(float targetTickRate) {
        return new GameLoop(systemManager, context.getMarshaller(), targetTickRate);
    }

    /**
     * Stop the loop, dispose systems, drop pending main thread work, properties and handlers.
     */
    @Override
    public void close() {
        gameLoop.stop();
        systemManager.disposeAll();
        if (context.getMarshaller() instanceof MainThreadMarshaller queue) {
            queue.clearQueue();
        }
        context.getProperties().clear();
        context.getEventBus().clear();
        log.debug("Flux instance closed");
    }

    public static class Builder {
        private final List<SystemRegistration> systems = new ArrayList<>();
        private final List<ConverterRegistration> converters = new ArrayList<>();
        private int maxMainThreadActionsPerTick = FluxSettings.DEFAULT_MAX_MAIN_THREAD_ACTIONS_PER_TICK;
        private int eventSubscriberSoftLimit = FluxSettings.DEFAULT_EVENT_SUBSCRIBER_SOFT_LIMIT;
        private float tickRate = FluxSettings.DEFAULT_TICK_RATE;
        private ThreadingMode threadingMode = ThreadingMode.MAIN_THREAD_QUEUE;
        private boolean converterDiscovery = true;

        record SystemRegistration(ISystem system, SystemGroup group) {}

        record ConverterRegistration(Class<?> source, Class<?> target, Class<? extends IValueConverter<?, ?>> type) {}

        /**
         * Run all notifications inline on the calling thread. Intended for tests and tools.
         */
        public Builder immediateThreading() {
            this.threadingMode = ThreadingMode.IMMEDIATE;
            return this;
        }

        public Builder threadingMode(ThreadingMode mode) {
            this.threadingMode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder maxMainThreadActionsPerTick(int max) {
            this.maxMainThreadActionsPerTick = max;
            return this;
        }

        /**
         * Per event type subscriber count above which a possible-leak warning is logged.
         */
        public Builder eventSubscriberSoftLimit(int limit) {
            this.eventSubscriberSoftLimit = limit;
            return this;
        }

        public Builder tickRate(float hz) {
            this.tickRate = hz;
            return this;
        }

        /**
         * Skip loading the generated converter indices. Only explicitly registered converters
         * will be known.
         */
        public Builder noConverterDiscovery() {
            this.converterDiscovery = false;
            return this;
        }

        public Builder registerConverter(Class<?> source, Class<?> target, Class<? extends IValueConverter<?, ?>> converterType) {
            converters.add(new ConverterRegistration(source, target, converterType));
            return this;
        }

        /**
         * Add a system in the default SIMULATION group.
         */
        public Builder addSystem(ISystem system) {
            return addSystem(system, SystemGroup.SIMULATION);
        }

        public Builder addSystem(ISystem system, SystemGroup group) {
            Objects.requireNonNull(system, "system");
            Objects.requireNonNull(group, "group");
            systems.add(new SystemRegistration(system, group));
            return this;
        }

        /**
         * Build the instance:
         * 1. Validate settings.
         * 2. Create marshaller, event bus, property store and converter registry.
         * 3. Create the SystemManager, install the main thread dispatcher and register systems.
         *
         * @throws IllegalArgumentException on invalid settings
         */
        public Flux build() {
            FluxSettings settings = new FluxSettings(maxMainThreadActionsPerTick, eventSubscriberSoftLimit,
                    tickRate, threadingMode, converterDiscovery);

            ThreadMarshaller marshaller = settings.threadingMode() == ThreadingMode.IMMEDIATE
                    ? new ImmediateThreadMarshaller()
                    : new MainThreadMarshaller(settings.maxMainThreadActionsPerTick());

            EventBus eventBus = new EventBus(marshaller, settings.eventSubscriberSoftLimit());
            eventBus.initialize();
            PropertyStore properties = new PropertyStore(marshaller, eventBus);

            ConverterRegistry converterRegistry = new ConverterRegistry(settings.converterDiscovery());
            for (ConverterRegistration reg : converters) {
                converterRegistry.register(reg.source(), reg.target(), reg.type());
            }

            FluxContext context = new FluxContext(settings, marshaller, eventBus, properties, converterRegistry);
            SystemManager sysMgr = new SystemManager(context);

            if (marshaller instanceof MainThreadMarshaller queue) {
                sysMgr.registerSystem(new MainThreadDispatchSystem(queue), SystemGroup.INPUT);
            }
            for (SystemRegistration reg : systems) {
                try {
                    sysMgr.registerSystem(reg.system(), reg.group());
                } catch (RuntimeException ex) {
                    throw new IllegalStateException("Failed to register system " + reg.system().getClass().getName(), ex);
                }
            }

            log.debug("Flux instance built: {}", settings);
            return new Flux(context, sysMgr);
        }
    }
}
