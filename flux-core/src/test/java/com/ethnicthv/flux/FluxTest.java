package com.ethnicthv.flux;

import com.ethnicthv.flux.core.FluxSettings;
import com.ethnicthv.flux.core.events.PropertyChangedEvent;
import com.ethnicthv.flux.core.properties.ReactiveProperty;
import com.ethnicthv.flux.core.system.BaseSystem;
import com.ethnicthv.flux.core.system.MainThreadDispatchSystem;
import com.ethnicthv.flux.core.system.SystemGroup;
import com.ethnicthv.flux.core.threading.ImmediateThreadMarshaller;
import com.ethnicthv.flux.core.threading.MainThreadMarshaller;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Flux facade")
public class FluxTest {

    @Test
    @DisplayName("Default build uses a queued marshaller drained by the INPUT group")
    void defaultBuild() {
        try (Flux flux = Flux.builder().noConverterDiscovery().build()) {
            assertInstanceOf(MainThreadMarshaller.class, flux.getMarshaller());
            assertTrue(flux.getEventBus().isInitialized());
            assertEquals(FluxSettings.DEFAULT_MAX_MAIN_THREAD_ACTIONS_PER_TICK,
                    ((MainThreadMarshaller) flux.getMarshaller()).getMaxActionsPerTick());
            assertEquals(1, flux.getSystemManager().getSystems(SystemGroup.INPUT).size());
            assertInstanceOf(MainThreadDispatchSystem.class, flux.getSystemManager().getSystems(SystemGroup.INPUT).get(0));
        }
    }

    @Test
    @DisplayName("Work marshalled from another thread is delivered by the next update")
    void updateDrainsMarshalledWork() throws Exception {
        try (Flux flux = Flux.builder().noConverterDiscovery().build()) {
            ReactiveProperty<Integer> health = flux.getProperties().getOrCreateProperty("health", 100);
            List<Integer> received = new ArrayList<>();
            health.subscribe(v -> received.add(v));

            Thread writer = new Thread(() -> health.setValue(80));
            writer.start();
            writer.join(5_000);
            assertTrue(received.isEmpty());

            flux.update(0.016f);
            assertEquals(List.of(80), received);
        }
    }

    @Test
    @DisplayName("Immediate threading builds an inline instance without a dispatcher")
    void immediateBuild() {
        try (Flux flux = Flux.builder().immediateThreading().noConverterDiscovery().build()) {
            assertInstanceOf(ImmediateThreadMarshaller.class, flux.getMarshaller());
            assertTrue(flux.getSystemManager().getSystems(SystemGroup.INPUT).isEmpty());

            List<String> events = new ArrayList<>();
            flux.getEventBus().subscribe(PropertyChangedEvent.class, e -> events.add(e.getPropertyKey()));
            flux.getProperties().getOrCreateProperty("gold", 0).setValue(5);
            assertEquals(List.of("gold"), events);
        }
    }

    @Test
    @DisplayName("Invalid settings are rejected at build time")
    void settingsValidation() {
        assertThrows(IllegalArgumentException.class, () -> Flux.builder().maxMainThreadActionsPerTick(0).build());
        assertThrows(IllegalArgumentException.class, () -> Flux.builder().eventSubscriberSoftLimit(-1).build());
        assertThrows(IllegalArgumentException.class, () -> Flux.builder().tickRate(0f).build());
        assertThrows(NullPointerException.class, () -> Flux.builder().addSystem(null));
    }

    @Test
    @DisplayName("Registered systems are awakened with the context and disposed on close")
    void systemLifecycle() {
        AtomicBoolean disposed = new AtomicBoolean();
        BaseSystem system = new BaseSystem() {
            @Override
            public void onUpdate(float deltaTime) {
                context.getProperties().getOrCreateProperty("ticks", 0).setValue(1);
            }

            @Override
            public void onDispose() {
                disposed.set(true);
            }
        };

        Flux flux = Flux.builder().immediateThreading().noConverterDiscovery().addSystem(system).build();
        flux.updateGroup(SystemGroup.SIMULATION, 0.02f);
        assertEquals(1, flux.getProperties().getProperty("ticks").getValue());

        flux.close();
        assertTrue(disposed.get());
        assertEquals(0, flux.getProperties().getPropertyCount());
        assertEquals(0, flux.getEventBus().getTotalSubscriberCount());
    }

    @Test
    @DisplayName("Explicit converters are registered even without discovery")
    void explicitConverters() {
        try (Flux flux = Flux.builder()
                .immediateThreading()
                .noConverterDiscovery()
                .registerConverter(Integer.class, String.class,
                        com.ethnicthv.flux.core.convert.builtin.IntToStringConverter.class)
                .build()) {
            assertEquals(1, flux.getConverters().getConverterCount());
        }
    }

    @Test
    @DisplayName("Instances are isolated from each other")
    void isolation() {
        try (Flux a = Flux.builder().immediateThreading().noConverterDiscovery().build();
             Flux b = Flux.builder().immediateThreading().noConverterDiscovery().build()) {
            a.getProperties().getOrCreateProperty("shared", 1);
            assertFalse(b.getProperties().hasProperty("shared"));
        }
    }
}
