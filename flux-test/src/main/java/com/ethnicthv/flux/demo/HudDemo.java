package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.Flux;
import com.ethnicthv.flux.core.events.PropertyChangedEvent;
import com.ethnicthv.flux.core.system.SystemGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Demo wiring a HUD to gameplay state: the game loop owns the main thread, a background
 * "network" thread publishes damage, the HUD text bindings are refreshed on the loop thread.
 */
public class HudDemo {

    private static final Logger log = LoggerFactory.getLogger(HudDemo.class);

    public static void main(String[] args) throws InterruptedException {
        try (Flux flux = Flux.builder()
                .tickRate(50f)
                .addSystem(new CombatSystem())
                .addSystem(new HealthRegenerationSystem(5f))
                .addSystem(new SessionTimerSystem(), SystemGroup.PRESENTATION)
                .build();
             TextBinding healthText = new TextBinding(flux.getConverters(), t -> log.info("HUD health: {}", t));
             TextBinding timerText = new TextBinding(flux.getConverters(), t -> log.info("HUD time: {}", t))) {

            healthText.bind(flux.getProperties(), PlayerKeys.HEALTH);
            timerText.bind(flux.getProperties(), PlayerKeys.SESSION_TIME);
            flux.getEventBus().subscribe(PlayerDiedEvent.class, e -> log.info("Player died"));
            flux.getEventBus().subscribe(PropertyChangedEvent.class,
                    e -> log.debug("{} changed: {} -> {}", e.getPropertyKey(), e.getOldValue(), e.getNewValue()), -10);

            ScheduledExecutorService network = Executors.newSingleThreadScheduledExecutor();
            network.scheduleAtFixedRate(
                    () -> flux.getEventBus().publish(new DamageEvent(15, "network")), 200, 400, TimeUnit.MILLISECONDS);
            network.schedule(flux::stop, 3, TimeUnit.SECONDS);

            flux.run();

            network.shutdownNow();
            network.awaitTermination(1, TimeUnit.SECONDS);
            log.info("Final health: {}", flux.getProperties().getProperty(PlayerKeys.HEALTH).getValue());
        }
    }
}
