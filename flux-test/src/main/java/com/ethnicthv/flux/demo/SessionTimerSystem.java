package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.FluxContext;
import com.ethnicthv.flux.core.properties.ReactiveProperty;
import com.ethnicthv.flux.core.system.BaseSystem;

import java.time.Duration;

/**
 * Publishes the elapsed session time as a persistent {@link Duration} property,
 * changing once per whole second.
 */
public class SessionTimerSystem extends BaseSystem {

    private ReactiveProperty<Duration> sessionTime;
    private double elapsedSeconds;

    @Override
    public void onAwake(FluxContext context) {
        super.onAwake(context);
        sessionTime = new ReactiveProperty<>(Duration.class, Duration.ZERO);
        context.getProperties().registerProperty(PlayerKeys.SESSION_TIME, sessionTime, true);
    }

    @Override
    public void onUpdate(float deltaTime) {
        elapsedSeconds += deltaTime;
        sessionTime.setValue(Duration.ofSeconds((long) elapsedSeconds));
    }
}
