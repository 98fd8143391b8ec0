package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.FluxContext;
import com.ethnicthv.flux.core.properties.ReactiveProperty;
import com.ethnicthv.flux.core.system.BaseSystem;

/**
 * Regenerates the player's health up to its maximum at a fixed rate per second.
 * Runs in the fixed step SIMULATION group; dead players do not regenerate.
 */
public class HealthRegenerationSystem extends BaseSystem {

    private final float pointsPerSecond;
    private ReactiveProperty<Integer> health;
    private ReactiveProperty<Integer> maxHealth;
    private float pending;

    public HealthRegenerationSystem(float pointsPerSecond) {
        if (pointsPerSecond < 0f) {
            throw new IllegalArgumentException("pointsPerSecond must be >= 0");
        }
        this.pointsPerSecond = pointsPerSecond;
    }

    @Override
    public void onAwake(FluxContext context) {
        super.onAwake(context);
        health = context.getProperties().getOrCreateProperty(PlayerKeys.HEALTH, Integer.class, 100);
        maxHealth = context.getProperties().getOrCreateProperty(PlayerKeys.MAX_HEALTH, Integer.class, 100);
    }

    @Override
    public void onUpdate(float deltaTime) {
        int current = health.getValue();
        int max = maxHealth.getValue();
        if (current <= 0 || current >= max) {
            pending = 0f;
            return;
        }
        pending += pointsPerSecond * deltaTime;
        int whole = (int) pending;
        if (whole > 0) {
            pending -= whole;
            health.setValue(Math.min(max, current + whole));
        }
    }
}
