package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.FluxContext;
import com.ethnicthv.flux.core.properties.ReactiveProperty;
import com.ethnicthv.flux.core.system.BaseSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies {@link DamageEvent}s to the player's health and announces death.
 * <p>
 * Handlers are registered with this system as owner and removed in bulk on dispose.
 */
public class CombatSystem extends BaseSystem {

    private static final Logger log = LoggerFactory.getLogger(CombatSystem.class);

    private ReactiveProperty<Integer> health;

    @Override
    public void onAwake(FluxContext context) {
        super.onAwake(context);
        health = context.getProperties().getOrCreateProperty(PlayerKeys.HEALTH, Integer.class, 100);
        context.getEventBus().subscribe(DamageEvent.class, this::applyDamage, 0, this);
    }

    @Override
    public void onUpdate(float deltaTime) {
        // event driven
    }

    @Override
    public void onDispose() {
        context.getEventBus().unsubscribeAll(this);
    }

    private void applyDamage(DamageEvent event) {
        if (!isEnabled()) {
            return;
        }
        int before = health.getValue();
        if (before == 0) {
            return;
        }
        int after = Math.max(0, before - event.getAmount());
        health.setValue(after);
        log.debug("{} dealt {} damage: {} -> {}", event.getSource(), event.getAmount(), before, after);
        if (after == 0) {
            context.getEventBus().publish(new PlayerDiedEvent());
        }
    }
}
