package com.ethnicthv.flux.core.system;

import com.ethnicthv.flux.core.FluxContext;

/**
 * Contract for systems ticked by the {@link SystemManager}.
 * <p>
 * Lifecycle:
 * <ul>
 *     <li>{@link #onAwake(FluxContext)} - once, when the system is registered.</li>
 *     <li>{@link #onUpdate(float)} - every tick of its group while enabled, on the main thread.</li>
 *     <li>{@link #onDispose()} - when the owning Flux instance is closed.</li>
 * </ul>
 */
public interface ISystem {

    void onAwake(FluxContext context);

    /**
     * @param deltaTime time in seconds since the last update (fixed or variable step)
     */
    void onUpdate(float deltaTime);

    void onDispose();

    boolean isEnabled();

    /** Disabled systems are skipped by the update loop. */
    void setEnabled(boolean enabled);
}
