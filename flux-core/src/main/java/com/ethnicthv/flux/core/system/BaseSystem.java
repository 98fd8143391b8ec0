package com.ethnicthv.flux.core.system;

import com.ethnicthv.flux.core.FluxContext;

/**
 * Convenience base class for systems: keeps the {@link FluxContext} received in
 * {@link #onAwake(FluxContext)}, provides an enabled flag and a no-op {@link #onDispose()}.
 * Subclasses implement {@link #onUpdate(float)}.
 */
public abstract class BaseSystem implements ISystem {

    protected FluxContext context;
    private volatile boolean enabled = true;

    @Override
    public void onAwake(FluxContext context) {
        this.context = context;
    }

    @Override
    public void onDispose() {
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
}
