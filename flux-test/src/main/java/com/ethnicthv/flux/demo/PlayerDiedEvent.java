package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.events.FluxEventBase;

public final class PlayerDiedEvent extends FluxEventBase {

    public PlayerDiedEvent() {
        super(CombatSystem.class.getSimpleName());
    }
}
