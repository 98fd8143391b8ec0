package com.ethnicthv.flux.demo;

import com.ethnicthv.flux.core.events.FluxEventBase;

public final class DamageEvent extends FluxEventBase {

    private final int amount;

    public DamageEvent(int amount, String source) {
        super(source);
        if (amount < 0) {
            throw new IllegalArgumentException("amount must be >= 0, got " + amount);
        }
        this.amount = amount;
    }

    public int getAmount() {
        return amount;
    }
}
