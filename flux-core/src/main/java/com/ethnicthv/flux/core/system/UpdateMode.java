package com.ethnicthv.flux.core.system;

/**
 * Defines when a group of systems should execute.
 */
public enum UpdateMode {
    /**
     * Runs once per frame with the measured frame time.
     * Use for: input, main thread dispatch, UI refresh.
     */
    VARIABLE,

    /**
     * Runs in the fixed time step loop (deterministic).
     * Use for: simulation and gameplay logic that drives properties.
     */
    FIXED
}
