package com.ethnicthv.flux.core.system;

import java.util.Objects;

/**
 * Phase of the tick pipeline. Groups run by ascending priority within their {@link UpdateMode}.
 * <p>
 * Custom phases are plain instances of this record.
 */
public record SystemGroup(String name, int priority, UpdateMode mode) implements Comparable<SystemGroup> {

    public SystemGroup {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(mode, "mode");
    }

    @Override
    public int compareTo(SystemGroup other) {
        int cmp = Integer.compare(this.priority, other.priority);
        if (cmp != 0) return cmp;
        // name keeps equal priorities in a stable order
        return this.name.compareTo(other.name);
    }

    /** First variable phase of a frame; hosts the main thread dispatcher. */
    public static final SystemGroup INPUT = new SystemGroup("Input", 0, UpdateMode.VARIABLE);
    public static final SystemGroup SIMULATION = new SystemGroup("Simulation", 1000, UpdateMode.FIXED);
    public static final SystemGroup PRESENTATION = new SystemGroup("Presentation", 3000, UpdateMode.VARIABLE);
    public static final SystemGroup CLEANUP = new SystemGroup("Cleanup", 4000, UpdateMode.VARIABLE);
}
