package com.ethnicthv.flux.core.system;

import com.ethnicthv.flux.core.FluxContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Registers systems into execution groups and runs them in a deterministic pipeline.
 * <p>
 * Not thread-safe: registration and updates happen on the main thread.
 */
public class SystemManager {

    private static final Logger log = LoggerFactory.getLogger(SystemManager.class);

    private final FluxContext context;
    private final Map<SystemGroup, List<ISystem>> systemsByGroup = new HashMap<>();
    private final List<SystemGroup> fixedGroups = new ArrayList<>();
    private final List<SystemGroup> variableGroups = new ArrayList<>();

    public SystemManager(FluxContext context) {
        this.context = Objects.requireNonNull(context, "context");
        registerGroupIfAbsent(SystemGroup.INPUT);
        registerGroupIfAbsent(SystemGroup.SIMULATION);
        registerGroupIfAbsent(SystemGroup.PRESENTATION);
        registerGroupIfAbsent(SystemGroup.CLEANUP);
        rebuildGroupOrdering();
    }

    /**
     * Register a system into the default {@link SystemGroup#SIMULATION} group.
     */
    public <T extends ISystem> T registerSystem(T system) {
        return registerSystem(system, SystemGroup.SIMULATION);
    }

    /**
     * Register a system into an explicit execution group. {@link ISystem#onAwake} runs before
     * the system is added to the pipeline.
     */
    public <T extends ISystem> T registerSystem(T system, SystemGroup group) {
        if (system == null) {
            throw new IllegalArgumentException("System cannot be null");
        }
        if (group == null) {
            throw new IllegalArgumentException("SystemGroup cannot be null");
        }
        system.onAwake(context);
        systemsByGroup.computeIfAbsent(group, g -> new ArrayList<>()).add(system);
        rebuildGroupOrdering();
        log.debug("Registered system {} in group {}", system.getClass().getSimpleName(), group.name());
        return system;
    }

    /**
     * Snapshot of all registered systems across all groups.
     */
    public List<ISystem> getRegisteredSystems() {
        List<ISystem> all = new ArrayList<>();
        for (List<ISystem> list : systemsByGroup.values()) {
            all.addAll(list);
        }
        return all;
    }

    public List<ISystem> getSystems(SystemGroup group) {
        List<ISystem> list = systemsByGroup.get(group);
        return list == null ? List.of() : new ArrayList<>(list);
    }

    /**
     * Execute all enabled systems of one group.
     */
    public void updateGroup(SystemGroup group, float deltaTime) {
        List<ISystem> list = systemsByGroup.get(group);
        if (list == null) return;
        for (ISystem sys : list) {
            if (sys.isEnabled()) {
                sys.onUpdate(deltaTime);
            }
        }
    }

    /**
     * Execute every group once: fixed groups first, then variable groups, each in priority order.
     * Useful for tests and hosts that drive their own loop.
     */
    public void update(float deltaTime) {
        for (SystemGroup group : fixedGroups) {
            updateGroup(group, deltaTime);
        }
        for (SystemGroup group : variableGroups) {
            updateGroup(group, deltaTime);
        }
    }

    /**
     * Dispose every system and forget them. A failing {@link ISystem#onDispose()} is logged and
     * does not prevent the others from being disposed.
     */
    public void disposeAll() {
        for (ISystem system : getRegisteredSystems()) {
            try {
                system.onDispose();
            } catch (RuntimeException e) {
                log.error("Failed to dispose system {}", system.getClass().getName(), e);
            }
        }
        for (List<ISystem> list : systemsByGroup.values()) {
            list.clear();
        }
    }

    List<SystemGroup> getFixedGroups() {
        return new ArrayList<>(fixedGroups);
    }

    List<SystemGroup> getVariableGroups() {
        return new ArrayList<>(variableGroups);
    }

    private void registerGroupIfAbsent(SystemGroup group) {
        systemsByGroup.computeIfAbsent(group, g -> new ArrayList<>());
    }

    private void rebuildGroupOrdering() {
        fixedGroups.clear();
        variableGroups.clear();
        for (SystemGroup group : systemsByGroup.keySet()) {
            if (group.mode() == UpdateMode.FIXED) {
                fixedGroups.add(group);
            } else {
                variableGroups.add(group);
            }
        }
        Collections.sort(fixedGroups);
        Collections.sort(variableGroups);
    }
}
