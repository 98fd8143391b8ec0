package com.ethnicthv.flux.core.system;

import com.ethnicthv.flux.core.threading.ThreadMarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Fixed-timestep loop coordinator built on top of {@link SystemManager}.
 * <p>
 * Implements the "Fix Your Timestep" pattern: FIXED groups run at the configured tick rate,
 * VARIABLE groups run once per frame. The thread calling {@link #run()} becomes the main
 * execution context of the {@link ThreadMarshaller}.
 */
public final class GameLoop {

    private static final Logger log = LoggerFactory.getLogger(GameLoop.class);

    // Frame time clamp, avoids the spiral of death after a hitch
    private static final double MAX_FRAME_TIME = 0.25;

    private final SystemManager systems;
    private final ThreadMarshaller marshaller;
    private final float fixedDeltaTime;
    private volatile boolean running = false;

    /**
     * @param targetTickRate fixed update rate in Hz (e.g. 60 => 1/60s)
     */
    public GameLoop(SystemManager systems, ThreadMarshaller marshaller, float targetTickRate) {
        if (systems == null) throw new IllegalArgumentException("systems must not be null");
        if (!(targetTickRate > 0f)) throw new IllegalArgumentException("targetTickRate must be > 0");
        this.systems = systems;
        this.marshaller = Objects.requireNonNull(marshaller, "marshaller");
        this.fixedDeltaTime = 1.0f / targetTickRate;
    }

    /**
     * Run the loop on the calling thread until {@link #stop()} is called from another thread
     * or the thread is interrupted.
     */
    public void run() {
        marshaller.bindToCurrentThread();
        running = true;
        log.info("Game loop started on '{}' at {} Hz", Thread.currentThread().getName(), 1.0f / fixedDeltaTime);

        double accumulator = 0.0;
        long previousTime = System.nanoTime();

        while (running && !Thread.currentThread().isInterrupted()) {
            long now = System.nanoTime();
            double frameTime = (now - previousTime) / 1_000_000_000.0;
            previousTime = now;

            if (frameTime > MAX_FRAME_TIME) frameTime = MAX_FRAME_TIME;

            accumulator += frameTime;
            float deltaTime = (float) frameTime;

            while (accumulator >= fixedDeltaTime) {
                for (SystemGroup group : systems.getFixedGroups()) {
                    systems.updateGroup(group, fixedDeltaTime);
                }
                accumulator -= fixedDeltaTime;
            }

            for (SystemGroup group : systems.getVariableGroups()) {
                systems.updateGroup(group, deltaTime);
            }

            Thread.onSpinWait();
        }
        running = false;
        log.info("Game loop stopped");
    }

    /**
     * Request the loop to stop. The current iteration finishes first.
     */
    public void stop() {
        running = false;
    }

    public boolean isRunning() {
        return running;
    }

    public float getFixedDeltaTime() {
        return fixedDeltaTime;
    }
}
