package com.ethnicthv.flux.core.threading;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Marshaller backed by a lock-free FIFO queue that the owning thread drains once per tick.
 * <p>
 * The owning thread is the thread that constructed the marshaller until
 * {@link #bindToCurrentThread()} rebinds it (the game loop does so when it starts).
 * Actions submitted from the owning thread run inline; actions from any other thread are
 * queued and executed by {@link #drain()}, at most {@link #getMaxActionsPerTick()} per call.
 * A failing action is logged and does not prevent the remaining actions from running.
 */
public final class MainThreadMarshaller implements ThreadMarshaller {

    private static final Logger log = LoggerFactory.getLogger(MainThreadMarshaller.class);

    public static final int DEFAULT_MAX_ACTIONS_PER_TICK = 100;

    private final ConcurrentLinkedQueue<Runnable> queue = new ConcurrentLinkedQueue<>();
    // ConcurrentLinkedQueue#size is O(n)
    private final AtomicInteger queued = new AtomicInteger();
    private volatile Thread mainThread;
    private volatile int maxActionsPerTick;

    public MainThreadMarshaller() {
        this(DEFAULT_MAX_ACTIONS_PER_TICK);
    }

    public MainThreadMarshaller(int maxActionsPerTick) {
        setMaxActionsPerTick(maxActionsPerTick);
        this.mainThread = Thread.currentThread();
    }

    @Override
    public void executeOnMainThread(Runnable action) {
        Objects.requireNonNull(action, "action");
        if (isMainThread()) {
            action.run();
            return;
        }
        queue.offer(action);
        queued.incrementAndGet();
    }

    @Override
    public boolean isMainThread() {
        return Thread.currentThread() == mainThread;
    }

    @Override
    public void bindToCurrentThread() {
        Thread current = Thread.currentThread();
        if (current != mainThread) {
            log.debug("Main thread rebound from '{}' to '{}'", mainThread.getName(), current.getName());
            mainThread = current;
        }
    }

    /**
     * Execute queued actions in submission order, at most {@link #getMaxActionsPerTick()} of them.
     * Remaining actions stay queued for the next call.
     *
     * @return number of actions executed
     * @throws IllegalStateException when called from a thread other than the main thread
     */
    public int drain() {
        if (!isMainThread()) {
            throw new IllegalStateException("drain() must be called on the main thread '"
                    + mainThread.getName() + "', not '" + Thread.currentThread().getName() + "'");
        }
        int budget = maxActionsPerTick;
        int executed = 0;
        Runnable action;
        while (executed < budget && (action = queue.poll()) != null) {
            queued.decrementAndGet();
            executed++;
            try {
                action.run();
            } catch (RuntimeException e) {
                log.error("Error executing main thread action", e);
            }
        }
        if (executed == budget && !queue.isEmpty()) {
            log.trace("{} main thread actions deferred to the next tick", queued.get());
        }
        return executed;
    }

    /** Approximate number of actions waiting to be drained. */
    public int getQueuedActionCount() {
        return queued.get();
    }

    /**
     * Drop every queued action without running it.
     *
     * @return number of dropped actions
     */
    public int clearQueue() {
        int dropped = 0;
        while (queue.poll() != null) {
            queued.decrementAndGet();
            dropped++;
        }
        if (dropped > 0) {
            log.debug("Cleared {} pending main thread actions", dropped);
        }
        return dropped;
    }

    public int getMaxActionsPerTick() {
        return maxActionsPerTick;
    }

    public void setMaxActionsPerTick(int maxActionsPerTick) {
        if (maxActionsPerTick <= 0) {
            throw new IllegalArgumentException("maxActionsPerTick must be > 0, got " + maxActionsPerTick);
        }
        this.maxActionsPerTick = maxActionsPerTick;
    }
}
