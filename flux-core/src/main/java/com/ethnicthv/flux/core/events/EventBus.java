package com.ethnicthv.flux.core.events;

import com.ethnicthv.flux.core.Subscription;
import com.ethnicthv.flux.core.threading.ThreadMarshaller;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Typed publish/subscribe bus.
 * <p>
 * Handlers are keyed by the exact event class. Each type's handler list is an immutable
 * snapshot: subscribing appends atomically through {@link ConcurrentHashMap#compute}, removal
 * rebuilds the list and swaps it in with a compare-and-swap that is retried until it wins.
 * Publishing never takes a lock: it copies the current snapshot, orders it by descending
 * priority (ties keep subscription order) and dispatches inline on the main thread or through
 * the {@link ThreadMarshaller} otherwise. A failing handler is logged and does not stop delivery
 * to the others.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    public static final int DEFAULT_SUBSCRIBER_SOFT_LIMIT = 100;

    // Removal attempts after which CAS contention is reported
    static final int CONTENTION_WARNING_ATTEMPTS = 16;

    private static final Comparator<HandlerEntry> BY_PRIORITY_DESCENDING =
            (a, b) -> Integer.compare(b.priority(), a.priority());

    private final ThreadMarshaller marshaller;
    private final int subscriberSoftLimit;
    private final ConcurrentHashMap<Class<?>, List<HandlerEntry>> handlers = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<MonitorSlot> monitors = new CopyOnWriteArrayList<>();
    private final AtomicLong nextHandlerId = new AtomicLong();
    private final AtomicBoolean initialized = new AtomicBoolean();

    public EventBus(ThreadMarshaller marshaller) {
        this(marshaller, DEFAULT_SUBSCRIBER_SOFT_LIMIT);
    }

    public EventBus(ThreadMarshaller marshaller, int subscriberSoftLimit) {
        this.marshaller = Objects.requireNonNull(marshaller, "marshaller");
        if (subscriberSoftLimit <= 0) {
            throw new IllegalArgumentException("subscriberSoftLimit must be > 0, got " + subscriberSoftLimit);
        }
        this.subscriberSoftLimit = subscriberSoftLimit;
    }

    /**
     * One-time initialization latch. Subsequent calls are no-ops.
     */
    public void initialize() {
        if (initialized.compareAndSet(false, true)) {
            log.debug("EventBus initialized (subscriber soft limit {})", subscriberSoftLimit);
        }
    }

    public boolean isInitialized() {
        return initialized.get();
    }

    public <T extends IFluxEvent> Subscription subscribe(Class<T> eventType, Consumer<? super T> handler) {
        return subscribe(eventType, handler, 0, null);
    }

    public <T extends IFluxEvent> Subscription subscribe(Class<T> eventType, Consumer<? super T> handler, int priority) {
        return subscribe(eventType, handler, priority, null);
    }

    /**
     * Register {@code handler} for events whose runtime class is exactly {@code eventType}.
     *
     * @param priority higher runs first
     * @param owner    optional receiver used by {@link #unsubscribeAll(Object)}
     * @return handle removing exactly this registration
     */
    public <T extends IFluxEvent> Subscription subscribe(Class<T> eventType, Consumer<? super T> handler,
                                                         int priority, Object owner) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");

        HandlerEntry entry = new HandlerEntry(nextHandlerId.incrementAndGet(), handler, priority, owner);
        List<HandlerEntry> updated = handlers.compute(eventType, (type, current) -> append(current, entry));

        if (updated.size() > subscriberSoftLimit) {
            log.warn("Event type {} has {} subscribers (soft limit {}), possible subscription leak",
                    eventType.getSimpleName(), updated.size(), subscriberSoftLimit);
        }
        return Subscription.of(() -> removeWhere(eventType, e -> e.id() == entry.id()));
    }

    /**
     * Remove every registration of {@code handler} for {@code eventType}.
     *
     * @return {@code true} if at least one registration was removed
     */
    public <T extends IFluxEvent> boolean unsubscribe(Class<T> eventType, Consumer<? super T> handler) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(handler, "handler");
        return removeWhere(eventType, e -> e.handler().equals(handler)) > 0;
    }

    /**
     * Remove, across all event types, every registration made with {@code owner}.
     *
     * @return number of removed registrations
     */
    public int unsubscribeAll(Object owner) {
        if (owner == null) {
            return 0;
        }
        int removed = 0;
        for (Class<?> eventType : List.copyOf(handlers.keySet())) {
            removed += removeWhere(eventType, e -> e.owner() == owner);
        }
        if (removed > 0) {
            log.debug("Removed {} event handlers owned by {}", removed, owner.getClass().getSimpleName());
        }
        return removed;
    }

    /**
     * Register a monitor that observes every published event before dispatch.
     */
    public Subscription addPublishMonitor(Consumer<? super IFluxEvent> monitor) {
        MonitorSlot slot = new MonitorSlot(Objects.requireNonNull(monitor, "monitor"));
        monitors.add(slot);
        return Subscription.of(() -> monitors.remove(slot));
    }

    /**
     * Publish {@code event} to the handlers of its runtime class.
     */
    @SuppressWarnings("unchecked")
    public <T extends IFluxEvent> void publish(T event) {
        Objects.requireNonNull(event, "event");
        publish((Class<T>) event.getClass(), event);
    }

    /**
     * Publish {@code event} to the handlers registered for {@code eventType}.
     */
    public <T extends IFluxEvent> void publish(Class<T> eventType, T event) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(event, "event");

        notifyMonitors(event);

        List<HandlerEntry> current = handlers.get(eventType);
        if (current == null || current.isEmpty()) {
            return;
        }
        List<HandlerEntry> ordered = new ArrayList<>(current);
        ordered.sort(BY_PRIORITY_DESCENDING);

        if (marshaller.isMainThread()) {
            deliver(ordered, event);
        } else {
            marshaller.executeOnMainThread(() -> deliver(ordered, event));
        }
    }

    public int getSubscriberCount(Class<? extends IFluxEvent> eventType) {
        List<HandlerEntry> current = handlers.get(eventType);
        return current == null ? 0 : current.size();
    }

    public int getTotalSubscriberCount() {
        int total = 0;
        for (List<HandlerEntry> list : handlers.values()) {
            total += list.size();
        }
        return total;
    }

    /** Remove all handlers. Publish monitors are kept. */
    public void clear() {
        handlers.clear();
        log.debug("EventBus cleared");
    }

    private void notifyMonitors(IFluxEvent event) {
        for (MonitorSlot slot : monitors) {
            try {
                slot.monitor().accept(event);
            } catch (RuntimeException e) {
                log.error("Publish monitor failed for {}", event.getClass().getSimpleName(), e);
            }
        }
    }

    private static void deliver(List<HandlerEntry> ordered, IFluxEvent event) {
        for (HandlerEntry entry : ordered) {
            try {
                entry.invoke(event);
            } catch (RuntimeException e) {
                log.error("Event handler failed for {}", event.getClass().getSimpleName(), e);
            }
        }
    }

    private static List<HandlerEntry> append(List<HandlerEntry> current, HandlerEntry entry) {
        if (current == null || current.isEmpty()) {
            return List.of(entry);
        }
        List<HandlerEntry> next = new ArrayList<>(current.size() + 1);
        next.addAll(current);
        next.add(entry);
        return List.copyOf(next);
    }

    private int removeWhere(Class<?> eventType, Predicate<HandlerEntry> predicate) {
        int attempts = 0;
        while (true) {
            List<HandlerEntry> current = handlers.get(eventType);
            if (current == null) {
                return 0;
            }
            List<HandlerEntry> remaining = new ArrayList<>(current.size());
            for (HandlerEntry entry : current) {
                if (!predicate.test(entry)) {
                    remaining.add(entry);
                }
            }
            int removed = current.size() - remaining.size();
            if (removed == 0) {
                return 0;
            }
            if (handlers.replace(eventType, current, List.copyOf(remaining))) {
                return removed;
            }
            if (++attempts == CONTENTION_WARNING_ATTEMPTS) {
                log.warn("Unsubscribe from {} still contended after {} attempts, retrying",
                        eventType.getSimpleName(), attempts);
            }
        }
    }

    private record HandlerEntry(long id, Consumer<?> handler, int priority, Object owner) {

        @SuppressWarnings("unchecked")
        void invoke(IFluxEvent event) {
            ((Consumer<Object>) handler).accept(event);
        }
    }

    // Identity wrapper so the same monitor can be added twice and removed independently
    private static final class MonitorSlot {
        private final Consumer<? super IFluxEvent> monitor;

        MonitorSlot(Consumer<? super IFluxEvent> monitor) {
            this.monitor = monitor;
        }

        Consumer<? super IFluxEvent> monitor() {
            return monitor;
        }
    }
}
