package com.ethnicthv.flux.core.events;

import java.time.Instant;
import java.util.UUID;

/**
 * Convenience base for events: stamps creation time, a random id and a source name,
 * which defaults to the concrete event class' simple name.
 */
public abstract class FluxEventBase implements IFluxEvent {

    private final Instant timestamp;
    private final String eventId;
    private final String source;

    protected FluxEventBase() {
        this(null);
    }

    protected FluxEventBase(String source) {
        this.timestamp = Instant.now();
        this.eventId = UUID.randomUUID().toString();
        this.source = source != null ? source : getClass().getSimpleName();
    }

    @Override
    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String getEventId() {
        return eventId;
    }

    @Override
    public String getSource() {
        return source;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{id=" + eventId + ", source=" + source + ", at=" + timestamp + '}';
    }
}
