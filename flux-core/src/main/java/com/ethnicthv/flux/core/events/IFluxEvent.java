package com.ethnicthv.flux.core.events;

import java.time.Instant;

/**
 * Contract of every event carried by the {@link EventBus}.
 */
public interface IFluxEvent {

    /** Moment the event object was created. */
    Instant getTimestamp();

    /** Unique id of this event instance. */
    String getEventId();

    /** Name of the system that raised the event, may be {@code null}. */
    String getSource();
}
