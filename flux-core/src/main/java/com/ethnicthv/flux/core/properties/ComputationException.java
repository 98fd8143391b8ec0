package com.ethnicthv.flux.core.properties;

import com.ethnicthv.flux.core.FluxException;

/**
 * Thrown when the computation of a {@link ComputedProperty} fails. The property keeps its
 * previous cached value and stays dirty, so the next read retries.
 */
public class ComputationException extends FluxException {

    public ComputationException(String message, Throwable cause) {
        super(message, cause);
    }
}
