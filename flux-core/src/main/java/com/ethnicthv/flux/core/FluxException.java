package com.ethnicthv.flux.core;

/**
 * Base type of the unchecked exceptions raised by the Flux core.
 */
public class FluxException extends RuntimeException {

    public FluxException(String message) {
        super(message);
    }

    public FluxException(String message, Throwable cause) {
        super(message, cause);
    }
}
