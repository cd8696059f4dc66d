package com.kotsin.grid.broker;

/**
 * Generic wrapper for any error that occurs while talking to the exchange.
 * Callers treat it as transient: log, abandon the cycle, retry on the next trigger.
 */
public class GatewayException extends RuntimeException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }
}
