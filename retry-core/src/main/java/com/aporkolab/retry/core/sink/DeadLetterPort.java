package com.aporkolab.retry.core.sink;

/**
 * Durable store for quarantined messages. Implementations throw on failure.
 */
public interface DeadLetterPort {

    void send(DeadLetterRecord record);
}
