package com.aporkolab.retry.core.sink;

/**
 * Why a message was quarantined. Sent as the {@code ErrorType} attribute.
 */
public enum ErrorType {

    /** Retry budget exhausted; the only code the retry core produces */
    RETRY_COUNT_EXCEEDED,

    /** Body could not be parsed (intake validator) */
    INVALID_MESSAGE_FORMAT,

    /** Body parsed but violated the message schema (intake validator) */
    INVALID_MESSAGE_SCHEMA
}
