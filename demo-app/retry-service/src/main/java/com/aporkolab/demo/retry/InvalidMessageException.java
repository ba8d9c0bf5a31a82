package com.aporkolab.demo.retry;

import com.aporkolab.retry.core.sink.ErrorType;

/**
 * A message that can never be processed. Goes straight to the final DLQ.
 */
public class InvalidMessageException extends RuntimeException {

    private final ErrorType errorType;

    public InvalidMessageException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public InvalidMessageException(ErrorType errorType, String message) {
        this(errorType, message, null);
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
