package com.aporkolab.retry.core.schedule;

/**
 * What the delayed-delivery service does with a schedule once it has fired.
 */
public enum ActionAfterCompletion {
    DELETE,
    NONE
}
