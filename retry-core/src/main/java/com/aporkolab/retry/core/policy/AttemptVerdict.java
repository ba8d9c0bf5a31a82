package com.aporkolab.retry.core.policy;

/**
 * Outcome of {@link AttemptLimiter#classify(int)}.
 */
public enum AttemptVerdict {

    /** Budget left, schedule another delivery */
    CONTINUE,

    /** Budget used up, quarantine the message */
    EXHAUSTED
}
