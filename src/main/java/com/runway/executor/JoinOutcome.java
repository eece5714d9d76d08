package com.runway.executor;

/**
 * Result of waiting for two independent completion signals.
 */
public enum JoinOutcome {
    /** Both signals arrived within the window. */
    BOTH_ARRIVED,
    /** The window elapsed with at most one signal. */
    TIMED_OUT
}
