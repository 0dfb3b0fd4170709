package com.proxynode.core.node;

/**
 * How a start push was handled.
 */
public enum StartOutcome {
    /** A new engine instance was started. */
    STARTED,
    /** The running instance already matches the pushed state. */
    UNCHANGED,
    /** The engine could not be started. */
    FAILED,
    /** Another start push was in progress; this one was rejected. */
    CONFLICT
}
