package com.movesim.simulator;

/**
 * Why a {@link CancellationToken} fired. Children inherit their parent's cause.
 */
public enum CancellationCause {

    /** Explicit stop request. */
    MANUAL,

    /** The session's deadline elapsed. */
    DEADLINE,

    /** A new session was started while this one was live. */
    SUPERSEDED,

    /** The application context is closing. */
    SHUTDOWN,

    /** The generator task could not be scheduled. */
    REJECTED
}
