package com.movesim.event;

/**
 * Classifies the lifecycle transition reported by a {@link SimulationSessionEvent}.
 */
public enum SimulationSessionEventType {

    /** Generators were spawned for a new session. */
    STARTED,

    /** The session was stopped by an explicit stop request. */
    STOPPED,

    /** The session was torn down because a new one started. */
    SUPERSEDED,

    /** The session's deadline elapsed without a manual stop. */
    EXPIRED,

    /** The session was stopped because the application is shutting down. */
    SHUTDOWN
}
