package com.movesim.simulator;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One simulation run: the root cancellation token shared by all of its generators, and its
 * deadline.
 *
 * <p>Teardown happens at most once no matter which path gets there first (manual stop, a new
 * session, deadline, shutdown); see {@link #markTornDown()}.
 */
class SimulationSession {

    private final String sessionId;
    private final CancellationToken rootToken = CancellationToken.root();
    private final Instant startedAt;
    private final Instant deadline;
    private final AtomicBoolean tornDown = new AtomicBoolean(false);

    private volatile ScheduledFuture<?> deadlineTask;

    SimulationSession(String sessionId, Instant startedAt, Instant deadline) {
        this.sessionId = sessionId;
        this.startedAt = startedAt;
        this.deadline = deadline;
    }

    String getSessionId() {
        return sessionId;
    }

    CancellationToken getRootToken() {
        return rootToken;
    }

    Instant getStartedAt() {
        return startedAt;
    }

    Instant getDeadline() {
        return deadline;
    }

    void setDeadlineTask(ScheduledFuture<?> deadlineTask) {
        this.deadlineTask = deadlineTask;
    }

    /**
     * Unschedules the deadline timer. Does not touch the token.
     */
    void cancelDeadlineTask() {
        ScheduledFuture<?> task = deadlineTask;
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Claims the right to tear this session down. True for exactly one caller.
     */
    boolean markTornDown() {
        return tornDown.compareAndSet(false, true);
    }
}
