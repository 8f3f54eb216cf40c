package com.movesim.simulator;

import com.movesim.codec.SampleCodec;
import com.movesim.config.SimulationConfig;
import com.movesim.domain.model.SessionSummary;
import com.movesim.event.SimulationSessionEvent;
import com.movesim.event.SimulationSessionEventType;
import com.movesim.exception.ValidationException;
import com.movesim.observability.SimulationMetrics;
import com.movesim.repository.SampleStore;
import com.movesim.simulator.SupervisorState.RetiredSession;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.SplittableRandom;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Owns the single live simulation session and the generator task of every entity in it.
 *
 * <p>Lifecycle:
 * <ul>
 *   <li>{@link #start} tears down any live session, then spawns one {@link MovementGenerator}
 *       per entity under a fresh root {@link CancellationToken} bounded by a deadline</li>
 *   <li>{@link #stop} cancels the live session and clears the entity table; a no-op when idle</li>
 *   <li>the deadline fires the root token with {@link CancellationCause#DEADLINE}; a listener on
 *       the token then clears the table without signalling again</li>
 * </ul>
 *
 * <p>The entity table and the current-session reference ({@link SupervisorState}) are only
 * touched under {@link #lock}. The lock covers table mutation and task submission only; waiting
 * for generators, flushing and generating all happen outside it.
 *
 * <p>Stop and supersede wait up to {@code stop-grace-period} for cancelled generators to finish
 * their final flush, so an old session's entities stop producing before {@link #start} returns.
 */
@Service
public class SessionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(SessionSupervisor.class);

    private final SampleStore sampleStore;
    private final SampleCodec sampleCodec;
    private final SimulationConfig simulationConfig;
    private final SimulationMetrics simulationMetrics;
    private final ThreadPoolTaskExecutor generatorExecutor;
    private final TaskScheduler sessionScheduler;
    private final ApplicationEventPublisher applicationEventPublisher;

    private final ReentrantLock lock = new ReentrantLock();

    /** Guarded by {@link #lock}. */
    private final SupervisorState state = new SupervisorState();

    /** Guarded by {@link #lock}. Split once per generator so no two entities share a stream. */
    private final SplittableRandom seedSource = new SplittableRandom();

    public SessionSupervisor(
            SampleStore sampleStore,
            SampleCodec sampleCodec,
            SimulationConfig simulationConfig,
            SimulationMetrics simulationMetrics,
            @Qualifier("generatorExecutor") ThreadPoolTaskExecutor generatorExecutor,
            @Qualifier("sessionScheduler") TaskScheduler sessionScheduler,
            ApplicationEventPublisher applicationEventPublisher) {
        this.sampleStore = sampleStore;
        this.sampleCodec = sampleCodec;
        this.simulationConfig = simulationConfig;
        this.simulationMetrics = simulationMetrics;
        this.generatorExecutor = generatorExecutor;
        this.sessionScheduler = sessionScheduler;
        this.applicationEventPublisher = applicationEventPublisher;
    }

    /**
     * Starts a session with the configured default duration.
     */
    public SessionSummary start(Collection<String> entityIds) {
        return start(entityIds, simulationConfig.getDuration());
    }

    /**
     * Replaces any live session with a new one simulating {@code entityIds} for {@code duration}.
     *
     * <p>{@code null} and empty-string ids are skipped; whitespace-only ids are kept. Duplicates
     * collapse to one generator.
     *
     * @param duration session length, or null for the configured default
     * @throws ValidationException if no id survives filtering or the duration is not positive
     */
    public SessionSummary start(Collection<String> entityIds, Duration duration) {
        RetiredSession previous = detachCurrent();
        if (previous != null) {
            teardown(previous, CancellationCause.SUPERSEDED, true);
        }

        Duration sessionLength = duration != null ? duration : simulationConfig.getDuration();
        if (sessionLength.isNegative() || sessionLength.isZero()) {
            throw new ValidationException("Simulation duration must be positive, got " + sessionLength);
        }

        List<String> accepted = filterEntityIds(entityIds);
        if (accepted.isEmpty()) {
            throw new ValidationException("User ID list cannot be empty");
        }

        Instant now = Instant.now();
        SimulationSession session =
                new SimulationSession(UUID.randomUUID().toString(), now, now.plus(sessionLength));

        RetiredSession displaced;
        List<String> running;
        lock.lock();
        try {
            // another start may have installed a session since detachCurrent() above
            displaced = state.detach();
            state.install(session);
            for (String entityId : accepted) {
                spawn(session, entityId);
            }
            scheduleDeadline(session);
            running = state.orderedEntityIds();
        } finally {
            lock.unlock();
        }

        if (displaced != null) {
            teardown(displaced, CancellationCause.SUPERSEDED, false);
        }

        log.info(
                "Simulation {} started for {} entities, will run for approximately {}",
                session.getSessionId(),
                running.size(),
                sessionLength);
        publish(session, SimulationSessionEventType.STARTED, running);

        return SessionSummary.builder()
                .active(true)
                .sessionId(session.getSessionId())
                .entityIds(running)
                .startedAt(session.getStartedAt())
                .deadline(session.getDeadline())
                .build();
    }

    /**
     * Stops the live session, if any. Idempotent.
     */
    public void stop() {
        stop(CancellationCause.MANUAL);
    }

    /**
     * Stops the live session when the application context closes.
     */
    @PreDestroy
    public void shutdown() {
        stop(CancellationCause.SHUTDOWN);
    }

    public SessionSummary status() {
        lock.lock();
        try {
            SimulationSession session = state.current();
            if (session == null) {
                return SessionSummary.idle();
            }
            return SessionSummary.builder()
                    .active(true)
                    .sessionId(session.getSessionId())
                    .entityIds(state.orderedEntityIds())
                    .startedAt(session.getStartedAt())
                    .deadline(session.getDeadline())
                    .build();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Entities that currently hold a generation handle.
     */
    public Set<String> activeEntityIds() {
        lock.lock();
        try {
            return state.entityIds();
        } finally {
            lock.unlock();
        }
    }

    private void stop(CancellationCause cause) {
        RetiredSession retired = detachCurrent();
        if (retired == null) {
            log.info("Stop request received, but no simulation is currently active");
            return;
        }
        teardown(retired, cause, true);
    }

    private RetiredSession detachCurrent() {
        lock.lock();
        try {
            return state.detach();
        } finally {
            lock.unlock();
        }
    }

    /** Caller holds {@link #lock}. */
    private void spawn(SimulationSession session, String entityId) {
        CancellationToken token = session.getRootToken().child();
        MovementGenerator generator = new MovementGenerator(
                entityId,
                token,
                new MovementModel(seedSource.split(), simulationConfig.getMaxStepMagnitude()),
                sampleStore,
                sampleCodec,
                simulationMetrics,
                simulationConfig);
        try {
            Future<?> task = generatorExecutor.submit(generator);
            state.register(new GenerationHandle(entityId, token, task));
        } catch (TaskRejectedException e) {
            token.cancel(CancellationCause.REJECTED);
            log.error("Could not schedule generator for entity {}: {}", entityId, e.getMessage());
        }
    }

    /** Caller holds {@link #lock}. */
    private void scheduleDeadline(SimulationSession session) {
        CancellationToken root = session.getRootToken();
        root.onCancel(cause -> {
            if (cause == CancellationCause.DEADLINE) {
                expire(session);
            }
        });
        session.setDeadlineTask(
                sessionScheduler.schedule(() -> root.cancel(CancellationCause.DEADLINE), session.getDeadline()));
    }

    /**
     * Deadline path. The root token has already fired; only the bookkeeping is left.
     */
    private void expire(SimulationSession session) {
        List<String> entityIds;
        lock.lock();
        try {
            if (state.current() != session) {
                return;
            }
            entityIds = state.orderedEntityIds();
            state.detach();
        } finally {
            lock.unlock();
        }

        if (!session.markTornDown()) {
            return;
        }
        log.info("Simulation {} reached its deadline, stopped automatically", session.getSessionId());
        publish(session, SimulationSessionEventType.EXPIRED, entityIds);
    }

    private void teardown(RetiredSession retired, CancellationCause cause, boolean awaitGenerators) {
        SimulationSession session = retired.session();
        if (!session.markTornDown()) {
            return;
        }

        session.cancelDeadlineTask();
        session.getRootToken().cancel(cause);

        List<String> entityIds = new ArrayList<>();
        retired.handles().forEach(handle -> entityIds.add(handle.entityId()));
        log.info("Stopping {} generators of simulation {} ({})", entityIds.size(), session.getSessionId(), cause);

        if (awaitGenerators) {
            awaitTermination(retired.handles());
        }

        publish(session, eventTypeFor(cause), entityIds);
        log.info("Simulation {} stopped", session.getSessionId());
    }

    private void awaitTermination(List<GenerationHandle> handles) {
        long deadline = System.nanoTime() + simulationConfig.getStopGracePeriod().toNanos();
        for (GenerationHandle handle : handles) {
            long remaining = deadline - System.nanoTime();
            try {
                handle.task().get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
            } catch (TimeoutException e) {
                log.warn("Generator for entity {} still running after the grace period", handle.entityId());
            } catch (CancellationException e) {
                log.debug("Generator task for entity {} was cancelled before it ran", handle.entityId());
            } catch (ExecutionException e) {
                log.error("Generator for entity {} failed: {}", handle.entityId(), e.getCause().getMessage(), e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for generators to stop");
                return;
            }
        }
    }

    private static SimulationSessionEventType eventTypeFor(CancellationCause cause) {
        return switch (cause) {
            case SUPERSEDED -> SimulationSessionEventType.SUPERSEDED;
            case SHUTDOWN -> SimulationSessionEventType.SHUTDOWN;
            case DEADLINE -> SimulationSessionEventType.EXPIRED;
            default -> SimulationSessionEventType.STOPPED;
        };
    }

    private void publish(SimulationSession session, SimulationSessionEventType type, List<String> entityIds) {
        applicationEventPublisher.publishEvent(
                new SimulationSessionEvent(this, session.getSessionId(), type, entityIds));
    }

    private static List<String> filterEntityIds(Collection<String> entityIds) {
        if (entityIds == null) {
            return List.of();
        }
        Set<String> accepted = new LinkedHashSet<>();
        for (String entityId : entityIds) {
            if (entityId == null || entityId.isEmpty()) {
                log.info("Skipping empty user ID in start request");
                continue;
            }
            if (!accepted.add(entityId)) {
                log.debug("Ignoring duplicate user ID {} in start request", entityId);
            }
        }
        return new ArrayList<>(accepted);
    }
}
