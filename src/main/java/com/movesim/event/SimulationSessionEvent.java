package com.movesim.event;

import java.time.Instant;
import java.util.List;
import org.springframework.context.ApplicationEvent;

/**
 * Published by {@link com.movesim.simulator.SessionSupervisor} whenever a simulation session
 * starts or ends. Each session publishes exactly one STARTED event and at most one terminal event.
 */
public class SimulationSessionEvent extends ApplicationEvent {

    private final String sessionId;
    private final SimulationSessionEventType eventType;
    private final List<String> entityIds;
    private final Instant occurredAt;

    public SimulationSessionEvent(
            Object source, String sessionId, SimulationSessionEventType eventType, List<String> entityIds) {
        super(source);
        this.sessionId = sessionId;
        this.eventType = eventType;
        this.entityIds = List.copyOf(entityIds);
        this.occurredAt = Instant.now();
    }

    public String getSessionId() {
        return sessionId;
    }

    public SimulationSessionEventType getEventType() {
        return eventType;
    }

    public List<String> getEntityIds() {
        return entityIds;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
