package com.movesim.simulator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The entity table and the current-session reference, kept in lockstep.
 *
 * <p>Not thread-safe: every access goes through {@link SessionSupervisor} while it holds its lock.
 */
class SupervisorState {

    private SimulationSession current;
    private final Map<String, GenerationHandle> handles = new LinkedHashMap<>();

    void install(SimulationSession session) {
        if (current != null) {
            throw new IllegalStateException("Session " + current.getSessionId() + " is still installed");
        }
        current = session;
    }

    void register(GenerationHandle handle) {
        if (current == null) {
            throw new IllegalStateException("No session to register " + handle.entityId() + " with");
        }
        handles.put(handle.entityId(), handle);
    }

    SimulationSession current() {
        return current;
    }

    /**
     * Removes the current session and empties the entity table.
     *
     * @return the removed session with the handles it owned, or null when idle
     */
    RetiredSession detach() {
        if (current == null) {
            return null;
        }
        RetiredSession retired = new RetiredSession(current, new ArrayList<>(handles.values()));
        current = null;
        handles.clear();
        return retired;
    }

    Set<String> entityIds() {
        return Set.copyOf(handles.keySet());
    }

    List<String> orderedEntityIds() {
        return List.copyOf(handles.keySet());
    }

    record RetiredSession(SimulationSession session, List<GenerationHandle> handles) {}
}
