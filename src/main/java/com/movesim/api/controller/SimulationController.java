package com.movesim.api.controller;

import com.movesim.api.dto.request.StartRequest;
import com.movesim.api.dto.response.SessionStatusResponse;
import com.movesim.domain.model.SessionSummary;
import com.movesim.mapper.LocationMapper;
import com.movesim.simulator.SessionSupervisor;
import jakarta.validation.Valid;
import java.time.Duration;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for the simulation session lifecycle.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>POST /start  - Body: {"user_ids": ["id1", "id2"], "duration_seconds": 30}</li>
 *   <li>POST /stop   - Stop the live session (always 200)</li>
 *   <li>GET  /status - Live session summary</li>
 * </ul>
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final SessionSupervisor sessionSupervisor;
    private final LocationMapper locationMapper;

    /**
     * Replaces any running session. Returns 400 when no usable user id is given.
     */
    @PostMapping("/start")
    public ResponseEntity<SessionStatusResponse> start(@Valid @RequestBody StartRequest request) {
        log.info("Received /start request for {} users", request.getUserIds().size());

        Duration duration =
                request.getDurationSeconds() != null ? Duration.ofSeconds(request.getDurationSeconds()) : null;
        SessionSummary summary = sessionSupervisor.start(request.getUserIds(), duration);
        return ResponseEntity.ok(locationMapper.toResponse(summary));
    }

    @PostMapping("/stop")
    public ResponseEntity<Map<String, String>> stop() {
        sessionSupervisor.stop();
        return ResponseEntity.ok(Map.of("message", "All active simulations stopped"));
    }

    @GetMapping("/status")
    public ResponseEntity<SessionStatusResponse> status() {
        return ResponseEntity.ok(locationMapper.toResponse(sessionSupervisor.status()));
    }
}
