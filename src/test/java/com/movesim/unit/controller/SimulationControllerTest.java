package com.movesim.unit.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.movesim.api.controller.SimulationController;
import com.movesim.config.ApiResponseAdvice;
import com.movesim.domain.model.SessionSummary;
import com.movesim.exception.GlobalExceptionHandler;
import com.movesim.exception.ValidationException;
import com.movesim.mapper.LocationMapper;
import com.movesim.simulator.SessionSupervisor;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mapstruct.factory.Mappers;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

/**
 * Standalone MockMvc tests for the SimulationController.
 */
@ExtendWith(MockitoExtension.class)
class SimulationControllerTest {

    private MockMvc mockMvc;

    @Mock
    private SessionSupervisor sessionSupervisor;

    @BeforeEach
    void setUp() {
        SimulationController controller =
                new SimulationController(sessionSupervisor, Mappers.getMapper(LocationMapper.class));
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler(), new ApiResponseAdvice())
                .build();
    }

    private static SessionSummary running(String... ids) {
        Instant startedAt = Instant.parse("2025-03-01T09:00:00Z");
        return SessionSummary.builder()
                .active(true)
                .sessionId("session-1")
                .entityIds(List.of(ids))
                .startedAt(startedAt)
                .deadline(startedAt.plusSeconds(30))
                .build();
    }

    @Test
    @DisplayName("POST /start starts a session with the default duration")
    void startWithDefaultDuration() throws Exception {
        when(sessionSupervisor.start(eq(List.of("u1", "u2")), isNull())).thenReturn(running("u1", "u2"));

        mockMvc.perform(post("/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_ids\":[\"u1\",\"u2\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.active").value(true))
                .andExpect(jsonPath("$.data.session_id").value("session-1"))
                .andExpect(jsonPath("$.data.user_ids[0]").value("u1"))
                .andExpect(jsonPath("$.data.user_ids[1]").value("u2"))
                .andExpect(jsonPath("$.data.deadline").value("2025-03-01T09:00:30Z"));
    }

    @Test
    @DisplayName("POST /start forwards duration_seconds")
    void startWithDuration() throws Exception {
        when(sessionSupervisor.start(anyList(), eq(Duration.ofSeconds(5)))).thenReturn(running("u1"));

        mockMvc.perform(post("/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_ids\":[\"u1\"],\"duration_seconds\":5}"))
                .andExpect(status().isOk());

        verify(sessionSupervisor).start(List.of("u1"), Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("POST /start returns 400 for an empty user_ids list")
    void startRejectsEmptyList() throws Exception {
        mockMvc.perform(post("/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_ids\":[]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));

        verifyNoInteractions(sessionSupervisor);
    }

    @Test
    @DisplayName("POST /start returns 400 for a missing or malformed body")
    void startRejectsMalformedBody() throws Exception {
        mockMvc.perform(post("/start").contentType(MediaType.APPLICATION_JSON).content("{"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("MALFORMED_REQUEST"));

        mockMvc.perform(post("/start").contentType(MediaType.APPLICATION_JSON).content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /start returns 400 for an out-of-range duration")
    void startRejectsDuration() throws Exception {
        mockMvc.perform(post("/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_ids\":[\"u1\"],\"duration_seconds\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("POST /start returns 400 when only empty ids remain")
    void startRejectsAllEmptyIds() throws Exception {
        when(sessionSupervisor.start(anyList(), any()))
                .thenThrow(new ValidationException("User ID list cannot be empty"));

        mockMvc.perform(post("/start")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user_ids\":[\"\"]}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.message").value("User ID list cannot be empty"))
                .andExpect(jsonPath("$.error.path").value("/start"));
    }

    @Test
    @DisplayName("GET /start is not allowed")
    void startRequiresPost() throws Exception {
        mockMvc.perform(get("/start")).andExpect(status().isMethodNotAllowed());
    }

    @Test
    @DisplayName("POST /stop always succeeds")
    void stop() throws Exception {
        mockMvc.perform(post("/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.message").value("All active simulations stopped"));

        verify(sessionSupervisor).stop();
    }

    @Test
    @DisplayName("GET /status reports an idle supervisor")
    void statusIdle() throws Exception {
        when(sessionSupervisor.status()).thenReturn(SessionSummary.idle());

        mockMvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.active").value(false))
                .andExpect(jsonPath("$.data.user_ids").isEmpty());
    }

    @Test
    @DisplayName("POST /start with a non-JSON content type returns 415")
    void startRejectsPlainText() throws Exception {
        mockMvc.perform(post("/start").contentType(MediaType.TEXT_PLAIN).content("u1,u2"))
                .andExpect(status().isUnsupportedMediaType())
                .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_MEDIA_TYPE"));

        verifyNoInteractions(sessionSupervisor);
    }
}
