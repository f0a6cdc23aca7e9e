package com.baykanat.socialsync.api.controller;

import com.baykanat.socialsync.domain.service.HeartbeatFailoverService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Clock;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for HeartbeatController.
 */
@WebMvcTest(HeartbeatController.class)
class HeartbeatControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HeartbeatFailoverService failoverService;

    @MockitoBean
    private Clock clock;

    @Test
    @DisplayName("POST /agent/heartbeat - valid beat should return 200")
    void validBeat() throws Exception {
        Instant beat = Instant.parse("2026-10-19T08:30:00Z");
        when(clock.instant()).thenReturn(beat);

        mockMvc.perform(post("/agent/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"agent_id\": \"agent-1\", \"timestamp\": \"2026-10-19T08:30:00Z\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.agent_id").value("agent-1"));

        verify(failoverService).recordBeat("agent-1", beat);
    }

    @Test
    @DisplayName("POST /agent/heartbeat - missing agent_id should return 400")
    void missingAgentId() throws Exception {
        mockMvc.perform(post("/agent/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Validation failed"));

        verify(failoverService, never()).recordBeat(any(), any());
    }
}
