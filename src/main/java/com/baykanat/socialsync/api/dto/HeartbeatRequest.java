package com.baykanat.socialsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** Agent heartbeat ping'i. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Heartbeat ping sent by an agent instance")
public class HeartbeatRequest {

    @NotBlank(message = "agent_id is required")
    @JsonProperty("agent_id")
    @Schema(description = "Agent instance identifier", example = "5f1c2a1e-9d7b-4c55-8a43-0b8f0f6a2e11")
    private String agentId;

    @JsonProperty("timestamp")
    @Schema(description = "Beat time (ISO-8601); server time is used when absent", example = "2026-10-19T08:30:00Z")
    private Instant timestamp;
}
