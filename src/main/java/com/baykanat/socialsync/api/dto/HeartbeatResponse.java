package com.baykanat.socialsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Heartbeat acknowledgement")
public class HeartbeatResponse {

    private boolean success;

    @JsonProperty("agent_id")
    private String agentId;

    @JsonProperty("received_at")
    private String receivedAt;
}
