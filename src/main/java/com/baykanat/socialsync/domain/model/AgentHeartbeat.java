package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** agent_heartbeats satırı; agent başına tek kayıt. */
@Value
@Builder
public class AgentHeartbeat {

    String agentId;
    Instant lastBeatAt;
    HeartbeatStatus status;
}
