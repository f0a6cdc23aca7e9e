package com.baykanat.socialsync.api.controller;

import com.baykanat.socialsync.api.dto.HeartbeatRequest;
import com.baykanat.socialsync.api.dto.HeartbeatResponse;
import com.baykanat.socialsync.domain.service.HeartbeatFailoverService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/** POST /agent/heartbeat. Agent satırını alive olarak upsert eder. */
@Slf4j
@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
@Tag(name = "Agent Heartbeat", description = "Liveness pings from agent instances")
public class HeartbeatController {

    private final HeartbeatFailoverService failoverService;
    private final Clock clock;

    @PostMapping("/heartbeat")
    @Operation(summary = "Record an agent heartbeat", description = "Upserts the agent row with status alive")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Heartbeat recorded"),
            @ApiResponse(responseCode = "400", description = "Missing agent_id")
    })
    public ResponseEntity<HeartbeatResponse> heartbeat(@Valid @RequestBody HeartbeatRequest request) {
        failoverService.recordBeat(request.getAgentId(), request.getTimestamp());

        return ResponseEntity.ok(HeartbeatResponse.builder()
                .success(true)
                .agentId(request.getAgentId())
                .receivedAt(clock.instant().toString())
                .build());
    }
}
