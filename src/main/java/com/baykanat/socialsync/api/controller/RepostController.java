package com.baykanat.socialsync.api.controller;

import com.baykanat.socialsync.api.dto.RepostRequest;
import com.baykanat.socialsync.api.dto.RepostResponse;
import com.baykanat.socialsync.domain.mapper.QueueRowMapper;
import com.baykanat.socialsync.domain.model.DeliveryOutcome;
import com.baykanat.socialsync.domain.service.RepostService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** POST /agent/repost-ugc. Aksiyon kuyruğa yazılır, ardından hemen dağıtım denenir; 202 döner. */
@Slf4j
@RestController
@RequestMapping("/agent")
@RequiredArgsConstructor
@Tag(name = "UGC Repost", description = "Repost permissioned user-generated content")
public class RepostController {

    private final RepostService repostService;
    private final QueueRowMapper queueRowMapper;

    @PostMapping("/repost-ugc")
    @Operation(summary = "Repost UGC", description = "Queues a repost_ugc action and attempts immediate delivery")
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Repost queued (status shows the delivery result)"),
            @ApiResponse(responseCode = "400", description = "Invalid request or content has no media"),
            @ApiResponse(responseCode = "403", description = "Permission not granted"),
            @ApiResponse(responseCode = "404", description = "Permission or content not found")
    })
    public ResponseEntity<RepostResponse> repost(@Valid @RequestBody RepostRequest request) {
        log.debug("Repost request: account={}, permission={}", request.getBusinessAccountId(), request.getPermissionId());

        DeliveryOutcome outcome = repostService.repost(request.getBusinessAccountId(), request.getPermissionId());

        return ResponseEntity.status(HttpStatus.ACCEPTED).body(queueRowMapper.toRepostResponse(outcome));
    }
}
