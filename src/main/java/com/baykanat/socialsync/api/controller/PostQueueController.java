package com.baykanat.socialsync.api.controller;

import com.baykanat.socialsync.api.dto.DeadLetterResponse;
import com.baykanat.socialsync.api.dto.DeadLetterView;
import com.baykanat.socialsync.api.dto.QueueStatusResponse;
import com.baykanat.socialsync.api.dto.RetryRequest;
import com.baykanat.socialsync.api.dto.RetryResponse;
import com.baykanat.socialsync.domain.mapper.QueueRowMapper;
import com.baykanat.socialsync.domain.model.QueueRow;
import com.baykanat.socialsync.domain.service.OutboundActionQueue;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/** post_queue yönetim uçları: durum özeti, dlq listesi, manuel retry. */
@Slf4j
@Validated
@RestController
@RequestMapping("/post-queue")
@RequiredArgsConstructor
@Tag(name = "Post Queue", description = "Outbound action queue administration")
public class PostQueueController {

    private final OutboundActionQueue actionQueue;
    private final QueueRowMapper queueRowMapper;
    private final Clock clock;

    @GetMapping("/status")
    @Operation(summary = "Queue status summary", description = "Row counts grouped by action_type::status")
    public ResponseEntity<QueueStatusResponse> status() {
        Map<String, Long> summary = actionQueue.statusSummary();
        long total = summary.values().stream().mapToLong(Long::longValue).sum();

        return ResponseEntity.ok(QueueStatusResponse.builder()
                .success(true)
                .summary(summary)
                .total(total)
                .timestamp(clock.instant().toString())
                .build());
    }

    @GetMapping("/dlq")
    @Operation(summary = "List dead-lettered rows", description = "Most recently updated first, at most 200")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dead letters returned"),
            @ApiResponse(responseCode = "400", description = "Invalid limit")
    })
    public ResponseEntity<DeadLetterResponse> deadLetters(
            @Parameter(description = "Maximum rows to return (1-200)", example = "50")
            @RequestParam(defaultValue = "50") @Min(1) @Max(OutboundActionQueue.DEAD_LETTER_MAX_LIMIT) int limit) {
        List<QueueRow> rows = actionQueue.findDeadLetters(limit);
        List<DeadLetterView> views = queueRowMapper.toDeadLetterViews(rows);

        return ResponseEntity.ok(DeadLetterResponse.builder()
                .success(true)
                .dlq(views)
                .count(views.size())
                .timestamp(clock.instant().toString())
                .build());
    }

    @PostMapping("/retry")
    @Operation(summary = "Retry a dlq/failed row", description = "Resets the row to pending and clears its error")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Row reset to pending"),
            @ApiResponse(responseCode = "400", description = "Missing queue_id"),
            @ApiResponse(responseCode = "404", description = "Row not found or not in dlq/failed status")
    })
    public ResponseEntity<RetryResponse> retry(@Valid @RequestBody RetryRequest request) {
        QueueRow row = actionQueue.resetForRetry(request.getQueueId());

        return ResponseEntity.ok(RetryResponse.builder()
                .success(true)
                .queueId(row.getId())
                .actionType(row.getActionType().wireValue())
                .previousRetryCount(row.getRetryCount())
                .message("Row reset to pending; it will be picked up on the next delivery run")
                .build());
    }
}
