package com.baykanat.socialsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Manual retry of a dlq/failed queue row")
public class RetryRequest {

    @NotNull(message = "queue_id is required")
    @JsonProperty("queue_id")
    @Schema(description = "post_queue row id", example = "42")
    private Long queueId;
}
