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
@Schema(description = "Manual retry result")
public class RetryResponse {

    private boolean success;

    @JsonProperty("queue_id")
    private Long queueId;

    @JsonProperty("action_type")
    private String actionType;

    @JsonProperty("previous_retry_count")
    private int previousRetryCount;

    private String message;
}
