package com.baykanat.socialsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** Manuel inceleme için dlq satırı. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dead-lettered queue row")
public class DeadLetterView {

    private Long id;

    @JsonProperty("business_account_id")
    private String businessAccountId;

    @JsonProperty("action_type")
    private String actionType;

    private Map<String, Object> payload;

    @JsonProperty("retry_count")
    private int retryCount;

    private String error;

    @JsonProperty("error_category")
    private String errorCategory;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
