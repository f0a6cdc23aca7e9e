package com.baykanat.socialsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** post_queue özet sayıları. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "post_queue row counts grouped by action_type::status")
public class QueueStatusResponse {

    private boolean success;

    @Schema(description = "Counts keyed by action_type::status", example = "{\"publish_post::pending\": 3}")
    private Map<String, Long> summary;

    private long total;

    private String timestamp;
}
