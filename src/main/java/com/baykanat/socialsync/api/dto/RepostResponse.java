package com.baykanat.socialsync.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
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
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "UGC repost result; the row stays in the queue when delivery is deferred")
public class RepostResponse {

    private boolean success;

    @JsonProperty("queue_id")
    private Long queueId;

    @Schema(description = "Queue row status after the delivery attempt", example = "sent")
    private String status;

    @JsonProperty("instagram_id")
    private String instagramId;

    private String error;

    @JsonProperty("error_category")
    private String errorCategory;
}
