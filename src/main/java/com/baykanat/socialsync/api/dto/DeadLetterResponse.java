package com.baykanat.socialsync.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Dead-letter listing")
public class DeadLetterResponse {

    private boolean success;
    private List<DeadLetterView> dlq;
    private int count;
    private String timestamp;
}
