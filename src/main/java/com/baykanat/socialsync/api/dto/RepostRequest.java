package com.baykanat.socialsync.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Onaylı UGC içeriğini hesabın profilinde yeniden paylaşma isteği. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "UGC repost request")
public class RepostRequest {

    @NotBlank(message = "business_account_id is required")
    @JsonProperty("business_account_id")
    private String businessAccountId;

    @NotBlank(message = "permission_id is required")
    @JsonProperty("permission_id")
    private String permissionId;
}
