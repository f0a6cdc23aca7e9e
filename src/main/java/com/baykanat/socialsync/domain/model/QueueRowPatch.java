package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/** Kısmi güncelleme; null alanlar dokunulmadan kalır. */
@Value
@Builder
public class QueueRowPatch {

    Map<String, Object> payload;
    QueueStatus status;
    Integer retryCount;
    String error;
    String errorCategory;
    Instant nextRetryAt;
    String instagramId;

    public boolean isEmpty() {
        return payload == null && status == null && retryCount == null && error == null
                && errorCategory == null && nextRetryAt == null && instagramId == null;
    }
}
