package com.baykanat.socialsync.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/** post_queue satırı için domain model (JDBC, JPA değil). */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueRow {

    private Long id;
    private String businessAccountId;
    private ActionType actionType;
    private Map<String, Object> payload; // JSONB
    private String idempotencyKey;
    private QueueStatus status;
    private int retryCount;
    private String error;
    private String errorCategory;
    private Instant nextRetryAt;
    private String instagramId;
    private Instant createdAt;
    private Instant updatedAt;

    /** Payload'dan string alan okur; yoksa null. */
    public String payloadString(String key) {
        if (payload == null) {
            return null;
        }
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }
}
