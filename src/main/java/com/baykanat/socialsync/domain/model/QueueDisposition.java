package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/** recordFailure sonucu: failed (yeniden denenecek) veya dlq. */
@Value
@Builder
public class QueueDisposition {

    Long queueId;
    QueueStatus status;
    int retryCount;
    Instant nextRetryAt;

    public boolean isDeadLettered() {
        return status == QueueStatus.DLQ;
    }
}
