package com.baykanat.socialsync.domain.model;

import com.baykanat.socialsync.domain.error.ErrorCategory;
import lombok.Builder;
import lombok.Value;

/** Tek kuyruk satırı dağıtım sonucu. */
@Value
@Builder
public class DeliveryOutcome {

    Long queueId;
    QueueStatus status;
    String instagramId;
    String error;
    ErrorCategory errorCategory;

    /** Satır başka worker'da veya terminal durumdaysa true. */
    boolean skipped;
}
