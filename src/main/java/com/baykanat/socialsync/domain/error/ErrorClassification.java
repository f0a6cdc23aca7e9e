package com.baykanat.socialsync.domain.error;

import lombok.Builder;
import lombok.Value;

/** Sınıflandırma sonucu: kategori, bekleme süresi ipucu ve tekrar denenebilirlik. */
@Value
@Builder
public class ErrorClassification {

    public static final long DEFAULT_RETRY_AFTER_SECONDS = 3600;

    ErrorCategory category;

    /** Sadece RATE_LIMIT için anlamlı; diğerlerinde null. */
    Long retryAfterSeconds;

    boolean retryable;

    public static ErrorClassification authFailure() {
        return ErrorClassification.builder()
                .category(ErrorCategory.AUTH_FAILURE)
                .retryable(false)
                .build();
    }

    public static ErrorClassification rateLimit(Long retryAfterSeconds) {
        long effective = retryAfterSeconds != null && retryAfterSeconds > 0
                ? retryAfterSeconds
                : DEFAULT_RETRY_AFTER_SECONDS;
        return ErrorClassification.builder()
                .category(ErrorCategory.RATE_LIMIT)
                .retryAfterSeconds(effective)
                .retryable(true)
                .build();
    }

    public static ErrorClassification transientFailure() {
        return ErrorClassification.builder()
                .category(ErrorCategory.OTHER)
                .retryable(true)
                .build();
    }

    public static ErrorClassification permanentFailure() {
        return ErrorClassification.builder()
                .category(ErrorCategory.OTHER)
                .retryable(false)
                .build();
    }
}
