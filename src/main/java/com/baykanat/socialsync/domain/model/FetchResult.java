package com.baykanat.socialsync.domain.model;

import lombok.Builder;
import lombok.Value;

/** GraphApiClient fetchAndStore* sözleşmesinin sonucu: başarı, kayıt sayısı ve hata kategorisi. */
@Value
@Builder
public class FetchResult {

    boolean success;
    int count;
    String error;

    /** Adaptörün ürettiği ham kategori (auth_failure, rate_limit, permanent, transient, unknown). */
    String errorCategory;

    Long retryAfterSeconds;

    public static FetchResult ok(int count) {
        return FetchResult.builder().success(true).count(count).build();
    }

    public static FetchResult failed(String error, String errorCategory, Long retryAfterSeconds) {
        return FetchResult.builder()
                .success(false)
                .error(error)
                .errorCategory(errorCategory)
                .retryAfterSeconds(retryAfterSeconds)
                .build();
    }
}
