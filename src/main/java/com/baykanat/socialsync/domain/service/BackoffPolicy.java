package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.config.AppProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Tüm üretici ve worker'lar için tek formül: min(2^n * base, max). Jitter yok, n'e göre azalmaz. */
@Component
public class BackoffPolicy {

    private final Duration base;
    private final Duration max;

    @Autowired
    public BackoffPolicy(AppProperties appProperties) {
        this(appProperties.getQueue().getBackoffBase(), appProperties.getQueue().getBackoffMax());
    }

    BackoffPolicy(Duration base, Duration max) {
        if (base.isNegative() || base.isZero() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 < base <= max");
        }
        this.base = base;
        this.max = max;
    }

    /** retryCount. deneme sonrası beklenecek süre. */
    public Duration delayFor(int retryCount) {
        int exponent = Math.max(0, retryCount);
        long maxMillis = max.toMillis();
        // 2^exponent taşmadan önce tavana ulaşılır
        if (exponent >= 62) {
            return max;
        }
        long multiplier = 1L << exponent;
        long baseMillis = base.toMillis();
        if (baseMillis > maxMillis / multiplier) {
            return max;
        }
        return Duration.ofMillis(Math.min(baseMillis * multiplier, maxMillis));
    }
}
