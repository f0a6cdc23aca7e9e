package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.domain.error.ErrorClassification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hesap başına "şu zamana kadar engelli" kaydı tutan process-local circuit breaker.
 * Restart'ta kaybolur; birden fazla instance arasında paylaşılmaz.
 */
@Slf4j
@Component
public class RateLimitCircuitBreaker {

    private final Map<String, Instant> unblockedAt = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimitCircuitBreaker(Clock clock) {
        this.clock = clock;
    }

    /** now &lt; unblockedAt ise true; süresi dolan kayıt silinir. */
    public boolean isBlocked(String accountId) {
        Instant until = unblockedAt.get(accountId);
        if (until == null) {
            return false;
        }
        if (clock.instant().isBefore(until)) {
            return true;
        }
        unblockedAt.remove(accountId, until);
        log.debug("[CircuitBreaker] Block expired for account {}", accountId);
        return false;
    }

    /** Önceki kaydın üzerine yazar; null veya pozitif olmayan süre 3600 sn sayılır. */
    public Instant markBlocked(String accountId, Long retryAfterSeconds) {
        long seconds = retryAfterSeconds == null || retryAfterSeconds <= 0
                ? ErrorClassification.DEFAULT_RETRY_AFTER_SECONDS
                : retryAfterSeconds;
        Instant until = clock.instant().plusSeconds(seconds);
        unblockedAt.put(accountId, until);
        log.warn("[CircuitBreaker] Account {} rate limited, blocked for {}s until {}", accountId, seconds, until);
        return until;
    }

    public Optional<Instant> blockedUntil(String accountId) {
        return isBlocked(accountId) ? Optional.ofNullable(unblockedAt.get(accountId)) : Optional.empty();
    }
}
