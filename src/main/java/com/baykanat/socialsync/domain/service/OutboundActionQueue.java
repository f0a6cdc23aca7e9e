package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.AuditSink;
import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.error.ErrorCategory;
import com.baykanat.socialsync.domain.error.ErrorClassification;
import com.baykanat.socialsync.domain.error.ResourceNotFoundException;
import com.baykanat.socialsync.domain.model.AuditEvent;
import com.baykanat.socialsync.domain.model.NewQueueAction;
import com.baykanat.socialsync.domain.model.QueueDisposition;
import com.baykanat.socialsync.domain.model.QueueRow;
import com.baykanat.socialsync.domain.model.QueueRowPatch;
import com.baykanat.socialsync.domain.model.QueueStatus;
import com.baykanat.socialsync.infrastructure.persistence.PostQueueJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Kalıcı ve idempotent dış aksiyon kuyruğu (post_queue).
 * Aynı idempotency key ile ikinci insert yeni satır oluşturmaz; mevcut satırın id'si döner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutboundActionQueue {

    public static final int DEAD_LETTER_MAX_LIMIT = 200;
    static final String PERMANENT_FAILURE_EVENT = "post_failed_permanent";

    private final PostQueueJdbcRepository queueRepository;
    private final IdempotencyService idempotencyService;
    private final BackoffPolicy backoffPolicy;
    private final AuditSink auditSink;
    private final AppProperties appProperties;
    private final Clock clock;

    /** Idempotent insert; key çakışmasında mevcut satırın id'sini döner. */
    public long insertQueueRow(NewQueueAction action) {
        if (action.getBusinessAccountId() == null || action.getActionType() == null) {
            throw new IllegalArgumentException("business_account_id and action_type are required");
        }
        String key = action.getIdempotencyKey() != null
                ? action.getIdempotencyKey()
                : idempotencyService.keyFor(action.getIdempotencySeed());

        Optional<Long> inserted = queueRepository.insertIfAbsent(
                action.getBusinessAccountId(), action.getActionType(), action.getPayload(), key);
        if (inserted.isPresent()) {
            log.info("[PostQueue] Enqueued {} row {} for account {}",
                    action.getActionType().wireValue(), inserted.get(), action.getBusinessAccountId());
            return inserted.get();
        }

        // Çakışma: aynı mantıksal aksiyon daha önce eklenmiş
        long existing = queueRepository.findIdByKey(key)
                .orElseThrow(() -> new IllegalStateException("Idempotency conflict but no row for key " + key));
        log.debug("[PostQueue] Duplicate {} action, reusing row {}", action.getActionType().wireValue(), existing);
        return existing;
    }

    /** Null olmayan alanları günceller; satır yoksa false. */
    public boolean updateQueueRow(long queueId, QueueRowPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return false;
        }
        return queueRepository.update(queueId, patch) > 0;
    }

    /** Çok adımlı aksiyonda ara sonucu (ör. creation_id) payload'a yazar. */
    public void recordIntermediate(long queueId, String key, Object value) {
        queueRepository.mergePayload(queueId, key, value);
        log.debug("[PostQueue] Row {} recorded {}={}", queueId, key, value);
    }

    public void markSent(long queueId, String instagramId) {
        queueRepository.markSent(queueId, instagramId);
        log.info("[PostQueue] Row {} sent (instagram_id: {})", queueId, instagramId);
    }

    /**
     * Başarısız denemeyi kaydeder. AUTH_FAILURE, retry edilemez hata veya max-retries'a ulaşan satır dlq olur;
     * diğerleri failed + next_retry_at = now + min(2^n * base, max).
     */
    public QueueDisposition recordFailure(QueueRow row, ErrorClassification classification, String message) {
        int newRetryCount = row.getRetryCount() + 1;
        int maxRetries = appProperties.getQueue().getMaxRetries();
        ErrorCategory category = classification.getCategory();

        boolean deadLetter = switch (category) {
            case AUTH_FAILURE -> true;
            case RATE_LIMIT, OTHER -> !classification.isRetryable() || newRetryCount >= maxRetries;
        };

        if (deadLetter) {
            queueRepository.recordFailure(row.getId(), QueueStatus.DLQ, newRetryCount, message,
                    category.wireValue(), null);
            auditPermanentFailure(row, category, message, newRetryCount);
            log.error("[PostQueue] {} row {} moved to DLQ after {} attempt(s): {}",
                    row.getActionType().wireValue(), row.getId(), newRetryCount, message);
            return QueueDisposition.builder()
                    .queueId(row.getId())
                    .status(QueueStatus.DLQ)
                    .retryCount(newRetryCount)
                    .build();
        }

        Duration delay = backoffPolicy.delayFor(newRetryCount);
        Instant nextRetryAt = clock.instant().plus(delay);
        queueRepository.recordFailure(row.getId(), QueueStatus.FAILED, newRetryCount, message,
                category.wireValue(), nextRetryAt);
        log.warn("[PostQueue] {} row {} failed ({}/{}), retry at {}: {}",
                row.getActionType().wireValue(), row.getId(), newRetryCount, maxRetries, nextRetryAt, message);
        return QueueDisposition.builder()
                .queueId(row.getId())
                .status(QueueStatus.FAILED)
                .retryCount(newRetryCount)
                .nextRetryAt(nextRetryAt)
                .build();
    }

    public Optional<QueueRow> findById(long queueId) {
        return queueRepository.findById(queueId);
    }

    /** Zamanı gelmiş pending/failed satırlar, eskiden yeniye. */
    public List<QueueRow> findDeliverable(int batchSize) {
        return queueRepository.findDeliverable(clock.instant(), batchSize);
    }

    /** Satırı bu worker adına processing yapar; başka worker aldıysa false. */
    public boolean claim(long queueId) {
        return queueRepository.claim(queueId);
    }

    /** Süresi aşan processing sahipliklerini pending'e döndürür. */
    public int releaseStaleClaims(Duration claimTimeout) {
        int released = queueRepository.releaseStaleClaims(clock.instant().minus(claimTimeout));
        if (released > 0) {
            log.warn("[PostQueue] Released {} stale processing claim(s) older than {}", released, claimTimeout);
        }
        return released;
    }

    /** action_type::status → adet. */
    public Map<String, Long> statusSummary() {
        return queueRepository.countByActionAndStatus();
    }

    /** dlq satırları; limit 1..200 aralığına çekilir. */
    public List<QueueRow> findDeadLetters(int limit) {
        int bounded = Math.max(1, Math.min(limit, DEAD_LETTER_MAX_LIMIT));
        return queueRepository.findByStatus(QueueStatus.DLQ, bounded);
    }

    /** dlq|failed satırı pending'e çeker; uygun satır yoksa ResourceNotFoundException. */
    public QueueRow resetForRetry(long queueId) {
        QueueRow row = queueRepository.resetForRetry(queueId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "Queue row " + queueId + " not found or not in dlq/failed status"));
        log.info("[PostQueue] Row {} ({}) reset to pending for manual retry (retry_count={})",
                queueId, row.getActionType().wireValue(), row.getRetryCount());
        return row;
    }

    private void auditPermanentFailure(QueueRow row, ErrorCategory category, String message, int retryCount) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("action_type", row.getActionType().wireValue());
        details.put("error", message);
        details.put("error_category", category.wireValue());
        details.put("retry_count", retryCount);
        details.put("business_account_id", row.getBusinessAccountId());
        try {
            auditSink.logAudit(AuditEvent.builder()
                    .eventType(PERMANENT_FAILURE_EVENT)
                    .action("post_queue_dlq")
                    .resourceType("post_queue")
                    .resourceId(String.valueOf(row.getId()))
                    .details(details)
                    .success(false)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[PostQueue] Audit log failed for DLQ row {}: {}", row.getId(), e.getMessage());
        }
    }
}
