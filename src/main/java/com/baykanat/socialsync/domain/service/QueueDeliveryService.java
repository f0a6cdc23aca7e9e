package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.CredentialStore;
import com.baykanat.socialsync.client.GraphPublishClient;
import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.error.ErrorClassification;
import com.baykanat.socialsync.domain.error.ErrorClassifier;
import com.baykanat.socialsync.domain.error.ResourceNotFoundException;
import com.baykanat.socialsync.domain.error.UpstreamApiException;
import com.baykanat.socialsync.domain.model.AccountCredentials;
import com.baykanat.socialsync.domain.model.DeliveryOutcome;
import com.baykanat.socialsync.domain.model.QueueDisposition;
import com.baykanat.socialsync.domain.model.QueueRow;
import com.baykanat.socialsync.domain.model.QueueStatus;
import com.baykanat.socialsync.domain.model.UgcContent;
import com.baykanat.socialsync.domain.model.UgcPermission;
import com.baykanat.socialsync.infrastructure.persistence.ScheduledPostJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.UgcJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Kuyruktaki aksiyonları GraphPublishClient ile yürütür. İki adımlı aksiyonlarda creation_id
 * payload'a yazılır; sonraki deneme container oluşturmayı atlayıp yayından devam eder.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QueueDeliveryService {

    static final String CREATION_ID = "creation_id";

    private final OutboundActionQueue actionQueue;
    private final CredentialStore credentialStore;
    private final GraphPublishClient publishClient;
    private final ErrorClassifier errorClassifier;
    private final RateLimitCircuitBreaker circuitBreaker;
    private final AccountDirectory accountDirectory;
    private final ScheduledPostJdbcRepository scheduledPostRepository;
    private final UgcJdbcRepository ugcRepository;
    private final AppProperties appProperties;
    private final Clock clock;

    @FunctionalInterface
    private interface ContainerFactory {
        String create() throws UpstreamApiException;
    }

    /** Tek cron turu: takılı sahiplikleri bırakır, zamanı gelen satırları sırayla dağıtır. */
    public List<DeliveryOutcome> runOnce() {
        AppProperties.DeliveryProperties cfg = appProperties.getDelivery();
        actionQueue.releaseStaleClaims(cfg.getClaimTimeout());

        List<QueueRow> rows = actionQueue.findDeliverable(cfg.getBatchSize());
        if (rows.isEmpty()) {
            log.debug("[Delivery] No deliverable rows");
            return List.of();
        }

        List<DeliveryOutcome> outcomes = new ArrayList<>();
        int skippedBlocked = 0;
        for (QueueRow row : rows) {
            if (circuitBreaker.isBlocked(row.getBusinessAccountId())) {
                skippedBlocked++;
                continue;
            }
            outcomes.add(deliver(row));
        }

        log.info("[Delivery] Processed {} row(s), {} skipped for rate-limited accounts",
                outcomes.size(), skippedBlocked);
        return outcomes;
    }

    /** Üreticinin hemen dağıtım isteği; aynı claim/dispatch yolunu kullanır. */
    public DeliveryOutcome deliverNow(long queueId) {
        QueueRow row = actionQueue.findById(queueId)
                .orElseThrow(() -> new ResourceNotFoundException("Queue row " + queueId + " not found"));

        if (row.getStatus().isTerminal() || row.getStatus() == QueueStatus.PROCESSING) {
            log.debug("[Delivery] Row {} is {}, nothing to deliver", queueId, row.getStatus().wireValue());
            return skipped(row);
        }
        if (circuitBreaker.isBlocked(row.getBusinessAccountId())) {
            log.info("[Delivery] Account {} rate-limited, row {} left for the delivery cron",
                    row.getBusinessAccountId(), queueId);
            return skipped(row);
        }
        return deliver(row);
    }

    private DeliveryOutcome deliver(QueueRow row) {
        if (!actionQueue.claim(row.getId())) {
            log.debug("[Delivery] Row {} claimed by another worker", row.getId());
            return skipped(row);
        }

        String instagramId;
        try {
            AccountCredentials credentials = credentialStore.resolveAccountCredentials(row.getBusinessAccountId())
                    .orElseThrow(() -> new IllegalStateException(
                            "No credentials for account " + row.getBusinessAccountId()));
            instagramId = dispatch(row, credentials);
        } catch (UpstreamApiException | RuntimeException e) {
            return handleFailure(row, e);
        }
        return completeSent(row, instagramId);
    }

    /**
     * Aksiyon Instagram'a ulaştı; bu noktadan sonra recordFailure çağrılmaz.
     * sent yazılamazsa bir kez daha denenir, yine olmazsa satır processing'te kalır.
     */
    private DeliveryOutcome completeSent(QueueRow row, String instagramId) {
        DeliveryOutcome.DeliveryOutcomeBuilder outcome = DeliveryOutcome.builder()
                .queueId(row.getId())
                .instagramId(instagramId);
        try {
            markSentWithRetry(row.getId(), instagramId);
            outcome.status(QueueStatus.SENT);
        } catch (DataAccessException e) {
            log.error("[Delivery] Row {} delivered (instagram_id: {}) but could not be marked sent: {}",
                    row.getId(), instagramId, e.getMessage(), e);
            outcome.status(QueueStatus.PROCESSING).error(e.getMessage());
        }
        afterSent(row, instagramId);
        return outcome.build();
    }

    private void markSentWithRetry(long queueId, String instagramId) {
        try {
            actionQueue.markSent(queueId, instagramId);
        } catch (DataAccessException first) {
            log.warn("[Delivery] Row {} mark-sent failed, retrying once: {}", queueId, first.getMessage());
            actionQueue.markSent(queueId, instagramId);
        }
    }

    private String dispatch(QueueRow row, AccountCredentials credentials) throws UpstreamApiException {
        return switch (row.getActionType()) {
            case REPLY_COMMENT -> publishClient.replyToComment(credentials,
                    required(row, "comment_id"), required(row, "reply_text").trim());
            case REPLY_DM -> publishClient.replyToConversation(credentials,
                    required(row, "conversation_id"), required(row, "message_text").trim());
            case SEND_DM -> publishClient.sendDirectMessage(credentials,
                    required(row, "recipient_id"), required(row, "message_text").trim());
            case PUBLISH_POST -> publishTwoStep(row, credentials, () -> publishClient.createMediaContainer(
                    credentials, required(row, "image_url"), row.payloadString("caption"), mediaType(row)));
            case REPOST_UGC -> publishTwoStep(row, credentials, () -> createRepostContainer(row, credentials));
        };
    }

    private String publishTwoStep(QueueRow row, AccountCredentials credentials, ContainerFactory factory)
            throws UpstreamApiException {
        String creationId = row.payloadString(CREATION_ID);
        if (creationId == null) {
            creationId = factory.create();
            actionQueue.recordIntermediate(row.getId(), CREATION_ID, creationId);
        } else {
            log.info("[Delivery] Row {} resuming publish with existing container {}", row.getId(), creationId);
        }
        return publishClient.publishContainer(credentials, creationId);
    }

    /** Payload'da medya yoksa izin → UGC kaydından yeniden okunur. */
    private String createRepostContainer(QueueRow row, AccountCredentials credentials) throws UpstreamApiException {
        String mediaUrl = row.payloadString("media_url");
        String caption = row.payloadString("caption");
        if (mediaUrl == null) {
            String permissionId = required(row, "permission_id");
            UgcPermission permission = ugcRepository.findPermission(permissionId)
                    .orElseThrow(() -> new IllegalArgumentException("Permission record not found for repost_ugc"));
            UgcContent content = ugcRepository.findContent(permission.getUgcContentId())
                    .filter(c -> c.getMediaUrl() != null)
                    .orElseThrow(() -> new IllegalArgumentException("UGC media not found for repost_ugc"));
            mediaUrl = content.getMediaUrl();
            caption = content.repostCaption();
        }
        return publishClient.createMediaContainer(credentials, mediaUrl, caption, "IMAGE");
    }

    /** Yayın sonrası bağlı kayıtlar; hata satırı tekrar denemeye döndürmez. */
    private void afterSent(QueueRow row, String instagramId) {
        try {
            switch (row.getActionType()) {
                case PUBLISH_POST -> {
                    String scheduledPostId = row.payloadString("scheduled_post_id");
                    if (scheduledPostId != null && instagramId != null) {
                        scheduledPostRepository.markPublished(scheduledPostId, instagramId, clock.instant());
                    }
                }
                case REPOST_UGC -> {
                    String permissionId = row.payloadString("permission_id");
                    if (permissionId != null) {
                        ugcRepository.markReposted(permissionId, instagramId, clock.instant());
                    }
                }
                case REPLY_COMMENT, REPLY_DM, SEND_DM -> {
                    // bağlı kayıt yok
                }
            }
        } catch (DataAccessException e) {
            log.error("[Delivery] Row {} sent but linked record update failed: {}", row.getId(), e.getMessage(), e);
        }
    }

    private DeliveryOutcome handleFailure(QueueRow row, Exception e) {
        ErrorClassification classification = e instanceof IllegalArgumentException
                ? ErrorClassification.permanentFailure()
                : errorClassifier.classify(e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();

        switch (classification.getCategory()) {
            case RATE_LIMIT -> circuitBreaker.markBlocked(row.getBusinessAccountId(),
                    classification.getRetryAfterSeconds());
            case AUTH_FAILURE -> accountDirectory.disableOnAuthFailure(
                    row.getBusinessAccountId(), "post_queue", message);
            case OTHER -> log.debug("[Delivery] Row {} failed with {}", row.getId(), e.getClass().getSimpleName());
        }

        QueueDisposition disposition = actionQueue.recordFailure(row, classification, message);
        return DeliveryOutcome.builder()
                .queueId(row.getId())
                .status(disposition.getStatus())
                .error(message)
                .errorCategory(classification.getCategory())
                .build();
    }

    private static String required(QueueRow row, String key) {
        String value = row.payloadString(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(row.getActionType().wireValue() + " payload missing " + key);
        }
        return value;
    }

    private static String mediaType(QueueRow row) {
        String type = row.payloadString("media_type");
        return type != null ? type : "IMAGE";
    }

    private static DeliveryOutcome skipped(QueueRow row) {
        return DeliveryOutcome.builder()
                .queueId(row.getId())
                .status(row.getStatus())
                .instagramId(row.getInstagramId())
                .skipped(true)
                .build();
    }
}
