package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.domain.error.PermissionDeniedException;
import com.baykanat.socialsync.domain.error.ResourceNotFoundException;
import com.baykanat.socialsync.domain.model.ActionType;
import com.baykanat.socialsync.domain.model.DeliveryOutcome;
import com.baykanat.socialsync.domain.model.NewQueueAction;
import com.baykanat.socialsync.domain.model.UgcContent;
import com.baykanat.socialsync.domain.model.UgcPermission;
import com.baykanat.socialsync.infrastructure.persistence.UgcJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/** UGC repost üreticisi: ön koşullar doğrulanır, aksiyon dış çağrıdan önce kuyruğa yazılır. */
@Slf4j
@Service
@RequiredArgsConstructor
public class RepostService {

    static final String REPOST_SEED_PREFIX = "repost_ugc";

    private final UgcJdbcRepository ugcRepository;
    private final OutboundActionQueue actionQueue;
    private final QueueDeliveryService deliveryService;
    private final IdempotencyService idempotencyService;

    public DeliveryOutcome repost(String accountId, String permissionId) {
        UgcPermission permission = ugcRepository.findPermission(permissionId, accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Permission not found for this account"));
        if (!permission.isGranted()) {
            throw new PermissionDeniedException(
                    "Permission status is '" + permission.getStatus() + "', must be 'granted' to repost");
        }

        UgcContent content = ugcRepository.findContent(permission.getUgcContentId())
                .orElseThrow(() -> new ResourceNotFoundException("UGC content not found"));
        if (content.getMediaUrl() == null || content.getMediaUrl().isBlank()) {
            throw new IllegalArgumentException("UGC content has no media_url to repost");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("permission_id", permissionId);
        payload.put("media_url", content.getMediaUrl());
        payload.put("caption", content.repostCaption());

        long queueId = actionQueue.insertQueueRow(NewQueueAction.builder()
                .businessAccountId(accountId)
                .actionType(ActionType.REPOST_UGC)
                .payload(payload)
                .idempotencySeed(idempotencyService.seedFor(REPOST_SEED_PREFIX, permissionId))
                .build());
        log.info("[Repost] Permission {} queued as row {}", permissionId, queueId);

        return deliveryService.deliverNow(queueId);
    }
}
