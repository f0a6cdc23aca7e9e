package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.AuditSink;
import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.model.ActionType;
import com.baykanat.socialsync.domain.model.AgentHeartbeat;
import com.baykanat.socialsync.domain.model.AuditEvent;
import com.baykanat.socialsync.domain.model.FailoverReport;
import com.baykanat.socialsync.domain.model.MediaAsset;
import com.baykanat.socialsync.domain.model.NewQueueAction;
import com.baykanat.socialsync.domain.model.ScheduledPost;
import com.baykanat.socialsync.infrastructure.persistence.AgentHeartbeatJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.MediaAssetJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.ScheduledPostJdbcRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Yanıt vermeyen agent'ları down işaretler ve onaylanmış ama yayınlanmamış postları
 * publish_post aksiyonu olarak kuyruğa taşır.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HeartbeatFailoverService {

    static final String FAILOVER_SEED_PREFIX = "failover_publish";
    static final String AGENT_DOWN_EVENT = "agent_down_alert";

    private final AgentHeartbeatJdbcRepository heartbeatRepository;
    private final ScheduledPostJdbcRepository scheduledPostRepository;
    private final MediaAssetJdbcRepository assetRepository;
    private final OutboundActionQueue actionQueue;
    private final IdempotencyService idempotencyService;
    private final AuditSink auditSink;
    private final AppProperties appProperties;
    private final Clock clock;

    /** Tek failover turu; post taraması agent geçişinden bağımsız her turda çalışır. */
    public FailoverReport runOnce() {
        AppProperties.HeartbeatProperties cfg = appProperties.getHeartbeat();
        Instant now = clock.instant();
        Instant threshold = now.minus(cfg.getStaleThreshold());

        List<AgentHeartbeat> downAgents = heartbeatRepository.markStaleAsDown(threshold);
        List<String> alerted = new ArrayList<>();
        if (!downAgents.isEmpty()) {
            log.warn("[Failover] Agent(s) down: {}", downAgents.stream().map(AgentHeartbeat::getAgentId).toList());
        }
        for (AgentHeartbeat agent : downAgents) {
            long missed = missedBeats(agent, now, cfg.getExpectedInterval());
            if (missed >= cfg.getMissedBeatAlertThreshold()) {
                auditAgentDown(agent, missed);
                alerted.add(agent.getAgentId());
                log.error("[Failover] Agent {} missed {} heartbeats (last beat {})",
                        agent.getAgentId(), missed, agent.getLastBeatAt());
            }
        }

        List<String> enqueued = new ArrayList<>();
        for (ScheduledPost post : scheduledPostRepository.findStaleApproved(threshold)) {
            try {
                if (failoverPost(post)) {
                    enqueued.add(post.getId());
                }
            } catch (RuntimeException e) {
                log.error("[Failover] Failed to enqueue scheduled_post {}: {}", post.getId(), e.getMessage(), e);
            }
        }

        if (!enqueued.isEmpty()) {
            log.info("[Failover] Enqueued {} stuck scheduled post(s) for fallback publishing", enqueued.size());
        }
        return FailoverReport.builder()
                .downAgents(downAgents.stream().map(AgentHeartbeat::getAgentId).toList())
                .alertedAgents(alerted)
                .enqueuedPostIds(enqueued)
                .build();
    }

    /** Agent heartbeat'ini kaydeder; timestamp yoksa şimdiki zaman kullanılır. */
    public Instant recordBeat(String agentId, Instant timestamp) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        Instant beatAt = timestamp != null ? timestamp : clock.instant();
        heartbeatRepository.upsertAlive(agentId, beatAt);
        log.debug("[Heartbeat] Agent {} alive at {}", agentId, beatAt);
        return beatAt;
    }

    /** Asset yoksa post atlanır ve approved kalır. */
    private boolean failoverPost(ScheduledPost post) {
        Optional<MediaAsset> asset = assetRepository.findById(post.getAssetId());
        if (asset.isEmpty()) {
            log.warn("[Failover] Asset {} missing for scheduled_post {}, skipping", post.getAssetId(), post.getId());
            return false;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("image_url", asset.get().getStoragePath());
        payload.put("caption", post.getCaption());
        payload.put("media_type", asset.get().getMediaType() != null ? asset.get().getMediaType() : "IMAGE");
        payload.put("scheduled_post_id", post.getId());

        long queueId = actionQueue.insertQueueRow(NewQueueAction.builder()
                .businessAccountId(post.getBusinessAccountId())
                .actionType(ActionType.PUBLISH_POST)
                .payload(payload)
                .idempotencySeed(idempotencyService.seedFor(FAILOVER_SEED_PREFIX, post.getId()))
                .build());

        boolean flipped = scheduledPostRepository.transition(
                post.getId(), ScheduledPost.STATUS_APPROVED, ScheduledPost.STATUS_PUBLISHING);
        if (!flipped) {
            log.debug("[Failover] scheduled_post {} already left approved status", post.getId());
        }
        log.info("[Failover] Enqueued publish_post row {} for scheduled_post {}", queueId, post.getId());
        return true;
    }

    private static long missedBeats(AgentHeartbeat agent, Instant now, Duration expectedInterval) {
        if (agent.getLastBeatAt() == null || expectedInterval.isZero()) {
            return 0;
        }
        return Duration.between(agent.getLastBeatAt(), now).toMillis() / expectedInterval.toMillis();
    }

    private void auditAgentDown(AgentHeartbeat agent, long missed) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("missed_beats", missed);
        details.put("last_beat_at", agent.getLastBeatAt() != null ? agent.getLastBeatAt().toString() : null);
        try {
            auditSink.logAudit(AuditEvent.builder()
                    .eventType(AGENT_DOWN_EVENT)
                    .action("heartbeat_missed")
                    .resourceType("agent_heartbeats")
                    .resourceId(agent.getAgentId())
                    .details(details)
                    .success(false)
                    .build());
        } catch (RuntimeException e) {
            log.warn("[Failover] Audit log failed for agent {}: {}", agent.getAgentId(), e.getMessage());
        }
    }
}
