package com.baykanat.socialsync.domain.service;

import com.baykanat.socialsync.client.AuditSink;
import com.baykanat.socialsync.config.AppProperties;
import com.baykanat.socialsync.domain.model.ActionType;
import com.baykanat.socialsync.domain.model.AgentHeartbeat;
import com.baykanat.socialsync.domain.model.AuditEvent;
import com.baykanat.socialsync.domain.model.FailoverReport;
import com.baykanat.socialsync.domain.model.HeartbeatStatus;
import com.baykanat.socialsync.domain.model.MediaAsset;
import com.baykanat.socialsync.domain.model.NewQueueAction;
import com.baykanat.socialsync.domain.model.ScheduledPost;
import com.baykanat.socialsync.infrastructure.persistence.AgentHeartbeatJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.MediaAssetJdbcRepository;
import com.baykanat.socialsync.infrastructure.persistence.ScheduledPostJdbcRepository;
import com.baykanat.socialsync.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for HeartbeatFailoverService.
 *
 * <p>Covers agent-down alerting, failover enqueue of stuck approved posts and heartbeat recording.
 */
@ExtendWith(MockitoExtension.class)
class HeartbeatFailoverServiceTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");
    private static final Instant THRESHOLD = NOW.minus(Duration.ofMinutes(30));

    @Mock
    private AgentHeartbeatJdbcRepository heartbeatRepository;

    @Mock
    private ScheduledPostJdbcRepository scheduledPostRepository;

    @Mock
    private MediaAssetJdbcRepository assetRepository;

    @Mock
    private OutboundActionQueue actionQueue;

    @Mock
    private AuditSink auditSink;

    private final IdempotencyService idempotencyService = new IdempotencyService();
    private HeartbeatFailoverService service;

    @BeforeEach
    void setUp() {
        service = new HeartbeatFailoverService(heartbeatRepository, scheduledPostRepository, assetRepository,
                actionQueue, idempotencyService, auditSink, new AppProperties(), new MutableClock(NOW));
    }

    @Test
    @DisplayName("Agent silent for 40 minutes is alerted with its missed beat count")
    void downAgentIsAlerted() {
        AgentHeartbeat agent = AgentHeartbeat.builder()
                .agentId("agent-1")
                .lastBeatAt(NOW.minus(Duration.ofMinutes(40)))
                .status(HeartbeatStatus.DOWN)
                .build();
        when(heartbeatRepository.markStaleAsDown(THRESHOLD)).thenReturn(List.of(agent));
        when(scheduledPostRepository.findStaleApproved(THRESHOLD)).thenReturn(List.of());

        FailoverReport report = service.runOnce();

        assertThat(report.getDownAgents()).containsExactly("agent-1");
        assertThat(report.getAlertedAgents()).containsExactly("agent-1");
        ArgumentCaptor<AuditEvent> captor = ArgumentCaptor.forClass(AuditEvent.class);
        verify(auditSink).logAudit(captor.capture());
        assertThat(captor.getValue().getEventType()).isEqualTo("agent_down_alert");
        assertThat(captor.getValue().getDetails()).containsEntry("missed_beats", 8L);
    }

    @Test
    @DisplayName("Stuck approved post is enqueued as publish_post and moved to publishing")
    void stuckPostIsEnqueued() {
        ScheduledPost post = ScheduledPost.builder()
                .id("post-1")
                .businessAccountId("acct-1")
                .assetId("asset-1")
                .caption("Autumn drop")
                .status(ScheduledPost.STATUS_APPROVED)
                .build();
        when(heartbeatRepository.markStaleAsDown(THRESHOLD)).thenReturn(List.of());
        when(scheduledPostRepository.findStaleApproved(THRESHOLD)).thenReturn(List.of(post));
        when(assetRepository.findById("asset-1")).thenReturn(Optional.of(MediaAsset.builder()
                .id("asset-1").storagePath("https://cdn.example.com/a.jpg").build()));
        when(actionQueue.insertQueueRow(any())).thenReturn(31L);
        when(scheduledPostRepository.transition("post-1", "approved", "publishing")).thenReturn(true);

        FailoverReport report = service.runOnce();

        assertThat(report.getEnqueuedPostIds()).containsExactly("post-1");
        ArgumentCaptor<NewQueueAction> captor = ArgumentCaptor.forClass(NewQueueAction.class);
        verify(actionQueue).insertQueueRow(captor.capture());
        NewQueueAction action = captor.getValue();
        assertThat(action.getActionType()).isEqualTo(ActionType.PUBLISH_POST);
        assertThat(action.getBusinessAccountId()).isEqualTo("acct-1");
        assertThat(action.getIdempotencySeed()).isEqualTo("failover_publish:post-1");
        assertThat(action.getPayload())
                .containsEntry("image_url", "https://cdn.example.com/a.jpg")
                .containsEntry("caption", "Autumn drop")
                .containsEntry("media_type", "IMAGE")
                .containsEntry("scheduled_post_id", "post-1");
        verify(auditSink, never()).logAudit(any());
    }

    @Test
    @DisplayName("Post whose asset is missing is skipped and stays approved")
    void missingAssetIsSkipped() {
        ScheduledPost post = ScheduledPost.builder().id("post-2").assetId("gone").build();
        when(heartbeatRepository.markStaleAsDown(THRESHOLD)).thenReturn(List.of());
        when(scheduledPostRepository.findStaleApproved(THRESHOLD)).thenReturn(List.of(post));
        when(assetRepository.findById("gone")).thenReturn(Optional.empty());

        FailoverReport report = service.runOnce();

        assertThat(report.getEnqueuedPostIds()).isEmpty();
        verify(actionQueue, never()).insertQueueRow(any());
        verify(scheduledPostRepository, never()).transition(any(), any(), any());
    }

    @Test
    @DisplayName("Failure on one post does not stop the others")
    void onePostFailureIsIsolated() {
        ScheduledPost broken = ScheduledPost.builder().id("p-1").businessAccountId("a").assetId("x1").build();
        ScheduledPost healthy = ScheduledPost.builder().id("p-2").businessAccountId("a").assetId("x2").build();
        when(heartbeatRepository.markStaleAsDown(THRESHOLD)).thenReturn(List.of());
        when(scheduledPostRepository.findStaleApproved(THRESHOLD)).thenReturn(List.of(broken, healthy));
        when(assetRepository.findById("x1")).thenThrow(new IllegalStateException("connection reset"));
        when(assetRepository.findById("x2")).thenReturn(Optional.of(MediaAsset.builder()
                .id("x2").storagePath("https://cdn.example.com/b.jpg").mediaType("IMAGE").build()));
        when(actionQueue.insertQueueRow(any())).thenReturn(2L);
        when(scheduledPostRepository.transition("p-2", "approved", "publishing")).thenReturn(true);

        assertThat(service.runOnce().getEnqueuedPostIds()).containsExactly("p-2");
    }

    @Test
    @DisplayName("Heartbeat without timestamp is recorded at the current time")
    void recordBeatDefaultsToNow() {
        assertThat(service.recordBeat("agent-1", null)).isEqualTo(NOW);
        verify(heartbeatRepository).upsertAlive("agent-1", NOW);
    }

    @Test
    @DisplayName("Heartbeat with blank agent id is rejected")
    void recordBeatRejectsBlankAgent() {
        assertThatThrownBy(() -> service.recordBeat(" ", NOW)).isInstanceOf(IllegalArgumentException.class);
    }
}
