package com.baykanat.socialsync.integration;

import com.baykanat.socialsync.client.CredentialStore;
import com.baykanat.socialsync.client.GraphApiClient;
import com.baykanat.socialsync.client.GraphPublishClient;
import com.baykanat.socialsync.domain.error.ErrorClassification;
import com.baykanat.socialsync.domain.model.AccountCredentials;
import com.baykanat.socialsync.domain.model.ActionType;
import com.baykanat.socialsync.domain.model.BusinessAccount;
import com.baykanat.socialsync.domain.model.DeliveryOutcome;
import com.baykanat.socialsync.domain.model.NewQueueAction;
import com.baykanat.socialsync.domain.model.QueueRow;
import com.baykanat.socialsync.domain.model.QueueRowPatch;
import com.baykanat.socialsync.domain.model.QueueStatus;
import com.baykanat.socialsync.domain.service.AccountDirectory;
import com.baykanat.socialsync.domain.service.HeartbeatFailoverService;
import com.baykanat.socialsync.domain.service.OutboundActionQueue;
import com.baykanat.socialsync.domain.service.QueueDeliveryService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Integration test for the outbound action queue against a real PostgreSQL database
 * (via Testcontainers).
 *
 * <p>This test validates:
 * <ul>
 *   <li>Inserting the same logical action twice yields a single row</li>
 *   <li>Repeated failover runs never enqueue the same scheduled post twice</li>
 *   <li>Failure bookkeeping, dead-lettering and manual retry through the SQL layer</li>
 *   <li>Immediate delivery of a queued reply</li>
 *   <li>Partial row updates and auth-failure account disabling</li>
 * </ul>
 *
 * <p>Graph API adapters and the credential store are mocked; everything else is wired as in production.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboundQueueIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("socialsync_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @MockitoBean
    private GraphApiClient graphApiClient;

    @MockitoBean
    private GraphPublishClient publishClient;

    @MockitoBean
    private CredentialStore credentialStore;

    @Autowired
    private OutboundActionQueue actionQueue;

    @Autowired
    private HeartbeatFailoverService failoverService;

    @Autowired
    private QueueDeliveryService deliveryService;

    @Autowired
    private AccountDirectory accountDirectory;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("Same logical action enqueued twice produces exactly one row")
    void duplicateInsertIsIdempotent() {
        String accountId = createAccount();
        NewQueueAction action = NewQueueAction.builder()
                .businessAccountId(accountId)
                .actionType(ActionType.REPOST_UGC)
                .payload(Map.of("permission_id", "perm-" + accountId))
                .idempotencySeed("repost_ugc:perm-" + accountId)
                .build();

        long first = actionQueue.insertQueueRow(action);
        long second = actionQueue.insertQueueRow(action);

        assertThat(second).isEqualTo(first);
        Integer rows = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM post_queue WHERE business_account_id = ?::uuid", Integer.class, accountId);
        assertThat(rows).isEqualTo(1);
    }

    @Test
    @DisplayName("Stuck approved post is enqueued once across repeated failover runs")
    void failoverDoesNotDoubleEnqueue() {
        String accountId = createAccount();
        String assetId = jdbcTemplate.queryForObject(
                "INSERT INTO instagram_assets (storage_path) VALUES ('https://cdn.example.com/p.jpg') RETURNING id::text",
                String.class);
        String postId = jdbcTemplate.queryForObject("""
                INSERT INTO scheduled_posts (business_account_id, asset_id, caption, status, created_at)
                VALUES (?::uuid, ?::uuid, 'Autumn drop', 'approved', NOW() - INTERVAL '2 hours')
                RETURNING id::text
                """, String.class, accountId, assetId);

        failoverService.runOnce();
        // force the post back so the second run sees it again
        jdbcTemplate.update("UPDATE scheduled_posts SET status = 'approved' WHERE id = ?::uuid", postId);
        failoverService.runOnce();

        Integer rows = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM post_queue
                WHERE action_type = 'publish_post' AND payload->>'scheduled_post_id' = ?
                """, Integer.class, postId);
        assertThat(rows).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT status FROM scheduled_posts WHERE id = ?::uuid", String.class, postId))
                .isEqualTo("publishing");
    }

    @Test
    @DisplayName("Failed row waits for its backoff; dead-lettered row can be reset for retry")
    void failureAndManualRetry() {
        String accountId = createAccount();
        long queueId = actionQueue.insertQueueRow(NewQueueAction.builder()
                .businessAccountId(accountId)
                .actionType(ActionType.SEND_DM)
                .payload(Map.of("recipient_id", "igsid-1", "message_text", "hi"))
                .idempotencySeed("send_dm:" + accountId)
                .build());
        QueueRow row = actionQueue.findById(queueId).orElseThrow();

        actionQueue.recordFailure(row, ErrorClassification.transientFailure(), "503 Service Unavailable");

        QueueRow failed = actionQueue.findById(queueId).orElseThrow();
        assertThat(failed.getStatus()).isEqualTo(QueueStatus.FAILED);
        assertThat(failed.getRetryCount()).isEqualTo(1);
        assertThat(failed.getNextRetryAt()).isAfter(Instant.now());
        assertThat(actionQueue.findDeliverable(200)).extracting(QueueRow::getId).doesNotContain(queueId);

        actionQueue.recordFailure(failed, ErrorClassification.authFailure(), "Session has expired");
        assertThat(actionQueue.findDeadLetters(200)).extracting(QueueRow::getId).contains(queueId);

        QueueRow reset = actionQueue.resetForRetry(queueId);
        assertThat(reset.getStatus()).isEqualTo(QueueStatus.PENDING);
        assertThat(reset.getRetryCount()).isEqualTo(2);
        assertThat(reset.getError()).isNull();
        assertThat(actionQueue.findDeliverable(200)).extracting(QueueRow::getId).contains(queueId);
    }

    @Test
    @DisplayName("Queued reply is delivered immediately and marked sent")
    void deliverNowMarksSent() throws Exception {
        String accountId = createAccount();
        AccountCredentials credentials = AccountCredentials.builder().pageToken("token").igUserId("ig-1").build();
        when(credentialStore.resolveAccountCredentials(accountId)).thenReturn(Optional.of(credentials));
        when(publishClient.replyToComment(any(), anyString(), anyString())).thenReturn("reply-123");

        long queueId = actionQueue.insertQueueRow(NewQueueAction.builder()
                .businessAccountId(accountId)
                .actionType(ActionType.REPLY_COMMENT)
                .payload(Map.of("comment_id", "c-1", "reply_text", "Thank you!"))
                .idempotencySeed("reply_comment:c-1:" + accountId)
                .build());

        DeliveryOutcome outcome = deliveryService.deliverNow(queueId);

        assertThat(outcome.getStatus()).isEqualTo(QueueStatus.SENT);
        QueueRow stored = actionQueue.findById(queueId).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(QueueStatus.SENT);
        assertThat(stored.getInstagramId()).isEqualTo("reply-123");
    }

    @Test
    @DisplayName("Partial update changes only the patched columns")
    void updateQueueRowPatchesGivenColumns() {
        String accountId = createAccount();
        long queueId = actionQueue.insertQueueRow(NewQueueAction.builder()
                .businessAccountId(accountId)
                .actionType(ActionType.PUBLISH_POST)
                .payload(Map.of("image_url", "https://cdn.example.com/a.jpg", "caption", "first"))
                .idempotencySeed("publish_post:" + accountId)
                .build());
        QueueRow before = actionQueue.findById(queueId).orElseThrow();

        boolean updated = actionQueue.updateQueueRow(queueId, QueueRowPatch.builder()
                .payload(Map.of("image_url", "https://cdn.example.com/b.jpg", "caption", "second"))
                .status(QueueStatus.FAILED)
                .build());

        assertThat(updated).isTrue();
        QueueRow after = actionQueue.findById(queueId).orElseThrow();
        assertThat(after.getStatus()).isEqualTo(QueueStatus.FAILED);
        assertThat(after.getPayload())
                .containsEntry("image_url", "https://cdn.example.com/b.jpg")
                .containsEntry("caption", "second");
        assertThat(after.getRetryCount()).isEqualTo(before.getRetryCount());
        assertThat(after.getIdempotencyKey()).isEqualTo(before.getIdempotencyKey());
        assertThat(after.getActionType()).isEqualTo(ActionType.PUBLISH_POST);
        assertThat(after.getError()).isNull();
        assertThat(after.getNextRetryAt()).isNull();
        assertThat(after.getInstagramId()).isNull();

        assertThat(actionQueue.updateQueueRow(queueId, QueueRowPatch.builder().build())).isFalse();
        assertThat(actionQueue.updateQueueRow(Long.MAX_VALUE,
                QueueRowPatch.builder().status(QueueStatus.PENDING).build())).isFalse();
    }

    @Test
    @DisplayName("Auth failure disconnects the account, raises an alert and drops cached credentials")
    void authFailureDisconnectsAccount() {
        String accountId = createAccount();

        accountDirectory.disableOnAuthFailure(accountId, "engagement", "Error validating access token");

        Map<String, Object> account = jdbcTemplate.queryForMap(
                "SELECT is_connected, connection_status FROM instagram_business_accounts WHERE id = ?::uuid",
                accountId);
        assertThat(account).containsEntry("is_connected", false)
                .containsEntry("connection_status", "disconnected");
        Integer alerts = jdbcTemplate.queryForObject("""
                SELECT COUNT(*) FROM system_alerts
                WHERE alert_type = 'auth_failure' AND business_account_id = ?::uuid AND resolved = FALSE
                """, Integer.class, accountId);
        assertThat(alerts).isEqualTo(1);
        verify(credentialStore).invalidate(accountId);
        assertThat(accountDirectory.getActiveAccounts()).extracting(BusinessAccount::getId).doesNotContain(accountId);
    }

    private String createAccount() {
        return jdbcTemplate.queryForObject(
                "INSERT INTO instagram_business_accounts (instagram_business_id) VALUES (?) RETURNING id::text",
                String.class, "ig-" + UUID.randomUUID());
    }
}
