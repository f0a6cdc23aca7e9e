package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.ActionType;
import com.baykanat.socialsync.domain.model.QueueRow;
import com.baykanat.socialsync.domain.model.QueueRowPatch;
import com.baykanat.socialsync.domain.model.QueueStatus;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** post_queue tablosu: ON CONFLICT ile idempotent insert, koşullu durum geçişleri, JSONB payload merge. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class PostQueueJdbcRepository {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private static final String COLUMNS = """
            id, business_account_id, action_type, payload, idempotency_key, status, retry_count,
            error, error_category, next_retry_at, instagram_id, created_at, updated_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private final RowMapper<QueueRow> rowMapper = this::mapRow;

    /** Yeni satır eklendiyse id'sini döner; key çakışmasında boş döner. */
    public Optional<Long> insertIfAbsent(String accountId, ActionType actionType,
                                         Map<String, Object> payload, String idempotencyKey) {
        String sql = """
                INSERT INTO post_queue (business_account_id, action_type, payload, idempotency_key, status, retry_count)
                VALUES (?::uuid, ?, ?::jsonb, ?, 'pending', 0)
                ON CONFLICT (idempotency_key) DO NOTHING
                RETURNING id
                """;
        List<Long> ids = jdbcTemplate.queryForList(sql, Long.class,
                accountId, actionType.wireValue(), toJson(payload), idempotencyKey);
        return ids.stream().findFirst();
    }

    public Optional<Long> findIdByKey(String idempotencyKey) {
        String sql = "SELECT id FROM post_queue WHERE idempotency_key = ?";
        return jdbcTemplate.queryForList(sql, Long.class, idempotencyKey).stream().findFirst();
    }

    public Optional<QueueRow> findById(long queueId) {
        String sql = "SELECT " + COLUMNS + " FROM post_queue WHERE id = ?";
        return jdbcTemplate.query(sql, rowMapper, queueId).stream().findFirst();
    }

    /** Null olmayan alanlardan dinamik SET oluşturur; güncellenen satır sayısını döner. */
    public int update(long queueId, QueueRowPatch patch) {
        if (patch == null || patch.isEmpty()) {
            return 0;
        }

        StringBuilder sql = new StringBuilder("UPDATE post_queue SET updated_at = NOW()");
        List<Object> params = new ArrayList<>();

        if (patch.getPayload() != null) {
            sql.append(", payload = ?::jsonb");
            params.add(toJson(patch.getPayload()));
        }
        if (patch.getStatus() != null) {
            sql.append(", status = ?");
            params.add(patch.getStatus().wireValue());
        }
        if (patch.getRetryCount() != null) {
            sql.append(", retry_count = ?");
            params.add(patch.getRetryCount());
        }
        if (patch.getError() != null) {
            sql.append(", error = ?");
            params.add(patch.getError());
        }
        if (patch.getErrorCategory() != null) {
            sql.append(", error_category = ?");
            params.add(patch.getErrorCategory());
        }
        if (patch.getNextRetryAt() != null) {
            sql.append(", next_retry_at = ?");
            params.add(Timestamp.from(patch.getNextRetryAt()));
        }
        if (patch.getInstagramId() != null) {
            sql.append(", instagram_id = ?");
            params.add(patch.getInstagramId());
        }

        sql.append(" WHERE id = ?");
        params.add(queueId);
        return jdbcTemplate.update(sql.toString(), params.toArray());
    }

    /** Tek anahtarı payload'a ekler (jsonb ||); diğer anahtarlar korunur. */
    public int mergePayload(long queueId, String key, Object value) {
        String sql = """
                UPDATE post_queue
                SET payload = COALESCE(payload, '{}'::jsonb) || ?::jsonb,
                    updated_at = NOW()
                WHERE id = ?
                """;
        Map<String, Object> fragment = new LinkedHashMap<>();
        fragment.put(key, value);
        return jdbcTemplate.update(sql, toJson(fragment), queueId);
    }

    public int markSent(long queueId, String instagramId) {
        String sql = """
                UPDATE post_queue
                SET status = 'sent',
                    instagram_id = ?,
                    error = NULL,
                    error_category = NULL,
                    next_retry_at = NULL,
                    updated_at = NOW()
                WHERE id = ?
                """;
        return jdbcTemplate.update(sql, instagramId, queueId);
    }

    /** Başarısız denemenin sonucunu yazar; dlq için next_retry_at temizlenir. */
    public int recordFailure(long queueId, QueueStatus status, int retryCount, String error,
                             String errorCategory, Instant nextRetryAt) {
        String sql = """
                UPDATE post_queue
                SET status = ?,
                    retry_count = ?,
                    error = ?,
                    error_category = ?,
                    next_retry_at = ?,
                    updated_at = NOW()
                WHERE id = ?
                """;
        return jdbcTemplate.update(sql, status.wireValue(), retryCount, error, errorCategory,
                nextRetryAt != null ? Timestamp.from(nextRetryAt) : null, queueId);
    }

    /** pending/failed ve zamanı gelmiş satırlar, eskiden yeniye. */
    public List<QueueRow> findDeliverable(Instant now, int limit) {
        String sql = "SELECT " + COLUMNS + """
                FROM post_queue
                WHERE status IN ('pending', 'failed')
                  AND (next_retry_at IS NULL OR next_retry_at <= ?)
                ORDER BY created_at, id
                LIMIT ?
                """;
        return jdbcTemplate.query(sql, rowMapper, Timestamp.from(now), limit);
    }

    /** pending|failed → processing; yalnızca bir worker kazanır. */
    public boolean claim(long queueId) {
        String sql = """
                UPDATE post_queue
                SET status = 'processing', updated_at = NOW()
                WHERE id = ?
                  AND status IN ('pending', 'failed')
                """;
        return jdbcTemplate.update(sql, queueId) == 1;
    }

    /** processing'te olup updated_at'i verilen zamandan eski olan satırları pending'e döndürür. */
    public int releaseStaleClaims(Instant claimedBefore) {
        String sql = """
                UPDATE post_queue
                SET status = 'pending', updated_at = NOW()
                WHERE status = 'processing'
                  AND updated_at < ?
                """;
        return jdbcTemplate.update(sql, Timestamp.from(claimedBefore));
    }

    /** action_type::status → satır sayısı. */
    public Map<String, Long> countByActionAndStatus() {
        String sql = """
                SELECT action_type, status, COUNT(*) AS cnt
                FROM post_queue
                GROUP BY action_type, status
                ORDER BY action_type, status
                """;
        Map<String, Long> summary = new LinkedHashMap<>();
        RowCallbackHandler collector = rs ->
                summary.put(rs.getString("action_type") + "::" + rs.getString("status"), rs.getLong("cnt"));
        jdbcTemplate.query(sql, collector);
        return summary;
    }

    public List<QueueRow> findByStatus(QueueStatus status, int limit) {
        String sql = "SELECT " + COLUMNS + """
                FROM post_queue
                WHERE status = ?
                ORDER BY updated_at DESC, id DESC
                LIMIT ?
                """;
        return jdbcTemplate.query(sql, rowMapper, status.wireValue(), limit);
    }

    /** dlq|failed → pending; hata ve next_retry_at temizlenir, retry_count korunur. */
    public Optional<QueueRow> resetForRetry(long queueId) {
        String sql = """
                UPDATE post_queue
                SET status = 'pending',
                    next_retry_at = NULL,
                    error = NULL,
                    error_category = NULL,
                    updated_at = NOW()
                WHERE id = ?
                  AND status IN ('dlq', 'failed')
                RETURNING
                """ + COLUMNS;
        return jdbcTemplate.query(sql, rowMapper, queueId).stream().findFirst();
    }

    private QueueRow mapRow(ResultSet rs, int rowNum) throws SQLException {
        return QueueRow.builder()
                .id(rs.getLong("id"))
                .businessAccountId(rs.getString("business_account_id"))
                .actionType(ActionType.fromWire(rs.getString("action_type")))
                .payload(fromJson(rs.getString("payload")))
                .idempotencyKey(rs.getString("idempotency_key"))
                .status(QueueStatus.fromWire(rs.getString("status")))
                .retryCount(rs.getInt("retry_count"))
                .error(rs.getString("error"))
                .errorCategory(rs.getString("error_category"))
                .nextRetryAt(toInstant(rs.getTimestamp("next_retry_at")))
                .instagramId(rs.getString("instagram_id"))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .updatedAt(toInstant(rs.getTimestamp("updated_at")))
                .build();
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload != null ? payload : Map.of());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Queue payload is not serializable: " + e.getOriginalMessage(), e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, PAYLOAD_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable post_queue payload, treating as empty: {}", e.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
