package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.ScheduledPost;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/** scheduled_posts: failover taraması ve koşullu durum geçişleri. */
@Repository
@RequiredArgsConstructor
public class ScheduledPostJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<ScheduledPost> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp publishedAt = rs.getTimestamp("published_at");
        Timestamp createdAt = rs.getTimestamp("created_at");
        return ScheduledPost.builder()
                .id(rs.getString("id"))
                .businessAccountId(rs.getString("business_account_id"))
                .assetId(rs.getString("asset_id"))
                .caption(rs.getString("caption"))
                .status(rs.getString("status"))
                .instagramMediaId(rs.getString("instagram_media_id"))
                .publishedAt(publishedAt != null ? publishedAt.toInstant() : null)
                .createdAt(createdAt != null ? createdAt.toInstant() : null)
                .build();
    };

    /** approved durumunda olup eşikten önce oluşturulmuş postlar, eskiden yeniye. */
    public List<ScheduledPost> findStaleApproved(Instant threshold) {
        String sql = """
                SELECT id, business_account_id, asset_id, caption, status, instagram_media_id, published_at, created_at
                FROM scheduled_posts
                WHERE status = 'approved'
                  AND created_at < ?
                ORDER BY created_at, id
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(threshold));
    }

    /** Yalnızca mevcut durum expected ise geçiş yapar. */
    public boolean transition(String postId, String expectedStatus, String newStatus) {
        String sql = """
                UPDATE scheduled_posts
                SET status = ?, updated_at = NOW()
                WHERE id = ?::uuid
                  AND status = ?
                """;
        return jdbcTemplate.update(sql, newStatus, postId, expectedStatus) == 1;
    }

    public int markPublished(String postId, String instagramMediaId, Instant publishedAt) {
        String sql = """
                UPDATE scheduled_posts
                SET status = 'published',
                    instagram_media_id = ?,
                    published_at = ?,
                    updated_at = NOW()
                WHERE id = ?::uuid
                """;
        return jdbcTemplate.update(sql, instagramMediaId, Timestamp.from(publishedAt), postId);
    }
}
