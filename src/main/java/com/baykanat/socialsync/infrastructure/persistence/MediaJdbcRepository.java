package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.RecentMedia;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/** Döngü iş miktarını sınırlayan okuma sorguları: son medya ve izlenen hashtag'ler. */
@Repository
@RequiredArgsConstructor
public class MediaJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    /** since sonrasında yayınlanmış en yeni limit adet medya, yeniden eskiye. */
    public List<RecentMedia> findRecentMedia(String accountId, Instant since, int limit) {
        String sql = """
                SELECT business_account_id, instagram_media_id, published_at
                FROM instagram_media
                WHERE business_account_id = ?::uuid
                  AND published_at >= ?
                ORDER BY published_at DESC
                LIMIT ?
                """;
        return jdbcTemplate.query(sql, (rs, rowNum) -> {
            Timestamp publishedAt = rs.getTimestamp("published_at");
            return RecentMedia.builder()
                    .businessAccountId(rs.getString("business_account_id"))
                    .instagramMediaId(rs.getString("instagram_media_id"))
                    .publishedAt(publishedAt != null ? publishedAt.toInstant() : null)
                    .build();
        }, accountId, Timestamp.from(since), limit);
    }

    /** Aktif izlenen hashtag'ler (en fazla limit). */
    public List<String> findActiveHashtags(String accountId, int limit) {
        String sql = """
                SELECT hashtag
                FROM ugc_monitored_hashtags
                WHERE business_account_id = ?::uuid
                  AND is_active = TRUE
                ORDER BY created_at, hashtag
                LIMIT ?
                """;
        return jdbcTemplate.queryForList(sql, String.class, accountId, limit);
    }
}
