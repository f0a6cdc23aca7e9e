package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.UgcContent;
import com.baykanat.socialsync.domain.model.UgcPermission;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

/** ugc_permissions ve ugc_discovered okuma; repost sonrası izin kaydını günceller. */
@Repository
@RequiredArgsConstructor
public class UgcJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<UgcPermission> PERMISSION_MAPPER = (rs, rowNum) -> UgcPermission.builder()
            .id(rs.getString("id"))
            .businessAccountId(rs.getString("business_account_id"))
            .ugcContentId(rs.getString("ugc_discovered_id"))
            .status(rs.getString("status"))
            .repostedMediaId(rs.getString("instagram_media_id"))
            .build();

    public Optional<UgcPermission> findPermission(String permissionId) {
        String sql = """
                SELECT id, business_account_id, ugc_discovered_id, status, instagram_media_id
                FROM ugc_permissions
                WHERE id = ?::uuid
                """;
        return jdbcTemplate.query(sql, PERMISSION_MAPPER, permissionId).stream().findFirst();
    }

    /** Hesaba ait izin; başka hesabın izni görünmez. */
    public Optional<UgcPermission> findPermission(String permissionId, String accountId) {
        String sql = """
                SELECT id, business_account_id, ugc_discovered_id, status, instagram_media_id
                FROM ugc_permissions
                WHERE id = ?::uuid
                  AND business_account_id = ?::uuid
                """;
        return jdbcTemplate.query(sql, PERMISSION_MAPPER, permissionId, accountId).stream().findFirst();
    }

    public Optional<UgcContent> findContent(String ugcContentId) {
        if (ugcContentId == null) {
            return Optional.empty();
        }
        String sql = "SELECT id, username, caption, media_url, media_type FROM ugc_discovered WHERE id = ?::uuid";
        return jdbcTemplate.query(sql, (rs, rowNum) -> UgcContent.builder()
                        .id(rs.getString("id"))
                        .username(rs.getString("username"))
                        .caption(rs.getString("caption"))
                        .mediaUrl(rs.getString("media_url"))
                        .mediaType(rs.getString("media_type"))
                        .build(), ugcContentId)
                .stream()
                .findFirst();
    }

    public int markReposted(String permissionId, String instagramMediaId, Instant repostedAt) {
        String sql = """
                UPDATE ugc_permissions
                SET status = 'reposted',
                    instagram_media_id = ?,
                    reposted_at = ?
                WHERE id = ?::uuid
                """;
        return jdbcTemplate.update(sql, instagramMediaId, Timestamp.from(repostedAt), permissionId);
    }
}
