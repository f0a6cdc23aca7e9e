package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.MediaAsset;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@RequiredArgsConstructor
public class MediaAssetJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    public Optional<MediaAsset> findById(String assetId) {
        if (assetId == null) {
            return Optional.empty();
        }
        String sql = "SELECT id, storage_path, media_type FROM instagram_assets WHERE id = ?::uuid";
        return jdbcTemplate.query(sql, (rs, rowNum) -> MediaAsset.builder()
                        .id(rs.getString("id"))
                        .storagePath(rs.getString("storage_path"))
                        .mediaType(rs.getString("media_type"))
                        .build(), assetId)
                .stream()
                .findFirst();
    }
}
