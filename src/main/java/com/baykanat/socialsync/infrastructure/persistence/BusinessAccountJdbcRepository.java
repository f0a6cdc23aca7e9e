package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.BusinessAccount;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;

/** instagram_business_accounts okuma ve auth hatasında soft-disable. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class BusinessAccountJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<BusinessAccount> ROW_MAPPER = (rs, rowNum) -> BusinessAccount.builder()
            .id(rs.getString("id"))
            .instagramBusinessId(rs.getString("instagram_business_id"))
            .userId(rs.getString("user_id"))
            .connected(rs.getBoolean("is_connected"))
            .connectionStatus(rs.getString("connection_status"))
            .build();

    /** Bağlı ve aktif hesaplar; sıra oluşturulma zamanına göre sabittir. */
    public List<BusinessAccount> findActiveAccounts() {
        String sql = """
                SELECT id, instagram_business_id, user_id, is_connected, connection_status
                FROM instagram_business_accounts
                WHERE is_connected = TRUE
                  AND connection_status = 'active'
                ORDER BY created_at, id
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER);
    }

    /** is_connected=false, connection_status=disconnected; güncellenen satır sayısını döner. */
    public int markDisconnected(String accountId) {
        String sql = """
                UPDATE instagram_business_accounts
                SET is_connected = FALSE,
                    connection_status = 'disconnected',
                    updated_at = NOW()
                WHERE id = ?::uuid
                """;
        return jdbcTemplate.update(sql, accountId);
    }
}
