package com.baykanat.socialsync.infrastructure.persistence;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Map;

/** system_alerts insert; hata çağırana taşınmaz, warn loglanır. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class SystemAlertJdbcRepository {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /** Alert yazıldıysa true. */
    public boolean insert(String alertType, String accountId, String message, Map<String, Object> details) {
        String sql = """
                INSERT INTO system_alerts (alert_type, business_account_id, message, details, resolved)
                VALUES (?, ?::uuid, ?, ?::jsonb, FALSE)
                """;
        try {
            jdbcTemplate.update(sql, alertType, accountId, message, objectMapper.writeValueAsString(details));
            return true;
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Failed to write system alert {} for account {}: {}", alertType, accountId, e.getMessage());
            return false;
        }
    }
}
