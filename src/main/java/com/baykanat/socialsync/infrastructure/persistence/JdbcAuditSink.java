package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.client.AuditSink;
import com.baykanat.socialsync.domain.model.AuditEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Map;

/** audit_log tablosuna yazan AuditSink; yazım hatası yalnızca warn loglanır. */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcAuditSink implements AuditSink {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    private static final String INSERT_SQL = """
            INSERT INTO audit_log (user_id, event_type, action, resource_type, resource_id, details, success)
            VALUES (?, ?, ?, ?, ?, ?::jsonb, ?)
            """;

    @Override
    public void logAudit(AuditEvent event) {
        try {
            Map<String, Object> details = event.getDetails() != null ? event.getDetails() : Map.of();
            jdbcTemplate.update(INSERT_SQL,
                    event.getUserId(),
                    event.getEventType(),
                    event.getAction(),
                    event.getResourceType(),
                    event.getResourceId(),
                    objectMapper.writeValueAsString(details),
                    event.isSuccess());
        } catch (DataAccessException | JsonProcessingException e) {
            log.warn("Audit write failed for {} / {}: {}", event.getEventType(), event.getAction(), e.getMessage());
        }
    }
}
