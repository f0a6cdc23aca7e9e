package com.baykanat.socialsync.infrastructure.persistence;

import com.baykanat.socialsync.domain.model.AgentHeartbeat;
import com.baykanat.socialsync.domain.model.HeartbeatStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

/** agent_heartbeats: agent upsert ve atomik alive → down geçişi. */
@Repository
@RequiredArgsConstructor
public class AgentHeartbeatJdbcRepository {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<AgentHeartbeat> ROW_MAPPER = (rs, rowNum) -> {
        Timestamp lastBeat = rs.getTimestamp("last_beat_at");
        return AgentHeartbeat.builder()
                .agentId(rs.getString("agent_id"))
                .lastBeatAt(lastBeat != null ? lastBeat.toInstant() : null)
                .status(HeartbeatStatus.fromWire(rs.getString("status")))
                .build();
    };

    /** Eşikten eski alive agent'ları down yapar; yalnızca bu çağrıda geçiş yapanları döner. */
    public List<AgentHeartbeat> markStaleAsDown(Instant threshold) {
        String sql = """
                UPDATE agent_heartbeats
                SET status = 'down', updated_at = NOW()
                WHERE status = 'alive'
                  AND last_beat_at < ?
                RETURNING agent_id, last_beat_at, status
                """;
        return jdbcTemplate.query(sql, ROW_MAPPER, Timestamp.from(threshold));
    }

    /** Heartbeat upsert; satır her durumda alive olur. */
    public void upsertAlive(String agentId, Instant beatAt) {
        String sql = """
                INSERT INTO agent_heartbeats (agent_id, last_beat_at, status, updated_at)
                VALUES (?, ?, 'alive', NOW())
                ON CONFLICT (agent_id) DO UPDATE
                SET last_beat_at = EXCLUDED.last_beat_at,
                    status = 'alive',
                    updated_at = NOW()
                """;
        jdbcTemplate.update(sql, agentId, Timestamp.from(beatAt));
    }
}
