package com.company.alerting.repository;

import com.company.alerting.domain.DeadLetterRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
@RequiredArgsConstructor
@Slf4j
public class DeadLetterRepository {

    private final JdbcTemplate jdbcTemplate;

    public DeadLetterRecord save(DeadLetterRecord record) {
        if (record.getCreatedAt() == null) {
            record.setCreatedAt(Instant.now());
        }

        String sql = """
            INSERT INTO alert_dead_letters (
                event_id, severity, channel_type, endpoint, reason,
                attempts, payload, history, created_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

        KeyHolder keyHolder = new GeneratedKeyHolder();

        jdbcTemplate.update(connection -> {
            PreparedStatement ps = connection.prepareStatement(sql, new String[]{"dead_letter_id"});
            ps.setString(1, record.getEventId());
            ps.setString(2, record.getSeverity());
            ps.setString(3, record.getChannelType());
            ps.setString(4, record.getEndpoint());
            ps.setString(5, record.getReason());
            ps.setInt(6, record.getAttempts() != null ? record.getAttempts() : 0);
            ps.setString(7, record.getPayload());
            ps.setString(8, record.getHistory());
            ps.setTimestamp(9, Timestamp.from(record.getCreatedAt()));
            return ps;
        }, keyHolder);

        record.setDeadLetterId(keyHolder.getKey().longValue());
        return record;
    }

    public List<DeadLetterRecord> findRecent(int limit) {
        String sql = """
            SELECT dead_letter_id, event_id, severity, channel_type, endpoint, reason,
                   attempts, payload, history, created_at, replayed_at, replay_status
            FROM alert_dead_letters
            ORDER BY created_at DESC
            LIMIT ?
            """;

        return jdbcTemplate.query(sql, new DeadLetterRowMapper(), limit);
    }

    public Optional<DeadLetterRecord> findById(long deadLetterId) {
        String sql = """
            SELECT dead_letter_id, event_id, severity, channel_type, endpoint, reason,
                   attempts, payload, history, created_at, replayed_at, replay_status
            FROM alert_dead_letters
            WHERE dead_letter_id = ?
            """;

        List<DeadLetterRecord> results = jdbcTemplate.query(sql, new DeadLetterRowMapper(), deadLetterId);
        return results.stream().findFirst();
    }

    public void markReplayed(long deadLetterId, String replayStatus, Instant replayedAt) {
        String sql = """
            UPDATE alert_dead_letters
            SET replayed_at = ?,
                replay_status = ?
            WHERE dead_letter_id = ?
            """;

        jdbcTemplate.update(sql, Timestamp.from(replayedAt), replayStatus, deadLetterId);
    }

    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM alert_dead_letters", Long.class);
        return count != null ? count : 0L;
    }

    private static class DeadLetterRowMapper implements RowMapper<DeadLetterRecord> {
        @Override
        public DeadLetterRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            Timestamp replayedAt = rs.getTimestamp("replayed_at");
            return DeadLetterRecord.builder()
                    .deadLetterId(rs.getLong("dead_letter_id"))
                    .eventId(rs.getString("event_id"))
                    .severity(rs.getString("severity"))
                    .channelType(rs.getString("channel_type"))
                    .endpoint(rs.getString("endpoint"))
                    .reason(rs.getString("reason"))
                    .attempts(rs.getInt("attempts"))
                    .payload(rs.getString("payload"))
                    .history(rs.getString("history"))
                    .createdAt(rs.getTimestamp("created_at").toInstant())
                    .replayedAt(replayedAt != null ? replayedAt.toInstant() : null)
                    .replayStatus(rs.getString("replay_status"))
                    .build();
        }
    }
}
