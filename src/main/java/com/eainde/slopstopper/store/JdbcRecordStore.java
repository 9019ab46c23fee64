package com.eainde.slopstopper.store;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of {@link RecordStore}.
 *
 * <pre>
 * CREATE TABLE videos (
 *     video_id     VARCHAR(64) PRIMARY KEY,
 *     status       VARCHAR(16) NOT NULL,
 *     claim_token  VARCHAR(36),
 *     claimed_at   TIMESTAMP,
 *     analysis_json CLOB,
 *     ...
 * );
 * </pre>
 * See {@code schema.sql} for the full table. Claim and resolve are single conditional
 * {@code UPDATE} statements; the row count tells whether the transition happened.
 */
@Slf4j
public class JdbcRecordStore implements RecordStore {

    private static final String COLUMNS = """
            video_id, title, video_url, channel_id, channel_name, channel_url, watched_at,
            transcript_text, transcript_status, status, error_detail, skip_reason, claimed_at,
            model_used, schema_version, input_tokens, output_tokens, estimated_cost,
            safety_score, primary_genre, is_slop, is_brainrot, is_short, verdict_action,
            analysis_json, analyzed_at
            """;

    private static final String METADATA_COLUMNS = """
            title, channel_id, channel_name, channel_url, watched_at, title_seen_at, channel_seen_at
            """;

    private static final String CLAIMABLE = """
            (status = 'PENDING' OR (status = 'IN_PROGRESS' AND claimed_at < ?))
            """;

    private static final String RESET_SQL = """
            UPDATE videos
            SET status = 'PENDING',
                analysis_json = NULL,
                safety_score = NULL,
                primary_genre = NULL,
                is_slop = NULL,
                is_brainrot = NULL,
                is_short = NULL,
                verdict_action = NULL,
                model_used = NULL,
                schema_version = NULL,
                input_tokens = NULL,
                output_tokens = NULL,
                estimated_cost = NULL,
                error_detail = NULL,
                claim_token = NULL,
                claimed_at = NULL,
                analyzed_at = NULL
            """;

    private final JdbcTemplate jdbcTemplate;
    private final NamedParameterJdbcTemplate namedJdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final RowMapper<VideoRecord> rowMapper = this::mapRow;
    private final RowMapper<WatchMetadata> metadataMapper = JdbcRecordStore::mapMetadata;

    public JdbcRecordStore(JdbcTemplate jdbcTemplate, PlatformTransactionManager transactionManager) {
        this.jdbcTemplate = jdbcTemplate;
        this.namedJdbcTemplate = new NamedParameterJdbcTemplate(jdbcTemplate);
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    @Override
    public Optional<VideoRecord> findById(String id) {
        List<VideoRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM videos WHERE video_id = ?", rowMapper, id);
        return rows.stream().findFirst();
    }

    @Override
    public List<VideoRecord> findByStatus(RecordStatus status) {
        return jdbcTemplate.query("""
                SELECT %s FROM videos WHERE status = ?
                ORDER BY watched_at DESC NULLS LAST, video_id
                """.formatted(COLUMNS), rowMapper, status.name());
    }

    @Override
    public Map<RecordStatus, Integer> countByStatus() {
        Map<RecordStatus, Integer> counts = new EnumMap<>(RecordStatus.class);
        for (RecordStatus status : RecordStatus.values()) {
            counts.put(status, 0);
        }
        jdbcTemplate.query("SELECT status, COUNT(*) AS cnt FROM videos GROUP BY status",
                rs -> {
                    counts.put(RecordStatus.valueOf(rs.getString("status")), rs.getInt("cnt"));
                });
        return counts;
    }

    @Override
    public UpsertOutcome upsert(IngestedVideo video) {
        try {
            return transactionTemplate.execute(tx -> upsertInTransaction(video));
        } catch (DuplicateKeyException e) {
            // another ingester inserted the same id between our read and insert
            log.debug("Concurrent insert for {}, retrying as update", video.id());
            return transactionTemplate.execute(tx -> upsertInTransaction(video));
        }
    }

    private UpsertOutcome upsertInTransaction(IngestedVideo video) {
        List<WatchMetadata> existing = jdbcTemplate.query(
                "SELECT " + METADATA_COLUMNS + " FROM videos WHERE video_id = ? FOR UPDATE", metadataMapper, video.id());

        if (existing.isEmpty()) {
            WatchMetadata m = video.metadata();
            jdbcTemplate.update("""
                    INSERT INTO videos
                        (video_id, title, video_url, channel_id, channel_name, channel_url, watched_at,
                         title_seen_at, channel_seen_at, transcript_status, status, skip_reason)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, 'MISSING', ?, ?)
                    """,
                    video.id(), m.title(), video.url(), m.channelId(), m.channelName(), m.channelUrl(),
                    toTimestamp(m.watchedAt()), toTimestamp(m.titleSeenAt()), toTimestamp(m.channelSeenAt()),
                    video.initialStatus().name(), truncate(video.skipReason(), 2048));
            return UpsertOutcome.INSERTED;
        }

        WatchMetadata current = existing.get(0);
        WatchMetadata merged = current.mergeWith(video.metadata());
        if (merged.equals(current)) {
            return UpsertOutcome.UNCHANGED;
        }

        jdbcTemplate.update("""
                UPDATE videos
                SET title = ?, channel_id = ?, channel_name = ?, channel_url = ?, watched_at = ?,
                    title_seen_at = ?, channel_seen_at = ?
                WHERE video_id = ?
                """,
                merged.title(), merged.channelId(), merged.channelName(), merged.channelUrl(),
                toTimestamp(merged.watchedAt()), toTimestamp(merged.titleSeenAt()),
                toTimestamp(merged.channelSeenAt()), video.id());
        return UpsertOutcome.UPDATED;
    }

    @Override
    public List<String> findClaimable(Instant staleBefore, Integer limit) {
        String sql = "SELECT video_id FROM videos WHERE " + CLAIMABLE
                + " ORDER BY watched_at DESC NULLS LAST, video_id";
        if (limit != null) {
            return jdbcTemplate.queryForList(sql + " LIMIT ?", String.class, toTimestamp(staleBefore), limit);
        }
        return jdbcTemplate.queryForList(sql, String.class, toTimestamp(staleBefore));
    }

    @Override
    public Optional<Claim> claim(String id, Instant now, Instant staleBefore) {
        String token = UUID.randomUUID().toString();
        int rows = jdbcTemplate.update("""
                UPDATE videos
                SET status = 'IN_PROGRESS', claim_token = ?, claimed_at = ?
                WHERE video_id = ? AND
                """ + CLAIMABLE,
                token, toTimestamp(now), id, toTimestamp(staleBefore));
        return rows == 1 ? Optional.of(new Claim(id, token, now)) : Optional.empty();
    }

    @Override
    public boolean markAnalyzed(Claim claim, AnalysisResult result, Instant analyzedAt) {
        int rows = jdbcTemplate.update("""
                UPDATE videos
                SET status = 'ANALYZED',
                    analysis_json = ?,
                    safety_score = ?,
                    primary_genre = ?,
                    is_slop = ?,
                    is_brainrot = ?,
                    is_short = ?,
                    verdict_action = ?,
                    model_used = ?,
                    schema_version = ?,
                    input_tokens = ?,
                    output_tokens = ?,
                    estimated_cost = ?,
                    error_detail = NULL,
                    claim_token = NULL,
                    claimed_at = NULL,
                    analyzed_at = ?
                WHERE video_id = ? AND status = 'IN_PROGRESS' AND claim_token = ?
                """,
                result.analysisJson(),
                result.safetyScore(),
                result.primaryGenre(),
                result.slop(),
                result.brainrot(),
                result.isShort(),
                result.verdictAction(),
                result.modelUsed(),
                result.schemaVersion(),
                result.inputTokens(),
                result.outputTokens(),
                result.estimatedCost(),
                toTimestamp(analyzedAt),
                claim.videoId(),
                claim.token());
        return rows == 1;
    }

    @Override
    public boolean markError(Claim claim, String errorDetail, String modelUsed) {
        int rows = jdbcTemplate.update("""
                UPDATE videos
                SET status = 'ERROR',
                    error_detail = ?,
                    model_used = ?,
                    claim_token = NULL,
                    claimed_at = NULL
                WHERE video_id = ? AND status = 'IN_PROGRESS' AND claim_token = ?
                """,
                truncate(errorDetail, 4000), modelUsed, claim.videoId(), claim.token());
        return rows == 1;
    }

    @Override
    public int resetToPending(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return namedJdbcTemplate.update(RESET_SQL + " WHERE status IN ('ANALYZED', 'ERROR') AND video_id IN (:ids)",
                new MapSqlParameterSource("ids", ids));
    }

    @Override
    public int resetAllErrors() {
        return jdbcTemplate.update(RESET_SQL + " WHERE status = 'ERROR'");
    }


    @Override
    public boolean updateTranscript(String id, TranscriptStatus status, String transcriptText) {
        return jdbcTemplate.update(
                "UPDATE videos SET transcript_status = ?, transcript_text = ? WHERE video_id = ?",
                status.name(), transcriptText, id) == 1;
    }

    private VideoRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new VideoRecord(
                rs.getString("video_id"),
                rs.getString("title"),
                rs.getString("video_url"),
                rs.getString("channel_id"),
                rs.getString("channel_name"),
                rs.getString("channel_url"),
                toInstant(rs.getTimestamp("watched_at")),
                rs.getString("transcript_text"),
                TranscriptStatus.valueOf(rs.getString("transcript_status")),
                RecordStatus.valueOf(rs.getString("status")),
                rs.getString("error_detail"),
                rs.getString("skip_reason"),
                toInstant(rs.getTimestamp("claimed_at")),
                rs.getString("model_used"),
                rs.getString("schema_version"),
                rs.getObject("input_tokens", Integer.class),
                rs.getObject("output_tokens", Integer.class),
                rs.getBigDecimal("estimated_cost"),
                rs.getObject("safety_score", Integer.class),
                rs.getString("primary_genre"),
                rs.getObject("is_slop", Boolean.class),
                rs.getObject("is_brainrot", Boolean.class),
                rs.getObject("is_short", Boolean.class),
                rs.getString("verdict_action"),
                rs.getString("analysis_json"),
                toInstant(rs.getTimestamp("analyzed_at"))
        );
    }

    private static WatchMetadata mapMetadata(ResultSet rs, int rowNum) throws SQLException {
        return new WatchMetadata(
                rs.getString("title"),
                rs.getString("channel_id"),
                rs.getString("channel_name"),
                rs.getString("channel_url"),
                toInstant(rs.getTimestamp("watched_at")),
                toInstant(rs.getTimestamp("title_seen_at")),
                toInstant(rs.getTimestamp("channel_seen_at")));
    }

    private static Timestamp toTimestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
