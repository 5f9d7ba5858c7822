package com.automotiveiot.jdbcsink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read and administrative access to stored driving records. Rows come back as
 * case-insensitive column maps, newest first.
 * <p>
 * The streaming sink only writes; this bean is the library entry point for callers that
 * embed the sink (dashboards, voice front ends, maintenance jobs). Exposing it over HTTP
 * is left to those callers.
 */
public class DrivingRecordQueries {
    private static final Logger log = LoggerFactory.getLogger(DrivingRecordQueries.class);

    private static final Set<String> SEVERITIES = Set.of("low", "medium", "high");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final int defaultLimit;

    public DrivingRecordQueries(NamedParameterJdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                                int defaultLimit) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.defaultLimit = defaultLimit;
    }

    public List<Map<String, Object>> findHarshBrakingEvents(RecordQuery query) {
        return select(RecordTable.HARSH_BRAKING, query);
    }

    public List<Map<String, Object>> findFollowDistanceViolations(RecordQuery query) {
        return select(RecordTable.FOLLOW_DISTANCE, query);
    }

    public List<Map<String, Object>> findSpeedSnapshots(RecordQuery query) {
        return select(RecordTable.SPEED_SNAPSHOTS, query);
    }

    public Optional<Map<String, Object>> findById(RecordTable table, long id) {
        String sql = "SELECT * FROM " + table.getTableName() + " WHERE " + table.getIdColumn() + " = :id";
        List<Map<String, Object>> rows = jdbcTemplate.queryForList(sql, new MapSqlParameterSource("id", id));
        return rows.stream().findFirst();
    }

    public boolean delete(RecordTable table, long id) {
        String sql = "DELETE FROM " + table.getTableName() + " WHERE " + table.getIdColumn() + " = :id";
        int deleted = jdbcTemplate.update(sql, new MapSqlParameterSource("id", id));
        if (deleted > 0) {
            log.info("Deleted {} id={}", table.getTableName(), id);
        }
        return deleted > 0;
    }

    /**
     * Removes every snapshot and event.
     *
     * @return the number of rows deleted
     */
    public int clearAll() {
        Integer deleted = transactionTemplate.execute(status -> {
            int rows = 0;
            for (RecordTable table : RecordTable.values()) {
                rows += jdbcTemplate.update("DELETE FROM " + table.getTableName(), new MapSqlParameterSource());
            }
            return rows;
        });
        log.info("Cleared all driving data ({} rows)", deleted);
        return deleted == null ? 0 : deleted;
    }

    private List<Map<String, Object>> select(RecordTable table, RecordQuery query) {
        StringBuilder sql = new StringBuilder("SELECT * FROM ").append(table.getTableName());
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> where = new ArrayList<>();

        if (query.start() != null) {
            where.add(table.getTimestampColumn() + " >= :start");
            params.addValue("start", OffsetDateTime.ofInstant(query.start(), ZoneOffset.UTC));
        }
        if (query.end() != null) {
            where.add(table.getTimestampColumn() + " <= :end");
            params.addValue("end", OffsetDateTime.ofInstant(query.end(), ZoneOffset.UTC));
        }
        if (table == RecordTable.HARSH_BRAKING && query.severity() != null) {
            if (!SEVERITIES.contains(query.severity())) {
                throw new IllegalArgumentException("Unknown severity '" + query.severity() + "'");
            }
            where.add("severity = :severity");
            params.addValue("severity", query.severity());
        }
        if (table == RecordTable.SPEED_SNAPSHOTS && query.speedingOnly()) {
            where.add("is_speeding = TRUE");
        }

        if (!where.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", where));
        }
        sql.append(" ORDER BY ").append(table.getTimestampColumn()).append(" DESC, ")
                .append(table.getIdColumn()).append(" DESC");

        int limit = query.limit() != null && query.limit() > 0 ? query.limit() : defaultLimit;
        sql.append(" LIMIT :limit");
        params.addValue("limit", limit);

        return jdbcTemplate.queryForList(sql.toString(), params);
    }
}
