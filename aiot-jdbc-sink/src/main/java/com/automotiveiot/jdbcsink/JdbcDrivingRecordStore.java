package com.automotiveiot.jdbcsink;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Map;

public class JdbcDrivingRecordStore implements DrivingRecordStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcDrivingRecordStore.class);

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcDrivingRecordStore(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long persistSnapshot(JsonNode snapshot) {
        return insert(RecordTable.SPEED_SNAPSHOTS, snapshot);
    }

    @Override
    public long persistEvent(String kind, JsonNode event) {
        return insert(RecordTable.forEventKind(kind), event);
    }

    private long insert(RecordTable table, JsonNode record) {
        MapSqlParameterSource parameterSource = new MapSqlParameterSource();
        for (String column : table.getColumns()) {
            parameterSource.addValue(column, jdbcValue(record.path(column), column.equals(table.getTimestampColumn())));
        }

        KeyHolder keyHolder = new GeneratedKeyHolder();
        try {
            jdbcTemplate.update(table.insertSql(), parameterSource, keyHolder);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to insert into " + table.getTableName() + ": " + e.getMessage(), e);
        }

        // Some drivers return every column of the inserted row, so look the id up by name
        Map<String, Object> keys = keyHolder.getKeys();
        Object id = keys == null ? null : keys.get(table.getIdColumn());
        if (!(id instanceof Number number)) {
            throw new StorageException("No generated id returned by " + table.getTableName(), null);
        }
        log.debug("Inserted {} id={}", table.getTableName(), number);
        return number.longValue();
    }

    static Object jdbcValue(JsonNode node, boolean timestamp) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        if (timestamp) {
            return OffsetDateTime.ofInstant(Instant.parse(node.asText()), ZoneOffset.UTC);
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNumber()) {
            return node.numberValue();
        }
        return node.asText();
    }
}
