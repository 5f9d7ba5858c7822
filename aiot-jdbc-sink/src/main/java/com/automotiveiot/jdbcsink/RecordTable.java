package com.automotiveiot.jdbcsink;

import java.util.Arrays;
import java.util.List;

/**
 * The three driving record tables. Column names double as the JSON field names of the records
 * in a derivation unit.
 */
public enum RecordTable {

    SPEED_SNAPSHOTS("snapshot", "SpeedSnapshots", "snapshot_id", "snapshot_timestamp",
            List.of("snapshot_timestamp", "speed_mph", "speed_limit", "is_speeding", "acceleration",
                    "heading", "light_condition", "latitude", "longitude")),

    HARSH_BRAKING("harsh_braking", "HarshBrakingEvents", "event_id", "event_timestamp",
            List.of("event_timestamp", "deceleration_rate", "speed_before", "speed_after", "severity",
                    "light_condition", "latitude", "longitude")),

    FOLLOW_DISTANCE("follow_distance", "FollowDistanceViolations", "violation_id", "event_timestamp",
            List.of("event_timestamp", "distance_meters", "current_speed", "required_distance",
                    "duration_seconds", "light_condition", "latitude", "longitude"));

    private final String kind;
    private final String tableName;
    private final String idColumn;
    private final String timestampColumn;
    private final List<String> columns;

    RecordTable(String kind, String tableName, String idColumn, String timestampColumn, List<String> columns) {
        this.kind = kind;
        this.tableName = tableName;
        this.idColumn = idColumn;
        this.timestampColumn = timestampColumn;
        this.columns = columns;
    }

    public static RecordTable forEventKind(String kind) {
        return Arrays.stream(values())
                .filter(table -> table != SPEED_SNAPSHOTS && table.kind.equals(kind))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown event kind '" + kind + "'"));
    }

    public String getKind() {
        return kind;
    }

    public String getTableName() {
        return tableName;
    }

    public String getIdColumn() {
        return idColumn;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public List<String> getColumns() {
        return columns;
    }

    String insertSql() {
        StringBuilder sql = new StringBuilder("INSERT INTO ");
        sql.append(tableName).append(" (");

        StringBuilder values = new StringBuilder(" VALUES (");
        boolean first = true;

        for (String column : columns) {
            if (!first) {
                sql.append(", ");
                values.append(", ");
            }
            sql.append(column);
            values.append(":").append(column);
            first = false;
        }

        sql.append(")").append(values).append(")");
        return sql.toString();
    }
}
