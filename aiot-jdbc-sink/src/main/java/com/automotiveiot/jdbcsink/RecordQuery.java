package com.automotiveiot.jdbcsink;

import java.time.Instant;

/**
 * Filters for listing driving records. Null bounds are open; a null limit falls back to the
 * configured default. {@code severity} applies to harsh braking events only,
 * {@code speedingOnly} to speed snapshots only.
 */
public record RecordQuery(Instant start, Instant end, String severity, boolean speedingOnly, Integer limit) {

    public static RecordQuery all() {
        return new RecordQuery(null, null, null, false, null);
    }

    public RecordQuery between(Instant from, Instant to) {
        return new RecordQuery(from, to, severity, speedingOnly, limit);
    }

    public RecordQuery withSeverity(String level) {
        return new RecordQuery(start, end, level, speedingOnly, limit);
    }

    public RecordQuery onlySpeeding() {
        return new RecordQuery(start, end, severity, true, limit);
    }

    public RecordQuery withLimit(int rows) {
        return new RecordQuery(start, end, severity, speedingOnly, rows);
    }
}
