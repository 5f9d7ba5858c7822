package com.automotiveiot.eventderiver.dto;

import java.time.Instant;

/**
 * A classified safety event derived from a single raw reading. Events are append-only and
 * never reference each other or the snapshot they were derived alongside.
 */
public interface DerivedEvent {

    EventKind kind();

    Instant eventTimestamp();
}
