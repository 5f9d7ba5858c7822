package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One snapshot is recorded for every accepted reading, whether or not any event fired.
 * Acceleration is the magnitude of the triaxial reading in m/s².
 */
public record SpeedSnapshot(
        @JsonProperty("snapshot_timestamp") Instant snapshotTimestamp,
        @JsonProperty("speed_mph") Double speedMph,
        @JsonProperty("speed_limit") Double speedLimit,
        @JsonProperty("is_speeding") boolean speeding,
        @JsonProperty("acceleration") double acceleration,
        @JsonProperty("heading") Double heading,
        @JsonProperty("light_condition") LightCondition lightCondition,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude) {
}
