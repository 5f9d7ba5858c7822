package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Deceleration rate is always a non-negative magnitude in m/s². Speeds are in mph and may be
 * null when the embedded client reports no speed.
 */
public record HarshBrakingEvent(
        @JsonProperty("event_timestamp") Instant eventTimestamp,
        @JsonProperty("deceleration_rate") double decelerationRate,
        @JsonProperty("speed_before") Double speedBefore,
        @JsonProperty("speed_after") Double speedAfter,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("light_condition") LightCondition lightCondition,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude) implements DerivedEvent {

    @Override
    public EventKind kind() {
        return EventKind.HARSH_BRAKING;
    }
}
