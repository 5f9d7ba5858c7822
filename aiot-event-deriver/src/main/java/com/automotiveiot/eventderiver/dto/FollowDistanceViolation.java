package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record FollowDistanceViolation(
        @JsonProperty("event_timestamp") Instant eventTimestamp,
        @JsonProperty("distance_meters") double distanceMeters,
        @JsonProperty("current_speed") Double currentSpeed,
        @JsonProperty("required_distance") double requiredDistance,
        @JsonProperty("duration_seconds") Integer durationSeconds,
        @JsonProperty("light_condition") LightCondition lightCondition,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude) implements DerivedEvent {

    @Override
    public EventKind kind() {
        return EventKind.FOLLOW_DISTANCE;
    }
}
