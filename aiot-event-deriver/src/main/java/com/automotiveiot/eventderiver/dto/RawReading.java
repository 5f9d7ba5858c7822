package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A raw upload from the embedded client. Required fields are boxed so that an absent value can
 * be told apart from zero; the engine validates them once before any derivation happens.
 * {@code receivedAt} is stamped by the gateway on arrival and is not trusted from the wire.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawReading(
        @JsonProperty("distance_cm") Integer distanceCm,
        @JsonProperty("light_level") Integer lightLevel,
        @JsonProperty("accX") Double accX,
        @JsonProperty("accY") Double accY,
        @JsonProperty("accZ") Double accZ,
        @JsonProperty("speed_mph") Double speedMph,
        @JsonProperty("speed_limit") Double speedLimit,
        @JsonProperty("duration_seconds") Integer durationSeconds,
        @JsonProperty("latitude") Double latitude,
        @JsonProperty("longitude") Double longitude,
        @JsonProperty("heading") Double heading,
        @JsonProperty("received_at") Instant receivedAt) {

    public static RawReading of(Integer distanceCm, Integer lightLevel, Double accX, Double accY, Double accZ,
                                Double speedMph, Instant receivedAt) {
        return new RawReading(distanceCm, lightLevel, accX, accY, accZ, speedMph,
                null, null, null, null, null, receivedAt);
    }

    public RawReading withReceivedAt(Instant arrival) {
        return new RawReading(distanceCm, lightLevel, accX, accY, accZ, speedMph,
                speedLimit, durationSeconds, latitude, longitude, heading, arrival);
    }
}
