package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventKind {
    HARSH_BRAKING("harsh_braking"),
    FOLLOW_DISTANCE("follow_distance");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
