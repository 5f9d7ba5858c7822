package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Ordinal intensity of a harsh braking event.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
