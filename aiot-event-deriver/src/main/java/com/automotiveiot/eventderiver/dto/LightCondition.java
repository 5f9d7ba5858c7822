package com.automotiveiot.eventderiver.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum LightCondition {
    DAY("day"),
    NIGHT("night"),
    DAWN("dawn"),
    DUSK("dusk");

    private final String wireName;

    LightCondition(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
