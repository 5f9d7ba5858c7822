package com.automotiveiot.eventderiver.dto;

import java.util.List;

/**
 * The derivation unit for one reading: its snapshot and every event it produced. Callers
 * persist the two together or not at all.
 */
public record DerivationResult(SpeedSnapshot snapshot, List<DerivedEvent> events) {

    public DerivationResult {
        events = List.copyOf(events);
    }

    public <T extends DerivedEvent> List<T> eventsOfType(Class<T> type) {
        return events.stream()
                .filter(type::isInstance)
                .map(type::cast)
                .toList();
    }
}
