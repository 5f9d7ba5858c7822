package com.automotiveiot.eventderiver.engine;

import java.time.Clock;
import java.time.LocalTime;

@FunctionalInterface
public interface LocalHourSource {

    /**
     * @return the current hour of day, 0-23
     */
    int currentLocalHour();

    static LocalHourSource fromClock(Clock clock) {
        return () -> LocalTime.now(clock).getHour();
    }
}
