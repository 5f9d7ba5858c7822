package com.automotiveiot.eventderiver.engine;

import com.automotiveiot.eventderiver.dto.LightCondition;

/**
 * Maps a 0-100 light level and the local hour to a coarse light condition.
 * <p>
 * A single light reading cannot tell dawn from dusk, so the wall-clock hour decides between
 * them. This is a heuristic: it does not hold near the poles and trusts whatever zone the
 * hour source is configured with.
 */
public class LightConditionClassifier {

    static final int NIGHT_BELOW = 20;
    static final int DAY_FROM = 60;
    static final int NOON = 12;

    public LightCondition classify(int lightLevel, int localHour) {
        if (lightLevel < NIGHT_BELOW) {
            return LightCondition.NIGHT;
        }
        if (lightLevel >= DAY_FROM) {
            return LightCondition.DAY;
        }
        return localHour < NOON ? LightCondition.DAWN : LightCondition.DUSK;
    }
}
