package com.automotiveiot.eventderiver.engine;

import java.time.Instant;

/**
 * The part of an accepted reading kept as the braking baseline. Acceleration axes are in g,
 * speed in mph (null when the client sent none).
 */
public record MotionSample(Double speedMph, double accX, double accY, double accZ, Instant timestamp) {
}
