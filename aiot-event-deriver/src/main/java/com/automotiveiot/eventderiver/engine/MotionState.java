package com.automotiveiot.eventderiver.engine;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the single most recently accepted motion sample. Exactly one instance exists per
 * ingesting process and only the derivation engine touches it.
 */
public class MotionState {

    private final AtomicReference<MotionSample> baseline = new AtomicReference<>();

    /**
     * Replaces the baseline with {@code sample} and returns the one it replaced, as a single
     * atomic exchange. Concurrent callers each get a distinct predecessor.
     */
    public Optional<MotionSample> observe(MotionSample sample) {
        return Optional.ofNullable(baseline.getAndSet(sample));
    }
}
