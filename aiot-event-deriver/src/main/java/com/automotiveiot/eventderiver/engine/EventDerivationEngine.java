package com.automotiveiot.eventderiver.engine;

import com.automotiveiot.eventderiver.config.DerivationProperties;
import com.automotiveiot.eventderiver.dto.DerivationResult;
import com.automotiveiot.eventderiver.dto.DerivedEvent;
import com.automotiveiot.eventderiver.dto.FollowDistanceViolation;
import com.automotiveiot.eventderiver.dto.HarshBrakingEvent;
import com.automotiveiot.eventderiver.dto.LightCondition;
import com.automotiveiot.eventderiver.dto.RawReading;
import com.automotiveiot.eventderiver.dto.Severity;
import com.automotiveiot.eventderiver.dto.SpeedSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Turns one raw sensor reading into a speed snapshot and zero or more safety events.
 * <p>
 * The only state is the {@link MotionState} baseline, which is exchanged atomically, so
 * {@link #ingest(RawReading)} may be called from several threads at once. The engine performs
 * no I/O; persisting the result is the caller's job.
 */
public class EventDerivationEngine {
    private static final Logger log = LoggerFactory.getLogger(EventDerivationEngine.class);

    private final DerivationProperties properties;
    private final MotionState motionState;
    private final LightConditionClassifier lightClassifier;
    private final LocalHourSource hourSource;

    public EventDerivationEngine(DerivationProperties properties, MotionState motionState,
                                 LightConditionClassifier lightClassifier, LocalHourSource hourSource) {
        this.properties = properties;
        this.motionState = motionState;
        this.lightClassifier = lightClassifier;
        this.hourSource = hourSource;
    }

    /**
     * @throws MissingDataException if a required field is absent
     * @throws InvalidReadingException if a present field is out of physical range
     */
    public DerivationResult ingest(RawReading reading) {
        requireComplete(reading);
        double distanceMeters = UnitConversion.metersFromCentimeters(reading.distanceCm());
        requireInRange(reading);

        Instant receivedAt = reading.receivedAt();
        LightCondition light = lightClassifier.classify(reading.lightLevel(), hourSource.currentLocalHour());
        double acceleration = UnitConversion.metersPerSecondSquared(
                UnitConversion.gForceMagnitude(reading.accX(), reading.accY(), reading.accZ()));
        if (!Double.isFinite(acceleration)) {
            throw new InvalidReadingException(List.of("accX", "accY", "accZ"),
                    "acceleration magnitude is not representable");
        }

        List<DerivedEvent> events = new ArrayList<>(2);

        if (distanceMeters < properties.getFollowDistanceThresholdMeters()) {
            events.add(new FollowDistanceViolation(receivedAt, distanceMeters, reading.speedMph(),
                    properties.getFollowDistanceThresholdMeters(), reading.durationSeconds(), light,
                    reading.latitude(), reading.longitude()));
            log.debug("Follow distance violation: {} m (required {} m)", distanceMeters,
                    properties.getFollowDistanceThresholdMeters());
        }

        MotionSample current = new MotionSample(reading.speedMph(), reading.accX(), reading.accY(),
                reading.accZ(), receivedAt);
        Optional<MotionSample> previous = motionState.observe(current);
        previous.filter(baseline -> withinStalenessWindow(baseline, current))
                .flatMap(baseline -> detectHarshBraking(baseline, current, reading, light))
                .ifPresent(events::add);

        return new DerivationResult(snapshotOf(reading, acceleration, light), events);
    }

    private void requireComplete(RawReading reading) {
        List<String> missing = new ArrayList<>();
        if (reading.distanceCm() == null) {
            missing.add("distance_cm");
        }
        if (reading.lightLevel() == null) {
            missing.add("light_level");
        }
        if (reading.accX() == null) {
            missing.add("accX");
        }
        if (reading.accY() == null) {
            missing.add("accY");
        }
        if (reading.accZ() == null) {
            missing.add("accZ");
        }
        if (reading.receivedAt() == null) {
            missing.add("received_at");
        }
        if (!missing.isEmpty()) {
            throw new MissingDataException(missing);
        }
    }

    private void requireInRange(RawReading reading) {
        int level = reading.lightLevel();
        if (level < 0 || level > 100) {
            throw new InvalidReadingException("light_level", "light level must be within 0-100: " + level);
        }
        requireFinite("accX", reading.accX());
        requireFinite("accY", reading.accY());
        requireFinite("accZ", reading.accZ());
        requireFinite("speed_mph", reading.speedMph());
        requireFinite("speed_limit", reading.speedLimit());
        requireFinite("heading", reading.heading());
        if (reading.speedMph() != null && reading.speedMph() < 0) {
            throw new InvalidReadingException("speed_mph", "speed cannot be negative: " + reading.speedMph());
        }
        requireWithin("latitude", reading.latitude(), 90.0);
        requireWithin("longitude", reading.longitude(), 180.0);
    }

    private static void requireFinite(String field, Double value) {
        if (value != null && !Double.isFinite(value)) {
            throw new InvalidReadingException(field, field + " must be a finite number: " + value);
        }
    }

    private static void requireWithin(String field, Double value, double bound) {
        if (value != null && !(value >= -bound && value <= bound)) {
            throw new InvalidReadingException(field, field + " must be within +/-" + bound + ": " + value);
        }
    }

    // Out-of-order arrivals are compared by absolute gap; reception order still decides the baseline.
    private boolean withinStalenessWindow(MotionSample baseline, MotionSample current) {
        Duration gap = Duration.between(baseline.timestamp(), current.timestamp()).abs();
        return gap.compareTo(Duration.ofSeconds(properties.getStalenessWindowSeconds())) <= 0;
    }

    private Optional<DerivedEvent> detectHarshBraking(MotionSample baseline, MotionSample current,
                                                      RawReading reading, LightCondition light) {
        double fromAccelerometer = UnitConversion.metersPerSecondSquared(-current.accX());
        OptionalDouble fromSpeed = speedDeceleration(baseline, current);
        double deceleration = fromSpeed.isPresent()
                ? Math.max(fromSpeed.getAsDouble(), fromAccelerometer)
                : fromAccelerometer;

        double threshold = UnitConversion.metersPerSecondSquared(properties.getHarshBrakeThresholdG());
        if (!(deceleration > threshold)) {
            return Optional.empty();
        }

        Severity severity = severityOf(deceleration);
        log.info("Harsh braking detected deceleration={} m/s² severity={} speed {} -> {}",
                deceleration, severity, baseline.speedMph(), current.speedMph());
        return Optional.of(new HarshBrakingEvent(current.timestamp(), deceleration, baseline.speedMph(),
                current.speedMph(), severity, light, reading.latitude(), reading.longitude()));
    }

    private OptionalDouble speedDeceleration(MotionSample baseline, MotionSample current) {
        if (baseline.speedMph() == null || current.speedMph() == null) {
            return OptionalDouble.empty();
        }
        long elapsedMillis = Duration.between(baseline.timestamp(), current.timestamp()).toMillis();
        if (elapsedMillis <= 0) {
            return OptionalDouble.empty();
        }
        double speedDrop = UnitConversion.metersPerSecond(baseline.speedMph() - current.speedMph());
        double rate = speedDrop / (elapsedMillis / 1000.0);
        return Double.isFinite(rate) ? OptionalDouble.of(rate) : OptionalDouble.empty();
    }

    private Severity severityOf(double deceleration) {
        if (deceleration >= UnitConversion.metersPerSecondSquared(properties.getHighSeverityG())) {
            return Severity.HIGH;
        }
        if (deceleration >= UnitConversion.metersPerSecondSquared(properties.getMediumSeverityG())) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private SpeedSnapshot snapshotOf(RawReading reading, double acceleration, LightCondition light) {
        Double speed = reading.speedMph();
        double limit = reading.speedLimit() != null ? reading.speedLimit() : properties.getDefaultSpeedLimitMph();
        boolean speeding = speed != null && speed > limit;
        return new SpeedSnapshot(reading.receivedAt(), speed, reading.speedLimit(), speeding, acceleration,
                reading.heading(), light, reading.latitude(), reading.longitude());
    }
}
