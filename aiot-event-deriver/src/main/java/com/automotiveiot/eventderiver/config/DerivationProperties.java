package com.automotiveiot.eventderiver.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Thresholds used by the event derivation engine.
 */
@ConfigurationProperties("aiot.derivation")
public class DerivationProperties {

    /**
     * Deceleration, in g, above which a harsh braking event is emitted (default: 0.3).
     */
    private double harshBrakeThresholdG = 0.3;

    /**
     * Deceleration, in g, from which a harsh braking event is rated medium (default: 0.5).
     */
    private double mediumSeverityG = 0.5;

    /**
     * Deceleration, in g, from which a harsh braking event is rated high (default: 0.7).
     */
    private double highSeverityG = 0.7;

    /**
     * Distance to the vehicle ahead, in meters, below which a follow distance violation is
     * emitted. Also reported as the required distance of the violation (default: 9.0).
     */
    private double followDistanceThresholdMeters = 9.0;

    /**
     * Maximum gap, in seconds, between two readings for them to be diffed. A reading arriving
     * later than this after the previous one becomes a fresh baseline (default: 5).
     */
    private long stalenessWindowSeconds = 5;

    /**
     * Speed limit in mph applied to snapshots when the reading carries none (default: 65).
     */
    private double defaultSpeedLimitMph = 65.0;

    /**
     * Time zone whose wall-clock hour separates dawn from dusk. Empty means the system zone.
     */
    private String zoneId = "";

    public double getHarshBrakeThresholdG() {
        return harshBrakeThresholdG;
    }

    public void setHarshBrakeThresholdG(double harshBrakeThresholdG) {
        this.harshBrakeThresholdG = harshBrakeThresholdG;
    }

    public double getMediumSeverityG() {
        return mediumSeverityG;
    }

    public void setMediumSeverityG(double mediumSeverityG) {
        this.mediumSeverityG = mediumSeverityG;
    }

    public double getHighSeverityG() {
        return highSeverityG;
    }

    public void setHighSeverityG(double highSeverityG) {
        this.highSeverityG = highSeverityG;
    }

    public double getFollowDistanceThresholdMeters() {
        return followDistanceThresholdMeters;
    }

    public void setFollowDistanceThresholdMeters(double followDistanceThresholdMeters) {
        this.followDistanceThresholdMeters = followDistanceThresholdMeters;
    }

    public long getStalenessWindowSeconds() {
        return stalenessWindowSeconds;
    }

    public void setStalenessWindowSeconds(long stalenessWindowSeconds) {
        this.stalenessWindowSeconds = stalenessWindowSeconds;
    }

    public double getDefaultSpeedLimitMph() {
        return defaultSpeedLimitMph;
    }

    public void setDefaultSpeedLimitMph(double defaultSpeedLimitMph) {
        this.defaultSpeedLimitMph = defaultSpeedLimitMph;
    }

    public String getZoneId() {
        return zoneId;
    }

    public void setZoneId(String zoneId) {
        this.zoneId = zoneId;
    }
}
