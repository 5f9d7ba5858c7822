package com.automotiveiot.eventderiver.config;

import com.automotiveiot.eventderiver.engine.EventDerivationEngine;
import com.automotiveiot.eventderiver.engine.LightConditionClassifier;
import com.automotiveiot.eventderiver.engine.LocalHourSource;
import com.automotiveiot.eventderiver.engine.MotionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@EnableConfigurationProperties(DerivationProperties.class)
public class DeriverConfiguration {

    private static final Logger logger = LoggerFactory.getLogger(DeriverConfiguration.class);

    @Bean
    public Clock derivationClock(DerivationProperties properties) {
        ZoneId zone = properties.getZoneId() == null || properties.getZoneId().isBlank()
                ? ZoneId.systemDefault()
                : ZoneId.of(properties.getZoneId());
        logger.info("Light conditions use the wall-clock hour of zone {}", zone);
        return Clock.system(zone);
    }

    @Bean
    public LocalHourSource localHourSource(Clock derivationClock) {
        return LocalHourSource.fromClock(derivationClock);
    }

    @Bean
    public MotionState motionState() {
        return new MotionState();
    }

    @Bean
    public LightConditionClassifier lightConditionClassifier() {
        return new LightConditionClassifier();
    }

    @Bean
    public EventDerivationEngine eventDerivationEngine(DerivationProperties properties, MotionState motionState,
                                                       LightConditionClassifier lightConditionClassifier,
                                                       LocalHourSource localHourSource) {
        logger.info("Derivation thresholds: harshBrake={}g followDistance={}m staleness={}s",
                properties.getHarshBrakeThresholdG(), properties.getFollowDistanceThresholdMeters(),
                properties.getStalenessWindowSeconds());
        return new EventDerivationEngine(properties, motionState, lightConditionClassifier, localHourSource);
    }
}
