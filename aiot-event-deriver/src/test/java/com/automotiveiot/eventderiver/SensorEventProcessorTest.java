package com.automotiveiot.eventderiver;

import com.automotiveiot.eventderiver.config.DerivationProperties;
import com.automotiveiot.eventderiver.engine.EventDerivationEngine;
import com.automotiveiot.eventderiver.engine.LightConditionClassifier;
import com.automotiveiot.eventderiver.engine.LocalHourSource;
import com.automotiveiot.eventderiver.engine.MotionState;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SensorEventProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T18:30:00Z");

    private MeterRegistry meterRegistry;
    private StreamBridge streamBridge;
    private ObjectMapper mapper;
    private Function<Message<byte[]>, Message<byte[]>> deriveFunction;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        streamBridge = mock(StreamBridge.class);
        when(streamBridge.send(eq(SensorEventProcessor.REJECTS_BINDING), any())).thenReturn(true);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        EventDerivationEngine engine = new EventDerivationEngine(new DerivationProperties(), new MotionState(),
                new LightConditionClassifier(), LocalHourSource.fromClock(clock));
        deriveFunction = new SensorEventProcessor(engine, meterRegistry, streamBridge, clock).deriveSensorEvents();
        mapper = new ObjectMapper();
    }

    private Message<byte[]> message(String json) {
        return MessageBuilder.withPayload(json.getBytes(StandardCharsets.UTF_8)).build();
    }

    @Test
    void testDerivesSnapshotAndFollowDistanceViolation() throws Exception {
        String json = """
            {
              "distance_cm": 450,
              "light_level": 40,
              "accX": 0.05,
              "accY": -0.02,
              "accZ": 0.98,
              "speed_mph": 42.5,
              "latitude": 33.7701,
              "longitude": -84.3876
            }
            """;

        Message<byte[]> result = deriveFunction.apply(message(json));

        assertNotNull(result);
        assertEquals("application/json", String.valueOf(result.getHeaders().get("contentType")));
        JsonNode unit = mapper.readTree(result.getPayload());
        assertEquals("2026-03-01T18:30:00Z", unit.get("received_at").asText());

        JsonNode snapshot = unit.get("snapshot");
        assertEquals("2026-03-01T18:30:00Z", snapshot.get("snapshot_timestamp").asText());
        assertEquals(42.5, snapshot.get("speed_mph").asDouble(), 0.001);
        assertEquals("dusk", snapshot.get("light_condition").asText());
        assertFalse(snapshot.get("is_speeding").asBoolean());
        assertTrue(snapshot.get("speed_limit").isNull());
        assertEquals(33.7701, snapshot.get("latitude").asDouble(), 0.0001);

        JsonNode events = unit.get("events");
        assertEquals(1, events.size());
        assertEquals("follow_distance", events.get(0).get("kind").asText());
        JsonNode violation = events.get(0).get("record");
        assertEquals(4.5, violation.get("distance_meters").asDouble(), 0.001);
        assertEquals(9.0, violation.get("required_distance").asDouble(), 0.001);
        assertEquals(42.5, violation.get("current_speed").asDouble(), 0.001);

        assertEquals(1.0, meterRegistry.counter("sensor_readings_total", "binding", "deriveSensorEvents-in-0").count());
        assertEquals(1.0, meterRegistry.counter("derived_events_total", "kind", "follow_distance").count());
        verify(streamBridge, never()).send(any(String.class), any());
    }

    @Test
    void testArrivalTimeIsNotTakenFromThePayload() throws Exception {
        String json = "{\"distance_cm\":2000,\"light_level\":90,\"accX\":0,\"accY\":0,\"accZ\":1,"
                + "\"received_at\":\"2020-01-01T00:00:00Z\"}";

        JsonNode unit = mapper.readTree(deriveFunction.apply(message(json)).getPayload());

        assertEquals("2026-03-01T18:30:00Z", unit.get("snapshot").get("snapshot_timestamp").asText());
        assertTrue(unit.get("snapshot").get("speed_mph").isNull());
        assertEquals(0, unit.get("events").size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testMissingFieldIsRejected() throws Exception {
        String json = "{\"distance_cm\":2000,\"light_level\":90,\"accX\":0,\"accZ\":1}";

        Message<byte[]> result = deriveFunction.apply(message(json));

        assertNull(result);
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(streamBridge).send(eq(SensorEventProcessor.REJECTS_BINDING), captor.capture());
        JsonNode rejection = mapper.readTree(((Message<byte[]>) captor.getValue()).getPayload());
        assertEquals("missing_data", rejection.get("error").asText());
        assertEquals("accY", rejection.get("fields").get(0).asText());
        assertEquals(json, rejection.get("payload").asText());
        assertEquals(1.0, meterRegistry.counter("sensor_readings_rejected_total", "reason", "missing_data").count());
    }

    @Test
    void testNegativeDistanceIsRejected() {
        String json = "{\"distance_cm\":-10,\"light_level\":90,\"accX\":0,\"accY\":0,\"accZ\":1}";

        assertNull(deriveFunction.apply(message(json)));
        assertEquals(1.0, meterRegistry.counter("sensor_readings_rejected_total", "reason", "invalid_reading").count());
    }

    @Test
    void testHandleMalformedJson() {
        assertNull(deriveFunction.apply(message("{ invalid json }")));
        assertNull(deriveFunction.apply(message("{\"distance_cm\":\"far\",\"light_level\":90}")));

        assertEquals(2.0, meterRegistry.counter("sensor_readings_rejected_total", "reason", "invalid_reading").count());
        verify(streamBridge, org.mockito.Mockito.times(2)).send(eq(SensorEventProcessor.REJECTS_BINDING), any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testNaNAccelerometerIsRejectedNotBraking() throws Exception {
        assertNotNull(deriveFunction.apply(message("{\"distance_cm\":2000,\"light_level\":80,\"accX\":0,\"accY\":0,\"accZ\":1}")));

        Message<byte[]> result = deriveFunction.apply(message(
                "{\"distance_cm\":2000,\"light_level\":80,\"accX\":\"NaN\",\"accY\":0,\"accZ\":1}"));

        assertNull(result);
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(streamBridge).send(eq(SensorEventProcessor.REJECTS_BINDING), captor.capture());
        JsonNode rejection = mapper.readTree(((Message<byte[]>) captor.getValue()).getPayload());
        assertEquals("invalid_reading", rejection.get("error").asText());
        assertEquals("accX", rejection.get("fields").get(0).asText());
        assertEquals(0.0, meterRegistry.counter("derived_events_total", "kind", "harsh_braking").count());
    }

    @Test
    void testFractionalIntegerFieldsAreRejected() {
        assertNull(deriveFunction.apply(message("{\"distance_cm\":-0.5,\"light_level\":90,\"accX\":0,\"accY\":0,\"accZ\":1}")));
        assertNull(deriveFunction.apply(message("{\"distance_cm\":2000,\"light_level\":12.9,\"accX\":0,\"accY\":0,\"accZ\":1}")));

        assertEquals(2.0, meterRegistry.counter("sensor_readings_rejected_total", "reason", "invalid_reading").count());
    }

    @Test
    void testHarshBrakingAcrossTwoUploads() throws Exception {
        // both uploads share the fixed clock, so only the accelerometer can show braking
        deriveFunction.apply(message("{\"distance_cm\":2000,\"light_level\":90,\"accX\":0,\"accY\":0,\"accZ\":1,\"speed_mph\":50}"));
        Message<byte[]> result = deriveFunction.apply(message(
                "{\"distance_cm\":2000,\"light_level\":90,\"accX\":-0.8,\"accY\":0,\"accZ\":1,\"speed_mph\":38}"));

        JsonNode events = mapper.readTree(result.getPayload()).get("events");
        assertEquals(1, events.size());
        assertEquals("harsh_braking", events.get(0).get("kind").asText());
        JsonNode braking = events.get(0).get("record");
        assertEquals("high", braking.get("severity").asText());
        assertEquals(50.0, braking.get("speed_before").asDouble(), 0.001);
        assertEquals(38.0, braking.get("speed_after").asDouble(), 0.001);
        assertEquals("day", braking.get("light_condition").asText());
    }
}
