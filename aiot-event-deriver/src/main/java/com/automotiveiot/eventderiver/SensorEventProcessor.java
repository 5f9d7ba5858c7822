package com.automotiveiot.eventderiver;

import com.automotiveiot.eventderiver.dto.DerivationResult;
import com.automotiveiot.eventderiver.dto.DerivedEvent;
import com.automotiveiot.eventderiver.dto.RawReading;
import com.automotiveiot.eventderiver.engine.EventDerivationEngine;
import com.automotiveiot.eventderiver.engine.IngestException;
import com.automotiveiot.eventderiver.engine.InvalidReadingException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.context.annotation.Bean;
import org.springframework.messaging.Message;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

@Component
public class SensorEventProcessor {
    private static final Logger log = LoggerFactory.getLogger(SensorEventProcessor.class);

    static final String REJECTS_BINDING = "sensorRejects-out-0";

    private final ObjectMapper mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
            .build();
    private final EventDerivationEngine engine;
    private final MeterRegistry meterRegistry;
    private final StreamBridge streamBridge;
    private final Clock clock;

    public SensorEventProcessor(EventDerivationEngine engine, MeterRegistry meterRegistry,
                                StreamBridge streamBridge, Clock derivationClock) {
        this.engine = engine;
        this.meterRegistry = meterRegistry;
        this.streamBridge = streamBridge;
        this.clock = derivationClock;
    }

    @Bean
    public Function<Message<byte[]>, Message<byte[]>> deriveSensorEvents() {
        // One derivation unit per accepted reading; rejected readings go to the rejects binding
        return in -> {
            meterRegistry.counter("sensor_readings_total", "binding", "deriveSensorEvents-in-0").increment();
            Instant receivedAt = Instant.now(clock);
            try {
                RawReading reading = parse(in.getPayload()).withReceivedAt(receivedAt);
                DerivationResult result = engine.ingest(reading);
                for (DerivedEvent event : result.events()) {
                    meterRegistry.counter("derived_events_total", "kind", event.kind().getWireName()).increment();
                }
                return MessageBuilder.withPayload(toDerivationUnit(result, receivedAt))
                        .copyHeaders(in.getHeaders())
                        .setHeader("contentType", "application/json")
                        .build();
            } catch (IngestException e) {
                log.warn("Rejected sensor reading ({}): {}", e.getErrorCode(), e.getMessage());
                meterRegistry.counter("sensor_readings_rejected_total", "reason", e.getErrorCode()).increment();
                publishRejection(e, receivedAt, in.getPayload());
                return null;
            }
        };
    }

    private RawReading parse(byte[] payload) {
        try {
            RawReading reading = mapper.readValue(payload, RawReading.class);
            if (reading == null) {
                throw new InvalidReadingException((String) null, "Empty sensor payload");
            }
            return reading;
        } catch (IOException e) {
            throw new InvalidReadingException((String) null, "Unreadable sensor payload: " + e.getMessage());
        }
    }

    byte[] toDerivationUnit(DerivationResult result, Instant receivedAt) {
        ObjectNode unit = mapper.createObjectNode();
        unit.put("received_at", receivedAt.toString());
        unit.set("snapshot", mapper.valueToTree(result.snapshot()));
        ArrayNode events = unit.putArray("events");
        for (DerivedEvent event : result.events()) {
            ObjectNode entry = events.addObject();
            entry.put("kind", event.kind().getWireName());
            entry.set("record", mapper.valueToTree(event));
        }
        try {
            return mapper.writeValueAsBytes(unit);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize derivation unit", e);
        }
    }

    private void publishRejection(IngestException e, Instant receivedAt, byte[] payload) {
        ObjectNode rejection = mapper.createObjectNode();
        rejection.put("error", e.getErrorCode());
        rejection.put("message", e.getMessage());
        ArrayNode fields = rejection.putArray("fields");
        e.getFields().forEach(fields::add);
        rejection.put("received_at", receivedAt.toString());
        rejection.put("payload", new String(payload, StandardCharsets.UTF_8));

        Message<byte[]> msg = MessageBuilder.withPayload(rejection.toString().getBytes(StandardCharsets.UTF_8))
                .setHeader("contentType", "application/json")
                .build();
        boolean sent = streamBridge.send(REJECTS_BINDING, msg);
        if (!sent) {
            log.warn("Failed to publish rejection to {}", REJECTS_BINDING);
        }
    }
}
