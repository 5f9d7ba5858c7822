package com.automotiveiot.jdbcsink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Writes one derivation unit per message: the snapshot and all of its events commit together
 * or not at all. A failed write is retried with the records already in hand; the deriver is
 * never asked to derive them again.
 */
@Component("derivationUnitSink")
public class DerivationUnitSink implements Consumer<String> {
    private static final Logger log = LoggerFactory.getLogger(DerivationUnitSink.class);

    private final DrivingRecordStore store;
    private final TransactionTemplate transactionTemplate;
    private final MeterRegistry meterRegistry;
    private final JdbcSinkProperties properties;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public DerivationUnitSink(DrivingRecordStore store, TransactionTemplate transactionTemplate,
                              MeterRegistry meterRegistry, JdbcSinkProperties properties) {
        this.store = store;
        this.transactionTemplate = transactionTemplate;
        this.meterRegistry = meterRegistry;
        this.properties = properties;
    }

    @Override
    public void accept(String jsonMessage) {
        Timer.Sample sample = null;
        if (properties.isEnableMetrics()) {
            sample = Timer.start(meterRegistry);
            meterRegistry.counter(properties.getMetricsPrefix() + "_units_total").increment();
        }

        try {
            log.info("Derivation unit received: {}",
                    jsonMessage.substring(0, Math.min(100, jsonMessage.length())) + "...");

            PersistedUnit persisted = persistWithRetry(parse(jsonMessage));

            if (properties.isEnableMetrics()) {
                meterRegistry.counter(properties.getMetricsPrefix() + "_units_persisted").increment();
            }
            log.debug("Stored snapshot id={} with event ids {}", persisted.snapshotId(), persisted.eventIds());

        } catch (RuntimeException e) {
            log.error("Error storing derivation unit: {}", e.getMessage(), e);
            if (properties.isEnableMetrics()) {
                meterRegistry.counter(properties.getMetricsPrefix() + "_units_failed",
                                    "error", e.getClass().getSimpleName()).increment();
            }
            throw e;
        } finally {
            if (sample != null) {
                sample.stop(meterRegistry.timer(properties.getMetricsPrefix() + "_unit_duration"));
            }
        }
    }

    private JsonNode parse(String jsonMessage) {
        JsonNode unit;
        try {
            unit = objectMapper.readTree(jsonMessage);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Derivation unit is not valid JSON", e);
        }
        if (unit == null || !unit.path("snapshot").isObject()) {
            throw new IllegalArgumentException("Derivation unit has no snapshot");
        }
        return unit;
    }

    PersistedUnit persistWithRetry(JsonNode unit) {
        int maxAttempts = properties.isEnableRetry() ? Math.max(1, properties.getMaxRetryAttempts()) : 1;
        for (int attempt = 1; ; attempt++) {
            try {
                return transactionTemplate.execute(status -> persist(unit));
            } catch (StorageException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                log.warn("Storing derivation unit failed (attempt {}/{}): {}", attempt, maxAttempts, e.getMessage());
                if (properties.isEnableMetrics()) {
                    meterRegistry.counter(properties.getMetricsPrefix() + "_persist_retries_total").increment();
                }
            }
        }
    }

    private PersistedUnit persist(JsonNode unit) {
        long snapshotId = store.persistSnapshot(unit.get("snapshot"));
        List<Long> eventIds = new ArrayList<>();
        for (JsonNode event : unit.path("events")) {
            String kind = event.path("kind").asText();
            eventIds.add(store.persistEvent(kind, event.path("record")));
            log.info("Stored {} event for snapshot id={}", kind, snapshotId);
        }
        return new PersistedUnit(snapshotId, List.copyOf(eventIds));
    }

    record PersistedUnit(long snapshotId, List<Long> eventIds) {
    }
}
