package com.automotiveiot.jdbcsink;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.context.TestPropertySource;
import org.testcontainers.containers.RabbitMQContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest
@TestPropertySource(properties = {
    "spring.datasource.url=jdbc:h2:mem:drivingrecords;DB_CLOSE_DELAY=-1",
    "spring.datasource.driver-class-name=org.h2.Driver",
    "spring.datasource.username=sa",
    "spring.datasource.password=",
    "aiot.jdbc.sink.initialize=true",
    "spring.cloud.stream.rabbit.default.producer.exchangeType=fanout"
})
class JdbcSinkApplicationTests {

    @Container
    static RabbitMQContainer rabbit = new RabbitMQContainer("rabbitmq:3.13-management");

    @DynamicPropertySource
    static void rabbitmqProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.rabbitmq.host", rabbit::getHost);
        registry.add("spring.rabbitmq.port", rabbit::getAmqpPort);
    }

    @Autowired
    private StreamBridge streamBridge;

    @Autowired
    private DrivingRecordQueries queries;

    @Test
    void contextLoads() {
        assertThat(queries.findSpeedSnapshots(RecordQuery.all())).isNotNull();
    }

    @Test
    void storesUnitsArrivingOnTheDerivedEventsDestination() throws Exception {
        queries.clearAll();
        String unit = DrivingRecordFixtures.unit(
                DrivingRecordFixtures.snapshot("2026-03-01T18:30:00Z", 42.5, false),
                DrivingRecordFixtures.followDistance("2026-03-01T18:30:00Z", "dusk"));

        Thread.sleep(500);
        streamBridge.send("derived_events", unit.getBytes(StandardCharsets.UTF_8));

        long deadline = System.currentTimeMillis() + 5000;
        while (queries.findFollowDistanceViolations(RecordQuery.all()).isEmpty()
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(100);
        }
        assertThat(queries.findSpeedSnapshots(RecordQuery.all())).hasSize(1);
        assertThat(queries.findFollowDistanceViolations(RecordQuery.all()))
                .singleElement()
                .satisfies(row -> assertThat(row.get("light_condition")).isEqualTo("dusk"));
    }
}
