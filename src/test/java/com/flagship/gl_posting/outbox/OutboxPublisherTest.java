package com.flagship.gl_posting.outbox;

import com.flagship.gl_posting.TestLedger;
import com.flagship.gl_posting.journal.JournalLine;
import com.flagship.gl_posting.journal.JournalPostingInput;
import com.flagship.gl_posting.posting.PostingResult;
import com.flagship.gl_posting.posting.PostingService;
import com.flagship.gl_posting.posting.event.JournalPostedEvent;
import com.flagship.gl_posting.posting.event.TaxLookupDegradedEvent;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static com.flagship.gl_posting.TestLedger.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox to Kafka: journal events keyed by journal id on the journals topic,
 * tax degradation on the audit topic, rows marked published once the send is acknowledged.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("gl_posting_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("idempotency.redis.enabled", () -> "false");
        // Publisher bean on, but the schedule effectively off; tests trigger it
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private PostingService postingService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxEventRepository outboxEventRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Value("${kafka.topic.journals}")
    private String journalsTopic;

    @Value("${kafka.topic.audit}")
    private String auditTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        TestLedger.seed(jdbcTemplate);
        outboxPublisher.publishPendingEvents();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(List.of(journalsTopic, auditTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private JournalPostingInput.JournalPostingInputBuilder sale() {
        return cashSale("admin").journalDate(LocalDate.now(ZoneOffset.UTC).minusDays(1));
    }

    @Test
    @DisplayName("A posted journal reaches the journals topic keyed by its id, with tenant, type and event id headers")
    void publishesPostedEvent() {
        PostingResult result = postingService.post(sale().build());
        assertTrue(outboxEventRepository.countUnpublished() > 0);

        outboxPublisher.publishPendingEvents();

        assertEquals(0, outboxEventRepository.countUnpublished());
        ConsumerRecord<String, String> record = awaitRecord(journalsTopic, result.getId().toString(), 10_000);
        assertEquals(JournalPostedEvent.EVENT_TYPE, header(record, OutboxPublisher.EVENT_TYPE_HEADER));
        assertEquals(TENANT.toString(), header(record, OutboxPublisher.TENANT_HEADER));
        assertTrue(record.value().contains(result.getJournalNumber()));

        UUID eventId = UUID.fromString(header(record, OutboxPublisher.EVENT_ID_HEADER));
        OutboxEventEntity row = outboxEventRepository.findById(eventId).orElseThrow();
        assertEquals(result.getId(), row.getAggregateId());
        assertEquals(JournalPostedEvent.EVENT_TYPE, row.getEventType());
    }

    @Test
    @DisplayName("Tax degradation is published to the audit topic, not the journals topic")
    void publishesAuditEvent() {
        PostingResult result = postingService.post(sale().clearLines()
            .line(JournalLine.debit(CASH.getId(), new BigDecimal("100.00"), null))
            .line(JournalLine.credit(REVENUE.getId(), new BigDecimal("100.00"), null).toBuilder()
                .taxCode("ZZ9").build())
            .build());
        assertFalse(result.getWarnings().isEmpty());

        outboxPublisher.publishPendingEvents();

        ConsumerRecord<String, String> record = awaitRecord(auditTopic, result.getId().toString(), 10_000);
        assertEquals(TaxLookupDegradedEvent.EVENT_TYPE, header(record, OutboxPublisher.EVENT_TYPE_HEADER));
        assertTrue(record.value().contains("TAX_CODE_NOT_FOUND"));
    }

    private ConsumerRecord<String, String> awaitRecord(String topic, String key, long timeoutMs) {
        List<ConsumerRecord<String, String>> seen = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;
        while (System.currentTimeMillis() < endTime) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(200))) {
                if (record.topic().equals(topic) && key.equals(record.key())) {
                    return record;
                }
                seen.add(record);
            }
        }
        throw new AssertionError("No record with key " + key + " on " + topic + "; saw " + seen.size() + " others");
    }

    private static String header(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}
