package com.fleetinsight.domain;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.data.mongo.DataMongoTest;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

@DataMongoTest
@Testcontainers(disabledWithoutDocker = true)
class EnrichedRecordRepositoryIntegrationTest {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7"));

    @DynamicPropertySource
    static void mongoProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", mongo::getReplicaSetUrl);
    }

    @Autowired
    EnrichedGpsPointRepository gpsRepository;
    @Autowired
    ProcessingRunRepository processingRunRepository;

    @BeforeEach
    void clean() {
        gpsRepository.deleteAll();
        processingRunRepository.deleteAll();
    }

    @Test
    @DisplayName("saved point gets an id and round-trips its labels")
    void save_assignsIdAndKeepsLabels() {
        EnrichedGpsPoint saved = gpsRepository.save(EnrichedGpsPoint.builder()
                .originalId("p1").latitude(51.15).longitude(71.4).speed(11)
                .areaLabel(AreaLabel.NORTH).activityLabel(ActivityLabel.HIGH)
                .classificationSource(ClassificationSource.ORACLE).confidence(0.8)
                .build());

        assertThat(saved.getId()).isNotNull();
        EnrichedGpsPoint loaded = gpsRepository.findById(saved.getId()).orElseThrow();
        assertThat(loaded.getAreaLabel()).isEqualTo(AreaLabel.NORTH);
        assertThat(loaded.getActivityLabel()).isEqualTo(ActivityLabel.HIGH);
        assertThat(loaded.getConfidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("area filter honours the page size; speed stream excludes stationary points")
    void findByAreaLabel_andSpeedStream() {
        gpsRepository.saveAll(List.of(
                EnrichedGpsPoint.builder().originalId("a").areaLabel(AreaLabel.SOUTH).speed(0).build(),
                EnrichedGpsPoint.builder().originalId("b").areaLabel(AreaLabel.SOUTH).speed(3).build(),
                EnrichedGpsPoint.builder().originalId("c").areaLabel(AreaLabel.CENTER).speed(5).build()));

        assertThat(gpsRepository.findByAreaLabel(AreaLabel.SOUTH, PageRequest.of(0, 1))).hasSize(1);
        assertThat(gpsRepository.findByAreaLabel(AreaLabel.SOUTH, PageRequest.of(0, 10))).hasSize(2);
        try (Stream<EnrichedGpsPoint> moving = gpsRepository.streamBySpeedGreaterThan(0)) {
            assertThat(moving.map(EnrichedGpsPoint::getOriginalId).toList()).containsExactlyInAnyOrder("b", "c");
        }
    }

    @Test
    @DisplayName("latest run is the most recently started")
    void findFirstByOrderByStartedAtDesc() {
        ProcessingRun older = new ProcessingRun();
        older.setStartedAt(Instant.parse("2024-05-01T10:00:00Z"));
        ProcessingRun newer = new ProcessingRun();
        newer.setStartedAt(Instant.parse("2024-05-02T10:00:00Z"));
        newer.setStatus(ProcessingRun.RunStatus.COMPLETED);
        processingRunRepository.saveAll(List.of(older, newer));

        assertThat(processingRunRepository.findFirstByOrderByStartedAtDesc())
                .hasValueSatisfying(r -> assertThat(r.getStatus()).isEqualTo(ProcessingRun.RunStatus.COMPLETED));
    }
}
