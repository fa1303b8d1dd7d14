package com.p14n.kafkatopology.resolver;

import com.p14n.kafkatopology.FailureKind;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResolutionReportTest {

    @Test
    void failureOverridesSuccess() {
        ResolutionReport report = ResolutionReport.builder()
                .success(Stage.PRODUCER_TOPIC, "orders")
                .failure(Stage.PRODUCER_TOPIC, "orders", FailureKind.PROBE, "timed out")
                .success(Stage.PRODUCER_TOPIC, "orders")
                .build();

        assertTrue(report.successes().isEmpty());
        assertEquals(FailureKind.PROBE, report.outcome(Stage.PRODUCER_TOPIC, "orders").orElseThrow().kind());
    }

    @Test
    void firstFailureIsKept() {
        ResolutionReport report = ResolutionReport.builder()
                .failure(Stage.CLUSTER, "main", FailureKind.CONFIG, "first")
                .failure(Stage.CLUSTER, "main", FailureKind.STORE, "second")
                .build();

        assertEquals("first", report.outcome(Stage.CLUSTER, "main").orElseThrow().cause());
        assertTrue(report.failuresOf(FailureKind.STORE).isEmpty());
    }

    @Test
    void equalityIgnoresInsertionOrder() {
        ResolutionReport a = ResolutionReport.builder()
                .success(Stage.PRODUCER_TOPIC, "a")
                .failure(Stage.PRODUCER, "p", FailureKind.OPEN, "down")
                .build();
        ResolutionReport b = ResolutionReport.builder()
                .failure(Stage.PRODUCER, "p", FailureKind.OPEN, "down")
                .success(Stage.PRODUCER_TOPIC, "a")
                .build();

        assertEquals(a, b);
        assertFalse(a.isClean());
        assertTrue(ResolutionReport.builder().build().isClean());
    }

    @Test
    void sameIdAtDifferentStagesIsDistinct() {
        ResolutionReport report = ResolutionReport.builder()
                .success(Stage.PRODUCER_TOPIC, "orders")
                .success(Stage.CONSUMER_TOPIC, "orders")
                .build();

        assertEquals(2, report.successes().size());
    }
}
