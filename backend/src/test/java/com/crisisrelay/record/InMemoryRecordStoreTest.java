package com.crisisrelay.record;

import com.crisisrelay.protocol.ProtocolError;
import com.crisisrelay.protocol.ProtocolException;
import com.crisisrelay.sealed.SealedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.function.Predicate;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryRecordStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private InMemoryRecordStore store;

    @BeforeEach
    void setup() {
        store = new InMemoryRecordStore();
    }

    private long create() {
        return store.create(new SealedValue("sealed-content"), new SealedValue("sealed-score"), NOW).block();
    }

    private static Predicate<Throwable> failure(ProtocolError error) {
        return ex -> ex instanceof ProtocolException pe && pe.getError() == error;
    }

    @Test
    void createStoresEvaluatingRecordWithEmptyAlert() {
        long id = create();

        StepVerifier.create(store.get(id))
                .assertNext(record -> {
                    assertEquals(1L, record.id());
                    assertEquals(new SealedValue("sealed-content"), record.sealedContent());
                    assertEquals(new SealedValue("sealed-score"), record.sealedScore());
                    assertEquals(NOW, record.createdAt());
                    assertEquals(RiskState.EVALUATING, record.riskState());
                    assertFalse(record.highRisk());
                    assertEquals(Alert.empty(), record.alert());
                    assertFalse(record.alert().revealed());
                })
                .verifyComplete();
    }

    @Test
    void concurrentCreatesNeverShareAnId() {
        List<Long> ids = Flux.range(0, 200)
                .flatMap(i -> store.create(new SealedValue("c" + i), new SealedValue("s" + i), NOW)
                        .subscribeOn(Schedulers.parallel()))
                .collectList()
                .block();

        assertNotNull(ids);
        assertEquals(200, new HashSet<>(ids).size());
        assertTrue(ids.stream().allMatch(id -> id >= 1 && id <= 200));
    }

    @Test
    void unknownIdIsEmptyOnFindAndNotFoundOnGet() {
        StepVerifier.create(store.find(7)).verifyComplete();
        StepVerifier.create(store.get(7))
                .expectErrorMatches(failure(ProtocolError.NOT_FOUND))
                .verify();
        StepVerifier.create(store.markHighRisk(7, true))
                .expectErrorMatches(failure(ProtocolError.NOT_FOUND))
                .verify();
    }

    @Test
    void markHighRiskIsIdempotent() {
        long id = create();

        store.markHighRisk(id, true).block();
        store.markHighRisk(id, true).block();

        assertEquals(RiskState.HIGH_RISK, store.get(id).block().riskState());
    }

    @Test
    void revealRequestIsACompareAndSet() {
        long id = create();

        StepVerifier.create(store.markRevealRequested(id)).verifyComplete();
        StepVerifier.create(store.markRevealRequested(id))
                .expectErrorMatches(failure(ProtocolError.ALREADY_REVEALED))
                .verify();

        store.clearRevealRequest(id).block();
        assertEquals(RevealState.NOT_REVEALED, store.getAlert(id).block().state());
        StepVerifier.create(store.markRevealRequested(id)).verifyComplete();
    }

    @Test
    void alertContentIsWrittenOnce() {
        long id = create();
        store.markRevealRequested(id).block();

        StepVerifier.create(store.setAlertContent(id, "first")).verifyComplete();
        StepVerifier.create(store.setAlertContent(id, "second"))
                .expectErrorMatches(failure(ProtocolError.ALREADY_REVEALED))
                .verify();

        Alert alert = store.getAlert(id).block();
        assertEquals("first", alert.content());
        assertTrue(alert.revealed());

        // Clearing a revealed alert is a no-op
        store.clearRevealRequest(id).block();
        assertTrue(store.getAlert(id).block().revealed());
    }

    @Test
    void onlyOpenHighRiskRecordsResolve() {
        long evaluating = create();
        long highRisk = create();
        store.markHighRisk(highRisk, true).block();

        StepVerifier.create(store.markResolved(evaluating))
                .expectErrorMatches(failure(ProtocolError.NOT_HIGH_RISK))
                .verify();
        StepVerifier.create(store.markResolved(highRisk)).verifyComplete();
        StepVerifier.create(store.markResolved(highRisk))
                .expectErrorMatches(failure(ProtocolError.ALREADY_RESOLVED))
                .verify();
        StepVerifier.create(store.markResolved(42))
                .expectErrorMatches(failure(ProtocolError.NOT_FOUND))
                .verify();

        assertEquals(CaseState.RESOLVED, store.get(highRisk).block().caseState());
        assertEquals(CaseState.OPEN, store.get(evaluating).block().caseState());
    }

    @Test
    void listBeforeReturnsNewestFirstBelowTheCursor() {
        for (int i = 0; i < 5; i++) {
            create();
        }

        StepVerifier.create(store.listBefore(Long.MAX_VALUE, 3).map(RiskRecord::id))
                .expectNext(5L, 4L, 3L)
                .verifyComplete();
        StepVerifier.create(store.listBefore(3, 10).map(RiskRecord::id))
                .expectNext(2L, 1L)
                .verifyComplete();
        StepVerifier.create(store.listBefore(1, 10)).verifyComplete();
    }

    @Test
    void statisticsFollowTransitions() {
        long id = create();
        create();
        store.markHighRisk(id, true).block();
        store.markRevealRequested(id).block();
        store.markResolved(id).block();

        StepVerifier.create(store.statistics())
                .expectNext(new RiskStatistics(2, 1, 0, 1, 1, 0, 1))
                .verifyComplete();
    }
}
