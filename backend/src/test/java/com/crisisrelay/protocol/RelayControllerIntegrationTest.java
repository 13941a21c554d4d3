package com.crisisrelay.protocol;

import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.ledger.RequestKind;
import com.crisisrelay.oracle.OracleClient;
import com.crisisrelay.oracle.OracleSigner;
import com.crisisrelay.record.RiskStatistics;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.Base64;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * HTTP-layer integration tests for the record, counselor and oracle callback endpoints.
 *
 * Runs the real protocol on an embedded Netty server with in-memory storage (test profile).
 * Only the outbound oracle transport is replaced; callbacks are signed with the test oracle key,
 * so proof verification runs for real. Each test gets a fresh context because the threshold
 * can only be set once.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_EACH_TEST_METHOD)
class RelayControllerIntegrationTest {

    private static final String COUNSELOR = "counselor@crisisrelay.io";
    private static final String ACTOR = CounselorController.ACTOR_HEADER;

    @Autowired
    private WebTestClient webTestClient;

    @MockitoBean
    private OracleClient oracleClient;

    private final OracleSigner oracle = OracleSigner.testOracle();

    // ── Helpers ───────────────────────────────────────────────────────────────

    private void setThreshold() {
        webTestClient.put()
                .uri("/api/counselor/threshold")
                .header(ACTOR, COUNSELOR)
                .bodyValue(new ThresholdRequest("sealed-threshold-70"))
                .exchange()
                .expectStatus().isNoContent();
    }

    private long submit(String oracleRequestId) {
        when(oracleClient.request(eq(RequestKind.RISK_EVALUATION), anyList()))
                .thenReturn(Mono.just(new RequestId(oracleRequestId)));

        SubmissionResponse response = webTestClient.post()
                .uri("/api/records")
                .bodyValue(new SubmissionRequest("sealed-content", "sealed-score"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody(SubmissionResponse.class)
                .returnResult()
                .getResponseBody();
        return response.recordId();
    }

    private static Map<String, String> callback(String requestId, byte[] cleartext, byte[] proof) {
        return Map.of(
                "requestId", requestId,
                "cleartext", Base64.getEncoder().encodeToString(cleartext),
                "proof", Base64.getEncoder().encodeToString(proof));
    }

    private WebTestClient.ResponseSpec answerRisk(String requestId, boolean highRisk, OracleSigner signer) {
        byte[] verdict = OracleSigner.verdict(highRisk);
        return webTestClient.post()
                .uri("/api/oracle/callbacks/risk-evaluation")
                .bodyValue(callback(requestId, verdict, signer.sign(new RequestId(requestId), verdict)))
                .exchange();
    }

    private WebTestClient.ResponseSpec answerReveal(String requestId, String content) {
        byte[] text = OracleSigner.text(content);
        return webTestClient.post()
                .uri("/api/oracle/callbacks/content-reveal")
                .bodyValue(callback(requestId, text, oracle.sign(new RequestId(requestId), text)))
                .exchange();
    }

    // ── Full flow ─────────────────────────────────────────────────────────────

    @Test
    void highRiskSubmissionIsRevealedToTheCounselor() {
        setThreshold();
        long id = submit("orc-1");

        webTestClient.get().uri("/api/records/{id}", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.evaluated").isEqualTo(false);

        answerRisk("orc-1", true, oracle).expectStatus().isNoContent();

        webTestClient.get().uri("/api/records/{id}", id)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.evaluated").isEqualTo(true)
                .jsonPath("$.riskState").doesNotExist()
                .jsonPath("$.sealedContent").doesNotExist();

        webTestClient.get().uri("/api/counselor/records/{id}", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.riskState").isEqualTo("HIGH_RISK")
                .jsonPath("$.caseState").isEqualTo("OPEN");

        when(oracleClient.request(eq(RequestKind.CONTENT_REVEAL), anyList()))
                .thenReturn(Mono.just(new RequestId("orc-2")));

        webTestClient.post().uri("/api/counselor/records/{id}/reveal", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isAccepted()
                .expectBody(RevealResponse.class)
                .isEqualTo(new RevealResponse(id, "orc-2"));

        webTestClient.get().uri("/api/counselor/records/{id}/alert", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isOk()
                .expectBody(AlertView.class)
                .isEqualTo(new AlertView("", false));

        answerReveal("orc-2", "I can't do this anymore").expectStatus().isNoContent();

        webTestClient.get().uri("/api/counselor/records/{id}/alert", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isOk()
                .expectBody(AlertView.class)
                .isEqualTo(new AlertView("I can't do this anymore", true));

        webTestClient.post().uri("/api/counselor/records/{id}/resolve", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.get().uri("/api/counselor/statistics")
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isOk()
                .expectBody(RiskStatistics.class)
                .value(stats -> {
                    assertEquals(1, stats.total());
                    assertEquals(1, stats.highRisk());
                    assertEquals(1, stats.revealed());
                    assertEquals(1, stats.resolved());
                });
    }

    // ── Counselor listing and resolution ──────────────────────────────────────

    @Test
    void recordListPagesWithCursor() {
        setThreshold();
        submit("orc-1");
        submit("orc-2");
        submit("orc-3");

        webTestClient.get().uri("/api/counselor/records?limit=2")
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.records.length()").isEqualTo(2)
                .jsonPath("$.records[0].id").isEqualTo(3)
                .jsonPath("$.records[0].riskState").isEqualTo("EVALUATING")
                .jsonPath("$.nextBefore").isEqualTo(2);

        webTestClient.get().uri("/api/counselor/records?before=2&limit=2")
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.records.length()").isEqualTo(1)
                .jsonPath("$.records[0].id").isEqualTo(1)
                .jsonPath("$.nextBefore").doesNotExist();
    }

    @Test
    void recordListFromVisitor_shouldReturn403() {
        webTestClient.get().uri("/api/counselor/records")
                .header(ACTOR, "anonymous-7f3a")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void oversizedPage_shouldReturn400() {
        webTestClient.get().uri("/api/counselor/records?limit=500")
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_ARGUMENT");
    }

    @Test
    void resolvingTwice_shouldReturn409() {
        setThreshold();
        long id = submit("orc-1");
        answerRisk("orc-1", true, oracle).expectStatus().isNoContent();

        webTestClient.post().uri("/api/counselor/records/{id}/resolve", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isNoContent();

        webTestClient.post().uri("/api/counselor/records/{id}/resolve", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("ALREADY_RESOLVED");
    }

    @Test
    void statisticsFromVisitor_shouldReturn403() {
        webTestClient.get().uri("/api/counselor/statistics")
                .header(ACTOR, "anonymous-7f3a")
                .exchange()
                .expectStatus().isForbidden();
    }

    // ── Error mapping ─────────────────────────────────────────────────────────

    @Test
    void submitBeforeThreshold_shouldReturn409() {
        webTestClient.post()
                .uri("/api/records")
                .bodyValue(new SubmissionRequest("sealed-content", "sealed-score"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("THRESHOLD_NOT_SET");
    }

    @Test
    void thresholdFromVisitor_shouldReturn403() {
        webTestClient.put()
                .uri("/api/counselor/threshold")
                .header(ACTOR, "anonymous-7f3a")
                .bodyValue(new ThresholdRequest("sealed-threshold-70"))
                .exchange()
                .expectStatus().isForbidden()
                .expectBody()
                .jsonPath("$.code").isEqualTo("UNAUTHORIZED");
    }

    @Test
    void secondThreshold_shouldReturn409() {
        setThreshold();

        webTestClient.put()
                .uri("/api/counselor/threshold")
                .header(ACTOR, COUNSELOR)
                .bodyValue(new ThresholdRequest("sealed-threshold-50"))
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("THRESHOLD_ALREADY_SET");
    }

    @Test
    void missingActorHeader_shouldReturn400() {
        webTestClient.get()
                .uri("/api/counselor/records/1/alert")
                .exchange()
                .expectStatus().isBadRequest();
    }

    @Test
    void unknownRecord_shouldReturn404() {
        webTestClient.get()
                .uri("/api/records/99")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo("NOT_FOUND");
    }

    @Test
    void alertReadByVisitor_shouldReturn403() {
        setThreshold();
        long id = submit("orc-1");

        webTestClient.get().uri("/api/counselor/records/{id}/alert", id)
                .header(ACTOR, "anonymous-7f3a")
                .exchange()
                .expectStatus().isForbidden();
    }

    @Test
    void revealOfLowRiskRecord_shouldReturn409() {
        setThreshold();
        long id = submit("orc-1");
        answerRisk("orc-1", false, oracle).expectStatus().isNoContent();

        webTestClient.post().uri("/api/counselor/records/{id}/reveal", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectStatus().isEqualTo(409)
                .expectBody()
                .jsonPath("$.code").isEqualTo("NOT_HIGH_RISK");
    }

    @Test
    void forgedCallback_shouldReturn422AndLeaveRequestPending() {
        setThreshold();
        long id = submit("orc-1");

        answerRisk("orc-1", true, OracleSigner.impostor())
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_PROOF");

        answerRisk("orc-1", false, oracle).expectStatus().isNoContent();

        webTestClient.get().uri("/api/counselor/records/{id}", id)
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectBody()
                .jsonPath("$.riskState").isEqualTo("LOW_RISK");
    }

    @Test
    void replayedCallback_shouldReturn404() {
        setThreshold();
        submit("orc-1");
        answerRisk("orc-1", true, oracle).expectStatus().isNoContent();

        answerRisk("orc-1", true, oracle)
                .expectStatus().isNotFound()
                .expectBody()
                .jsonPath("$.code").isEqualTo("UNKNOWN_REQUEST");
    }

    @Test
    void unreachableOracle_shouldReturn502() {
        setThreshold();
        when(oracleClient.request(eq(RequestKind.RISK_EVALUATION), anyList()))
                .thenReturn(Mono.error(WebClientResponseException.create(
                        503, "Service Unavailable", HttpHeaders.EMPTY, new byte[0], null)));

        webTestClient.post()
                .uri("/api/records")
                .bodyValue(new SubmissionRequest("sealed-content", "sealed-score"))
                .exchange()
                .expectStatus().isEqualTo(502)
                .expectBody()
                .jsonPath("$.code").isEqualTo("ORACLE_UNAVAILABLE");

        webTestClient.get().uri("/api/counselor/statistics")
                .header(ACTOR, COUNSELOR)
                .exchange()
                .expectBody()
                .jsonPath("$.total").isEqualTo(0);
    }

    // ── GET /api/oracle/status ────────────────────────────────────────────────

    @Test
    void oracleStatus_shouldReflectHealthCheck() {
        when(oracleClient.isAvailable()).thenReturn(Mono.just(true));

        webTestClient.get()
                .uri("/api/oracle/status")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.available").isEqualTo(true);
    }
}
