package com.crisisrelay.oracle;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.protocol.RiskAssessmentProtocol;

import reactor.core.publisher.Mono;

/**
 * Inbound side of the oracle transport.
 *
 * <p>These endpoints need no caller identity: every callback authenticates itself through its
 * proof, so whoever relays it (the oracle, a queue consumer, an operator) does not matter.
 */
@RestController
@RequestMapping("/api/oracle")
public class OracleCallbackController {

    private final RiskAssessmentProtocol protocol;

    public OracleCallbackController(RiskAssessmentProtocol protocol) {
        this.protocol = protocol;
    }

    @PostMapping("/callbacks/risk-evaluation")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> riskEvaluation(@RequestBody CallbackRequest callback) {
        return protocol.resolveRiskEvaluation(new RequestId(callback.requestId()), callback.cleartext(), callback.proof());
    }

    @PostMapping("/callbacks/content-reveal")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> contentReveal(@RequestBody CallbackRequest callback) {
        return protocol.resolveReveal(new RequestId(callback.requestId()), callback.cleartext(), callback.proof());
    }

    /** Mirrors the availability check the chat client runs before sending. */
    @GetMapping("/status")
    public Mono<OracleStatus> status() {
        return protocol.oracleAvailable().map(OracleStatus::new);
    }
}
