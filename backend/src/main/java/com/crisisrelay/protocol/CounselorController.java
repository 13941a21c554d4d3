package com.crisisrelay.protocol;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.crisisrelay.record.RiskStatistics;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Mono;

/**
 * Privileged endpoints. The caller is taken from {@code X-Actor-Id}, which the gateway
 * sets after authenticating the session; every operation here rejects anyone but the counselor.
 */
@RestController
@RequestMapping("/api/counselor")
public class CounselorController {

    static final String ACTOR_HEADER = "X-Actor-Id";

    private final RiskAssessmentProtocol protocol;

    public CounselorController(RiskAssessmentProtocol protocol) {
        this.protocol = protocol;
    }

    @PutMapping("/threshold")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> setThreshold(@RequestHeader(ACTOR_HEADER) String actor,
                                   @RequestBody ThresholdRequest request) {
        return protocol.setThreshold(new Actor(actor), new SealedValue(request.sealedThreshold()));
    }

    /** Newest first. Pass the previous page's {@code nextBefore} as {@code before} to continue. */
    @GetMapping("/records")
    public Mono<RecordPage> listRecords(@RequestHeader(ACTOR_HEADER) String actor,
                                        @RequestParam(required = false) Long before,
                                        @RequestParam(defaultValue = "20") int limit) {
        return protocol.listRecords(new Actor(actor), before == null ? Long.MAX_VALUE : before, limit);
    }

    @GetMapping("/records/{id}")
    public Mono<RecordStatus> status(@RequestHeader(ACTOR_HEADER) String actor,
                                     @PathVariable long id) {
        return protocol.status(new Actor(actor), id);
    }

    @PostMapping("/records/{id}/reveal")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<RevealResponse> requestReveal(@RequestHeader(ACTOR_HEADER) String actor,
                                              @PathVariable long id) {
        return protocol.requestReveal(new Actor(actor), id)
                .map(requestId -> new RevealResponse(id, requestId.value()));
    }

    @GetMapping("/records/{id}/alert")
    public Mono<AlertView> readAlert(@RequestHeader(ACTOR_HEADER) String actor,
                                     @PathVariable long id) {
        return protocol.readAlert(new Actor(actor), id);
    }

    @PostMapping("/records/{id}/resolve")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> resolve(@RequestHeader(ACTOR_HEADER) String actor,
                              @PathVariable long id) {
        return protocol.resolve(new Actor(actor), id);
    }

    @GetMapping("/statistics")
    public Mono<RiskStatistics> statistics(@RequestHeader(ACTOR_HEADER) String actor) {
        return protocol.statistics(new Actor(actor));
    }
}
