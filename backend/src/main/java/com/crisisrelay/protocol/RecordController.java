package com.crisisrelay.protocol;

import java.time.Clock;
import java.time.Instant;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Mono;

/** Submitter-facing endpoints. Open to any caller. */
@RestController
@RequestMapping("/api/records")
public class RecordController {

    private final RiskAssessmentProtocol protocol;
    private final Clock clock;

    public RecordController(RiskAssessmentProtocol protocol, Clock clock) {
        this.protocol = protocol;
        this.clock = clock;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<SubmissionResponse> submit(@RequestBody SubmissionRequest request) {
        SealedValue content = new SealedValue(request.sealedContent());
        SealedValue score = new SealedValue(request.sealedScore());
        return protocol.submit(content, score, Instant.now(clock))
                .map(SubmissionResponse::new);
    }

    @GetMapping("/{id}")
    public Mono<SubmissionStatus> status(@PathVariable long id) {
        return protocol.submissionStatus(id);
    }
}
