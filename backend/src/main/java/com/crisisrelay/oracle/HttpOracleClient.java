package com.crisisrelay.oracle;

import java.time.Duration;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;

import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.ledger.RequestKind;
import com.crisisrelay.sealed.SealedValue;

import reactor.core.publisher.Mono;

/**
 * {@link OracleClient} speaking JSON over HTTP to the off-chain oracle gateway.
 *
 * <p>No retries here: a failed issuance surfaces to the caller, and a request that was issued
 * but never answered simply leaves its record where it is.
 */
public class HttpOracleClient implements OracleClient {

    private static final Logger log = LoggerFactory.getLogger(HttpOracleClient.class);

    private final WebClient webClient;
    private final String callbackBaseUrl;
    private final Duration timeout;

    public HttpOracleClient(WebClient oracleWebClient, String callbackBaseUrl, Duration timeout) {
        this.webClient = oracleWebClient;
        this.callbackBaseUrl = callbackBaseUrl.endsWith("/")
                ? callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1)
                : callbackBaseUrl;
        this.timeout = timeout;
    }

    @Override
    public Mono<RequestId> request(RequestKind kind, List<SealedValue> sealedValues) {
        OracleRequest body = new OracleRequest(
                kind,
                sealedValues.stream().map(SealedValue::handle).toList(),
                callbackBaseUrl + "/" + kind.wireName());

        return webClient.post()
                .uri("/requests")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(OracleTicket.class)
                .timeout(timeout)
                .switchIfEmpty(Mono.error(() -> new IllegalStateException("Oracle returned no ticket for " + kind.wireName())))
                .map(ticket -> new RequestId(ticket.requestId()))
                .doOnNext(requestId -> log.debug("Issued {} request {}", kind.wireName(), requestId))
                .doOnError(ex -> log.warn("Oracle {} request failed: {}", kind.wireName(), ex.getMessage()));
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return webClient.get()
                .uri("/health")
                .retrieve()
                .toBodilessEntity()
                .map(response -> response.getStatusCode().is2xxSuccessful())
                .timeout(timeout)
                .onErrorResume(ex -> {
                    log.warn("Oracle health check failed: {}", ex.getMessage());
                    return Mono.just(false);
                });
    }
}
