package com.crisisrelay.oracle;

import com.crisisrelay.ledger.RequestId;
import com.crisisrelay.ledger.RequestKind;
import com.crisisrelay.sealed.SealedValue;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process stand-in for the oracle transport. Hands out {@code req-1, req-2, ...}
 * and remembers what was asked, so tests can answer through the callback entry points.
 */
public class StubOracleClient implements OracleClient {

    public record Issued(RequestKind kind, List<SealedValue> sealedValues, RequestId requestId) {}

    private final AtomicLong counter = new AtomicLong();
    private final List<Issued> issued = new CopyOnWriteArrayList<>();

    private volatile RequestId recycledId;
    private volatile RuntimeException failure;
    private volatile boolean available = true;

    @Override
    public Mono<RequestId> request(RequestKind kind, List<SealedValue> sealedValues) {
        return Mono.fromCallable(() -> {
            if (failure != null) {
                throw failure;
            }
            RequestId requestId = recycledId != null ? recycledId : new RequestId("req-" + counter.incrementAndGet());
            issued.add(new Issued(kind, List.copyOf(sealedValues), requestId));
            return requestId;
        });
    }

    @Override
    public Mono<Boolean> isAvailable() {
        return Mono.just(available);
    }

    public List<Issued> issued() {
        return List.copyOf(issued);
    }

    public Issued lastIssued() {
        if (issued.isEmpty()) {
            throw new IllegalStateException("No request issued yet");
        }
        return issued.get(issued.size() - 1);
    }

    /** Misbehave: answer every following request with the same id. */
    public void recycle(RequestId requestId) {
        this.recycledId = requestId;
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}
