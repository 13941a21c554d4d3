package com.crisisrelay.ledger;

import java.util.concurrent.ConcurrentHashMap;

import com.crisisrelay.protocol.ProtocolException;

import reactor.core.publisher.Mono;

public class InMemoryRequestLedger implements RequestLedger {

    private record Entry(PendingRequest request, boolean resolved) {}

    private final ConcurrentHashMap<RequestId, Entry> entries = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> register(RequestId requestId, long recordId, RequestKind kind) {
        return Mono.fromRunnable(() -> {
            Entry previous = entries.putIfAbsent(requestId, new Entry(new PendingRequest(requestId, recordId, kind), false));
            if (previous != null) {
                throw ProtocolException.duplicateRequest(requestId);
            }
        });
    }

    @Override
    public Mono<Boolean> isRegistered(RequestId requestId) {
        return Mono.fromSupplier(() -> entries.containsKey(requestId));
    }

    @Override
    public Mono<PendingRequest> lookup(RequestId requestId) {
        return Mono.fromSupplier(() -> {
            Entry entry = entries.get(requestId);
            return entry == null || entry.resolved() ? null : entry.request();
        });
    }

    @Override
    public Mono<PendingRequest> resolve(RequestId requestId) {
        return Mono.fromCallable(() -> {
            Entry entry = entries.get(requestId);
            // replace(key, old, new) only succeeds for the caller that still sees the pending entry
            if (entry == null || entry.resolved()
                    || !entries.replace(requestId, entry, new Entry(entry.request(), true))) {
                throw ProtocolException.unknownRequest(requestId);
            }
            return entry.request();
        });
    }
}
