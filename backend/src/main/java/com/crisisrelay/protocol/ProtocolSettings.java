package com.crisisrelay.protocol;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import com.crisisrelay.sealed.SealedValue;

/**
 * Process-wide protocol configuration, built once at startup.
 *
 * <p>Holds the counselor's identity and the sealed risk threshold. The threshold starts
 * unset and can be assigned exactly once; the set-once rule is enforced here with a
 * compare-and-set rather than left to callers.
 */
public class ProtocolSettings {

    private final Actor counselor;
    private final AtomicReference<SealedValue> threshold = new AtomicReference<>();

    public ProtocolSettings(Actor counselor) {
        if (counselor == null) {
            throw new IllegalArgumentException("Counselor identity must be configured");
        }
        this.counselor = counselor;
    }

    public boolean isCounselor(Actor actor) {
        return counselor.equals(actor);
    }

    public Optional<SealedValue> threshold() {
        return Optional.ofNullable(threshold.get());
    }

    /** @return false if a threshold was already assigned; the existing one is kept */
    boolean assignThreshold(SealedValue value) {
        return threshold.compareAndSet(null, value);
    }
}
