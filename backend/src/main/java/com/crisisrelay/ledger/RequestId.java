package com.crisisrelay.ledger;

/**
 * Opaque correlation token issued by the oracle for one evaluation or reveal request.
 * The relay only compares it; it never interprets its structure.
 */
public record RequestId(String value) implements Comparable<RequestId> {

    public RequestId {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Request id must not be blank");
        }
    }

    @Override
    public int compareTo(RequestId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
