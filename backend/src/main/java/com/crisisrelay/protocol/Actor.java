package com.crisisrelay.protocol;

/** Whoever invokes an operation, as identified by the gateway in front of the relay. */
public record Actor(String id) {

    public Actor {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Actor id must not be blank");
        }
    }
}
