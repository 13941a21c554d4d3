package com.crisisrelay.record;

/**
 * Reveal sub-state of a record's alert. Only ever moves forward, except that
 * {@code REVEAL_REQUESTED} is rolled back when the reveal request could not be registered.
 */
public enum RevealState {
    NOT_REVEALED,
    REVEAL_REQUESTED,
    REVEALED
}
