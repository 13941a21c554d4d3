package com.crisisrelay.record;

/** Counselor follow-up on a record. Only high-risk records are ever resolved. */
public enum CaseState {
    OPEN,
    RESOLVED
}
