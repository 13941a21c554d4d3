package com.crisisrelay.protocol;

/** Accepted reveal: the content arrives later, under this oracle request id. */
public record RevealResponse(long recordId, String requestId) {}
