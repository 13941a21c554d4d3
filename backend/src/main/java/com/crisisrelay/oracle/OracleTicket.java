package com.crisisrelay.oracle;

/** The oracle's answer to a request: just the correlation token. */
public record OracleTicket(String requestId) {}
