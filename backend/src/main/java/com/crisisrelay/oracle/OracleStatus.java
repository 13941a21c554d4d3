package com.crisisrelay.oracle;

public record OracleStatus(boolean available) {}
