package com.crisisrelay.protocol;

public record ThresholdRequest(String sealedThreshold) {}
