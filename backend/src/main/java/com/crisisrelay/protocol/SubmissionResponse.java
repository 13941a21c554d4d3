package com.crisisrelay.protocol;

public record SubmissionResponse(long recordId) {}
