package com.crisisrelay.protocol;

/**
 * The sealed envelope a submitter posts.
 * Both fields are handles produced client-side by the sealing provider;
 * the relay stores and forwards them without reading.
 */
public record SubmissionRequest(
        String sealedContent,   // the message itself
        String sealedScore      // its confidential risk score
) {}
