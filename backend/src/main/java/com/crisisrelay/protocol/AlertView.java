package com.crisisrelay.protocol;

/** What the counselor sees of an alert. content is empty until revealed. */
public record AlertView(String content, boolean revealed) {}
