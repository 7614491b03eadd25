package com.voicetally.shared.model;

public record ReportRow(
    String userId,
    String displayName,
    long seconds
) {}
