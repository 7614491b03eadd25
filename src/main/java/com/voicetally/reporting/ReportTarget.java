package com.voicetally.reporting;

public record ReportTarget(
    MemberDirectory members,
    ReportChannel channel,
    String trackedChannelName
) {}
