package com.voicetally.shared.model;

import java.time.Instant;

public record PresenceEvent(
    String userId,
    boolean joined,
    Instant at
) {}
