package com.voicetally.shared.model;

import java.time.Instant;

public record OpenSession(
    String userId,
    Instant startedAt
) {}
