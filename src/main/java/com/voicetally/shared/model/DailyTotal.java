package com.voicetally.shared.model;

import java.time.LocalDate;

public record DailyTotal(
    LocalDate day,
    String userId,
    long seconds
) {}
