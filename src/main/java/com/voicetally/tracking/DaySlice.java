package com.voicetally.tracking;

import java.time.LocalDate;

/**
 * Part of an interval that falls on one local calendar day.
 */
public record DaySlice(LocalDate day, long seconds) {

    public String dayKey() {
        return day.toString();
    }
}
