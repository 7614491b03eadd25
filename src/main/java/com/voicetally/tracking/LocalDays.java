package com.voicetally.tracking;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

public class LocalDays {

    private final ZoneId zone;

    public LocalDays(ZoneId zone) {
        this.zone = zone;
    }

    public ZoneId zone() {
        return zone;
    }

    public LocalDate localDay(Instant now) {
        return now.atZone(zone).toLocalDate();
    }

    public LocalDate previousLocalDay(Instant now) {
        return localDay(now).minusDays(1);
    }

    /**
     * First instant of the local date. When midnight falls inside a DST gap this
     * is the first wall-clock time that exists on that date.
     */
    public Instant midnightOf(LocalDate day) {
        return day.atStartOfDay(zone).toInstant();
    }

    public Instant nextMidnightAfter(Instant now) {
        return midnightOf(localDay(now).plusDays(1));
    }
}
