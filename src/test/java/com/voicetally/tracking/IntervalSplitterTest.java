package com.voicetally.tracking;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class IntervalSplitterTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void splitsAtLocalMidnight() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var start = ZonedDateTime.of(2026, 1, 1, 23, 50, 0, 0, NEW_YORK).toInstant();
        var end = ZonedDateTime.of(2026, 1, 2, 0, 10, 0, 0, NEW_YORK).toInstant();

        var slices = splitter.split(start, end);

        assertEquals(List.of(
                new DaySlice(LocalDate.of(2026, 1, 1), 600),
                new DaySlice(LocalDate.of(2026, 1, 2), 600)), slices);
        assertEquals("2026-01-01", slices.get(0).dayKey());
    }

    @Test
    void sameDayIntervalIsOneSlice() {
        var splitter = new IntervalSplitter(ZoneOffset.UTC);
        var slices = splitter.split(Instant.parse("2026-02-01T10:00:00Z"), Instant.parse("2026-02-01T10:01:30Z"));
        assertEquals(List.of(new DaySlice(LocalDate.of(2026, 2, 1), 90)), slices);
    }

    @Test
    void nonPositiveSpanIsEmpty() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var t = Instant.parse("2026-02-01T10:00:00Z");
        assertTrue(splitter.split(t, t).isEmpty());
        assertTrue(splitter.split(t, t.minusSeconds(30)).isEmpty());
    }

    @Test
    void multiDaySpanCoversEveryDayOnceInOrder() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var start = ZonedDateTime.of(2026, 3, 5, 18, 0, 0, 0, NEW_YORK).toInstant();
        var end = ZonedDateTime.of(2026, 3, 10, 6, 0, 0, 0, NEW_YORK).toInstant();

        var slices = splitter.split(start, end);

        assertEquals(6, slices.size());
        for (int i = 1; i < slices.size(); i++) {
            assertEquals(slices.get(i - 1).day().plusDays(1), slices.get(i).day());
        }
        assertEquals(Duration.between(start, end).getSeconds(), total(slices));
    }

    @Test
    void sumMatchesWholeSecondsAcrossZones() {
        var base = Instant.parse("2026-03-07T13:17:41.250Z");
        for (var zoneId : List.of("UTC", "America/New_York", "Europe/Berlin", "Australia/Lord_Howe", "Asia/Kolkata")) {
            var splitter = new IntervalSplitter(ZoneId.of(zoneId));
            for (long span : new long[]{1, 59, 3599, 86_399, 86_401, 200_000, 1_000_000}) {
                var end = base.plusSeconds(span).plusMillis(600);
                var slices = splitter.split(base, end);
                assertEquals(Duration.between(base, end).getSeconds(), total(slices), zoneId + " span " + span);
                assertTrue(slices.stream().allMatch(s -> s.seconds() > 0));
            }
        }
    }

    @Test
    void subSecondBoundsStillSumToTruncatedLength() {
        var splitter = new IntervalSplitter(ZoneOffset.UTC);
        var start = Instant.parse("2026-01-01T23:59:59.500Z");
        var end = Instant.parse("2026-01-02T00:00:10.700Z");

        var slices = splitter.split(start, end);

        assertEquals(11, total(slices));
        assertEquals(LocalDate.of(2026, 1, 2), slices.get(slices.size() - 1).day());
    }

    @Test
    void springForwardDayIsShort() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var start = ZonedDateTime.of(2026, 3, 7, 23, 0, 0, 0, NEW_YORK).toInstant();
        var end = ZonedDateTime.of(2026, 3, 8, 4, 0, 0, 0, NEW_YORK).toInstant();

        var slices = splitter.split(start, end);

        // 00:00 -> 04:00 wall clock skips 02:00-03:00
        assertEquals(List.of(
                new DaySlice(LocalDate.of(2026, 3, 7), 3600),
                new DaySlice(LocalDate.of(2026, 3, 8), 10800)), slices);

        var days = new LocalDays(NEW_YORK);
        var wholeDay = splitter.split(days.midnightOf(LocalDate.of(2026, 3, 8)), days.midnightOf(LocalDate.of(2026, 3, 9)));
        assertEquals(List.of(new DaySlice(LocalDate.of(2026, 3, 8), 23 * 3600)), wholeDay);
    }

    @Test
    void fallBackDayIsLong() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var start = ZonedDateTime.of(2026, 10, 31, 23, 0, 0, 0, NEW_YORK).toInstant();
        var end = ZonedDateTime.of(2026, 11, 1, 3, 0, 0, 0, NEW_YORK).toInstant();

        var slices = splitter.split(start, end);

        // 01:00-02:00 happens twice
        assertEquals(List.of(
                new DaySlice(LocalDate.of(2026, 10, 31), 3600),
                new DaySlice(LocalDate.of(2026, 11, 1), 14400)), slices);

        var days = new LocalDays(NEW_YORK);
        var wholeDay = splitter.split(days.midnightOf(LocalDate.of(2026, 11, 1)), days.midnightOf(LocalDate.of(2026, 11, 2)));
        assertEquals(List.of(new DaySlice(LocalDate.of(2026, 11, 1), 25 * 3600)), wholeDay);
    }

    @Test
    void midnightInsideDstGapUsesFirstValidTime() {
        // Sao Paulo jumped from 00:00 to 01:00 on 2018-11-04
        var zone = ZoneId.of("America/Sao_Paulo");
        var splitter = new IntervalSplitter(zone);
        var start = Instant.parse("2018-11-04T02:30:00Z");
        var end = Instant.parse("2018-11-04T03:30:00Z");

        var slices = splitter.split(start, end);

        assertEquals(List.of(
                new DaySlice(LocalDate.of(2018, 11, 3), 1800),
                new DaySlice(LocalDate.of(2018, 11, 4), 1800)), slices);
    }

    @Test
    void acceptsZonedBounds() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var start = ZonedDateTime.of(2026, 1, 1, 23, 50, 0, 0, NEW_YORK);
        var end = start.plusMinutes(20).withZoneSameInstant(ZoneId.of("Asia/Tokyo"));

        assertEquals(1200, total(splitter.split(start, end)));
    }

    @Test
    void rejectsBoundsWithoutOffset() {
        var splitter = new IntervalSplitter(NEW_YORK);
        var local = LocalDateTime.of(2026, 1, 1, 12, 0);
        var instant = Instant.parse("2026-01-01T12:00:00Z");

        assertThrows(InvalidIntervalException.class, () -> splitter.split(local, instant));
        assertThrows(InvalidIntervalException.class, () -> splitter.split(instant, local));
        assertThrows(InvalidIntervalException.class, () -> splitter.split((Instant) null, instant));
    }

    private static long total(List<DaySlice> slices) {
        return slices.stream().mapToLong(DaySlice::seconds).sum();
    }
}
