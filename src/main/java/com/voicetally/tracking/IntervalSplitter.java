package com.voicetally.tracking;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits an absolute time interval into local-day buckets for one timezone.
 *
 * <p>Chunk lengths are always absolute-instant differences; the zone only decides
 * where each local midnight falls, so DST gaps and overlaps never produce
 * negative or doubled seconds.
 */
public class IntervalSplitter {

    private final ZoneId zone;

    public IntervalSplitter(ZoneId zone) {
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Accepts any temporal value that resolves to an absolute instant
     * ({@code Instant}, {@code ZonedDateTime}, {@code OffsetDateTime}).
     *
     * @throws InvalidIntervalException if a bound is null or carries no offset
     */
    public List<DaySlice> split(TemporalAccessor start, TemporalAccessor end) {
        return split(toInstant(start, "start"), toInstant(end, "end"));
    }

    public List<DaySlice> split(Instant start, Instant end) {
        if (start == null || end == null) {
            throw new InvalidIntervalException("Interval bounds must not be null");
        }
        if (!end.isAfter(start)) {
            return List.of();
        }

        var slices = new ArrayList<DaySlice>();
        var cursor = start;
        long credited = 0;
        while (cursor.isBefore(end)) {
            LocalDate day = cursor.atZone(zone).toLocalDate();
            var nextMidnight = day.plusDays(1).atStartOfDay(zone).toInstant();
            var chunkEnd = nextMidnight.isBefore(end) ? nextMidnight : end;

            // truncate against the interval start so the chunks add up to floor(end - start)
            long elapsed = Duration.between(start, chunkEnd).getSeconds();
            long seconds = elapsed - credited;
            if (seconds > 0) {
                slices.add(new DaySlice(day, seconds));
                credited = elapsed;
            }
            cursor = chunkEnd;
        }
        return slices;
    }

    private static Instant toInstant(TemporalAccessor value, String name) {
        if (value == null) {
            throw new InvalidIntervalException("Interval " + name + " must not be null");
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (!value.isSupported(ChronoField.INSTANT_SECONDS)) {
            throw new InvalidIntervalException(
                    "Interval " + name + " has no zone offset: " + value);
        }
        return Instant.from(value);
    }
}
