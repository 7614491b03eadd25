package com.voicetally.sessions;

import com.voicetally.shared.model.DailyTotal;
import com.voicetally.shared.model.OpenSession;
import com.voicetally.tracking.DaySlice;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Durable open-session and daily-total state. Every write is committed before
 * the call returns; failures surface as {@link StoreUnavailableException}.
 */
public interface TrackerStore {

    /** Inserts or replaces the open session of a user. */
    void upsertOpenSession(String userId, Instant startedAt);

    Optional<OpenSession> getOpenSession(String userId);

    void deleteOpenSession(String userId);

    List<OpenSession> listOpenSessions();

    void clearOpenSessions();

    /** Adds {@code delta} seconds to the (day, user) row; a non-positive delta is ignored. */
    void addDailySeconds(LocalDate day, String userId, long delta);

    /** Ordered by seconds descending, then user id ascending. */
    List<DailyTotal> listDailyTotals(LocalDate day);

    /** Credits the slices and deletes the open session in one transaction. */
    void closeSession(String userId, List<DaySlice> slices);

    /** Credits the slices and moves the session start in one transaction. */
    void restartSession(String userId, List<DaySlice> slices, Instant startedAt);

    /** Clears every open session and opens one per user id, in one transaction. */
    void replaceOpenSessions(Collection<String> userIds, Instant startedAt);
}
