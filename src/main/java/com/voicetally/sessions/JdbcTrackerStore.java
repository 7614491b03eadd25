package com.voicetally.sessions;

import com.voicetally.shared.model.DailyTotal;
import com.voicetally.shared.model.OpenSession;
import com.voicetally.tracking.DaySlice;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * JDBC store for open sessions and daily totals. The SQL sticks to the upsert
 * dialect shared by SQLite and PostgreSQL.
 */
public class JdbcTrackerStore implements TrackerStore {

    private static final String UPSERT_SESSION = """
            INSERT INTO open_sessions (user_id, started_at_utc) VALUES (?, ?)
            ON CONFLICT (user_id) DO UPDATE SET started_at_utc = excluded.started_at_utc
            """;
    private static final String ADD_SECONDS = """
            INSERT INTO daily_totals (day_local, user_id, seconds) VALUES (?, ?, ?)
            ON CONFLICT (day_local, user_id) DO UPDATE SET seconds = daily_totals.seconds + excluded.seconds
            """;

    private final DataSource dataSource;

    public JdbcTrackerStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void initSchema() {
        try (var conn = dataSource.getConnection();
             var st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS open_sessions (
                      user_id TEXT PRIMARY KEY,
                      started_at_utc TEXT NOT NULL
                    )""");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS daily_totals (
                      day_local TEXT NOT NULL,
                      user_id TEXT NOT NULL,
                      seconds BIGINT NOT NULL DEFAULT 0,
                      PRIMARY KEY (day_local, user_id)
                    )""");
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to initialize tracker schema", e);
        }
    }

    @Override
    public void upsertOpenSession(String userId, Instant startedAt) {
        try (var conn = dataSource.getConnection()) {
            upsertSession(conn, userId, startedAt);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to save open session: " + userId, e);
        }
    }

    @Override
    public Optional<OpenSession> getOpenSession(String userId) {
        var sql = "SELECT user_id, started_at_utc FROM open_sessions WHERE user_id = ?";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, userId);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readSession(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to load open session: " + userId, e);
        }
    }

    @Override
    public void deleteOpenSession(String userId) {
        try (var conn = dataSource.getConnection()) {
            deleteSession(conn, userId);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to delete open session: " + userId, e);
        }
    }

    @Override
    public List<OpenSession> listOpenSessions() {
        var sql = "SELECT user_id, started_at_utc FROM open_sessions ORDER BY user_id";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql);
             var rs = ps.executeQuery()) {
            var sessions = new ArrayList<OpenSession>();
            while (rs.next()) {
                sessions.add(readSession(rs));
            }
            return sessions;
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list open sessions", e);
        }
    }

    @Override
    public void clearOpenSessions() {
        try (var conn = dataSource.getConnection()) {
            clearSessions(conn);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to clear open sessions", e);
        }
    }

    @Override
    public void addDailySeconds(LocalDate day, String userId, long delta) {
        if (delta <= 0) return;
        try (var conn = dataSource.getConnection()) {
            addSeconds(conn, day, userId, delta);
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to add daily seconds: " + day + "/" + userId, e);
        }
    }

    @Override
    public List<DailyTotal> listDailyTotals(LocalDate day) {
        var sql = """
                SELECT day_local, user_id, seconds FROM daily_totals
                WHERE day_local = ?
                ORDER BY seconds DESC, user_id ASC
                """;
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, day.toString());
            try (var rs = ps.executeQuery()) {
                var totals = new ArrayList<DailyTotal>();
                while (rs.next()) {
                    totals.add(new DailyTotal(
                            LocalDate.parse(rs.getString("day_local")),
                            rs.getString("user_id"),
                            rs.getLong("seconds")));
                }
                return totals;
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to list daily totals: " + day, e);
        }
    }

    @Override
    public void closeSession(String userId, List<DaySlice> slices) {
        inTransaction("Failed to close session: " + userId, conn -> {
            addSlices(conn, userId, slices);
            deleteSession(conn, userId);
        });
    }

    @Override
    public void restartSession(String userId, List<DaySlice> slices, Instant startedAt) {
        inTransaction("Failed to restart session: " + userId, conn -> {
            addSlices(conn, userId, slices);
            upsertSession(conn, userId, startedAt);
        });
    }

    @Override
    public void replaceOpenSessions(Collection<String> userIds, Instant startedAt) {
        inTransaction("Failed to replace open sessions", conn -> {
            clearSessions(conn);
            for (var userId : new LinkedHashSet<>(userIds)) {
                upsertSession(conn, userId, startedAt);
            }
        });
    }

    @FunctionalInterface
    private interface SqlWork {
        void run(Connection conn) throws SQLException;
    }

    private void inTransaction(String failure, SqlWork work) {
        try (var conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                work.run(conn);
                conn.commit();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException(failure, e);
        }
    }

    private void upsertSession(Connection conn, String userId, Instant startedAt) throws SQLException {
        try (var ps = conn.prepareStatement(UPSERT_SESSION)) {
            ps.setString(1, userId);
            ps.setString(2, startedAt.toString());
            ps.executeUpdate();
        }
    }

    private void deleteSession(Connection conn, String userId) throws SQLException {
        try (var ps = conn.prepareStatement("DELETE FROM open_sessions WHERE user_id = ?")) {
            ps.setString(1, userId);
            ps.executeUpdate();
        }
    }

    private void clearSessions(Connection conn) throws SQLException {
        try (var ps = conn.prepareStatement("DELETE FROM open_sessions")) {
            ps.executeUpdate();
        }
    }

    private void addSlices(Connection conn, String userId, List<DaySlice> slices) throws SQLException {
        for (var slice : slices) {
            if (slice.seconds() > 0) {
                addSeconds(conn, slice.day(), userId, slice.seconds());
            }
        }
    }

    private void addSeconds(Connection conn, LocalDate day, String userId, long delta) throws SQLException {
        try (var ps = conn.prepareStatement(ADD_SECONDS)) {
            ps.setString(1, day.toString());
            ps.setString(2, userId);
            ps.setLong(3, delta);
            ps.executeUpdate();
        }
    }

    private static OpenSession readSession(ResultSet rs) throws SQLException {
        return new OpenSession(rs.getString("user_id"), Instant.parse(rs.getString("started_at_utc")));
    }
}
