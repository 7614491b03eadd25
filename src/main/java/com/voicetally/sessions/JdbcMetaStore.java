package com.voicetally.sessions;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.Optional;

public class JdbcMetaStore implements MetaStore {

    private final DataSource dataSource;

    public JdbcMetaStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void initSchema() {
        try (var conn = dataSource.getConnection();
             var st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS meta (
                      key TEXT PRIMARY KEY,
                      value TEXT NOT NULL
                    )""");
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to initialize meta schema", e);
        }
    }

    @Override
    public Optional<String> get(String key) {
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement("SELECT value FROM meta WHERE key = ?")) {
            ps.setString(1, key);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to read meta value: " + key, e);
        }
    }

    @Override
    public void set(String key, String value) {
        var sql = "INSERT INTO meta (key, value) VALUES (?, ?) ON CONFLICT (key) DO UPDATE SET value = excluded.value";
        try (var conn = dataSource.getConnection();
             var ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreUnavailableException("Failed to write meta value: " + key, e);
        }
    }
}
