package com.wileyfuller.weatherenergy.fetch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Remote responses memoized in SQLite, keyed by a fingerprint of the source and the request
 * (identifier, date range, page). Entries older than the TTL are never served and are purged on open.
 */
public class FetchCache implements Closeable {

    private static final Logger LOG = LoggerFactory.getLogger(FetchCache.class);

    private final Connection connection;
    private final Duration ttl;
    private final Clock clock;

    FetchCache(Connection connection, Duration ttl, Clock clock) throws SQLException {
        this.connection = connection;
        this.ttl = ttl;
        this.clock = clock;
        createCacheTable();
    }

    public static FetchCache open(Path dbFile, Duration ttl, Clock clock) throws IOException, SQLException {
        Path parent = dbFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Connection connection = DriverManager.getConnection("jdbc:sqlite:" + dbFile.toAbsolutePath());
        FetchCache cache = new FetchCache(connection, ttl, clock);
        int purged = cache.purgeExpired();
        if (purged > 0) {
            LOG.info("Purged {} expired fetch cache entries from {}", purged, dbFile);
        }
        return cache;
    }

    /**
     * SHA-256 of the parts joined with '|'.
     */
    public static String fingerprint(String... parts) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(String.join("|", parts).getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private void createCacheTable() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS fetch_cache " +
                    "(fingerprint string, source string, payload string, fetched_at integer," +
                    " UNIQUE(fingerprint) ON CONFLICT REPLACE)");
        }
    }

    public synchronized Optional<String> get(String fingerprint) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "SELECT payload, fetched_at FROM fetch_cache WHERE fingerprint = ?")) {
            stmt.setString(1, fingerprint);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Instant fetchedAt = Instant.ofEpochMilli(rs.getLong("fetched_at"));
                if (isExpired(fetchedAt)) {
                    return Optional.empty();
                }
                return Optional.of(rs.getString("payload"));
            }
        }
    }

    public synchronized void put(String fingerprint, String source, String payload) throws SQLException {
        try (PreparedStatement stmt = connection.prepareStatement(
                "INSERT INTO fetch_cache (fingerprint, source, payload, fetched_at) VALUES (?, ?, ?, ?)")) {
            stmt.setString(1, fingerprint);
            stmt.setString(2, source);
            stmt.setString(3, payload);
            stmt.setLong(4, clock.millis());
            stmt.execute();
        }
    }

    public synchronized int purgeExpired() throws SQLException {
        Instant cutoff = clock.instant().minus(ttl);
        try (PreparedStatement stmt = connection.prepareStatement(
                "DELETE FROM fetch_cache WHERE fetched_at < ?")) {
            stmt.setLong(1, cutoff.toEpochMilli());
            return stmt.executeUpdate();
        }
    }

    public synchronized int size() throws SQLException {
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM fetch_cache")) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private boolean isExpired(Instant fetchedAt) {
        return clock.instant().isAfter(fetchedAt.plus(ttl));
    }

    @Override
    public synchronized void close() throws IOException {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new IOException("Could not close fetch cache", e);
        }
    }
}
