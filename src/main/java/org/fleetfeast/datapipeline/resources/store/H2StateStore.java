package org.fleetfeast.datapipeline.resources.store;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import org.fleetfeast.datapipeline.api.resources.store.IStateStore;
import org.fleetfeast.datapipeline.api.resources.store.StateStoreException;
import org.fleetfeast.datapipeline.resources.AbstractResource;

import com.typesafe.config.Config;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * H2-backed state store using HikariCP for connection pooling. Every key is a row in
 * {@code STATE_SLOTS}; writes replace the row with {@code MERGE}.
 * <p>
 * Options:
 * <ul>
 *   <li>{@code jdbcUrl} - default {@code jdbc:h2:mem:fleetfeast;DB_CLOSE_DELAY=-1}</li>
 *   <li>{@code username}, {@code password} - default {@code sa} / empty</li>
 *   <li>{@code maxPoolSize} - default 4</li>
 *   <li>{@code connectionTimeoutMs} - default 500; writes run on the tick thread, so keep it
 *       below the tick period</li>
 *   <li>{@code validationTimeoutSeconds} - timeout of the reachability probe, default 1</li>
 * </ul>
 */
public class H2StateStore extends AbstractResource implements IStateStore, AutoCloseable {

    private static final String DEFAULT_URL = "jdbc:h2:mem:fleetfeast;DB_CLOSE_DELAY=-1";
    static final long DEFAULT_CONNECTION_TIMEOUT_MS = 500L;
    // smallest value HikariCP accepts
    private static final long MIN_VALIDATION_TIMEOUT_MS = 250L;

    private final HikariDataSource dataSource;
    private final int validationTimeoutSeconds;
    private final AtomicLong writeCount = new AtomicLong();
    private final AtomicLong writeFailures = new AtomicLong();

    public H2StateStore(String name, Config options) {
        super(name, options);

        final String jdbcUrl = options.hasPath("jdbcUrl") ? options.getString("jdbcUrl") : DEFAULT_URL;
        final String username = options.hasPath("username") ? options.getString("username") : "sa";
        final String password = options.hasPath("password") ? options.getString("password") : "";
        this.validationTimeoutSeconds = options.hasPath("validationTimeoutSeconds")
                ? options.getInt("validationTimeoutSeconds") : 1;

        HikariConfig hikariConfig = new HikariConfig();
        hikariConfig.setJdbcUrl(jdbcUrl);
        hikariConfig.setDriverClassName("org.h2.Driver");
        hikariConfig.setMaximumPoolSize(options.hasPath("maxPoolSize") ? options.getInt("maxPoolSize") : 4);
        hikariConfig.setMinimumIdle(1);
        hikariConfig.setConnectionTimeout(options.hasPath("connectionTimeoutMs")
                ? options.getLong("connectionTimeoutMs") : DEFAULT_CONNECTION_TIMEOUT_MS);
        hikariConfig.setValidationTimeout(MIN_VALIDATION_TIMEOUT_MS);
        hikariConfig.setUsername(username);
        hikariConfig.setPassword(password);
        hikariConfig.setPoolName(name);

        try {
            this.dataSource = new HikariDataSource(hikariConfig);
        } catch (Exception e) {
            Throwable cause = e;
            while (cause.getCause() != null && cause.getCause() != cause) {
                cause = cause.getCause();
            }
            String errorMsg = String.format("Failed to initialize H2 state store '%s': %s. Database: %s. Error: %s",
                    name, cause.getClass().getSimpleName(), jdbcUrl, cause.getMessage());
            log.error(errorMsg);
            throw new RuntimeException(errorMsg, e);
        }

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("CREATE TABLE IF NOT EXISTS STATE_SLOTS ("
                    + "SLOT_KEY VARCHAR(255) PRIMARY KEY, "
                    + "SLOT_VALUE CLOB NOT NULL, "
                    + "UPDATED_AT TIMESTAMP NOT NULL)");
        } catch (SQLException e) {
            dataSource.close();
            throw new RuntimeException("Failed to create schema for H2 state store '" + name + "'", e);
        }
        log.debug("H2 state store '{}' ready at {}", name, jdbcUrl);
    }

    @Override
    public void put(String key, String value) throws StateStoreException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(
                     "MERGE INTO STATE_SLOTS (SLOT_KEY, SLOT_VALUE, UPDATED_AT) KEY (SLOT_KEY) VALUES (?, ?, ?)")) {
            stmt.setString(1, key);
            stmt.setString(2, value);
            stmt.setTimestamp(3, new Timestamp(System.currentTimeMillis()));
            stmt.executeUpdate();
            writeCount.incrementAndGet();
        } catch (SQLException e) {
            writeFailures.incrementAndGet();
            throw new StateStoreException("Failed to write slot '" + key + "' to " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> get(String key) throws StateStoreException {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement("SELECT SLOT_VALUE FROM STATE_SLOTS WHERE SLOT_KEY = ?")) {
            stmt.setString(1, key);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StateStoreException("Failed to read slot '" + key + "' from " + name + ": " + e.getMessage(), e);
        }
    }

    long getConnectionTimeoutMs() {
        return dataSource.getConnectionTimeout();
    }

    @Override
    public boolean isReachable() {
        if (dataSource.isClosed()) {
            return false;
        }
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(validationTimeoutSeconds);
        } catch (SQLException e) {
            log.debug("H2 state store '{}' is not reachable: {}", name, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isHealthy() {
        return isReachable();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("writes_total", writeCount.get());
        metrics.put("write_failures_total", writeFailures.get());
        if (!dataSource.isClosed() && dataSource.getHikariPoolMXBean() != null) {
            metrics.put("pool_active_connections", dataSource.getHikariPoolMXBean().getActiveConnections());
            metrics.put("pool_idle_connections", dataSource.getHikariPoolMXBean().getIdleConnections());
        }
    }

    /**
     * Issues {@code SHUTDOWN} so H2 releases the database, then closes the pool.
     */
    @Override
    public void close() {
        if (dataSource.isClosed()) {
            return;
        }
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute("SHUTDOWN");
        } catch (SQLException e) {
            // 90121: database already closed
            if (e.getErrorCode() != 90121) {
                log.warn("H2 state store '{}' shutdown command failed: {}", name, e.getMessage());
            }
        }
        dataSource.close();
        log.debug("H2 state store '{}' closed", name);
    }
}
