package com.phillippitts.uptimemonitor.service.probe.database;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.ProbeException;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.util.TimeUtils;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;

/**
 * Probe for {@code mysql} monitors: connects with the configured credentials and, when a query is
 * configured, executes it. Success iff both complete without error.
 */
public class MysqlProbeRunner implements ProbeRunner {

    private static final int DEFAULT_PORT = 3306;

    private final JdbcConnectionFactory connectionFactory;

    public MysqlProbeRunner(JdbcConnectionFactory connectionFactory) {
        this.connectionFactory = Objects.requireNonNull(connectionFactory, "connectionFactory");
    }

    @Override
    public Set<MonitorType> supportedTypes() {
        return Set.of(MonitorType.MYSQL);
    }

    @Override
    public CheckOutcome run(Monitor monitor, Duration timeout) {
        MonitorConfig cfg = monitor.config();
        if (cfg.hostname() == null) {
            throw new ProbeException("Hostname is not configured", MonitorType.MYSQL.code());
        }
        int port = cfg.port() == null ? DEFAULT_PORT : cfg.port();
        String url = jdbcUrl(cfg.hostname(), port, cfg.database());

        Properties props = new Properties();
        if (cfg.username() != null) {
            props.setProperty("user", cfg.username());
        }
        if (cfg.password() != null) {
            props.setProperty("password", cfg.password());
        }
        String timeoutMs = String.valueOf(timeout.toMillis());
        props.setProperty("connectTimeout", timeoutMs);
        props.setProperty("socketTimeout", timeoutMs);

        long start = System.nanoTime();
        try (Connection connection = connectionFactory.open(url, props)) {
            if (cfg.query() != null) {
                try (Statement statement = connection.createStatement()) {
                    statement.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
                    statement.execute(cfg.query());
                }
                return CheckOutcome.up(monitor.id(), "Query executed", TimeUtils.elapsedMillis(start));
            }
            return CheckOutcome.up(monitor.id(), "Connected", TimeUtils.elapsedMillis(start));
        } catch (SQLException e) {
            throw new ProbeException("MySQL check failed: " + e.getMessage(), MonitorType.MYSQL.code(), e);
        }
    }

    static String jdbcUrl(String host, int port, String database) {
        String db = database == null || database.isBlank() ? "" : database.trim();
        return "jdbc:mysql://" + host + ":" + port + "/" + db;
    }
}
