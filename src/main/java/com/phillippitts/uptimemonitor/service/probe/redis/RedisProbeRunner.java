package com.phillippitts.uptimemonitor.service.probe.redis;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.ProbeException;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.util.LogSanitizer;
import com.phillippitts.uptimemonitor.util.TimeUtils;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Probe for {@code redis} monitors: connects with the configured credentials and runs the configured
 * command ({@code PING} when none). Success iff the connection and the command complete without error.
 *
 * <p>A numeric {@code database} selects the database index.
 */
public class RedisProbeRunner implements ProbeRunner {

    private static final int DEFAULT_PORT = 6379;
    private static final int MAX_REPLY_IN_MESSAGE = 100;

    private final RedisCommandClient client;

    public RedisProbeRunner(RedisCommandClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    @Override
    public Set<MonitorType> supportedTypes() {
        return Set.of(MonitorType.REDIS);
    }

    @Override
    public CheckOutcome run(Monitor monitor, Duration timeout) {
        MonitorConfig cfg = monitor.config();
        if (cfg.hostname() == null) {
            throw new ProbeException("Hostname is not configured", MonitorType.REDIS.code());
        }
        RedisCommandClient.RedisTarget target = new RedisCommandClient.RedisTarget(
                cfg.hostname(),
                cfg.port() == null ? DEFAULT_PORT : cfg.port(),
                cfg.username(),
                cfg.password(),
                databaseIndex(cfg.database()));
        List<String> command = cfg.query() == null ? List.of("PING") : tokenize(cfg.query());

        long start = System.nanoTime();
        String reply;
        try {
            reply = client.execute(target, command, timeout);
        } catch (IllegalArgumentException e) {
            throw new ProbeException("Unsupported Redis command: " + command.get(0), MonitorType.REDIS.code(), e);
        } catch (RuntimeException e) {
            throw new ProbeException("Redis check failed: " + e.getMessage(), MonitorType.REDIS.code(), e);
        }
        return CheckOutcome.up(monitor.id(),
                command.get(0).toUpperCase(Locale.ROOT) + " -> " + LogSanitizer.truncate(reply, MAX_REPLY_IN_MESSAGE),
                TimeUtils.elapsedMillis(start));
    }

    static int databaseIndex(String database) {
        if (database == null || database.isBlank()) {
            return 0;
        }
        try {
            return Math.max(0, Integer.parseInt(database.trim()));
        } catch (NumberFormatException e) {
            throw new ProbeException("Redis database must be a number: " + database, MonitorType.REDIS.code(), e);
        }
    }

    static List<String> tokenize(String query) {
        return Arrays.stream(query.trim().split("\\s+")).filter(s -> !s.isEmpty()).toList();
    }
}
