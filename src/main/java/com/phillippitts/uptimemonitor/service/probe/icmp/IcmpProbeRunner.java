package com.phillippitts.uptimemonitor.service.probe.icmp;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.ProbeException;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;

/**
 * Probe for {@code icmp} monitors.
 *
 * <p>Runs the system {@code ping} command with the configured packet count and succeeds iff the
 * measured packet loss does not exceed {@code maxPacketLoss}. Raw ICMP sockets are not available to
 * an unprivileged JVM, so the OS tool is used instead.
 */
public class IcmpProbeRunner implements ProbeRunner {

    private static final Logger LOG = LogManager.getLogger(IcmpProbeRunner.class);

    // Hostnames and IP literals only; anything else could smuggle options into the command line
    private static final Pattern SAFE_HOST = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9.:\\-]*$");
    private static final long EXIT_GRACE_MILLIS = 1000;

    private final ProcessFactory processFactory;
    private final String pingCommand;
    private final boolean macOs;

    public IcmpProbeRunner(ProcessFactory processFactory, String pingCommand) {
        this(processFactory, pingCommand, System.getProperty("os.name", ""));
    }

    IcmpProbeRunner(ProcessFactory processFactory, String pingCommand, String osName) {
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory");
        this.pingCommand = Objects.requireNonNull(pingCommand, "pingCommand");
        this.macOs = osName.toLowerCase(Locale.ROOT).contains("mac");
    }

    @Override
    public Set<MonitorType> supportedTypes() {
        return Set.of(MonitorType.ICMP);
    }

    @Override
    public CheckOutcome run(Monitor monitor, Duration timeout) {
        MonitorConfig cfg = monitor.config();
        String host = cfg.hostname();
        if (host == null) {
            throw new ProbeException("Hostname is not configured", MonitorType.ICMP.code());
        }
        if (!SAFE_HOST.matcher(host).matches()) {
            throw new ProbeException("Invalid hostname: " + host, MonitorType.ICMP.code());
        }

        List<String> command = buildCommand(host, cfg.packetCount(), timeout);
        String output = execute(command, timeout);
        PingStatistics stats = PingStatistics.parse(output)
                .orElseThrow(() -> new ProbeException("Ping failed: " + lastLine(output), MonitorType.ICMP.code()));

        Long pingMs = stats.averageRttMs().isPresent() ? Math.round(stats.averageRttMs().getAsDouble()) : null;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transmitted", stats.transmitted());
        details.put("received", stats.received());
        details.put("packetLoss", stats.packetLoss());

        String summary = stats.received() + "/" + stats.transmitted() + " replies, "
                + formatLoss(stats.packetLoss()) + "% packet loss";
        if (stats.packetLoss() > cfg.maxPacketLoss()) {
            return CheckOutcome.down(monitor.id(), summary + " (max " + cfg.maxPacketLoss() + "%)", pingMs, details);
        }
        return CheckOutcome.up(monitor.id(), summary, pingMs, details);
    }

    /**
     * Linux: {@code ping -c N -w deadline host}. macOS: {@code ping -c N -t deadline host}.
     */
    List<String> buildCommand(String host, int packetCount, Duration timeout) {
        long deadlineSeconds = Math.max(1, timeout.toSeconds());
        List<String> cmd = new ArrayList<>();
        cmd.add(pingCommand);
        cmd.add("-c");
        cmd.add(String.valueOf(packetCount));
        cmd.add(macOs ? "-t" : "-w");
        cmd.add(String.valueOf(deadlineSeconds));
        cmd.add(host);
        return cmd;
    }

    private String execute(List<String> command, Duration timeout) {
        Process process;
        try {
            process = processFactory.start(command);
        } catch (IOException e) {
            throw new ProbeException("Cannot start ping: " + e.getMessage(), MonitorType.ICMP.code(), e);
        }
        try {
            boolean finished = process.waitFor(timeout.toMillis() + EXIT_GRACE_MILLIS, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new ProbeException("Ping timed out after " + timeout.toSeconds() + "s", MonitorType.ICMP.code());
            }
            try (InputStream in = process.getInputStream()) {
                String output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                LOG.debug("ping exit={} output={}", process.exitValue(), output);
                return output;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ProbeException("Ping interrupted", MonitorType.ICMP.code(), e);
        } catch (IOException e) {
            throw new ProbeException("Cannot read ping output: " + e.getMessage(), MonitorType.ICMP.code(), e);
        }
    }

    private static String formatLoss(double loss) {
        return loss == Math.rint(loss) ? String.valueOf((long) loss) : String.valueOf(loss);
    }

    private static String lastLine(String output) {
        if (output == null || output.isBlank()) {
            return "no output";
        }
        String[] lines = output.strip().split("\\R");
        return lines[lines.length - 1].trim();
    }
}
