package com.phillippitts.uptimemonitor.service.probe.port;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.ProbeException;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.util.TimeUtils;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Set;

/**
 * Probe for {@code port} monitors: succeeds iff a TCP connection to host:port is established within the timeout.
 */
public class PortProbeRunner implements ProbeRunner {

    @Override
    public Set<MonitorType> supportedTypes() {
        return Set.of(MonitorType.PORT);
    }

    @Override
    public CheckOutcome run(Monitor monitor, Duration timeout) {
        MonitorConfig cfg = monitor.config();
        String host = cfg.hostname();
        Integer port = cfg.port();
        if (host == null) {
            throw new ProbeException("Hostname is not configured", MonitorType.PORT.code());
        }
        if (port == null || port < 1 || port > 65535) {
            throw new ProbeException("Invalid port: " + port, MonitorType.PORT.code());
        }

        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());
        long start = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeoutMs);
            return CheckOutcome.up(monitor.id(), "Connected to " + host + ":" + port, TimeUtils.elapsedMillis(start));
        } catch (SocketTimeoutException e) {
            throw new ProbeException("Connection to " + host + ":" + port + " timed out after "
                    + timeoutMs + "ms", MonitorType.PORT.code(), e);
        } catch (UnknownHostException e) {
            throw new ProbeException("Unknown host: " + host, MonitorType.PORT.code(), e);
        } catch (IOException e) {
            throw new ProbeException("Connection to " + host + ":" + port + " failed: " + e.getMessage(),
                    MonitorType.PORT.code(), e);
        } catch (IllegalArgumentException e) {
            throw new ProbeException("Invalid address " + host + ":" + port, MonitorType.PORT.code(), e);
        }
    }
}
