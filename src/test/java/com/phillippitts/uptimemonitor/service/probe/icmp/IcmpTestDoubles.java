package com.phillippitts.uptimemonitor.service.probe.icmp;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Fake ping processes for hermetic ICMP probe tests.
 */
final class IcmpTestDoubles {

    private IcmpTestDoubles() {}

    static final String LINUX_ALL_REPLIES = """
            PING example.test (93.184.216.34) 56(84) bytes of data.
            64 bytes from 93.184.216.34: icmp_seq=1 ttl=56 time=11.2 ms
            64 bytes from 93.184.216.34: icmp_seq=2 ttl=56 time=11.8 ms

            --- example.test ping statistics ---
            4 packets transmitted, 4 received, 0% packet loss, time 3004ms
            rtt min/avg/max/mdev = 11.200/11.600/12.100/0.300 ms
            """;

    static final String LINUX_HALF_LOST = """
            --- example.test ping statistics ---
            4 packets transmitted, 2 received, 50% packet loss, time 3004ms
            rtt min/avg/max/mdev = 20.100/20.400/20.700/0.300 ms
            """;

    static final String LINUX_UNREACHABLE = """
            --- 10.255.255.1 ping statistics ---
            4 packets transmitted, 0 received, 100% packet loss, time 3060ms
            """;

    static final String MAC_PARTIAL = """
            --- example.test ping statistics ---
            5 packets transmitted, 4 packets received, 20.0% packet loss
            round-trip min/avg/max/stddev = 14.031/15.250/16.842/1.020 ms
            """;

    static final String UNKNOWN_HOST = "ping: nosuch.test: Name or service not known\n";

    /**
     * Records every command and returns the configured process.
     */
    static final class StubProcessFactory implements ProcessFactory {
        private final Process process;
        final List<List<String>> commands = new ArrayList<>();

        StubProcessFactory(Process process) {
            this.process = process;
        }

        @Override
        public Process start(List<String> command) {
            commands.add(List.copyOf(command));
            return process;
        }
    }

    static final class FailingProcessFactory implements ProcessFactory {
        @Override
        public Process start(List<String> command) throws IOException {
            throw new IOException("ping: command not found");
        }
    }

    /**
     * Process that either exits at once with the given output or never exits.
     */
    static final class FakeProcess extends Process {
        private final byte[] out;
        private final int exitCode;
        private final boolean hangs;
        private volatile boolean destroyed;

        private FakeProcess(String output, int exitCode, boolean hangs) {
            this.out = output.getBytes(StandardCharsets.UTF_8);
            this.exitCode = exitCode;
            this.hangs = hangs;
        }

        static FakeProcess exiting(String output, int exitCode) {
            return new FakeProcess(output, exitCode, false);
        }

        static FakeProcess hanging() {
            return new FakeProcess("", 0, true);
        }

        boolean wasDestroyed() {
            return destroyed;
        }

        @Override
        public OutputStream getOutputStream() {
            return new ByteArrayOutputStream();
        }

        @Override
        public InputStream getInputStream() {
            return new ByteArrayInputStream(out);
        }

        @Override
        public InputStream getErrorStream() {
            return new ByteArrayInputStream(new byte[0]);
        }

        @Override
        public int waitFor() {
            return exitCode;
        }

        @Override
        public boolean waitFor(long timeout, TimeUnit unit) throws InterruptedException {
            if (hangs) {
                Thread.sleep(unit.toMillis(timeout));
                return false;
            }
            return true;
        }

        @Override
        public int exitValue() {
            return exitCode;
        }

        @Override
        public void destroy() {
            destroyed = true;
        }

        @Override
        public Process destroyForcibly() {
            destroyed = true;
            return this;
        }

        @Override
        public boolean isAlive() {
            return hangs && !destroyed;
        }
    }
}
