package com.phillippitts.uptimemonitor.service.probe.icmp;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Summary parsed from the output of the system {@code ping} command.
 *
 * @param transmitted  echo requests sent
 * @param received     echo replies received
 * @param packetLoss   loss in percent (0-100)
 * @param averageRttMs average round trip in milliseconds, empty when no reply was received
 */
public record PingStatistics(int transmitted, int received, double packetLoss, OptionalDouble averageRttMs) {

    // "4 packets transmitted, 4 received, 0% packet loss" (Linux) / "4 packets received, 0.0% packet loss" (BSD)
    private static final Pattern SUMMARY = Pattern.compile(
            "(\\d+) packets transmitted, (\\d+) (?:packets )?received.*?([\\d.]+)% packet loss");
    // "rtt min/avg/max/mdev = 0.045/0.051/0.060/0.006 ms" or "round-trip min/avg/max/stddev = ..."
    private static final Pattern RTT = Pattern.compile(
            "(?:rtt|round-trip) [\\w/]+ = [\\d.]+/([\\d.]+)/");

    /**
     * @param output combined stdout/stderr of a ping run
     * @return statistics, or empty when the output has no summary line
     */
    public static Optional<PingStatistics> parse(String output) {
        if (output == null) {
            return Optional.empty();
        }
        Matcher summary = SUMMARY.matcher(output);
        if (!summary.find()) {
            return Optional.empty();
        }
        int transmitted = Integer.parseInt(summary.group(1));
        int received = Integer.parseInt(summary.group(2));
        double loss = Double.parseDouble(summary.group(3));

        Matcher rtt = RTT.matcher(output);
        OptionalDouble avg = rtt.find() ? OptionalDouble.of(Double.parseDouble(rtt.group(1))) : OptionalDouble.empty();
        return Optional.of(new PingStatistics(transmitted, received, loss, avg));
    }
}
