package com.phillippitts.uptimemonitor.service.probe.icmp;

import java.io.IOException;
import java.util.List;

/**
 * Default production implementation of {@link ProcessFactory} using {@link ProcessBuilder}.
 */
public final class DefaultProcessFactory implements ProcessFactory {

    @Override
    public Process start(List<String> command) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        // ping reports unreachable hosts on stderr on some platforms; parse both together
        pb.redirectErrorStream(true);
        return pb.start();
    }
}
