package com.phillippitts.uptimemonitor.service.probe.http;

import java.io.IOException;
import java.time.Duration;

/**
 * Reads the server certificate presented by a TLS endpoint.
 */
public interface CertificateInspector {

    /**
     * @throws IOException when the handshake fails or no X.509 certificate is presented
     */
    CertificateInfo inspect(String host, int port, Duration timeout) throws IOException;
}
