package com.phillippitts.uptimemonitor.service.probe.http;

import java.io.IOException;

/**
 * Sends the request of an HTTP check. Production code uses {@link ApacheHttpTransport};
 * tests may substitute a stub returning canned responses.
 */
public interface HttpTransport {

    /**
     * @throws IOException on connection, TLS, timeout or redirect-limit errors
     */
    HttpProbeResponse execute(HttpProbeRequest request) throws IOException;
}
