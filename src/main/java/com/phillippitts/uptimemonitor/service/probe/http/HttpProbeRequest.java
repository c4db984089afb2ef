package com.phillippitts.uptimemonitor.service.probe.http;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Transport-neutral description of the request an HTTP check sends.
 *
 * @param url          absolute target URL
 * @param method       upper-case HTTP method
 * @param headers      request headers (never null)
 * @param body         request body, null for none
 * @param maxRedirects redirect limit, 0 disables following redirects
 * @param ignoreTls    skip certificate and hostname verification
 * @param timeout      connect and response timeout
 */
public record HttpProbeRequest(
        String url,
        String method,
        Map<String, String> headers,
        String body,
        int maxRedirects,
        boolean ignoreTls,
        Duration timeout
) {
    public HttpProbeRequest {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(timeout, "timeout");
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
