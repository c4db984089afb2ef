package com.phillippitts.uptimemonitor.service.probe.http;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.exception.ProbeException;
import com.phillippitts.uptimemonitor.service.probe.ProbeRunner;
import com.phillippitts.uptimemonitor.util.LogSanitizer;
import com.phillippitts.uptimemonitor.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Probe for {@code http}, {@code keyword} and {@code https-cert} monitors.
 *
 * <p>Success requires the final status code to match the monitor's accepted codes. On top of that:
 * <ul>
 *   <li>{@code keyword}: the response body contains the configured keyword (case-sensitive)</li>
 *   <li>{@code https-cert}: the server certificate is readable, not expired, and has more than
 *       {@code certExpiryDays} days left; expiry details are attached to the outcome</li>
 *   <li>{@code http} with {@code notifyCertExpiry}: expiry details are attached but never fail the check</li>
 * </ul>
 */
public class HttpProbeRunner implements ProbeRunner {

    private static final Logger LOG = LogManager.getLogger(HttpProbeRunner.class);

    static final String DETAIL_CERT_EXPIRES_AT = "certExpiresAt";
    static final String DETAIL_CERT_DAYS_REMAINING = "certDaysRemaining";
    static final String DETAIL_CERT_ISSUER = "certIssuer";
    static final String DETAIL_STATUS_CODE = "statusCode";

    private static final int HTTPS_DEFAULT_PORT = 443;

    private final HttpTransport transport;
    private final CertificateInspector certificateInspector;
    private final Clock clock;

    public HttpProbeRunner(HttpTransport transport, CertificateInspector certificateInspector) {
        this(transport, certificateInspector, Clock.systemUTC());
    }

    /**
     * @param clock time source for certificate expiry arithmetic
     */
    public HttpProbeRunner(HttpTransport transport, CertificateInspector certificateInspector, Clock clock) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.certificateInspector = Objects.requireNonNull(certificateInspector, "certificateInspector");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Set<MonitorType> supportedTypes() {
        return EnumSet.of(MonitorType.HTTP, MonitorType.KEYWORD, MonitorType.HTTPS_CERT);
    }

    @Override
    public CheckOutcome run(Monitor monitor, Duration timeout) {
        MonitorConfig cfg = monitor.config();
        String typeCode = monitor.type().code();
        if (cfg.url() == null) {
            throw new ProbeException("URL is not configured", typeCode);
        }
        URI uri = parseUri(cfg.url(), typeCode);
        StatusCodeMatcher accepted = parseStatusCodes(cfg.statusCodes(), typeCode);

        HttpProbeRequest request = new HttpProbeRequest(
                cfg.url(),
                cfg.httpMethod(),
                parseHeaders(cfg.requestHeaders(), typeCode),
                cfg.requestBody(),
                cfg.maxRedirects(),
                cfg.ignoreTls(),
                timeout);

        long start = System.nanoTime();
        HttpProbeResponse response;
        try {
            response = transport.execute(request);
        } catch (IOException e) {
            throw new ProbeException(describe(e), typeCode, e);
        }
        long pingMs = TimeUtils.elapsedMillis(start);
        LOG.debug("HTTP {} {} -> {} in {}ms", cfg.httpMethod(), LogSanitizer.redactUrl(cfg.url()),
                response.statusCode(), pingMs);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put(DETAIL_STATUS_CODE, response.statusCode());

        if (!accepted.matches(response.statusCode())) {
            return CheckOutcome.down(monitor.id(),
                    "Unexpected status code " + response.statusCode() + " (expected " + accepted + ")",
                    pingMs, details);
        }

        if (monitor.type() == MonitorType.KEYWORD) {
            String keyword = cfg.keyword();
            if (keyword == null) {
                throw new ProbeException("Keyword is not configured", typeCode);
            }
            if (!response.body().contains(keyword)) {
                return CheckOutcome.down(monitor.id(),
                        "Keyword '" + keyword + "' not found (status code " + response.statusCode() + ")",
                        pingMs, details);
            }
        }

        boolean certRequired = monitor.type() == MonitorType.HTTPS_CERT;
        if (certRequired || (cfg.notifyCertExpiry() && isHttps(uri))) {
            String certProblem = inspectCertificate(uri, cfg, timeout, certRequired, details, typeCode);
            if (certProblem != null) {
                return CheckOutcome.down(monitor.id(), certProblem, pingMs, details);
            }
        }

        return CheckOutcome.up(monitor.id(), successMessage(monitor, response), pingMs, details);
    }

    /**
     * Adds certificate details and returns a failure message when the certificate must be valid but is not.
     */
    private String inspectCertificate(URI uri, MonitorConfig cfg, Duration timeout, boolean required,
                                      Map<String, Object> details, String typeCode) {
        if (!isHttps(uri)) {
            throw new ProbeException("Certificate check requires an https:// URL", typeCode);
        }
        int port = uri.getPort() > 0 ? uri.getPort() : HTTPS_DEFAULT_PORT;
        CertificateInfo cert;
        try {
            cert = certificateInspector.inspect(uri.getHost(), port, timeout);
        } catch (IOException e) {
            if (required) {
                throw new ProbeException("Cannot read certificate: " + describe(e), typeCode, e);
            }
            LOG.debug("Certificate details unavailable for {}: {}", uri.getHost(), e.toString());
            return null;
        }

        Instant now = clock.instant();
        long daysLeft = cert.daysRemaining(now);
        details.put(DETAIL_CERT_EXPIRES_AT, cert.notAfter().toString());
        details.put(DETAIL_CERT_DAYS_REMAINING, daysLeft);
        details.put(DETAIL_CERT_ISSUER, cert.issuer());

        if (!required) {
            return null;
        }
        if (cert.isExpired(now)) {
            return "Certificate expired on " + cert.notAfter();
        }
        int threshold = cfg.certExpiryDays();
        if (threshold > 0 && daysLeft <= threshold) {
            return "Certificate expires in " + daysLeft + " days (on " + cert.notAfter() + ")";
        }
        return null;
    }

    private static String successMessage(Monitor monitor, HttpProbeResponse response) {
        String status = (response.statusCode() + " " + response.reasonPhrase()).trim();
        if (monitor.type() == MonitorType.KEYWORD) {
            return status + ", keyword '" + monitor.config().keyword() + "' found";
        }
        return status;
    }

    private static URI parseUri(String url, String typeCode) {
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new ProbeException("Unsupported URL scheme: " + uri.getScheme(), typeCode);
            }
            if (uri.getHost() == null) {
                throw new ProbeException("URL has no host: " + LogSanitizer.redactUrl(url), typeCode);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ProbeException("Invalid URL: " + LogSanitizer.redactUrl(url), typeCode, e);
        }
    }

    private static StatusCodeMatcher parseStatusCodes(String expression, String typeCode) {
        try {
            return StatusCodeMatcher.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new ProbeException(e.getMessage(), typeCode, e);
        }
    }

    /**
     * Parses a JSON object of request headers. Non-string values are rendered with {@code toString()}.
     */
    static Map<String, String> parseHeaders(String json, String typeCode) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            JSONObject obj = new JSONObject(json);
            Map<String, String> headers = new LinkedHashMap<>();
            for (String key : obj.keySet()) {
                headers.put(key, String.valueOf(obj.get(key)));
            }
            return headers;
        } catch (JSONException e) {
            throw new ProbeException("Request headers are not a valid JSON object", typeCode, e);
        }
    }

    private static boolean isHttps(URI uri) {
        return "https".equalsIgnoreCase(uri.getScheme());
    }

    private static String describe(IOException e) {
        String msg = e.getMessage();
        return e.getClass().getSimpleName() + (msg == null || msg.isBlank() ? "" : ": " + msg);
    }
}
