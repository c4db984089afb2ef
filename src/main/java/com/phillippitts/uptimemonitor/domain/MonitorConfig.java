package com.phillippitts.uptimemonitor.domain;

import java.util.Locale;

/**
 * Type-specific settings of a monitor. Only the fields relevant to the monitor's
 * {@link MonitorType} are read; the rest stay {@code null}.
 *
 * <p>Defaults are applied on construction so probe runners never see a missing HTTP method,
 * status-code range, redirect limit, packet count or packet-loss ceiling. The timeout and push
 * grace stay nullable because their defaults come from application properties.
 *
 * @param url              target URL (http, keyword, https-cert)
 * @param httpMethod       request method, upper-cased (default GET)
 * @param statusCodes      accepted status codes, e.g. {@code 200-299,301} (default {@code 200-299})
 * @param maxRedirects     redirect limit, 0 disables redirects (default 10)
 * @param connectTimeout   connect/request timeout in seconds, null for the application default
 * @param ignoreTls        skip certificate and hostname verification
 * @param notifyCertExpiry attach certificate expiry details to plain http checks
 * @param certExpiryDays   https-cert fails when no more than this many days are left, 0 = only when expired (default 7)
 * @param keyword          text the response body must contain (keyword)
 * @param requestBody      optional request body; sent as JSON when it parses as JSON
 * @param requestHeaders   optional JSON object of request headers
 * @param hostname         target host (port, mysql, redis, icmp)
 * @param port             target port (port, mysql, redis)
 * @param username         credentials (mysql, redis)
 * @param password         credentials (mysql, redis); never rendered by {@link #toString()}
 * @param database         database name (mysql)
 * @param query            optional query or command run after connecting (mysql, redis)
 * @param packetCount      echo requests per check (default 4)
 * @param maxPacketLoss    tolerated packet loss in percent (default 0)
 * @param pushToken        token identifying the heartbeat sender (push)
 * @param pushGraceSeconds extra seconds on top of the interval before a push monitor is down, null for the application default
 */
public record MonitorConfig(
        String url,
        String httpMethod,
        String statusCodes,
        Integer maxRedirects,
        Integer connectTimeout,
        boolean ignoreTls,
        boolean notifyCertExpiry,
        Integer certExpiryDays,
        String keyword,
        String requestBody,
        String requestHeaders,
        String hostname,
        Integer port,
        String username,
        String password,
        String database,
        String query,
        Integer packetCount,
        Integer maxPacketLoss,
        String pushToken,
        Integer pushGraceSeconds
) {

    public static final String DEFAULT_HTTP_METHOD = "GET";
    public static final String DEFAULT_STATUS_CODES = "200-299";
    public static final int DEFAULT_MAX_REDIRECTS = 10;
    public static final int DEFAULT_CERT_EXPIRY_DAYS = 7;
    public static final int DEFAULT_PACKET_COUNT = 4;
    public static final int DEFAULT_MAX_PACKET_LOSS = 0;

    public MonitorConfig {
        httpMethod = isBlank(httpMethod) ? DEFAULT_HTTP_METHOD : httpMethod.trim().toUpperCase(Locale.ROOT);
        statusCodes = isBlank(statusCodes) ? DEFAULT_STATUS_CODES : statusCodes.trim();
        maxRedirects = maxRedirects == null ? DEFAULT_MAX_REDIRECTS : Math.max(0, maxRedirects);
        certExpiryDays = certExpiryDays == null ? DEFAULT_CERT_EXPIRY_DAYS : Math.max(0, certExpiryDays);
        packetCount = packetCount == null || packetCount < 1 ? DEFAULT_PACKET_COUNT : packetCount;
        maxPacketLoss = maxPacketLoss == null ? DEFAULT_MAX_PACKET_LOSS : Math.max(0, Math.min(100, maxPacketLoss));
        url = trimToNull(url);
        hostname = trimToNull(hostname);
        keyword = keyword == null || keyword.isEmpty() ? null : keyword;
        query = trimToNull(query);
        pushToken = trimToNull(pushToken);
    }

    /** An empty configuration with every default applied. */
    public static MonitorConfig empty() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copies this configuration into a builder for modification. */
    public Builder toBuilder() {
        return new Builder()
                .url(url).httpMethod(httpMethod).statusCodes(statusCodes).maxRedirects(maxRedirects)
                .connectTimeout(connectTimeout).ignoreTls(ignoreTls).notifyCertExpiry(notifyCertExpiry)
                .certExpiryDays(certExpiryDays).keyword(keyword).requestBody(requestBody)
                .requestHeaders(requestHeaders).hostname(hostname).port(port).username(username)
                .password(password).database(database).query(query).packetCount(packetCount)
                .maxPacketLoss(maxPacketLoss).pushToken(pushToken).pushGraceSeconds(pushGraceSeconds);
    }

    /** Copy without the password, for API responses. */
    public MonitorConfig withoutSecrets() {
        return password == null ? this : toBuilder().password(null).build();
    }

    @Override
    public String toString() {
        return "MonitorConfig[url=" + url
                + ", httpMethod=" + httpMethod
                + ", statusCodes=" + statusCodes
                + ", hostname=" + hostname
                + ", port=" + port
                + ", username=" + username
                + ", password=" + (password == null ? null : "****")
                + ", database=" + database
                + ", keyword=" + keyword
                + ", pushToken=" + (pushToken == null ? null : "****")
                + "]";
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static String trimToNull(String s) {
        return isBlank(s) ? null : s.trim();
    }

    /**
     * Fluent builder, mostly for seeding and tests.
     */
    public static final class Builder {
        private String url;
        private String httpMethod;
        private String statusCodes;
        private Integer maxRedirects;
        private Integer connectTimeout;
        private boolean ignoreTls;
        private boolean notifyCertExpiry;
        private Integer certExpiryDays;
        private String keyword;
        private String requestBody;
        private String requestHeaders;
        private String hostname;
        private Integer port;
        private String username;
        private String password;
        private String database;
        private String query;
        private Integer packetCount;
        private Integer maxPacketLoss;
        private String pushToken;
        private Integer pushGraceSeconds;

        private Builder() {
        }

        public Builder url(String url) { this.url = url; return this; }
        public Builder httpMethod(String httpMethod) { this.httpMethod = httpMethod; return this; }
        public Builder statusCodes(String statusCodes) { this.statusCodes = statusCodes; return this; }
        public Builder maxRedirects(Integer maxRedirects) { this.maxRedirects = maxRedirects; return this; }
        public Builder connectTimeout(Integer connectTimeout) { this.connectTimeout = connectTimeout; return this; }
        public Builder ignoreTls(boolean ignoreTls) { this.ignoreTls = ignoreTls; return this; }
        public Builder notifyCertExpiry(boolean notifyCertExpiry) { this.notifyCertExpiry = notifyCertExpiry; return this; }
        public Builder certExpiryDays(Integer certExpiryDays) { this.certExpiryDays = certExpiryDays; return this; }
        public Builder keyword(String keyword) { this.keyword = keyword; return this; }
        public Builder requestBody(String requestBody) { this.requestBody = requestBody; return this; }
        public Builder requestHeaders(String requestHeaders) { this.requestHeaders = requestHeaders; return this; }
        public Builder hostname(String hostname) { this.hostname = hostname; return this; }
        public Builder port(Integer port) { this.port = port; return this; }
        public Builder username(String username) { this.username = username; return this; }
        public Builder password(String password) { this.password = password; return this; }
        public Builder database(String database) { this.database = database; return this; }
        public Builder query(String query) { this.query = query; return this; }
        public Builder packetCount(Integer packetCount) { this.packetCount = packetCount; return this; }
        public Builder maxPacketLoss(Integer maxPacketLoss) { this.maxPacketLoss = maxPacketLoss; return this; }
        public Builder pushToken(String pushToken) { this.pushToken = pushToken; return this; }
        public Builder pushGraceSeconds(Integer pushGraceSeconds) { this.pushGraceSeconds = pushGraceSeconds; return this; }

        public MonitorConfig build() {
            return new MonitorConfig(url, httpMethod, statusCodes, maxRedirects, connectTimeout, ignoreTls,
                    notifyCertExpiry, certExpiryDays, keyword, requestBody, requestHeaders, hostname, port,
                    username, password, database, query, packetCount, maxPacketLoss, pushToken, pushGraceSeconds);
        }
    }
}
