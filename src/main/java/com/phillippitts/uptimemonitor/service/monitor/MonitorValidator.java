package com.phillippitts.uptimemonitor.service.monitor;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.MonitorType;
import com.phillippitts.uptimemonitor.domain.NotificationBinding;
import com.phillippitts.uptimemonitor.exception.InvalidMonitorException;
import com.phillippitts.uptimemonitor.service.probe.http.StatusCodeMatcher;
import org.json.JSONException;
import org.json.JSONObject;

import java.net.URI;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Turns a {@link MonitorDefinition} into a validated {@link Monitor}.
 *
 * <p>Rules: name and type are required; http, keyword and https-cert need an http(s) URL
 * (https-cert an https one); keyword needs a keyword; port, mysql and redis need a hostname and a
 * port in 1-65535; icmp needs a hostname. Status codes and request headers must parse.
 * Notification bindings need a channel name, at most once per channel.
 */
public final class MonitorValidator {

    private static final int MAX_PORT = 65535;

    private MonitorValidator() {}

    /**
     * @param id         identifier to assign
     * @param definition submitted definition
     * @return the monitor, with defaults applied and no cached status
     * @throws InvalidMonitorException naming the first offending field
     */
    public static Monitor toMonitor(String id, MonitorDefinition definition) {
        if (definition == null) {
            throw new InvalidMonitorException("body", "Monitor definition is required");
        }
        if (definition.name() == null || definition.name().isBlank()) {
            throw new InvalidMonitorException("name", "Name is required");
        }
        if (definition.type() == null || definition.type().isBlank()) {
            throw new InvalidMonitorException("type", "Type is required");
        }
        MonitorType type;
        try {
            type = MonitorType.fromCode(definition.type().trim());
        } catch (IllegalArgumentException e) {
            throw new InvalidMonitorException("type", "Unsupported monitor type: " + definition.type());
        }
        MonitorConfig config = definition.config() == null ? MonitorConfig.empty() : definition.config();
        validateConfig(type, config);
        List<NotificationBinding> bindings = validateBindings(definition.notificationBindings());

        Monitor.Builder builder = Monitor.builder(id, type)
                .name(definition.name().trim())
                .description(definition.description())
                .config(config)
                .notificationBindings(bindings);
        if (definition.interval() != null) {
            builder.interval(definition.interval());
        }
        if (definition.retries() != null) {
            builder.retries(definition.retries());
        }
        if (definition.retryInterval() != null) {
            builder.retryInterval(definition.retryInterval());
        }
        if (definition.resendInterval() != null) {
            builder.resendInterval(definition.resendInterval());
        }
        if (definition.upsideDown() != null) {
            builder.upsideDown(definition.upsideDown());
        }
        if (definition.active() != null) {
            builder.active(definition.active());
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidMonitorException("timing", e.getMessage());
        }
    }

    static void validateConfig(MonitorType type, MonitorConfig config) {
        if (type.isHttpFamily()) {
            validateUrl(type, config.url());
            try {
                StatusCodeMatcher.parse(config.statusCodes());
            } catch (IllegalArgumentException e) {
                throw new InvalidMonitorException("statusCodes", e.getMessage());
            }
            validateHeaders(config.requestHeaders());
        }
        if (type == MonitorType.KEYWORD && config.keyword() == null) {
            throw new InvalidMonitorException("keyword", "Keyword is required for keyword monitors");
        }
        if (type.requiresHostAndPort()) {
            requireHostname(type, config);
            if (config.port() == null || config.port() < 1 || config.port() > MAX_PORT) {
                throw new InvalidMonitorException("port", "Port must be between 1 and " + MAX_PORT);
            }
        }
        if (type == MonitorType.ICMP) {
            requireHostname(type, config);
        }
        if (config.connectTimeout() != null && config.connectTimeout() < 1) {
            throw new InvalidMonitorException("connectTimeout", "Timeout must be at least 1 second");
        }
    }

    private static List<NotificationBinding> validateBindings(List<NotificationBinding> bindings) {
        if (bindings == null) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        for (NotificationBinding binding : bindings) {
            if (binding == null || binding.channel().isEmpty()) {
                throw new InvalidMonitorException("notificationBindings", "Notification channel is required");
            }
            if (!seen.add(binding.channel())) {
                throw new InvalidMonitorException("notificationBindings",
                        "Notification channel bound twice: " + binding.channel());
            }
        }
        return bindings;
    }

    private static void validateUrl(MonitorType type, String url) {
        if (url == null) {
            throw new InvalidMonitorException("url", "URL is required for " + type.code() + " monitors");
        }
        URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new InvalidMonitorException("url", "URL is not valid");
        }
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (type == MonitorType.HTTPS_CERT && !scheme.equals("https")) {
            throw new InvalidMonitorException("url", "https-cert monitors need an https:// URL");
        }
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new InvalidMonitorException("url", "URL must start with http:// or https://");
        }
        if (uri.getHost() == null) {
            throw new InvalidMonitorException("url", "URL has no host");
        }
    }

    private static void validateHeaders(String headers) {
        if (headers == null || headers.isBlank()) {
            return;
        }
        try {
            new JSONObject(headers);
        } catch (JSONException e) {
            throw new InvalidMonitorException("requestHeaders", "Request headers must be a JSON object");
        }
    }

    private static void requireHostname(MonitorType type, MonitorConfig config) {
        if (config.hostname() == null) {
            throw new InvalidMonitorException("hostname", "Hostname is required for " + type.code() + " monitors");
        }
    }
}
