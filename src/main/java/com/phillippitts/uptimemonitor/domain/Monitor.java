package com.phillippitts.uptimemonitor.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A user-declared check definition, as owned by the configuration store.
 *
 * <p>The scheduler never keeps a copy of this beyond one check cycle; every run re-reads the
 * current definition so that edits made mid-flight take effect on the next cycle.
 *
 * @param id             opaque unique key
 * @param name           display name
 * @param type           kind of check
 * @param config         type-specific settings
 * @param interval       seconds between checks while up or confirmed down (at least 1)
 * @param retries        failed checks reported as pending before the monitor is confirmed down (at least 0)
 * @param retryInterval  seconds between checks while pending (at least 1)
 * @param resendInterval seconds between repeated down notifications, 0 disables resending
 * @param upsideDown     report a successful probe as down and a failed one as up
 * @param active         whether the scheduler should run this monitor
 * @param lastStatus     cached status of the latest recorded check, null before the first one
 * @param lastCheckAt    cached time of the latest recorded check, null before the first one
 * @param description    free text
 * @param notificationBindings channels this monitor's transitions go to, besides the always-on ones
 */
public record Monitor(
        String id,
        String name,
        MonitorType type,
        MonitorConfig config,
        int interval,
        int retries,
        int retryInterval,
        int resendInterval,
        boolean upsideDown,
        boolean active,
        MonitorStatus lastStatus,
        Instant lastCheckAt,
        String description,
        List<NotificationBinding> notificationBindings
) {

    public static final int DEFAULT_INTERVAL = 60;
    public static final int DEFAULT_RETRY_INTERVAL = 60;

    public Monitor {
        Objects.requireNonNull(id, "Monitor id must not be null");
        Objects.requireNonNull(type, "Monitor type must not be null");
        if (interval < 1) {
            throw new IllegalArgumentException("Interval must be at least 1 second, got: " + interval);
        }
        if (retries < 0) {
            throw new IllegalArgumentException("Retries must not be negative, got: " + retries);
        }
        if (retryInterval < 1) {
            throw new IllegalArgumentException("Retry interval must be at least 1 second, got: " + retryInterval);
        }
        if (resendInterval < 0) {
            throw new IllegalArgumentException("Resend interval must not be negative, got: " + resendInterval);
        }
        config = config == null ? MonitorConfig.empty() : config;
        name = name == null ? id : name;
        description = description == null ? "" : description;
        notificationBindings = notificationBindings == null ? List.of() : List.copyOf(notificationBindings);
    }

    /** Whether an enabled binding routes this monitor's transitions to the named channel. */
    public boolean notifiesVia(String channel) {
        for (NotificationBinding binding : notificationBindings) {
            if (binding.enabled() && binding.channel().equals(channel)) {
                return true;
            }
        }
        return false;
    }

    /** Returns a copy carrying the given cached status. */
    public Monitor withCachedStatus(MonitorStatus status, Instant checkedAt) {
        return new Monitor(id, name, type, config, interval, retries, retryInterval, resendInterval,
                upsideDown, active, status, checkedAt, description, notificationBindings);
    }

    public Monitor withActive(boolean newActive) {
        return new Monitor(id, name, type, config, interval, retries, retryInterval, resendInterval,
                upsideDown, newActive, lastStatus, lastCheckAt, description, notificationBindings);
    }

    public Monitor withId(String newId) {
        return new Monitor(newId, name, type, config, interval, retries, retryInterval, resendInterval,
                upsideDown, active, lastStatus, lastCheckAt, description, notificationBindings);
    }

    public static Builder builder(String id, MonitorType type) {
        return new Builder(id, type);
    }

    public Builder toBuilder() {
        return new Builder(id, type)
                .name(name).config(config).interval(interval).retries(retries)
                .retryInterval(retryInterval).resendInterval(resendInterval).upsideDown(upsideDown)
                .active(active).lastStatus(lastStatus).lastCheckAt(lastCheckAt).description(description)
                .notificationBindings(notificationBindings);
    }

    /**
     * Builder applying the same defaults as the monitor API: interval 60, retries 0,
     * retry interval 60, resend disabled, active.
     */
    public static final class Builder {
        private final String id;
        private MonitorType type;
        private String name;
        private MonitorConfig config = MonitorConfig.empty();
        private int interval = DEFAULT_INTERVAL;
        private int retries;
        private int retryInterval = DEFAULT_RETRY_INTERVAL;
        private int resendInterval;
        private boolean upsideDown;
        private boolean active = true;
        private MonitorStatus lastStatus;
        private Instant lastCheckAt;
        private String description;
        private List<NotificationBinding> notificationBindings = List.of();

        private Builder(String id, MonitorType type) {
            this.id = id;
            this.type = type;
        }

        public Builder type(MonitorType type) { this.type = type; return this; }
        public Builder name(String name) { this.name = name; return this; }
        public Builder config(MonitorConfig config) { this.config = config; return this; }
        public Builder interval(int interval) { this.interval = interval; return this; }
        public Builder retries(int retries) { this.retries = retries; return this; }
        public Builder retryInterval(int retryInterval) { this.retryInterval = retryInterval; return this; }
        public Builder resendInterval(int resendInterval) { this.resendInterval = resendInterval; return this; }
        public Builder upsideDown(boolean upsideDown) { this.upsideDown = upsideDown; return this; }
        public Builder active(boolean active) { this.active = active; return this; }
        public Builder lastStatus(MonitorStatus lastStatus) { this.lastStatus = lastStatus; return this; }
        public Builder lastCheckAt(Instant lastCheckAt) { this.lastCheckAt = lastCheckAt; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder notificationBindings(List<NotificationBinding> notificationBindings) {
            this.notificationBindings = notificationBindings;
            return this;
        }

        public Monitor build() {
            return new Monitor(id, name, type, config, interval, retries, retryInterval, resendInterval,
                    upsideDown, active, lastStatus, lastCheckAt, description, notificationBindings);
        }
    }
}
