package com.phillippitts.uptimemonitor.domain;

/**
 * Links a monitor to a notification channel by the channel's name.
 *
 * @param channel name of the notification channel, e.g. {@code webhook}; blank when missing
 * @param enabled whether transitions of the monitor are delivered to the channel
 */
public record NotificationBinding(String channel, boolean enabled) {

    public NotificationBinding {
        channel = channel == null ? "" : channel.trim();
    }

    public static NotificationBinding enabledFor(String channel) {
        return new NotificationBinding(channel, true);
    }
}
