package com.phillippitts.uptimemonitor.exception;

/**
 * Thrown by a notification channel that could not deliver a transition. Logged, never retried.
 */
public class NotificationException extends UptimeMonitorException {

    private final String channel;

    public NotificationException(String message, String channel) {
        super(message + " (channel: " + channel + ")");
        this.channel = channel;
    }

    public NotificationException(String message, String channel, Throwable cause) {
        super(message + " (channel: " + channel + ")", cause);
        this.channel = channel;
    }

    public String getChannel() {
        return channel;
    }
}
