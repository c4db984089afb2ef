package com.phillippitts.uptimemonitor.testutil;

import com.phillippitts.uptimemonitor.domain.CheckOutcome;
import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.TransitionKind;
import com.phillippitts.uptimemonitor.service.notification.NotificationChannel;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Channel that keeps every delivered transition for assertions. The default instance receives every
 * monitor's transitions; {@link #bound(String)} only those of monitors bound to it.
 */
public class RecordingNotificationChannel implements NotificationChannel {

    public record Delivery(String monitorId, TransitionKind kind, CheckOutcome outcome) {}

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final String name;
    private final boolean alwaysNotified;

    public RecordingNotificationChannel() {
        this("recording", true);
    }

    private RecordingNotificationChannel(String name, boolean alwaysNotified) {
        this.name = name;
        this.alwaysNotified = alwaysNotified;
    }

    public static RecordingNotificationChannel bound(String name) {
        return new RecordingNotificationChannel(name, false);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean alwaysNotified() {
        return alwaysNotified;
    }

    @Override
    public void notify(Monitor monitor, TransitionKind kind, CheckOutcome outcome) {
        deliveries.add(new Delivery(monitor.id(), kind, outcome));
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public List<TransitionKind> kinds() {
        return deliveries.stream().map(Delivery::kind).toList();
    }

    public long count(TransitionKind kind) {
        return deliveries.stream().filter(d -> d.kind() == kind).count();
    }
}
