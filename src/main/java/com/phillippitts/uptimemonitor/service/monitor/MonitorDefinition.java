package com.phillippitts.uptimemonitor.service.monitor;

import com.phillippitts.uptimemonitor.domain.MonitorConfig;
import com.phillippitts.uptimemonitor.domain.NotificationBinding;

import java.util.List;

/**
 * Monitor definition as submitted through the API or declared under {@code monitor.seed[n]}.
 * Every field except {@code name} and {@code type} is optional; missing values take the defaults
 * interval 60, retries 0, retryInterval 60, resendInterval 0, upsideDown false, active true.
 *
 * @param id             identifier, only honoured for seeded monitors; generated when blank
 * @param name           display name
 * @param type           type code, e.g. {@code http} or {@code https-cert}
 * @param description    free text
 * @param interval       seconds between checks
 * @param retries        failures reported as pending before down
 * @param retryInterval  seconds between checks while pending
 * @param resendInterval seconds between repeated down notifications, 0 disables
 * @param upsideDown     invert up and down
 * @param active         schedule the monitor
 * @param config         type-specific settings
 * @param notificationBindings channels to notify, by name; none means only the always-on channels
 */
public record MonitorDefinition(
        String id,
        String name,
        String type,
        String description,
        Integer interval,
        Integer retries,
        Integer retryInterval,
        Integer resendInterval,
        Boolean upsideDown,
        Boolean active,
        MonitorConfig config,
        List<NotificationBinding> notificationBindings
) {
}
