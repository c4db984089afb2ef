package com.phillippitts.uptimemonitor.presentation.controller;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.service.push.PushService;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Heartbeat endpoint for push monitors. Reporters call it with GET or POST.
 */
@RestController
class PushController {

    private final PushService pushService;

    PushController(PushService pushService) {
        this.pushService = pushService;
    }

    @RequestMapping(value = "/api/push/{pushToken}", method = {RequestMethod.GET, RequestMethod.POST})
    Map<String, Object> heartbeat(@PathVariable String pushToken) {
        Monitor monitor = pushService.heartbeat(pushToken);
        return Map.of(
                "ok", true,
                "monitorId", monitor.id(),
                "timestamp", Instant.now().toString());
    }
}
