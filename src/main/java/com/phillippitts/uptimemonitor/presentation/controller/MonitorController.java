package com.phillippitts.uptimemonitor.presentation.controller;

import com.phillippitts.uptimemonitor.domain.Monitor;
import com.phillippitts.uptimemonitor.domain.StatusRecord;
import com.phillippitts.uptimemonitor.exception.InvalidMonitorException;
import com.phillippitts.uptimemonitor.service.monitor.MonitorDefinition;
import com.phillippitts.uptimemonitor.service.monitor.MonitorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Monitor CRUD. Every change is forwarded to the scheduler through {@link MonitorService}.
 */
@RestController
@RequestMapping("/api/monitors")
class MonitorController {

    private static final int MAX_HISTORY = 1000;

    private final MonitorService monitorService;

    MonitorController(MonitorService monitorService) {
        this.monitorService = monitorService;
    }

    @GetMapping
    List<Monitor> list() {
        return monitorService.list().stream().map(MonitorController::redacted).toList();
    }

    @PostMapping
    ResponseEntity<Monitor> create(@RequestBody MonitorDefinition definition) {
        return ResponseEntity.status(HttpStatus.CREATED).body(redacted(monitorService.create(definition)));
    }

    @GetMapping("/{id}")
    Monitor get(@PathVariable String id) {
        return redacted(monitorService.get(id));
    }

    @PutMapping("/{id}")
    Monitor update(@PathVariable String id, @RequestBody MonitorDefinition definition) {
        return redacted(monitorService.update(id, definition));
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable String id) {
        monitorService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{id}")
    Monitor setActive(@PathVariable String id, @RequestBody ActiveRequest request) {
        if (request == null || request.active() == null) {
            throw new InvalidMonitorException("active", "Field 'active' is required");
        }
        return redacted(monitorService.setActive(id, request.active()));
    }

    @GetMapping("/{id}/history")
    List<StatusRecord> history(@PathVariable String id, @RequestParam(defaultValue = "100") int limit) {
        return monitorService.history(id, Math.max(1, Math.min(limit, MAX_HISTORY)));
    }

    private static Monitor redacted(Monitor monitor) {
        return monitor.toBuilder().config(monitor.config().withoutSecrets()).build();
    }

    record ActiveRequest(Boolean active) {}
}
