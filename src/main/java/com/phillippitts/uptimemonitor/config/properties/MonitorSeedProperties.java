package com.phillippitts.uptimemonitor.config.properties;

import com.phillippitts.uptimemonitor.service.monitor.MonitorDefinition;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Monitors loaded into the configuration store at startup, declared as {@code monitor.seed[n].*}.
 *
 * @param seed definitions, empty when none are declared
 */
@ConfigurationProperties(prefix = "monitor")
public record MonitorSeedProperties(List<MonitorDefinition> seed) {

    public MonitorSeedProperties {
        seed = seed == null ? List.of() : List.copyOf(seed);
    }
}
