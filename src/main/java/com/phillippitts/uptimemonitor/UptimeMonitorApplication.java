package com.phillippitts.uptimemonitor;

import com.phillippitts.uptimemonitor.config.properties.HistoryProperties;
import com.phillippitts.uptimemonitor.config.properties.MonitorSeedProperties;
import com.phillippitts.uptimemonitor.config.properties.ProbeProperties;
import com.phillippitts.uptimemonitor.config.properties.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableConfigurationProperties({
        SchedulerProperties.class,
        ProbeProperties.class,
        HistoryProperties.class,
        MonitorSeedProperties.class
})
@EnableScheduling
public class UptimeMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(UptimeMonitorApplication.class, args);
    }

}
