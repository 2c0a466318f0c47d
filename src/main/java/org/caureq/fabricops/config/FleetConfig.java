package org.caureq.fabricops.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

/** One bounded pool for every fan-out, shared across requests. */
@Configuration
public class FleetConfig {

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fleetWorkers(FabricProps props) {
        return Executors.newFixedThreadPool(props.poolSize(), new CustomizableThreadFactory("fleet-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService fleetWatchdog() {
        return Executors.newSingleThreadScheduledExecutor(new CustomizableThreadFactory("fleet-watchdog-"));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
