package io.github.drompincen.collabsync.gateway.config;

import io.github.drompincen.collabsync.runtime.scheduler.ExecutorSyncScheduler;
import io.github.drompincen.collabsync.runtime.scheduler.SyncScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class SchedulerConfig {

    @Bean(destroyMethod = "close")
    ExecutorSyncScheduler syncScheduler() {
        return new ExecutorSyncScheduler();
    }

    @Bean
    Clock clock() {
        return Clock.systemUTC();
    }
}
