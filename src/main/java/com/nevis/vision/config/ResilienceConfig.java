package com.nevis.vision.config;

import com.nevis.vision.availability.AvailabilityCache;
import com.nevis.vision.availability.HealthProbe;
import com.nevis.vision.retry.BackoffPolicy;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

import java.time.Clock;
import java.util.List;

@Configuration
public class ResilienceConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return new ThreadWaitSleeper();
    }

    @Bean
    public BackoffPolicy backoffPolicy() {
        return new BackoffPolicy();
    }

    @Bean
    public AvailabilityCache availabilityCache(List<HealthProbe> probes, Clock clock, Sleeper sleeper,
                                               VisionProperties properties) {
        VisionProperties.Availability availability = properties.availability();
        return new AvailabilityCache(probes, clock, sleeper,
            availability.successTtl(), availability.failureTtl(),
            availability.probeAttempts(), availability.probePause());
    }
}
