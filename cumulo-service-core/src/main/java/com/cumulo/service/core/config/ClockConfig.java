package com.cumulo.service.core.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ClockConfig {

    /** Runs in {@code cumulo.job.zone}, the zone the daily trigger fires in, so "yesterday" matches the cron. */
    @Bean
    public Clock jobZoneClock(CumuloProperties properties) {
        ZoneId zone = ZoneId.of(properties.getJob().getZone());
        return Clock.system(zone);
    }
}
