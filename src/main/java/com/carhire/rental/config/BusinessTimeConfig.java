package com.carhire.rental.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Every "now" in the services comes from this clock, so dates such as
 * reference prefixes and invoice due dates follow the business time zone.
 */
@Configuration
public class BusinessTimeConfig {

    @Bean
    public ZoneId businessZoneId(@Value("${app.business.zone:Africa/Blantyre}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean
    public Clock businessClock(ZoneId businessZoneId) {
        return Clock.system(businessZoneId);
    }
}
