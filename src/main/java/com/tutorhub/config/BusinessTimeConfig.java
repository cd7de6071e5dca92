package com.tutorhub.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

/**
 * Lesson times, working hours and purchase stamps are local date-times of the school's zone.
 * Everything that needs "now" takes this clock, so tests can pin it.
 */
@Configuration
@Slf4j
public class BusinessTimeConfig {

    @Bean
    public Clock businessClock(@Value("${tutorhub.business.zone:UTC}") String zone) {
        ZoneId zoneId = ZoneId.of(zone);
        log.info("Business time zone: {}", zoneId);
        return Clock.system(zoneId);
    }
}
