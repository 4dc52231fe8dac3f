package com.example.plantreport.infrastructure.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Application-wide beans that are not owned by a single component.
 */
@Configuration
public class ReportConfiguration {

	/**
	 * Time source for report dates and file names. Tests replace it with a fixed clock.
	 *
	 * @return system clock in the default zone
	 */
    @Bean
    Clock reportClock() {
        return Clock.systemDefaultZone();
    }
}
