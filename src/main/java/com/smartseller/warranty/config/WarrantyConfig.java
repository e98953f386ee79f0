package com.smartseller.warranty.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Core collaborators shared by the warranty services.
 *
 * @author Warranty Platform Team
 */
@Configuration
public class WarrantyConfig {

    /**
     * Clock used for every timestamp the services write. Tests substitute a fixed clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
