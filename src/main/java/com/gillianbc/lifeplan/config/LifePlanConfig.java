package com.gillianbc.lifeplan.config;

import com.gillianbc.lifeplan.tax.TaxTables;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the engines. Import this configuration, or let a Spring Boot application scan
 * {@code com.gillianbc.lifeplan}.
 */
@Configuration
@ComponentScan(basePackages = "com.gillianbc.lifeplan")
@EnableConfigurationProperties(ProjectionProperties.class)
public class LifePlanConfig {

    @Bean
    public TaxTables taxTables() {
        return TaxTables.builtIn();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
