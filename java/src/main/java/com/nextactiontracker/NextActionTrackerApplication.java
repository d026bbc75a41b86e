package com.nextactiontracker;

import com.nextactiontracker.config.NextActionTrackerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Next Action Tracker API Server
 *
 * Multi-tenant sales dashboard listing opportunities whose next action is due,
 * built with Spring Boot WebFlux and R2DBC.
 */
@SpringBootApplication
@EnableConfigurationProperties(NextActionTrackerProperties.class)
public class NextActionTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(NextActionTrackerApplication.class, args);
    }

}
