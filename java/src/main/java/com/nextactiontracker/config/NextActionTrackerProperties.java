package com.nextactiontracker.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;

/**
 * Application settings bound from the {@code nat.*} namespace.
 */
@Data
@ConfigurationProperties(prefix = "nat")
public class NextActionTrackerProperties {

    /**
     * Zone used to truncate timestamps to calendar days. Blank means the system zone.
     */
    private String timeZone;

    private Cors cors = new Cors();

    private Database database = new Database();

    public ZoneId resolveZone() {
        if (timeZone == null || timeZone.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(timeZone.trim());
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000"));
    }

    @Data
    public static class Database {
        /**
         * Run db/schema.sql on startup.
         */
        private boolean initializeSchema = false;
    }
}
