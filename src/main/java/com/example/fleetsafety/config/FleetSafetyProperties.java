package com.example.fleetsafety.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the fleet safety engine.
 * Maps to the 'fleet-safety' prefix in application.yml.
 *
 * Per-company settings live under {@code companies.<id>} and are layered over
 * {@code defaults}, which is itself layered over the built-in defaults.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "fleet-safety")
public class FleetSafetyProperties {

    private SeverityConfig severity = new SeverityConfig();
    private SweepConfig revalidation = new SweepConfig();
    private SweepConfig attention = new SweepConfig();
    private CacheConfig companyConfigCache = new CacheConfig();
    private CompanyConfig defaults = new CompanyConfig();
    private Map<Long, CompanyConfig> companies = new HashMap<>();

    /** Label taxonomy used to derive signal severity. */
    @Data
    public static class SeverityConfig {
        private List<String> criticalLabels = new ArrayList<>(List.of(
                "Crash", "crash", "Collision", "NearCollison", "NearCollision",
                "NearPedestrianCollision", "ForwardCollisionWarning", "RearCollisionWarning",
                "SevereSpeeding", "HeavySpeeding", "HighSpeedSuddenDisconnect"));
        private List<String> warningLabels = new ArrayList<>(List.of(
                "Acceleration", "Braking", "HarshTurn", "Speeding", "ModerateSpeeding",
                "GenericDistraction", "MobileUsage", "Drowsy", "FollowingDistance",
                "FollowingDistanceSevere", "NoSeatbelt", "RanRedLight", "RollingStop"));
    }

    @Data
    public static class SweepConfig {
        private boolean enabled = true;
        private long intervalMs = 60000;
        private int batchSize = 100;
    }

    @Data
    public static class CacheConfig {
        private int maximumSize = 500;
        private int expireAfterWriteSeconds = 300;
    }
}
