package com.example.fleetsafety;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Fleet Safety Core.
 *
 * Alert lifecycle and escalation engine for fleet safety signals:
 * - Detection rules decide whether an incoming signal opens an alert
 * - Alert state machine drives AI triage and the bounded revalidation loop
 * - Attention engine tracks acknowledgement/resolution SLAs and escalates
 * - Notification decisions are recorded as an append-only audit trail
 * - Incident correlation folds related signals and alerts together
 */
@SpringBootApplication
@EnableScheduling
public class FleetSafetyApplication {

    public static void main(String[] args) {
        SpringApplication.run(FleetSafetyApplication.class, args);
    }
}
