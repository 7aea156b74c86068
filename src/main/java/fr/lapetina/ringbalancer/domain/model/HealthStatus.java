package fr.lapetina.ringbalancer.domain.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time copy of a server's health-check bookkeeping.
 *
 * @param state                current health state
 * @param consecutiveFailures  failed probes since the last success
 * @param consecutiveSuccesses successful probes since the last failure
 * @param lastCheck            completion time of the last probe, null before the first
 * @param lastResponseTime     elapsed time of the last probe, null before the first
 * @param lastError            failure detail of the last probe, null when it succeeded
 * @param drained              true while an operator holds the server out of rotation
 */
public record HealthStatus(
        HealthState state,
        int consecutiveFailures,
        int consecutiveSuccesses,
        Instant lastCheck,
        Duration lastResponseTime,
        String lastError,
        boolean drained
) {

    public static HealthStatus initial() {
        return new HealthStatus(HealthState.UNKNOWN, 0, 0, null, null, null, false);
    }

    public boolean isHealthy() {
        return state == HealthState.HEALTHY;
    }
}
