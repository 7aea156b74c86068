package fr.lapetina.ringbalancer.domain.model;

/**
 * Health state of a backend server.
 *
 * UNKNOWN: Newly registered, no probe has completed yet; not eligible for routing
 * HEALTHY: Last probes succeeded; eligible for routing
 * UNHEALTHY: Failed enough consecutive probes, or drained manually
 */
public enum HealthState {
    UNKNOWN,
    HEALTHY,
    UNHEALTHY
}
