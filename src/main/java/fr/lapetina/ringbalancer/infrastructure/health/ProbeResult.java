package fr.lapetina.ringbalancer.infrastructure.health;

import java.time.Duration;

/**
 * Outcome of a single health probe attempt.
 *
 * @param healthy    whether the server returned the expected success signal in time
 * @param elapsed    time spent on the attempt
 * @param statusCode HTTP status for HTTP probes, null otherwise or when no response arrived
 * @param error      failure detail, null on success
 */
public record ProbeResult(boolean healthy, Duration elapsed, Integer statusCode, String error) {

    public static ProbeResult success(Duration elapsed) {
        return new ProbeResult(true, elapsed, null, null);
    }

    public static ProbeResult success(Duration elapsed, int statusCode) {
        return new ProbeResult(true, elapsed, statusCode, null);
    }

    public static ProbeResult failure(Duration elapsed, String error) {
        return new ProbeResult(false, elapsed, null, error);
    }

    public static ProbeResult failure(Duration elapsed, int statusCode, String error) {
        return new ProbeResult(false, elapsed, statusCode, error);
    }
}
