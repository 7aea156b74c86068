package fr.lapetina.ringbalancer.domain.model;

import java.util.Locale;

/**
 * How a server's health is probed.
 *
 * HTTP: GET on the health check path, healthy on the expected status code
 * TCP: healthy when a connection can be opened
 */
public enum ProbeType {
    HTTP,
    TCP;

    /**
     * Parses a configuration value such as {@code "http"} or {@code "tcp"}.
     */
    public static ProbeType fromName(String name) {
        if (name == null || name.isBlank()) {
            return HTTP;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown health check type: " + name + ". Available: http, tcp", e);
        }
    }
}
