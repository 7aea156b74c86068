package fr.lapetina.ringbalancer.infrastructure.http;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Outcome of forwarding a request to a backend.
 *
 * A response from the backend, whatever its status, is a successful forward.
 * {@code error} is set only when no response could be obtained.
 */
public record ProxyResponse(
        int statusCode,
        Map<String, List<String>> headers,
        byte[] body,
        Duration latency,
        String error
) {

    public static ProxyResponse failure(Duration latency, String error) {
        return new ProxyResponse(502, Map.of(), new byte[0], latency, error);
    }

    public boolean isForwarded() {
        return error == null;
    }

    /**
     * True when the backend answered with a server error, or did not answer at all.
     */
    public boolean isBackendError() {
        return !isForwarded() || statusCode >= 500;
    }
}
