package fr.lapetina.ringbalancer.infrastructure.http;

import java.util.List;
import java.util.Map;

/**
 * A client request to forward to a backend, as received by the proxy.
 *
 * @param method      HTTP method
 * @param pathAndQuery raw path, with the query string if any
 * @param headers     request headers
 * @param body        request body, empty if none
 */
public record ProxyRequest(
        String method,
        String pathAndQuery,
        Map<String, List<String>> headers,
        byte[] body
) {
}
