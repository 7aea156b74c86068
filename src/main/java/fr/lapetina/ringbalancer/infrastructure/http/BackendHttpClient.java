package fr.lapetina.ringbalancer.infrastructure.http;

import fr.lapetina.ringbalancer.domain.model.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP client forwarding proxied requests to backend servers.
 *
 * Uses java.net.http.HttpClient. Hop-by-hop headers and headers the JDK client
 * manages itself are not forwarded in either direction.
 */
public class BackendHttpClient {

    private static final Logger log = LoggerFactory.getLogger(BackendHttpClient.class);

    private static final Set<String> SKIPPED_HEADERS = Set.of(
            "connection", "content-length", "date", "expect", "from", "host", "http2-settings", "keep-alive",
            "proxy-connection", "te", "trailer", "transfer-encoding", "upgrade", "via", "warning"
    );

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public BackendHttpClient(Duration connectTimeout, Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NEVER)
                .build();
    }

    public BackendHttpClient() {
        this(Duration.ofSeconds(5), Duration.ofSeconds(30));
    }

    /**
     * Forwards a request to a server.
     *
     * @return future completed with the backend's response, or with a
     *         {@link ProxyResponse#failure} when the backend could not be reached;
     *         never completed exceptionally
     */
    public CompletableFuture<ProxyResponse> forward(Server server, ProxyRequest request) {
        long startNanos = System.nanoTime();
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(server, request);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to build forwarded request: serverId={}, path={}, error={}",
                    server.getId(), request.pathAndQuery(), e.getMessage());
            return CompletableFuture.completedFuture(ProxyResponse.failure(elapsed(startNanos), e.getMessage()));
        }

        log.debug("Forwarding request: serverId={}, method={}, uri={}",
                server.getId(), request.method(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(response -> {
                    Duration latency = elapsed(startNanos);
                    log.debug("Backend responded: serverId={}, status={}, latencyMs={}",
                            server.getId(), response.statusCode(), latency.toMillis());
                    return new ProxyResponse(response.statusCode(), copyHeaders(response.headers().map()),
                            response.body(), latency, null);
                })
                .exceptionally(ex -> handleException(server, request, ex, elapsed(startNanos)));
    }

    private HttpRequest buildHttpRequest(Server server, ProxyRequest request) {
        String path = request.pathAndQuery().startsWith("/") ? request.pathAndQuery() : "/" + request.pathAndQuery();
        URI uri = URI.create(server.getBaseUrl() + path);

        HttpRequest.BodyPublisher body = request.body() == null || request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .method(request.method(), body);

        request.headers().forEach((name, values) -> {
            if (!SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT))) {
                values.forEach(value -> builder.header(name, value));
            }
        });
        return builder.build();
    }

    private ProxyResponse handleException(Server server, ProxyRequest request, Throwable ex, Duration latency) {
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();

        if (cause instanceof HttpConnectTimeoutException) {
            log.warn("Backend connect timeout: serverId={}, path={}, error={}",
                    server.getId(), request.pathAndQuery(), message);
        } else if (cause instanceof HttpTimeoutException) {
            log.warn("Backend request timeout: serverId={}, path={}, latencyMs={}",
                    server.getId(), request.pathAndQuery(), latency.toMillis());
        } else if (cause instanceof IOException) {
            log.warn("Backend connection error: serverId={}, path={}, errorType={}, error={}",
                    server.getId(), request.pathAndQuery(), cause.getClass().getSimpleName(), message);
        } else {
            log.error("Forwarding failed unexpectedly: serverId={}, path={}", server.getId(), request.pathAndQuery(), ex);
        }
        return ProxyResponse.failure(latency, message);
    }

    private static Map<String, List<String>> copyHeaders(Map<String, List<String>> headers) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        headers.forEach((name, values) -> {
            if (!SKIPPED_HEADERS.contains(name.toLowerCase(Locale.ROOT)) && !name.startsWith(":")) {
                copy.put(name, values);
            }
        });
        return copy;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
