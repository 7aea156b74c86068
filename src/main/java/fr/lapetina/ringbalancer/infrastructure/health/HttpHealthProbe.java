package fr.lapetina.ringbalancer.infrastructure.health;

import fr.lapetina.ringbalancer.domain.model.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP health probe: GET on the server's health check path.
 *
 * Uses java.net.http.HttpClient for non-blocking I/O. The server is healthy when it
 * answers with its expected status code.
 */
public final class HttpHealthProbe implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpHealthProbe.class);

    private final HttpClient httpClient;

    public HttpHealthProbe(Duration connectTimeout) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    public HttpHealthProbe() {
        this(Duration.ofSeconds(2));
    }

    @Override
    public CompletableFuture<ProbeResult> probe(Server server, Duration timeout) {
        URI uri = URI.create(server.getBaseUrl() + server.getHealthCheckPath());

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(timeout)
                .GET()
                .build();

        long startNanos = System.nanoTime();
        log.debug("HTTP probe started: serverId={}, uri={}", server.getId(), uri);

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
                    int status = response.statusCode();
                    if (status == server.getExpectedStatus()) {
                        log.debug("HTTP probe passed: serverId={}, status={}, latencyMs={}",
                                server.getId(), status, elapsed.toMillis());
                        return ProbeResult.success(elapsed, status);
                    }
                    log.debug("HTTP probe failed: serverId={}, status={}, expected={}",
                            server.getId(), status, server.getExpectedStatus());
                    return ProbeResult.failure(elapsed, status,
                            "Unexpected status code: got " + status + ", expected " + server.getExpectedStatus());
                })
                .exceptionally(ex -> {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    log.debug("HTTP probe error: serverId={}, error={}", server.getId(), cause.toString());
                    return ProbeResult.failure(Duration.ofNanos(System.nanoTime() - startNanos), cause.toString());
                });
    }
}
