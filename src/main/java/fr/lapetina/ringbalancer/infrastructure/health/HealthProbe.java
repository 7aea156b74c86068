package fr.lapetina.ringbalancer.infrastructure.health;

import fr.lapetina.ringbalancer.domain.model.Server;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Performs one health check attempt against a server.
 *
 * Implementations must not block the calling thread on network I/O. Transport
 * errors should be reported as a failed {@link ProbeResult}; the monitor also
 * treats an exceptionally completed future as a failure.
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * Starts a probe.
     *
     * @param server  server to check
     * @param timeout time allowed for the attempt
     * @return future completed with the outcome
     */
    CompletableFuture<ProbeResult> probe(Server server, Duration timeout);
}
