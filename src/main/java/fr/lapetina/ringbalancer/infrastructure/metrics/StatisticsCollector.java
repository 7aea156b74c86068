package fr.lapetina.ringbalancer.infrastructure.metrics;

import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.model.ServerStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.LongAdder;

/**
 * Per-server request, error and latency counters.
 *
 * Counters are independent atomics; no cross-server coordination is needed.
 * Recording for a server that is not registered (an outcome reported after the
 * server was removed) is silently ignored. Every counter is mirrored into a
 * Micrometer registry, tagged by server.
 */
public final class StatisticsCollector {

    private static final Logger log = LoggerFactory.getLogger(StatisticsCollector.class);

    private final MeterRegistry meterRegistry;
    private final String prefix;
    private final Map<String, Counters> counters = new ConcurrentHashMap<>();

    public StatisticsCollector(MeterRegistry meterRegistry, String prefix) {
        this.meterRegistry = meterRegistry;
        this.prefix = prefix;
    }

    public StatisticsCollector() {
        this(new SimpleMeterRegistry(), "ring_lb");
    }

    /**
     * Creates a zeroed record for a server.
     *
     * @throws LoadBalancerException DUPLICATE_SERVER
     */
    public void register(String serverId) {
        if (counters.putIfAbsent(serverId, new Counters(serverId)) != null) {
            throw LoadBalancerException.duplicateServer(serverId);
        }
    }

    /**
     * Discards a server's counters and removes its meters.
     */
    public void deregister(String serverId) {
        Counters removed = counters.remove(serverId);
        if (removed != null) {
            meterRegistry.remove(removed.requests);
            meterRegistry.remove(removed.errors);
            meterRegistry.remove(removed.responseTime);
            log.debug("Statistics discarded: serverId={}, requests={}, errors={}",
                    serverId, removed.requestCount.sum(), removed.errorCount.sum());
        }
    }

    public void recordRequest(String serverId) {
        Counters c = counters.get(serverId);
        if (c != null) {
            c.requestCount.increment();
            c.requests.increment();
        }
    }

    public void recordError(String serverId) {
        Counters c = counters.get(serverId);
        if (c != null) {
            c.errorCount.increment();
            c.errors.increment();
        }
    }

    public void recordLatency(String serverId, Duration latency) {
        Counters c = counters.get(serverId);
        if (c == null) {
            return;
        }
        long millis = Math.max(0, latency.toMillis());
        c.totalLatencyMs.add(millis);
        c.latencySamples.increment();
        c.lastLatencyMs.set(millis);
        c.responseTime.record(latency);
    }

    public Optional<ServerStats> get(String serverId) {
        Counters c = counters.get(serverId);
        return c == null ? Optional.empty() : Optional.of(c.toStats());
    }

    /**
     * Point-in-time copy of every server's counters. Never a live view.
     */
    public Map<String, ServerStats> snapshot() {
        Map<String, ServerStats> copy = new LinkedHashMap<>();
        counters.forEach((id, c) -> copy.put(id, c.toStats()));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isRegistered(String serverId) {
        return counters.containsKey(serverId);
    }

    private final class Counters {
        final LongAdder requestCount = new LongAdder();
        final LongAdder errorCount = new LongAdder();
        final LongAdder totalLatencyMs = new LongAdder();
        final LongAdder latencySamples = new LongAdder();
        final AtomicLong lastLatencyMs = new AtomicLong();

        final Counter requests;
        final Counter errors;
        final Timer responseTime;

        Counters(String serverId) {
            this.requests = Counter.builder(prefix + "_requests_total")
                    .description("Requests routed to a server")
                    .tag("server", serverId)
                    .register(meterRegistry);
            this.errors = Counter.builder(prefix + "_errors_total")
                    .description("Caller-reported errors per server")
                    .tag("server", serverId)
                    .register(meterRegistry);
            this.responseTime = Timer.builder(prefix + "_response_time")
                    .description("Backend response time")
                    .tag("server", serverId)
                    .publishPercentiles(0.5, 0.9, 0.99)
                    .register(meterRegistry);
        }

        ServerStats toStats() {
            long samples = latencySamples.sum();
            long total = totalLatencyMs.sum();
            double average = samples > 0 ? (double) total / samples : 0.0;
            return new ServerStats(requestCount.sum(), errorCount.sum(), average, lastLatencyMs.get(), samples);
        }
    }
}
