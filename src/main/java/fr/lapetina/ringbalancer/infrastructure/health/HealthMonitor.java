package fr.lapetina.ringbalancer.infrastructure.health;

import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.model.HealthState;
import fr.lapetina.ringbalancer.domain.model.HealthStatus;
import fr.lapetina.ringbalancer.domain.model.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background health monitor for backend servers.
 *
 * Each registered server gets its own fixed-delay probe task. Probe results drive
 * a per-server state machine:
 * <ul>
 *   <li>UNKNOWN -> HEALTHY on the first successful probe, UNHEALTHY on the first failed one</li>
 *   <li>HEALTHY -> UNHEALTHY after {@code retries} consecutive failures</li>
 *   <li>UNHEALTHY -> HEALTHY after a single success</li>
 * </ul>
 *
 * {@link #isHealthy(String)} is a volatile read. Probe I/O runs outside of any lock;
 * the record monitor is only held while the counters and the state are updated.
 */
public final class HealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    private final HealthProbe probe;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration timeout;
    private final int retries;
    private final Map<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    public HealthMonitor(HealthProbe probe, Duration checkInterval, Duration timeout, int retries) {
        if (retries < 1) {
            throw new IllegalArgumentException("Retries must be at least 1: " + retries);
        }
        if (checkInterval.isZero() || checkInterval.isNegative()) {
            throw new IllegalArgumentException("Check interval must be positive: " + checkInterval);
        }
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Probe timeout must be positive: " + timeout);
        }
        this.probe = probe;
        this.checkInterval = checkInterval;
        this.timeout = timeout;
        this.retries = retries;
        AtomicInteger threadCounter = new AtomicInteger();
        this.scheduler = Executors.newScheduledThreadPool(2, r -> {
            Thread t = new Thread(r, "health-checker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public HealthMonitor(HealthProbe probe) {
        this(probe, Duration.ofSeconds(10), Duration.ofSeconds(2), 3);
    }

    /**
     * Starts periodic probing of every registered server, and of servers registered later.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            records.values().forEach(this::schedule);
            log.info("Health monitor started: interval={}, timeout={}, retries={}, servers={}",
                    checkInterval, timeout, retries, records.size());
        }
    }

    // ==================== REGISTRATION ====================

    /**
     * Registers a server in state UNKNOWN.
     *
     * @throws LoadBalancerException DUPLICATE_SERVER
     */
    public void register(Server server) {
        HealthRecord record = new HealthRecord(server);
        if (records.putIfAbsent(server.getId(), record) != null) {
            throw LoadBalancerException.duplicateServer(server.getId());
        }
        log.debug("Server registered for health checks: serverId={}, probeType={}",
                server.getId(), server.getProbeType());
        if (running.get()) {
            schedule(record);
        }
    }

    /**
     * Deregisters a server. Future probes are cancelled; the result of a probe already
     * in flight is discarded when it completes.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public void deregister(String serverId) {
        HealthRecord record = records.remove(serverId);
        if (record == null) {
            throw LoadBalancerException.serverNotFound(serverId);
        }
        ScheduledFuture<?> task = record.task;
        if (task != null) {
            task.cancel(false);
        }
        log.debug("Server deregistered from health checks: serverId={}", serverId);
    }

    private void schedule(HealthRecord record) {
        synchronized (record) {
            if (record.task != null || records.get(record.server.getId()) != record) {
                return;
            }
            record.task = scheduler.scheduleWithFixedDelay(
                    () -> probeSafely(record),
                    0,
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
        }
    }

    private void probeSafely(HealthRecord record) {
        try {
            runProbe(record);
        } catch (Exception e) {
            // A throwing task would be silently descheduled
            log.error("Health probe scheduling failed: serverId={}", record.server.getId(), e);
        }
    }

    // ==================== PROBING ====================

    /**
     * Probes a server immediately, outside of its schedule.
     *
     * @return future completed with the state after the probe has been applied; if a
     *         probe is already in flight for the server, completed with the current state
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public CompletableFuture<HealthState> probeNow(String serverId) {
        return runProbe(requireRecord(serverId));
    }

    private CompletableFuture<HealthState> runProbe(HealthRecord record) {
        if (!record.probing.compareAndSet(false, true)) {
            log.debug("Probe still in flight, skipping: serverId={}", record.server.getId());
            return CompletableFuture.completedFuture(record.state);
        }

        long startNanos = System.nanoTime();
        CompletableFuture<ProbeResult> attempt;
        try {
            attempt = probe.probe(record.server, timeout);
        } catch (Exception e) {
            attempt = CompletableFuture.failedFuture(e);
        }

        return attempt
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, ex) -> {
                    try {
                        ProbeResult outcome = ex == null && result != null
                                ? result
                                : ProbeResult.failure(Duration.ofNanos(System.nanoTime() - startNanos), describe(ex));
                        return applyResult(record, outcome);
                    } finally {
                        record.probing.set(false);
                    }
                });
    }

    private String describe(Throwable ex) {
        if (ex == null) {
            return "Probe returned no result";
        }
        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof TimeoutException) {
            return "Probe timed out after " + timeout.toMillis() + "ms";
        }
        return cause.toString();
    }

    private HealthState applyResult(HealthRecord record, ProbeResult result) {
        String serverId = record.server.getId();
        if (records.get(serverId) != record) {
            log.debug("Discarding probe result for deregistered server: serverId={}", serverId);
            return record.state;
        }

        HealthState previous;
        HealthState current;
        int failures;
        synchronized (record) {
            previous = record.state;
            record.lastCheck = Instant.now();
            record.lastResponseTime = result.elapsed();
            record.lastError = result.healthy() ? null : result.error();

            if (result.healthy()) {
                record.consecutiveSuccesses++;
                record.consecutiveFailures = 0;
                if (!record.drained) {
                    record.state = HealthState.HEALTHY;
                }
            } else {
                record.consecutiveFailures++;
                record.consecutiveSuccesses = 0;
                if (previous == HealthState.UNKNOWN || record.consecutiveFailures >= retries) {
                    record.state = HealthState.UNHEALTHY;
                }
            }
            current = record.state;
            failures = record.consecutiveFailures;
        }

        if (previous != current) {
            if (current == HealthState.HEALTHY) {
                log.info("Server health changed: serverId={}, previousHealth={}, newHealth={}",
                        serverId, previous, current);
            } else {
                log.warn("Server health changed: serverId={}, previousHealth={}, newHealth={}, consecutiveFailures={}, error={}",
                        serverId, previous, current, failures, result.error());
            }
        } else if (!result.healthy()) {
            log.debug("Health probe failed: serverId={}, health={}, consecutiveFailures={}, error={}",
                    serverId, current, failures, result.error());
        }
        return current;
    }

    // ==================== MANUAL OVERRIDES ====================

    /**
     * Takes a server out of rotation until {@link #markHealthy(String)} is called.
     * Probes keep running and updating counters but no longer change the state.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public void markUnhealthy(String serverId) {
        HealthRecord record = requireRecord(serverId);
        HealthState previous;
        synchronized (record) {
            previous = record.state;
            record.drained = true;
            record.state = HealthState.UNHEALTHY;
        }
        log.info("Server drained: serverId={}, previousHealth={}", serverId, previous);
    }

    /**
     * Puts a server back in rotation, clearing a drain.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public void markHealthy(String serverId) {
        HealthRecord record = requireRecord(serverId);
        HealthState previous;
        synchronized (record) {
            previous = record.state;
            record.drained = false;
            record.consecutiveFailures = 0;
            record.state = HealthState.HEALTHY;
        }
        log.info("Server enabled: serverId={}, previousHealth={}", serverId, previous);
    }

    // ==================== READS ====================

    /**
     * Non-blocking snapshot read. Unregistered servers are never healthy.
     */
    public boolean isHealthy(String serverId) {
        HealthRecord record = records.get(serverId);
        return record != null && record.state == HealthState.HEALTHY;
    }

    /**
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public HealthState getState(String serverId) {
        return requireRecord(serverId).state;
    }

    public Optional<HealthStatus> getStatus(String serverId) {
        HealthRecord record = records.get(serverId);
        return record == null ? Optional.empty() : Optional.of(record.toStatus());
    }

    /**
     * Point-in-time copy of every server's health status.
     */
    public Map<String, HealthStatus> snapshot() {
        Map<String, HealthStatus> copy = new LinkedHashMap<>();
        records.forEach((id, record) -> copy.put(id, record.toStatus()));
        return Collections.unmodifiableMap(copy);
    }

    public boolean isRegistered(String serverId) {
        return records.containsKey(serverId);
    }

    public int size() {
        return records.size();
    }

    private HealthRecord requireRecord(String serverId) {
        HealthRecord record = records.get(serverId);
        if (record == null) {
            throw LoadBalancerException.serverNotFound(serverId);
        }
        return record;
    }

    @Override
    public void close() {
        running.set(false);
        records.values().forEach(record -> {
            ScheduledFuture<?> task = record.task;
            if (task != null) {
                task.cancel(false);
            }
        });
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Health monitor stopped");
    }

    /**
     * Mutable per-server health bookkeeping. {@code state} is volatile for lock-free
     * reads; everything else is guarded by the record's monitor.
     */
    private static final class HealthRecord {
        final Server server;
        final AtomicBoolean probing = new AtomicBoolean(false);

        volatile HealthState state = HealthState.UNKNOWN;
        volatile ScheduledFuture<?> task;

        int consecutiveFailures;
        int consecutiveSuccesses;
        Instant lastCheck;
        Duration lastResponseTime;
        String lastError;
        boolean drained;

        HealthRecord(Server server) {
            this.server = server;
        }

        synchronized HealthStatus toStatus() {
            return new HealthStatus(state, consecutiveFailures, consecutiveSuccesses,
                    lastCheck, lastResponseTime, lastError, drained);
        }
    }
}
