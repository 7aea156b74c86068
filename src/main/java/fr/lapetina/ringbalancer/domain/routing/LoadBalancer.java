package fr.lapetina.ringbalancer.domain.routing;

import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.model.AggregateStats;
import fr.lapetina.ringbalancer.domain.model.ErrorType;
import fr.lapetina.ringbalancer.domain.model.HealthStatus;
import fr.lapetina.ringbalancer.domain.model.Server;
import fr.lapetina.ringbalancer.domain.model.ServerStats;
import fr.lapetina.ringbalancer.domain.model.ServerStatus;
import fr.lapetina.ringbalancer.domain.ring.ConsistentHashRing;
import fr.lapetina.ringbalancer.infrastructure.health.HealthMonitor;
import fr.lapetina.ringbalancer.infrastructure.metrics.StatisticsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Answers "which server should serve key K right now".
 *
 * Selection walks the ring's candidates for the key, in ring order, and returns the
 * first one the health monitor reports HEALTHY. Routing never blocks on topology
 * changes: the ring is read through its published snapshot and health through
 * volatile reads.
 *
 * Topology changes are serialized. A server is registered with the statistics
 * collector and the health monitor before it becomes visible on the ring, and
 * leaves the ring before those records are discarded, so a selection never sees
 * a ring entry without its health and statistics records.
 */
public final class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    private final ConsistentHashRing ring;
    private final HealthMonitor healthMonitor;
    private final StatisticsCollector statistics;
    private final Map<String, Server> servers = new ConcurrentHashMap<>();
    private final ReentrantLock topologyLock = new ReentrantLock();

    public LoadBalancer(ConsistentHashRing ring, HealthMonitor healthMonitor, StatisticsCollector statistics) {
        this.ring = ring;
        this.healthMonitor = healthMonitor;
        this.statistics = statistics;
    }

    // ==================== TOPOLOGY ====================

    /**
     * Adds a server to the pool in health state UNKNOWN. It receives traffic once
     * a probe (or an operator) marks it HEALTHY.
     *
     * @throws LoadBalancerException INVALID_WEIGHT or DUPLICATE_SERVER; nothing is mutated, and
     *                               a server the ring refuses is rolled back out of every record
     */
    public void addServer(Server server) {
        ring.checkWeight(server.getId(), server.getWeight());
        topologyLock.lock();
        try {
            if (servers.containsKey(server.getId())) {
                throw LoadBalancerException.duplicateServer(server.getId());
            }
            statistics.register(server.getId());
            healthMonitor.register(server);
            servers.put(server.getId(), server);
            try {
                ring.addServer(server.getId(), server.getWeight());
            } catch (RuntimeException e) {
                servers.remove(server.getId());
                healthMonitor.deregister(server.getId());
                statistics.deregister(server.getId());
                log.warn("Server add rolled back: serverId={}, error={}", server.getId(), e.getMessage());
                throw e;
            }
            log.info("Server added: serverId={}, address={}:{}, weight={}, virtualNodes={}",
                    server.getId(), server.getHost(), server.getPort(), server.getWeight(),
                    server.getWeight() * ring.getBaseVirtualNodes());
        } finally {
            topologyLock.unlock();
        }
    }

    /**
     * Removes a server with all of its virtual nodes, health and statistics records.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public void removeServer(String serverId) {
        topologyLock.lock();
        try {
            if (!servers.containsKey(serverId)) {
                throw LoadBalancerException.serverNotFound(serverId);
            }
            ring.removeServer(serverId);
            servers.remove(serverId);
            healthMonitor.deregister(serverId);
            statistics.deregister(serverId);
            log.info("Server removed: serverId={}, remainingServers={}", serverId, servers.size());
        } finally {
            topologyLock.unlock();
        }
    }

    /**
     * Changes a server's weight, replacing its virtual nodes in a single ring update.
     * Health and statistics are kept.
     *
     * @throws LoadBalancerException SERVER_NOT_FOUND or INVALID_WEIGHT
     */
    public Server updateWeight(String serverId, int weight) {
        topologyLock.lock();
        try {
            Server current = servers.get(serverId);
            if (current == null) {
                throw LoadBalancerException.serverNotFound(serverId);
            }
            ring.checkWeight(serverId, weight);
            Server updated = current.withWeight(weight);
            ring.updateWeight(serverId, weight);
            servers.put(serverId, updated);
            log.info("Server weight updated: serverId={}, weight={} -> {}", serverId, current.getWeight(), weight);
            return updated;
        } finally {
            topologyLock.unlock();
        }
    }

    // ==================== ROUTING ====================

    /**
     * Selects a server for a key, trying every registered server before giving up.
     *
     * @throws LoadBalancerException NO_SERVERS_AVAILABLE or NO_HEALTHY_SERVER
     */
    public Server selectServer(String key) {
        return selectServer(key, ring.size());
    }

    /**
     * Selects the first HEALTHY server among the first {@code maxCandidates} distinct
     * servers met walking the ring from the key's position, and counts the request
     * against it.
     *
     * @throws LoadBalancerException NO_SERVERS_AVAILABLE or NO_HEALTHY_SERVER
     */
    public Server selectServer(String key, int maxCandidates) {
        List<String> candidates = ring.lookupCandidates(key, maxCandidates);
        if (candidates.isEmpty()) {
            if (ring.isEmpty()) {
                throw new LoadBalancerException(ErrorType.NO_SERVERS_AVAILABLE, "No servers available");
            }
            throw new LoadBalancerException(ErrorType.NO_HEALTHY_SERVER,
                    "No healthy server among 0 candidates for key");
        }

        Optional<Server> selected = firstHealthy(candidates);
        if (selected.isEmpty()) {
            log.debug("No healthy server: key={}, candidates={}", key, candidates);
            throw new LoadBalancerException(ErrorType.NO_HEALTHY_SERVER,
                    "No healthy server among " + candidates.size() + " candidates");
        }
        Server server = selected.get();
        statistics.recordRequest(server.getId());
        if (log.isTraceEnabled()) {
            log.trace("Server selected: key={}, serverId={}, primary={}", key, server.getId(), candidates.get(0));
        }
        return server;
    }

    /**
     * The server {@link #selectServer(String)} would pick for a key right now, without
     * counting a request and without failing when none is available.
     */
    public Optional<Server> peekServer(String key) {
        return firstHealthy(ring.lookupCandidates(key, ring.size()));
    }

    private Optional<Server> firstHealthy(List<String> candidates) {
        for (String candidate : candidates) {
            if (!healthMonitor.isHealthy(candidate)) {
                continue;
            }
            // Removed between the ring read and now
            Server server = servers.get(candidate);
            if (server != null) {
                return Optional.of(server);
            }
        }
        return Optional.empty();
    }

    /**
     * Ring candidates for a key, without health filtering or statistics.
     */
    public List<String> candidates(String key, int n) {
        return ring.lookupCandidates(key, n);
    }

    /**
     * Records the outcome of a request forwarded to a server.
     */
    public void recordSuccess(String serverId, Duration latency) {
        statistics.recordLatency(serverId, latency);
    }

    public void recordError(String serverId) {
        statistics.recordError(serverId);
    }

    public void recordError(String serverId, Duration latency) {
        statistics.recordError(serverId);
        statistics.recordLatency(serverId, latency);
    }

    // ==================== HEALTH OVERRIDES ====================

    public void markHealthy(String serverId) {
        requireServer(serverId);
        healthMonitor.markHealthy(serverId);
    }

    public void markUnhealthy(String serverId) {
        requireServer(serverId);
        healthMonitor.markUnhealthy(serverId);
    }

    // ==================== QUERIES ====================

    /**
     * Every registered server with its health and statistics, in ring insertion order.
     */
    public List<ServerStatus> getServerList() {
        List<ServerStatus> result = new ArrayList<>();
        for (String serverId : ring.serverIds()) {
            status(serverId).ifPresent(result::add);
        }
        return result;
    }

    /**
     * @throws LoadBalancerException SERVER_NOT_FOUND
     */
    public ServerStatus getServer(String serverId) {
        return status(serverId).orElseThrow(() -> LoadBalancerException.serverNotFound(serverId));
    }

    public Optional<Server> findServer(String serverId) {
        return Optional.ofNullable(servers.get(serverId));
    }

    public AggregateStats getAggregateStats() {
        int healthy = 0;
        int unhealthy = 0;
        int unknown = 0;
        long requests = 0;
        long errors = 0;
        for (ServerStatus status : getServerList()) {
            switch (status.health().state()) {
                case HEALTHY -> healthy++;
                case UNHEALTHY -> unhealthy++;
                case UNKNOWN -> unknown++;
            }
            requests += status.stats().requestCount();
            errors += status.stats().errorCount();
        }
        return new AggregateStats(healthy + unhealthy + unknown, healthy, unhealthy, unknown, requests, errors);
    }

    public int size() {
        return servers.size();
    }

    public boolean hasHealthyServer() {
        return ring.serverIds().stream().anyMatch(healthMonitor::isHealthy);
    }

    public ConsistentHashRing getRing() {
        return ring;
    }

    private Optional<ServerStatus> status(String serverId) {
        Server server = servers.get(serverId);
        if (server == null) {
            return Optional.empty();
        }
        HealthStatus health = healthMonitor.getStatus(serverId).orElse(HealthStatus.initial());
        ServerStats stats = statistics.get(serverId).orElse(ServerStats.EMPTY);
        return Optional.of(new ServerStatus(server, health, stats));
    }

    private void requireServer(String serverId) {
        if (!servers.containsKey(serverId)) {
            throw LoadBalancerException.serverNotFound(serverId);
        }
    }
}
