package fr.lapetina.ringbalancer;

import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.hash.HashAlgorithm;
import fr.lapetina.ringbalancer.domain.model.ProbeType;
import fr.lapetina.ringbalancer.domain.model.Server;
import fr.lapetina.ringbalancer.domain.ring.ConsistentHashRing;
import fr.lapetina.ringbalancer.domain.routing.LoadBalancer;
import fr.lapetina.ringbalancer.infrastructure.config.ConfigLoader;
import fr.lapetina.ringbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.ringbalancer.infrastructure.health.DispatchingHealthProbe;
import fr.lapetina.ringbalancer.infrastructure.health.HealthMonitor;
import fr.lapetina.ringbalancer.infrastructure.health.HealthProbe;
import fr.lapetina.ringbalancer.infrastructure.health.ProbeResult;
import fr.lapetina.ringbalancer.infrastructure.http.BackendHttpClient;
import fr.lapetina.ringbalancer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ringbalancer.infrastructure.metrics.StatisticsCollector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Factory for creating a fully-wired load balancer from configuration.
 * This is the primary entry point for obtaining a configured LoadBalancer.
 *
 * <p>Usage:
 * <pre>{@code
 * try (BalancerFactory factory = BalancerFactory.create("config.yaml").start()) {
 *     Server server = factory.getLoadBalancer().selectServer("client-42:/orders");
 *     // forward to server...
 * }
 * }</pre>
 */
public class BalancerFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BalancerFactory.class);

    private final ConfigLoader configLoader;
    private final LoadBalancerConfig config;
    private final MetricsRegistry metricsRegistry;
    private final StatisticsCollector statistics;
    private final HealthProbe probe;
    private final DispatchingHealthProbe ownedProbe;
    private final HealthMonitor healthMonitor;
    private final HashAlgorithm hashAlgorithm;
    private final ConsistentHashRing ring;
    private final LoadBalancer loadBalancer;
    private final BackendHttpClient backendClient;

    protected BalancerFactory(String configPath, HealthProbe probeOverride) {
        log.info("Initializing BalancerFactory from config: {}", configPath);

        // Load configuration
        this.configLoader = new ConfigLoader(configPath);
        this.config = configLoader.load();

        // Initialize metrics
        if (config.getMetrics().isEnabled()) {
            this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());
            this.statistics = new StatisticsCollector(metricsRegistry.getRegistry(), config.getMetrics().getPrefix());
        } else {
            this.metricsRegistry = null;
            this.statistics = new StatisticsCollector(new SimpleMeterRegistry(), config.getMetrics().getPrefix());
        }

        // Initialize health checking (allow probe override for testing)
        LoadBalancerConfig.HealthCheckConfig healthConfig = config.getHealthCheck();
        Duration probeTimeout = Duration.ofMillis(healthConfig.getTimeoutMs());
        if (probeOverride != null) {
            this.ownedProbe = null;
            this.probe = probeOverride;
        } else if (healthConfig.isEnabled()) {
            this.ownedProbe = new DispatchingHealthProbe(probeTimeout);
            this.probe = ownedProbe;
        } else {
            log.warn("Health checks disabled, every server is considered healthy");
            this.ownedProbe = null;
            this.probe = (server, timeout) -> CompletableFuture.completedFuture(ProbeResult.success(Duration.ZERO));
        }
        this.healthMonitor = new HealthMonitor(
                probe,
                Duration.ofMillis(healthConfig.getIntervalMs()),
                probeTimeout,
                healthConfig.getRetries()
        );

        // Build the ring
        this.hashAlgorithm = HashAlgorithm.fromName(config.getRing().getHashFunction());
        this.ring = new ConsistentHashRing(hashAlgorithm, config.getRing().getVirtualNodes());
        log.info("Using hash ring: hashFunction={}, virtualNodesPerWeight={}",
                hashAlgorithm.getConfigName(), config.getRing().getVirtualNodes());

        this.loadBalancer = new LoadBalancer(ring, healthMonitor, statistics);
        loadServers();

        this.backendClient = new BackendHttpClient(
                Duration.ofMillis(config.getProxy().getConnectTimeoutMs()),
                Duration.ofMillis(config.getProxy().getTimeoutMs())
        );

        if (metricsRegistry != null) {
            metricsRegistry.bind(loadBalancer);
        }

        // Register config change listener
        configLoader.addListener(this::onConfigChanged);

        log.info("BalancerFactory initialized with {} servers", loadBalancer.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static BalancerFactory create(String configPath) {
        return new BalancerFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static BalancerFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts health checking.
     */
    public BalancerFactory start() {
        healthMonitor.start();
        log.info("Load balancer started");
        return this;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public HealthMonitor getHealthMonitor() {
        return healthMonitor;
    }

    public StatisticsCollector getStatistics() {
        return statistics;
    }

    /**
     * @return null when metrics are disabled
     */
    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public BackendHttpClient getBackendClient() {
        return backendClient;
    }

    public HashAlgorithm getHashAlgorithm() {
        return hashAlgorithm;
    }

    public LoadBalancerConfig getConfig() {
        return config;
    }

    public ConfigLoader getConfigLoader() {
        return configLoader;
    }

    /**
     * Builds a domain server from its configuration entry, falling back to the
     * global health check settings.
     */
    public static Server toServer(LoadBalancerConfig.BackendConfig backend, LoadBalancerConfig.HealthCheckConfig defaults) {
        return Server.builder()
                .id(backend.resolveId())
                .host(backend.getHost())
                .port(backend.getPort())
                .weight(backend.getWeight())
                .probeType(ProbeType.fromName(backend.getHealthCheckType() != null
                        ? backend.getHealthCheckType()
                        : defaults.getType()))
                .healthCheckPath(backend.getHealthCheckPath() != null
                        ? backend.getHealthCheckPath()
                        : defaults.getPath())
                .expectedStatus(backend.getExpectedStatus() != null
                        ? backend.getExpectedStatus()
                        : defaults.getExpectedStatus())
                .build();
    }

    private void loadServers() {
        for (LoadBalancerConfig.BackendConfig backend : config.getServers()) {
            Server server = toServer(backend, config.getHealthCheck());
            loadBalancer.addServer(server);
            log.debug("Registered server: {}", server);
        }
    }

    /**
     * Reconciles the server pool with a reloaded configuration: servers missing
     * from it are removed, new ones added, and changed ones updated. A weight-only
     * change is applied in place; any other change replaces the server.
     */
    private void onConfigChanged(LoadBalancerConfig oldConfig, LoadBalancerConfig newConfig) {
        if (oldConfig == null) {
            return;
        }
        log.info("Configuration changed, applying updates...");

        if (requiresRestart(newConfig)) {
            log.warn("Ring settings changed, restart required to apply them: virtualNodes={} (running {}), "
                            + "hashFunction={} (running {})",
                    newConfig.getRing().getVirtualNodes(), ring.getBaseVirtualNodes(),
                    newConfig.getRing().getHashFunction(), hashAlgorithm.getConfigName());
        }

        Map<String, Server> desired = new LinkedHashMap<>();
        for (LoadBalancerConfig.BackendConfig backend : newConfig.getServers()) {
            Server server = toServer(backend, newConfig.getHealthCheck());
            desired.put(server.getId(), server);
        }

        int removed = 0;
        int added = 0;
        int updated = 0;

        for (String serverId : ring.serverIds()) {
            if (!desired.containsKey(serverId)) {
                removeQuietly(serverId);
                removed++;
            }
        }

        for (Server server : desired.values()) {
            Server current = loadBalancer.findServer(server.getId()).orElse(null);
            try {
                if (current == null) {
                    loadBalancer.addServer(server);
                    added++;
                } else if (sameEndpoint(current, server)) {
                    if (current.getWeight() != server.getWeight()) {
                        loadBalancer.updateWeight(server.getId(), server.getWeight());
                        updated++;
                    }
                } else {
                    removeQuietly(server.getId());
                    loadBalancer.addServer(server);
                    updated++;
                }
            } catch (LoadBalancerException e) {
                log.warn("Failed to apply server configuration: serverId={}, errorType={}, error={}",
                        server.getId(), e.getErrorType(), e.getMessage());
            }
        }

        log.info("Configuration updates applied: added={}, removed={}, updated={}", added, removed, updated);
    }

    /**
     * Whether the ring settings of a configuration differ from those the running
     * ring was built with. The ring is only rebuilt on restart.
     */
    public boolean requiresRestart(LoadBalancerConfig newConfig) {
        return newConfig.getRing().getVirtualNodes() != ring.getBaseVirtualNodes()
                || HashAlgorithm.fromName(newConfig.getRing().getHashFunction()) != hashAlgorithm;
    }

    private static boolean sameEndpoint(Server a, Server b) {
        return a.getHost().equals(b.getHost())
                && a.getPort() == b.getPort()
                && a.getProbeType() == b.getProbeType()
                && a.getHealthCheckPath().equals(b.getHealthCheckPath())
                && a.getExpectedStatus() == b.getExpectedStatus();
    }

    private void removeQuietly(String serverId) {
        try {
            loadBalancer.removeServer(serverId);
        } catch (LoadBalancerException e) {
            // Removed concurrently through the API
            log.debug("Server already removed: serverId={}", serverId);
        }
    }

    @Override
    public void close() {
        log.info("Shutting down BalancerFactory...");

        try {
            healthMonitor.close();
        } catch (Exception e) {
            log.warn("Error closing health monitor", e);
        }

        if (ownedProbe != null) {
            try {
                ownedProbe.close();
            } catch (Exception e) {
                log.warn("Error closing health probe", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("BalancerFactory shut down");
    }
}
