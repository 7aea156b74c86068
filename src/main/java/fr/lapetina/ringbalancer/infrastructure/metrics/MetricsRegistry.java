package fr.lapetina.ringbalancer.infrastructure.metrics;

import fr.lapetina.ringbalancer.domain.model.HealthState;
import fr.lapetina.ringbalancer.domain.model.ServerStatus;
import fr.lapetina.ringbalancer.domain.routing.LoadBalancer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.MultiGauge;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Pool gauges (servers, healthy servers, virtual nodes)
 * - Per-server health and virtual node gauges
 * - Routing failure counters by error type
 * - JVM and system metrics
 * - Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Counter> routingFailures = new ConcurrentHashMap<>();

    private volatile LoadBalancer loadBalancer;
    private MultiGauge serverHealth;
    private MultiGauge serverVirtualNodes;

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("ring_lb");
    }

    /**
     * Exposes the pool of a load balancer. Per-server gauges are refreshed on every
     * {@link #scrape()}, so servers added or removed at runtime show up without
     * further registration.
     */
    public void bind(LoadBalancer loadBalancer) {
        this.loadBalancer = loadBalancer;

        Gauge.builder(prefix + "_servers", loadBalancer, lb -> lb.getAggregateStats().totalServers())
                .description("Number of registered servers")
                .register(registry);

        Gauge.builder(prefix + "_healthy_servers", loadBalancer, lb -> lb.getAggregateStats().healthyServers())
                .description("Number of servers eligible for routing")
                .register(registry);

        Gauge.builder(prefix + "_ring_virtual_nodes", loadBalancer, lb -> lb.getRing().virtualNodeCount())
                .description("Number of virtual nodes on the hash ring")
                .register(registry);

        serverHealth = MultiGauge.builder(prefix + "_server_health")
                .description("Server health state (0=UNHEALTHY, 1=UNKNOWN, 2=HEALTHY)")
                .register(registry);

        serverVirtualNodes = MultiGauge.builder(prefix + "_server_virtual_nodes")
                .description("Virtual nodes owned by a server")
                .register(registry);

        refresh();
    }

    /**
     * Increments the routing failure counter for an error type.
     */
    public void incrementRoutingFailure(String errorType) {
        routingFailures.computeIfAbsent(errorType, k ->
                Counter.builder(prefix + "_routing_failures_total")
                        .description("Requests that could not be routed")
                        .tag("type", errorType)
                        .register(registry)
        ).increment();
    }

    private void refresh() {
        LoadBalancer lb = loadBalancer;
        if (lb == null) {
            return;
        }
        List<ServerStatus> servers = lb.getServerList();
        int baseVirtualNodes = lb.getRing().getBaseVirtualNodes();

        List<MultiGauge.Row<?>> healthRows = servers.stream()
                .<MultiGauge.Row<?>>map(s -> MultiGauge.Row.of(Tags.of("server", s.id()), healthValue(s.health().state())))
                .collect(Collectors.toList());
        List<MultiGauge.Row<?>> virtualNodeRows = servers.stream()
                .<MultiGauge.Row<?>>map(s -> MultiGauge.Row.of(Tags.of("server", s.id()),
                        s.server().getWeight() * baseVirtualNodes))
                .collect(Collectors.toList());

        serverHealth.register(healthRows, true);
        serverVirtualNodes.register(virtualNodeRows, true);
    }

    private static int healthValue(HealthState state) {
        return switch (state) {
            case HEALTHY -> 2;
            case UNKNOWN -> 1;
            case UNHEALTHY -> 0;
        };
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        refresh();
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
