package fr.lapetina.ringbalancer.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ringbalancer.domain.model.HealthStatus;
import fr.lapetina.ringbalancer.domain.model.ServerStats;
import fr.lapetina.ringbalancer.domain.model.ServerStatus;

import java.time.Instant;
import java.util.Locale;

/**
 * API view of a server with its health and statistics.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ServerResponse {

    private String name;
    private String host;
    private int port;
    private int weight;

    @JsonProperty("virtual_nodes")
    private int virtualNodes;

    private String health;
    private boolean drained;

    @JsonProperty("health_check")
    private HealthCheck healthCheck;

    private Stats stats;

    // Getters and setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public int getPort() { return port; }
    public void setPort(int port) { this.port = port; }

    public int getWeight() { return weight; }
    public void setWeight(int weight) { this.weight = weight; }

    public int getVirtualNodes() { return virtualNodes; }
    public void setVirtualNodes(int virtualNodes) { this.virtualNodes = virtualNodes; }

    public String getHealth() { return health; }
    public void setHealth(String health) { this.health = health; }

    public boolean isDrained() { return drained; }
    public void setDrained(boolean drained) { this.drained = drained; }

    public HealthCheck getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheck healthCheck) { this.healthCheck = healthCheck; }

    public Stats getStats() { return stats; }
    public void setStats(Stats stats) { this.stats = stats; }

    /**
     * Creates from a domain ServerStatus.
     */
    public static ServerResponse fromServerStatus(ServerStatus status, int baseVirtualNodes) {
        ServerResponse api = new ServerResponse();
        api.setName(status.id());
        api.setHost(status.server().getHost());
        api.setPort(status.server().getPort());
        api.setWeight(status.server().getWeight());
        api.setVirtualNodes(status.server().getWeight() * baseVirtualNodes);

        HealthStatus health = status.health();
        api.setHealth(health.state().name());
        api.setDrained(health.drained());

        HealthCheck check = new HealthCheck();
        check.type = status.server().getProbeType().name().toLowerCase(Locale.ROOT);
        check.path = status.server().getHealthCheckPath();
        check.expectedStatus = status.server().getExpectedStatus();
        check.consecutiveFailures = health.consecutiveFailures();
        check.consecutiveSuccesses = health.consecutiveSuccesses();
        check.lastCheck = health.lastCheck();
        check.lastResponseTimeMs = health.lastResponseTime() != null ? health.lastResponseTime().toMillis() : null;
        check.lastError = health.lastError();
        api.setHealthCheck(check);

        api.setStats(Stats.from(status.stats()));
        return api;
    }

    /**
     * Health check bookkeeping of a server.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class HealthCheck {
        public String type;
        public String path;

        @JsonProperty("expected_status")
        public int expectedStatus;

        @JsonProperty("consecutive_failures")
        public int consecutiveFailures;

        @JsonProperty("consecutive_successes")
        public int consecutiveSuccesses;

        @JsonProperty("last_check")
        public Instant lastCheck;

        @JsonProperty("last_response_time_ms")
        public Long lastResponseTimeMs;

        @JsonProperty("last_error")
        public String lastError;
    }

    /**
     * Request statistics of a server.
     */
    public static class Stats {
        @JsonProperty("request_count")
        public long requestCount;

        @JsonProperty("error_count")
        public long errorCount;

        @JsonProperty("error_rate")
        public double errorRate;

        @JsonProperty("avg_response_time_ms")
        public double averageResponseTimeMs;

        @JsonProperty("last_response_time_ms")
        public long lastResponseTimeMs;

        public static Stats from(ServerStats stats) {
            Stats api = new Stats();
            api.requestCount = stats.requestCount();
            api.errorCount = stats.errorCount();
            api.errorRate = stats.errorRate();
            api.averageResponseTimeMs = stats.averageResponseTimeMs();
            api.lastResponseTimeMs = stats.lastResponseTimeMs();
            return api;
        }
    }
}
