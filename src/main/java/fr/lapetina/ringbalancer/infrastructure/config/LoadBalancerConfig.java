package fr.lapetina.ringbalancer.infrastructure.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root configuration object for the load balancer.
 * Designed to be populated from YAML.
 */
public class LoadBalancerConfig {

    private ServerConfig server = new ServerConfig();
    private RingConfig ring = new RingConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private ProxyConfig proxy = new ProxyConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private List<BackendConfig> servers = new ArrayList<>();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public RingConfig getRing() { return ring; }
    public void setRing(RingConfig ring) { this.ring = ring; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public ProxyConfig getProxy() { return proxy; }
    public void setProxy(ProxyConfig proxy) { this.proxy = proxy; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public List<BackendConfig> getServers() { return servers; }
    public void setServers(List<BackendConfig> servers) { this.servers = servers; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int threads = 16;

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
    }

    /**
     * Hash ring configuration.
     */
    public static class RingConfig {
        private int virtualNodes = 100;
        private String hashFunction = "md5";

        public int getVirtualNodes() { return virtualNodes; }
        public void setVirtualNodes(int virtualNodes) { this.virtualNodes = virtualNodes; }

        public String getHashFunction() { return hashFunction; }
        public void setHashFunction(String hashFunction) { this.hashFunction = hashFunction; }
    }

    /**
     * Health check configuration. Per-server settings in {@link BackendConfig}
     * override the probe type, path and expected status.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 10000;
        private long timeoutMs = 2000;
        private int retries = 3;
        private String type = "http";
        private String path = "/health";
        private int expectedStatus = 200;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public int getRetries() { return retries; }
        public void setRetries(int retries) { this.retries = retries; }

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public int getExpectedStatus() { return expectedStatus; }
        public void setExpectedStatus(int expectedStatus) { this.expectedStatus = expectedStatus; }
    }

    /**
     * Request forwarding configuration.
     */
    public static class ProxyConfig {
        private long timeoutMs = 30000;
        private long connectTimeoutMs = 5000;

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "ring_lb";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }

    /**
     * Individual backend server configuration. Null health-check fields fall back
     * to the {@code healthCheck} section.
     */
    public static class BackendConfig {
        private String name;
        private String host;
        private int port;
        private int weight = 1;
        private String healthCheckType;
        private String healthCheckPath;
        private Integer expectedStatus;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public String getHealthCheckType() { return healthCheckType; }
        public void setHealthCheckType(String healthCheckType) { this.healthCheckType = healthCheckType; }

        public String getHealthCheckPath() { return healthCheckPath; }
        public void setHealthCheckPath(String healthCheckPath) { this.healthCheckPath = healthCheckPath; }

        public Integer getExpectedStatus() { return expectedStatus; }
        public void setExpectedStatus(Integer expectedStatus) { this.expectedStatus = expectedStatus; }

        /**
         * Server id: the configured name, or {@code host:port} when none is given.
         */
        public String resolveId() {
            return name != null && !name.isBlank() ? name : host + ":" + port;
        }
    }
}
