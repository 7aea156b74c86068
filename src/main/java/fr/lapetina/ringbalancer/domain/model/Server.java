package fr.lapetina.ringbalancer.domain.model;

import java.net.URI;
import java.util.Objects;

/**
 * Represents a backend server in the pool.
 *
 * Immutable: health and statistics are tracked by the health monitor and the
 * statistics collector, keyed by {@link #getId()}.
 */
public final class Server {

    public static final int DEFAULT_WEIGHT = 1;

    private final String id;
    private final String host;
    private final int port;
    private final int weight;
    private final ProbeType probeType;
    private final String healthCheckPath;
    private final int expectedStatus;

    private Server(Builder builder) {
        this.host = Objects.requireNonNull(builder.host, "Host is required");
        if (builder.port < 1 || builder.port > 65535) {
            throw new IllegalArgumentException("Port must be between 1 and 65535: " + builder.port);
        }
        this.port = builder.port;
        this.id = builder.id != null && !builder.id.isBlank() ? builder.id : host + ":" + port;
        this.weight = builder.weight;
        this.probeType = Objects.requireNonNull(builder.probeType, "Probe type is required");
        this.healthCheckPath = builder.healthCheckPath.startsWith("/")
                ? builder.healthCheckPath
                : "/" + builder.healthCheckPath;
        this.expectedStatus = builder.expectedStatus;
    }

    public String getId() {
        return id;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getWeight() {
        return weight;
    }

    public ProbeType getProbeType() {
        return probeType;
    }

    public String getHealthCheckPath() {
        return healthCheckPath;
    }

    public int getExpectedStatus() {
        return expectedStatus;
    }

    public URI getBaseUrl() {
        return URI.create("http://" + host + ":" + port);
    }

    /**
     * Returns a copy of this server with a different weight.
     */
    public Server withWeight(int newWeight) {
        return toBuilder().weight(newWeight).build();
    }

    public Builder toBuilder() {
        return builder()
                .id(id)
                .host(host)
                .port(port)
                .weight(weight)
                .probeType(probeType)
                .healthCheckPath(healthCheckPath)
                .expectedStatus(expectedStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Server that = (Server) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Server{" +
                "id='" + id + '\'' +
                ", address=" + host + ":" + port +
                ", weight=" + weight +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String host;
        private int port;
        private int weight = DEFAULT_WEIGHT;
        private ProbeType probeType = ProbeType.HTTP;
        private String healthCheckPath = "/health";
        private int expectedStatus = 200;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder probeType(ProbeType probeType) {
            this.probeType = probeType;
            return this;
        }

        public Builder healthCheckPath(String path) {
            this.healthCheckPath = path;
            return this;
        }

        public Builder expectedStatus(int status) {
            this.expectedStatus = status;
            return this;
        }

        public Server build() {
            return new Server(this);
        }
    }
}
