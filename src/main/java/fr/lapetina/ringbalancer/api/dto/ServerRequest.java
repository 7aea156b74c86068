package fr.lapetina.ringbalancer.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ringbalancer.domain.model.ProbeType;
import fr.lapetina.ringbalancer.domain.model.Server;

/**
 * Body of {@code POST /api/servers} and {@code PUT /api/servers/{id}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ServerRequest {

    private String name;
    private String host;
    private Integer port;
    private Integer weight;

    @JsonProperty("health_check_type")
    private String healthCheckType;

    @JsonProperty("health_check_path")
    private String healthCheckPath;

    @JsonProperty("expected_status")
    private Integer expectedStatus;

    // Getters and setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }

    public Integer getWeight() { return weight; }
    public void setWeight(Integer weight) { this.weight = weight; }

    public String getHealthCheckType() { return healthCheckType; }
    public void setHealthCheckType(String healthCheckType) { this.healthCheckType = healthCheckType; }

    public String getHealthCheckPath() { return healthCheckPath; }
    public void setHealthCheckPath(String healthCheckPath) { this.healthCheckPath = healthCheckPath; }

    public Integer getExpectedStatus() { return expectedStatus; }
    public void setExpectedStatus(Integer expectedStatus) { this.expectedStatus = expectedStatus; }

    /**
     * Converts to a domain Server, applying the given health check defaults.
     *
     * @throws IllegalArgumentException if host or port is missing or invalid
     */
    public Server toServer(ProbeType defaultProbeType, String defaultPath, int defaultExpectedStatus) {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("Field 'host' is required");
        }
        if (port == null) {
            throw new IllegalArgumentException("Field 'port' is required");
        }
        return Server.builder()
                .id(name)
                .host(host)
                .port(port)
                .weight(weight != null ? weight : Server.DEFAULT_WEIGHT)
                .probeType(healthCheckType != null ? ProbeType.fromName(healthCheckType) : defaultProbeType)
                .healthCheckPath(healthCheckPath != null ? healthCheckPath : defaultPath)
                .expectedStatus(expectedStatus != null ? expectedStatus : defaultExpectedStatus)
                .build();
    }
}
