package fr.lapetina.ringbalancer.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Body of {@code PUT /api/servers/{id}/health}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HealthOverrideRequest {

    private Boolean healthy;

    public Boolean getHealthy() { return healthy; }
    public void setHealthy(Boolean healthy) { this.healthy = healthy; }
}
