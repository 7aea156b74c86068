package fr.lapetina.ringbalancer.domain.model;

/**
 * A registered server together with its health and statistics snapshots.
 */
public record ServerStatus(Server server, HealthStatus health, ServerStats stats) {

    public String id() {
        return server.getId();
    }

    public boolean isHealthy() {
        return health.isHealthy();
    }
}
