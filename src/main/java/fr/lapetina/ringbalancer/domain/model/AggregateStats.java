package fr.lapetina.ringbalancer.domain.model;

/**
 * Pool-wide statistics.
 */
public record AggregateStats(
        int totalServers,
        int healthyServers,
        int unhealthyServers,
        int unknownServers,
        long totalRequests,
        long totalErrors
) {

    public double errorRate() {
        return totalRequests > 0 ? (double) totalErrors / totalRequests : 0.0;
    }
}
