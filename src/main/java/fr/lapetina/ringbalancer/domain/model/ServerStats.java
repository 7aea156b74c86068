package fr.lapetina.ringbalancer.domain.model;

/**
 * Point-in-time copy of a server's request statistics.
 *
 * @param requestCount          requests routed to the server
 * @param errorCount            caller-reported errors
 * @param averageResponseTimeMs running mean of all latency samples, 0 if none
 * @param lastResponseTimeMs    most recent latency sample, 0 if none
 * @param latencySamples        number of latency samples recorded
 */
public record ServerStats(
        long requestCount,
        long errorCount,
        double averageResponseTimeMs,
        long lastResponseTimeMs,
        long latencySamples
) {

    public static final ServerStats EMPTY = new ServerStats(0, 0, 0.0, 0, 0);

    public double errorRate() {
        return requestCount > 0 ? (double) errorCount / requestCount : 0.0;
    }
}
