/**
 * Domain model classes representing core concepts in the load balancer.
 *
 * <p>This package contains immutable value objects shared by the ring, the health
 * monitor and the API layer.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ringbalancer.domain.model.Server} - Immutable backend server descriptor</li>
 *   <li>{@link fr.lapetina.ringbalancer.domain.model.HealthState} - Health states (UNKNOWN, HEALTHY, UNHEALTHY)</li>
 *   <li>{@link fr.lapetina.ringbalancer.domain.model.ServerStatus} - Server with health and statistics snapshots</li>
 *   <li>{@link fr.lapetina.ringbalancer.domain.model.ErrorType} - Categorized routing errors</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>Every class in this package is immutable. Mutable per-server state lives in
 * {@code HealthMonitor} and {@code StatisticsCollector}, which hand out copies of it as
 * {@code HealthStatus} and {@code ServerStats} records.
 *
 * @see fr.lapetina.ringbalancer.domain.model.Server
 */
package fr.lapetina.ringbalancer.domain.model;
