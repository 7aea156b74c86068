/**
 * Ring Balancer - Consistent-hashing load balancer with weighted virtual nodes.
 *
 * <p>This library routes keyed requests across a dynamic pool of backend servers. A key
 * keeps mapping to the same server while the pool is unchanged, adding or removing a
 * server only remaps a bounded share of keys, and unhealthy servers are skipped in ring
 * order.
 *
 * <h2>Key Components</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ringbalancer.BalancerFactory} - Main entry point for creating
 *       a fully-configured load balancer from YAML configuration</li>
 *   <li>{@link fr.lapetina.ringbalancer.RingBalancerApplication} - Standalone HTTP server
 *       with management API and request proxying</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * try (BalancerFactory factory = BalancerFactory.create("config.yaml").start()) {
 *     LoadBalancer loadBalancer = factory.getLoadBalancer();
 *
 *     Server server = loadBalancer.selectServer("10.0.0.7:/cart");
 *     // forward the request, then report the outcome
 *     loadBalancer.recordSuccess(server.getId(), Duration.ofMillis(12));
 * }
 * }</pre>
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Pluggable hash functions (MD5, SHA-1, CRC32, Murmur3, FNV-1a, DJB2)</li>
 *   <li>Weight-proportional virtual nodes</li>
 *   <li>HTTP and TCP health probes with debounced state transitions</li>
 *   <li>Configuration reload without restart</li>
 *   <li>Micrometer metrics with Prometheus export</li>
 * </ul>
 *
 * @see fr.lapetina.ringbalancer.BalancerFactory
 * @see fr.lapetina.ringbalancer.domain.routing.LoadBalancer
 */
package fr.lapetina.ringbalancer;
