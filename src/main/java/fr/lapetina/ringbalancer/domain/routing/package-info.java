/**
 * Server selection on top of the hash ring.
 *
 * <p>{@link fr.lapetina.ringbalancer.domain.routing.LoadBalancer} ties the ring, the health
 * monitor and the statistics collector together: it owns the server pool, keeps the three
 * in step on topology changes, and answers selections with failover in ring order.
 */
package fr.lapetina.ringbalancer.domain.routing;
