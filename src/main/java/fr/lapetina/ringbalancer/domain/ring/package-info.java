/**
 * Consistent hash ring with weighted virtual nodes.
 *
 * <h2>Key Classes</h2>
 * <ul>
 *   <li>{@link fr.lapetina.ringbalancer.domain.ring.ConsistentHashRing} - Sorted ring, key lookup and candidate walk</li>
 *   <li>{@link fr.lapetina.ringbalancer.domain.ring.VirtualNode} - One ring position of a physical server</li>
 * </ul>
 *
 * <h2>Collisions</h2>
 * <p>Two virtual nodes with the same hash value are both kept. They are ordered by the
 * insertion sequence of their server, then by server id, so the owner of a contested
 * position never depends on iteration order.
 *
 * <h2>Concurrency</h2>
 * <p>Lookups read an immutable snapshot without locking. Mutations are serialized and
 * publish a complete new snapshot.
 */
package fr.lapetina.ringbalancer.domain.ring;
