/**
 * Hash functions placing virtual nodes and keys on the ring.
 *
 * <p>{@link fr.lapetina.ringbalancer.domain.hash.HashFunction} is the single seam the ring
 * depends on; {@link fr.lapetina.ringbalancer.domain.hash.HashAlgorithm} is the closed set of
 * implementations selectable from configuration. All built-in algorithms share a 32-bit
 * output domain.
 */
package fr.lapetina.ringbalancer.domain.hash;
