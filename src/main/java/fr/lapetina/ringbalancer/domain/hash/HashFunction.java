package fr.lapetina.ringbalancer.domain.hash;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic mapping from a byte string to an unsigned integer in
 * {@code [0, 2^outputBits())}.
 *
 * Implementations must be thread-safe: the ring calls them from every routing
 * thread concurrently.
 */
@FunctionalInterface
public interface HashFunction {

    /**
     * Hashes the given bytes.
     *
     * @param data input bytes
     * @return unsigned hash value, always in {@code [0, 2^outputBits())}
     */
    long hash(byte[] data);

    /**
     * Width of the output domain in bits.
     */
    default int outputBits() {
        return 32;
    }

    /**
     * Hashes the UTF-8 encoding of a string.
     */
    default long hash(String key) {
        return hash(key.getBytes(StandardCharsets.UTF_8));
    }
}
