package fr.lapetina.ringbalancer.domain.hash;

import com.google.common.hash.Hashing;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Built-in hash algorithms, all producing unsigned 32-bit values.
 *
 * The algorithm is picked once, when the ring is built, from the
 * {@code ring.hashFunction} configuration value.
 */
public enum HashAlgorithm implements HashFunction {

    /** 32-bit FNV-1a. Fast, but clusters on keys that only differ in their last characters. */
    FNV1A("fnv1a") {
        @Override
        public long hash(byte[] data) {
            int hash = FNV_32_OFFSET_BASIS;
            for (byte b : data) {
                hash ^= (b & 0xFF);
                hash *= FNV_32_PRIME;
            }
            return Integer.toUnsignedLong(hash);
        }
    },

    /** Bernstein's hash * 33 + c, truncated to 32 bits. */
    DJB2("djb2") {
        @Override
        public long hash(byte[] data) {
            int hash = 5381;
            for (byte b : data) {
                hash = ((hash << 5) + hash) + (b & 0xFF);
            }
            return Integer.toUnsignedLong(hash);
        }
    },

    /** First four bytes of the MD5 digest, little endian. */
    @SuppressWarnings("deprecation")
    MD5("md5") {
        @Override
        public long hash(byte[] data) {
            return Integer.toUnsignedLong(Hashing.md5().hashBytes(data).asInt());
        }
    },

    /** First four bytes of the SHA-1 digest, little endian. */
    @SuppressWarnings("deprecation")
    SHA1("sha1") {
        @Override
        public long hash(byte[] data) {
            return Integer.toUnsignedLong(Hashing.sha1().hashBytes(data).asInt());
        }
    },

    CRC32("crc32") {
        @Override
        public long hash(byte[] data) {
            return Integer.toUnsignedLong(Hashing.crc32().hashBytes(data).asInt());
        }
    },

    /** MurmurHash3 x86 32-bit, seed 0. */
    MURMUR3("murmur3") {
        @Override
        public long hash(byte[] data) {
            return Integer.toUnsignedLong(Hashing.murmur3_32_fixed().hashBytes(data).asInt());
        }
    };

    private static final int FNV_32_OFFSET_BASIS = 0x811C9DC5;
    private static final int FNV_32_PRIME = 0x01000193;

    private final String configName;

    HashAlgorithm(String configName) {
        this.configName = configName;
    }

    /**
     * Name used in configuration files.
     */
    public String getConfigName() {
        return configName;
    }

    /**
     * Resolves an algorithm from its configuration name, case-insensitively.
     *
     * @throws IllegalArgumentException if no algorithm has that name
     */
    public static HashAlgorithm fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT).replace("-", "");
            for (HashAlgorithm algorithm : values()) {
                if (algorithm.configName.equals(normalized)) {
                    return algorithm;
                }
            }
        }
        throw new IllegalArgumentException("Hash function '" + name + "' not found. Available functions: "
                + availableNames());
    }

    public static List<String> availableNames() {
        return Arrays.stream(values()).map(HashAlgorithm::getConfigName).toList();
    }
}
