package fr.lapetina.ringbalancer.domain.hash;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HashAlgorithmTest {

    @Nested
    @DisplayName("Known values")
    class KnownValueTests {

        @Test
        @DisplayName("should match FNV-1a reference values")
        void shouldMatchFnv1a() {
            assertThat(HashAlgorithm.FNV1A.hash("")).isEqualTo(0x811c9dc5L);
            assertThat(HashAlgorithm.FNV1A.hash("a")).isEqualTo(0xe40c292cL);
            assertThat(HashAlgorithm.FNV1A.hash("hello")).isEqualTo(0x4f9f2cabL);
            assertThat(HashAlgorithm.FNV1A.hash("123456789")).isEqualTo(0xbb86b11cL);
        }

        @Test
        @DisplayName("should match djb2 reference values")
        void shouldMatchDjb2() {
            assertThat(HashAlgorithm.DJB2.hash("")).isEqualTo(5381L);
            assertThat(HashAlgorithm.DJB2.hash("a")).isEqualTo(0x2b606L);
            assertThat(HashAlgorithm.DJB2.hash("hello")).isEqualTo(0xf923099L);
            assertThat(HashAlgorithm.DJB2.hash("123456789")).isEqualTo(0x35cdbb82L);
        }

        @Test
        @DisplayName("should take the first four digest bytes little endian for md5 and sha1")
        void shouldTruncateDigests() {
            assertThat(HashAlgorithm.MD5.hash("")).isEqualTo(0xd98c1dd4L);
            assertThat(HashAlgorithm.MD5.hash("hello")).isEqualTo(0x2a40415dL);
            assertThat(HashAlgorithm.SHA1.hash("a")).isEqualTo(0x37e4f786L);
            assertThat(HashAlgorithm.SHA1.hash("123456789")).isEqualTo(0x1dbcc3f7L);
        }

        @Test
        @DisplayName("should match the CRC-32 check value")
        void shouldMatchCrc32() {
            assertThat(HashAlgorithm.CRC32.hash("")).isZero();
            assertThat(HashAlgorithm.CRC32.hash("123456789")).isEqualTo(0xcbf43926L);
        }

        @Test
        @DisplayName("should match murmur3 x86 32-bit with seed 0")
        void shouldMatchMurmur3() {
            assertThat(HashAlgorithm.MURMUR3.hash("")).isZero();
            assertThat(HashAlgorithm.MURMUR3.hash("hello")).isEqualTo(0x248bfa47L);
        }

        @Test
        @DisplayName("should hash strings as their UTF-8 bytes")
        void shouldHashUtf8() {
            String key = "clé-ü";
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                assertThat(algorithm.hash(key))
                        .isEqualTo(algorithm.hash(key.getBytes(StandardCharsets.UTF_8)));
            }
        }
    }

    @Nested
    @DisplayName("Output domain")
    class OutputDomainTests {

        @Test
        @DisplayName("should stay within unsigned 32-bit range")
        void shouldStayIn32Bits() {
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                assertThat(algorithm.outputBits()).isEqualTo(32);
                for (int i = 0; i < 1000; i++) {
                    long value = algorithm.hash("key-" + i);
                    assertThat(value).isBetween(0L, 0xFFFFFFFFL);
                }
            }
        }

        @Test
        @DisplayName("should be deterministic")
        void shouldBeDeterministic() {
            for (HashAlgorithm algorithm : HashAlgorithm.values()) {
                assertThat(algorithm.hash("server-1:42")).isEqualTo(algorithm.hash("server-1:42"));
            }
        }
    }

    @Nested
    @DisplayName("Name resolution")
    class NameTests {

        @Test
        @DisplayName("should resolve names case-insensitively")
        void shouldResolveIgnoringCase() {
            assertThat(HashAlgorithm.fromName("MD5")).isEqualTo(HashAlgorithm.MD5);
            assertThat(HashAlgorithm.fromName(" sha1 ")).isEqualTo(HashAlgorithm.SHA1);
            assertThat(HashAlgorithm.fromName("FNV-1a")).isEqualTo(HashAlgorithm.FNV1A);
            assertThat(HashAlgorithm.fromName("murmur3")).isEqualTo(HashAlgorithm.MURMUR3);
        }

        @Test
        @DisplayName("should reject unknown names and list the available ones")
        void shouldRejectUnknown() {
            assertThatThrownBy(() -> HashAlgorithm.fromName("xxhash"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("xxhash")
                    .hasMessageContaining("md5");
            assertThatThrownBy(() -> HashAlgorithm.fromName(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should list every algorithm")
        void shouldListAll() {
            assertThat(HashAlgorithm.availableNames())
                    .containsExactly("fnv1a", "djb2", "md5", "sha1", "crc32", "murmur3");
        }
    }
}
