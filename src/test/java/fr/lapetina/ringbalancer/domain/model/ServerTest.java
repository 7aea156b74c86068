package fr.lapetina.ringbalancer.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ServerTest {

    @Test
    @DisplayName("should create server with builder")
    void shouldCreateServerWithBuilder() {
        Server server = Server.builder()
                .id("web-1")
                .host("10.0.0.5")
                .port(8081)
                .weight(2)
                .probeType(ProbeType.TCP)
                .build();

        assertThat(server.getId()).isEqualTo("web-1");
        assertThat(server.getWeight()).isEqualTo(2);
        assertThat(server.getProbeType()).isEqualTo(ProbeType.TCP);
        assertThat(server.getBaseUrl().toString()).isEqualTo("http://10.0.0.5:8081");
        assertThat(server.getHealthCheckPath()).isEqualTo("/health");
        assertThat(server.getExpectedStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("should derive the id from host and port")
    void shouldDeriveId() {
        Server server = Server.builder().host("10.0.0.5").port(8081).build();

        assertThat(server.getId()).isEqualTo("10.0.0.5:8081");
        assertThat(server.getWeight()).isEqualTo(Server.DEFAULT_WEIGHT);
    }

    @Test
    @DisplayName("should normalize the health check path")
    void shouldNormalizePath() {
        Server server = Server.builder().host("h").port(1).healthCheckPath("status").build();

        assertThat(server.getHealthCheckPath()).isEqualTo("/status");
    }

    @Test
    @DisplayName("should reject out of range ports")
    void shouldRejectInvalidPort() {
        assertThatThrownBy(() -> Server.builder().host("h").port(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Server.builder().host("h").port(65536).build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should keep identity when the weight changes")
    void shouldCopyWithWeight() {
        Server server = Server.builder().id("web-1").host("h").port(80).build();
        Server heavier = server.withWeight(5);

        assertThat(heavier.getWeight()).isEqualTo(5);
        assertThat(heavier).isEqualTo(server);
        assertThat(heavier.getHost()).isEqualTo("h");
    }
}
