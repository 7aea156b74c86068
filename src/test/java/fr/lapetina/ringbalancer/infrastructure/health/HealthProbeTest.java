package fr.lapetina.ringbalancer.infrastructure.health;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.ringbalancer.domain.model.ProbeType;
import fr.lapetina.ringbalancer.domain.model.Server;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class HealthProbeTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(2);

    private HttpServer backend;
    private DispatchingHealthProbe probe;

    @BeforeEach
    void setUp() throws IOException {
        backend = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        backend.createContext("/health", exchange -> {
            exchange.sendResponseHeaders(200, -1);
            exchange.close();
        });
        backend.createContext("/degraded", exchange -> {
            exchange.sendResponseHeaders(503, -1);
            exchange.close();
        });
        backend.start();
        probe = new DispatchingHealthProbe(Duration.ofSeconds(1));
    }

    @AfterEach
    void tearDown() {
        backend.stop(0);
        probe.close();
    }

    private Server server(ProbeType type, int port, String path) {
        return Server.builder()
                .id("probed")
                .host("127.0.0.1")
                .port(port)
                .probeType(type)
                .healthCheckPath(path)
                .build();
    }

    private static int closedPort() throws IOException {
        try (ServerSocket socket = new ServerSocket(0)) {
            return socket.getLocalPort();
        }
    }

    private ProbeResult run(Server server) throws Exception {
        return probe.probe(server, TIMEOUT).get(5, TimeUnit.SECONDS);
    }

    @Nested
    @DisplayName("HTTP probe")
    class HttpProbeTests {

        @Test
        @DisplayName("should succeed on the expected status")
        void shouldSucceed() throws Exception {
            ProbeResult result = run(server(ProbeType.HTTP, backend.getAddress().getPort(), "/health"));

            assertThat(result.healthy()).isTrue();
            assertThat(result.statusCode()).isEqualTo(200);
            assertThat(result.error()).isNull();
        }

        @Test
        @DisplayName("should fail on any other status")
        void shouldFailOnUnexpectedStatus() throws Exception {
            ProbeResult result = run(server(ProbeType.HTTP, backend.getAddress().getPort(), "/degraded"));

            assertThat(result.healthy()).isFalse();
            assertThat(result.statusCode()).isEqualTo(503);
            assertThat(result.error()).contains("503");
        }

        @Test
        @DisplayName("should report connection errors as a failed result")
        void shouldFailOnConnectionError() throws Exception {
            ProbeResult result = run(server(ProbeType.HTTP, closedPort(), "/health"));

            assertThat(result.healthy()).isFalse();
            assertThat(result.error()).isNotBlank();
        }
    }

    @Nested
    @DisplayName("TCP probe")
    class TcpProbeTests {

        @Test
        @DisplayName("should succeed when a connection opens")
        void shouldSucceed() throws Exception {
            ProbeResult result = run(server(ProbeType.TCP, backend.getAddress().getPort(), "/ignored"));

            assertThat(result.healthy()).isTrue();
            assertThat(result.statusCode()).isNull();
        }

        @Test
        @DisplayName("should fail when the port is closed")
        void shouldFailOnClosedPort() throws Exception {
            ProbeResult result = run(server(ProbeType.TCP, closedPort(), "/ignored"));

            assertThat(result.healthy()).isFalse();
            assertThat(result.error()).isNotBlank();
        }
    }
}
