package fr.lapetina.ringbalancer.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ringbalancer.domain.hash.HashAlgorithm;
import fr.lapetina.ringbalancer.domain.model.Server;
import fr.lapetina.ringbalancer.domain.ring.ConsistentHashRing;
import fr.lapetina.ringbalancer.domain.routing.LoadBalancer;
import fr.lapetina.ringbalancer.infrastructure.health.HealthMonitor;
import fr.lapetina.ringbalancer.infrastructure.http.BackendHttpClient;
import fr.lapetina.ringbalancer.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ringbalancer.infrastructure.metrics.StatisticsCollector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class HttpServerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(2))
            .version(HttpClient.Version.HTTP_1_1)
            .build();

    private final List<com.sun.net.httpserver.HttpServer> backends = new ArrayList<>();
    private HealthMonitor healthMonitor;
    private MetricsRegistry metricsRegistry;
    private LoadBalancer loadBalancer;
    private HttpServer httpServer;
    private String baseUrl;

    @BeforeEach
    void setUp() throws IOException {
        // Never started: health is driven through the API
        healthMonitor = new HealthMonitor((server, timeout) -> new CompletableFuture<>(),
                Duration.ofHours(1), Duration.ofSeconds(1), 3);
        metricsRegistry = new MetricsRegistry("test_lb");
        StatisticsCollector statistics = new StatisticsCollector(metricsRegistry.getRegistry(), "test_lb");
        loadBalancer = new LoadBalancer(new ConsistentHashRing(HashAlgorithm.MD5, 100), healthMonitor, statistics);
        metricsRegistry.bind(loadBalancer);

        addBackend("backend-1");
        addBackend("backend-2");

        httpServer = new HttpServer("127.0.0.1", 0, 50, 4, loadBalancer,
                new BackendHttpClient(Duration.ofMillis(500), Duration.ofSeconds(5)), metricsRegistry, null);
        httpServer.start();
        baseUrl = "http://127.0.0.1:" + httpServer.getPort();
    }

    @AfterEach
    void tearDown() {
        httpServer.close();
        backends.forEach(backend -> backend.stop(0));
        healthMonitor.close();
        metricsRegistry.close();
    }

    /**
     * Starts a backend answering with its name and the requested path; /fail answers 500.
     */
    private void addBackend(String name) throws IOException {
        com.sun.net.httpserver.HttpServer backend =
                com.sun.net.httpserver.HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        backend.createContext("/", exchange -> {
            String path = exchange.getRequestURI().getPath();
            byte[] body = (name + " " + exchange.getRequestMethod() + " " + path).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("X-Backend", name);
            exchange.sendResponseHeaders(path.equals("/fail") ? 500 : 200, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        backend.start();
        backends.add(backend);

        loadBalancer.addServer(Server.builder()
                .id(name)
                .host("127.0.0.1")
                .port(backend.getAddress().getPort())
                .build());
        loadBalancer.markHealthy(name);
    }

    private HttpResponse<String> send(String method, String path, String body) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUrl + path))
                .timeout(Duration.ofSeconds(10))
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body));
        if (body != null) {
            builder.header("Content-Type", "application/json");
        }
        return client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        return send("GET", path, null);
    }

    private JsonNode json(HttpResponse<String> response) throws IOException {
        return objectMapper.readTree(response.body());
    }

    @Nested
    @DisplayName("Proxy")
    class ProxyTests {

        @Test
        @DisplayName("should forward to the server owning the client and path key")
        void shouldForwardToRingOwner() throws Exception {
            HttpResponse<String> response = get("/orders/42?verbose=true");

            String expected = loadBalancer.getRing().lookup("127.0.0.1:/orders/42");
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).isEqualTo(expected + " GET /orders/42");
            assertThat(response.headers().firstValue(HttpServer.SERVER_HEADER)).contains(expected);
            assertThat(response.headers().firstValue("X-Backend")).contains(expected);
            assertThat(response.headers().firstValue(HttpServer.RESPONSE_TIME_HEADER).orElseThrow())
                    .matches("\\d+\\.\\d{3}");
        }

        @Test
        @DisplayName("should key on the first X-Forwarded-For address")
        void shouldUseForwardedFor() throws Exception {
            HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/cart"))
                    .header("X-Forwarded-For", "203.0.113.9, 10.0.0.1")
                    .build();
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());

            assertThat(response.headers().firstValue(HttpServer.SERVER_HEADER))
                    .contains(loadBalancer.getRing().lookup("203.0.113.9:/cart"));
        }

        @Test
        @DisplayName("should keep routing the same key to the same server")
        void shouldBeSticky() throws Exception {
            String first = get("/session").headers().firstValue(HttpServer.SERVER_HEADER).orElseThrow();
            for (int i = 0; i < 10; i++) {
                assertThat(get("/session").headers().firstValue(HttpServer.SERVER_HEADER)).contains(first);
            }
        }

        @Test
        @DisplayName("should pass backend errors through and count them")
        void shouldPassThroughBackendErrors() throws Exception {
            HttpResponse<String> response = get("/fail");
            String owner = response.headers().firstValue(HttpServer.SERVER_HEADER).orElseThrow();

            assertThat(response.statusCode()).isEqualTo(500);
            assertThat(loadBalancer.getServer(owner).stats().errorCount()).isEqualTo(1);
            assertThat(loadBalancer.getServer(owner).stats().requestCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 502 when the backend cannot be reached")
        void shouldReportBadGateway() throws Exception {
            int closedPort;
            try (ServerSocket socket = new ServerSocket(0)) {
                closedPort = socket.getLocalPort();
            }
            loadBalancer.addServer(Server.builder().id("dead").host("127.0.0.1").port(closedPort).build());
            loadBalancer.markHealthy("dead");
            loadBalancer.markUnhealthy("backend-1");
            loadBalancer.markUnhealthy("backend-2");

            HttpResponse<String> response = get("/anything");

            assertThat(response.statusCode()).isEqualTo(502);
            assertThat(json(response).get("error_type").asText()).isEqualTo("BAD_GATEWAY");
            assertThat(loadBalancer.getServer("dead").stats().errorCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should answer 503 when no server is healthy")
        void shouldReportUnavailable() throws Exception {
            loadBalancer.markUnhealthy("backend-1");
            loadBalancer.markUnhealthy("backend-2");

            HttpResponse<String> response = get("/anything");

            assertThat(response.statusCode()).isEqualTo(503);
            assertThat(json(response).get("error_type").asText()).isEqualTo("NO_HEALTHY_SERVER");
        }
    }

    @Nested
    @DisplayName("Server management API")
    class ServerApiTests {

        @Test
        @DisplayName("should list servers with health and statistics")
        void shouldListServers() throws Exception {
            JsonNode body = json(get("/api/servers"));

            assertThat(body.get("total").asInt()).isEqualTo(2);
            assertThat(body.get("healthy").asInt()).isEqualTo(2);
            JsonNode first = body.get("servers").get(0);
            assertThat(first.get("name").asText()).isEqualTo("backend-1");
            assertThat(first.get("virtual_nodes").asInt()).isEqualTo(100);
            assertThat(first.get("health").asText()).isEqualTo("HEALTHY");
            assertThat(first.get("stats").get("request_count").asLong()).isZero();
        }

        @Test
        @DisplayName("should add, reweight and remove a server")
        void shouldManageLifecycle() throws Exception {
            HttpResponse<String> created = send("POST", "/api/servers",
                    "{\"name\":\"backend-3\",\"host\":\"127.0.0.1\",\"port\":9999,\"weight\":2}");
            assertThat(created.statusCode()).isEqualTo(201);
            assertThat(json(created).get("virtual_nodes").asInt()).isEqualTo(200);
            assertThat(json(created).get("health").asText()).isEqualTo("UNKNOWN");

            HttpResponse<String> updated = send("PUT", "/api/servers/backend-3", "{\"weight\":3}");
            assertThat(updated.statusCode()).isEqualTo(200);
            assertThat(json(updated).get("weight").asInt()).isEqualTo(3);
            assertThat(loadBalancer.getRing().weightOf("backend-3")).isEqualTo(3);

            assertThat(send("DELETE", "/api/servers/backend-3", null).statusCode()).isEqualTo(200);
            assertThat(loadBalancer.findServer("backend-3")).isEmpty();
        }

        @Test
        @DisplayName("should map domain errors to HTTP statuses")
        void shouldMapErrors() throws Exception {
            String duplicate = "{\"name\":\"backend-1\",\"host\":\"127.0.0.1\",\"port\":9998}";
            assertThat(send("POST", "/api/servers", duplicate).statusCode()).isEqualTo(409);
            assertThat(send("DELETE", "/api/servers/ghost", null).statusCode()).isEqualTo(404);
            assertThat(send("PUT", "/api/servers/backend-1", "{\"weight\":0}").statusCode()).isEqualTo(400);
            assertThat(send("POST", "/api/servers", "{\"host\":\"127.0.0.1\"}").statusCode()).isEqualTo(400);
            assertThat(send("POST", "/api/servers", "not json").statusCode()).isEqualTo(400);
            assertThat(get("/api/unknown").statusCode()).isEqualTo(404);
        }

        @Test
        @DisplayName("should override health through the API")
        void shouldOverrideHealth() throws Exception {
            HttpResponse<String> response = send("PUT", "/api/servers/backend-1/health", "{\"healthy\":false}");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("health").asText()).isEqualTo("UNHEALTHY");
            assertThat(json(response).get("drained").asBoolean()).isTrue();
            assertThat(loadBalancer.getServer("backend-1").isHealthy()).isFalse();
        }
    }

    @Nested
    @DisplayName("Operations endpoints")
    class OperationsTests {

        @Test
        @DisplayName("should report overall health")
        void shouldReportHealth() throws Exception {
            assertThat(get("/api/health").statusCode()).isEqualTo(200);

            assertThat(send("POST", "/manage/drain/backend-1", null).statusCode()).isEqualTo(200);
            assertThat(send("POST", "/manage/drain/backend-2", null).statusCode()).isEqualTo(200);
            HttpResponse<String> down = get("/api/health");
            assertThat(down.statusCode()).isEqualTo(503);
            assertThat(json(down).get("status").asText()).isEqualTo("unhealthy");

            assertThat(send("POST", "/manage/enable/backend-2", null).statusCode()).isEqualTo(200);
            assertThat(get("/api/health").statusCode()).isEqualTo(200);
        }

        @Test
        @DisplayName("should aggregate statistics")
        void shouldAggregateStats() throws Exception {
            get("/a");
            get("/b");

            JsonNode body = json(get("/api/stats"));

            assertThat(body.get("aggregate").get("total_servers").asInt()).isEqualTo(2);
            assertThat(body.get("aggregate").get("total_requests").asLong()).isEqualTo(2);
            assertThat(body.get("ring").get("virtual_nodes").asInt()).isEqualTo(200);
        }

        @Test
        @DisplayName("should explain where a key lands")
        void shouldDebugLookup() throws Exception {
            JsonNode body = json(get("/api/debug/lookup/user-17"));

            String primary = loadBalancer.getRing().lookup("user-17");
            assertThat(body.get("primary").asText()).isEqualTo(primary);
            assertThat(body.get("selected").asText()).isEqualTo(primary);
            assertThat(body.get("hash").asLong()).isEqualTo(HashAlgorithm.MD5.hash("user-17"));
            assertThat(body.get("candidates")).hasSize(2);
            assertThat(loadBalancer.getAggregateStats().totalRequests()).isZero();
        }

        @Test
        @DisplayName("should report no selection when no candidate is healthy")
        void shouldDebugLookupWithoutHealthyServer() throws Exception {
            for (String id : loadBalancer.getRing().serverIds()) {
                loadBalancer.markUnhealthy(id);
            }

            HttpResponse<String> response = get("/api/debug/lookup/user-17");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(json(response).get("selected").isNull()).isTrue();
            assertThat(json(response).get("candidates")).hasSize(2);
        }

        @Test
        @DisplayName("should describe the ring")
        void shouldDebugRing() throws Exception {
            JsonNode summary = json(get("/api/debug/ring"));
            assertThat(summary.get("total_virtual_nodes").asInt()).isEqualTo(200);
            assertThat(summary.get("distribution").get("backend-2").asInt()).isEqualTo(100);
            assertThat(summary.has("ring")).isFalse();

            JsonNode detailed = json(get("/api/debug/ring?include_ring=true"));
            assertThat(detailed.get("ring")).hasSize(100);
        }

        @Test
        @DisplayName("should expose Prometheus metrics")
        void shouldExposeMetrics() throws Exception {
            get("/metrics-check");

            HttpResponse<String> response = get("/metrics");

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body())
                    .contains("test_lb_requests_total")
                    .contains("test_lb_server_health")
                    .contains("test_lb_ring_virtual_nodes");
        }

        @Test
        @DisplayName("should refuse reload without a configuration source")
        void shouldRefuseReload() throws Exception {
            assertThat(send("POST", "/manage/reload", null).statusCode()).isEqualTo(503);
            assertThat(get("/manage/reload").statusCode()).isEqualTo(405);
        }
    }
}
