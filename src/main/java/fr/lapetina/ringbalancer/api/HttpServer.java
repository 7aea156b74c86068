package fr.lapetina.ringbalancer.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.ringbalancer.api.dto.HealthOverrideRequest;
import fr.lapetina.ringbalancer.api.dto.ServerRequest;
import fr.lapetina.ringbalancer.api.dto.ServerResponse;
import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.model.AggregateStats;
import fr.lapetina.ringbalancer.domain.model.ProbeType;
import fr.lapetina.ringbalancer.domain.model.Server;
import fr.lapetina.ringbalancer.domain.model.ServerStatus;
import fr.lapetina.ringbalancer.domain.ring.ConsistentHashRing;
import fr.lapetina.ringbalancer.domain.ring.VirtualNode;
import fr.lapetina.ringbalancer.domain.routing.LoadBalancer;
import fr.lapetina.ringbalancer.infrastructure.config.ConfigLoader;
import fr.lapetina.ringbalancer.infrastructure.config.LoadBalancerConfig;
import fr.lapetina.ringbalancer.infrastructure.http.BackendHttpClient;
import fr.lapetina.ringbalancer.infrastructure.http.ProxyRequest;
import fr.lapetina.ringbalancer.infrastructure.http.ProxyResponse;
import fr.lapetina.ringbalancer.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using JDK's built-in HttpServer.
 *
 * Endpoints:
 * - GET/POST /api/servers - List or add servers
 * - GET/PUT/DELETE /api/servers/{id} - Inspect, reweight or remove a server
 * - PUT /api/servers/{id}/health - Manual health override
 * - GET /api/stats - Aggregate and per-server statistics
 * - GET /api/health - 200 when at least one server is healthy
 * - GET /api/debug/lookup/{key} - Ring placement of a key
 * - GET /api/debug/ring - Ring shape, optionally the first virtual nodes
 * - POST /manage/drain/{id}, /manage/enable/{id} - Take a server out of or back into rotation
 * - POST /manage/reload - Reload configuration
 * - GET /metrics - Prometheus metrics endpoint
 * - anything else - Proxied to the server selected for the client and path
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    static final String SERVER_HEADER = "X-Load-Balancer-Server";
    static final String RESPONSE_TIME_HEADER = "X-Load-Balancer-Response-Time";

    private static final int DEBUG_CANDIDATES = 3;
    private static final int DEBUG_RING_SAMPLE = 100;

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final LoadBalancer loadBalancer;
    private final BackendHttpClient backendClient;
    private final MetricsRegistry metricsRegistry;
    private final ConfigLoader configLoader;

    /**
     * @param metricsRegistry null when metrics are disabled
     */
    public HttpServer(
            String host,
            int port,
            int backlog,
            int threads,
            LoadBalancer loadBalancer,
            BackendHttpClient backendClient,
            MetricsRegistry metricsRegistry,
            ConfigLoader configLoader
    ) throws IOException {
        this.loadBalancer = loadBalancer;
        this.backendClient = backendClient;
        this.metricsRegistry = metricsRegistry;
        this.configLoader = configLoader;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(host, port), backlog
        );

        AtomicInteger threadCounter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "http-worker-" + threadCounter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);

        server.createContext("/", new RootHandler());

        log.info("HTTP server configured: host={}, port={}, threads={}", host, getPort(), threads);
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("HTTP server stopped");
    }

    // ==================== DISPATCH ====================

    private class RootHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String requestId = UUID.randomUUID().toString();
            MDC.put("requestId", requestId);
            String path = exchange.getRequestURI().getPath();

            try {
                if (isUnder(path, "/api")) {
                    handleApi(exchange, path);
                } else if (isUnder(path, "/manage")) {
                    handleManage(exchange, path);
                } else if (path.equals("/metrics")) {
                    handleMetrics(exchange);
                } else {
                    handleProxy(exchange, path);
                }
            } catch (LoadBalancerException e) {
                sendError(exchange, statusFor(e), e.getErrorType().name(), e.getMessage());
            } catch (ConfigLoader.ConfigurationException e) {
                sendError(exchange, 500, "CONFIGURATION_ERROR", e.getMessage());
            } catch (BadRequestException e) {
                sendError(exchange, 400, "BAD_REQUEST", e.getMessage());
            } catch (Exception e) {
                log.error("Error handling request: method={}, path={}", exchange.getRequestMethod(), path, e);
                sendError(exchange, 500, "INTERNAL_ERROR", "Internal server error: " + e.getMessage());
            } finally {
                exchange.close();
                MDC.clear();
            }
        }
    }

    private static boolean isUnder(String path, String prefix) {
        return path.equals(prefix) || path.startsWith(prefix + "/");
    }

    static int statusFor(LoadBalancerException e) {
        return switch (e.getErrorType()) {
            case DUPLICATE_SERVER -> 409;
            case SERVER_NOT_FOUND -> 404;
            case INVALID_WEIGHT -> 400;
            case EMPTY_RING, NO_SERVERS_AVAILABLE, NO_HEALTHY_SERVER -> 503;
        };
    }

    // ==================== API HANDLER ====================

    private void handleApi(HttpExchange exchange, String path) throws IOException {
        String method = exchange.getRequestMethod();
        String[] parts = path.split("/");
        // parts[0] is empty, parts[1] is "api"

        if (path.equals("/api/servers") && "GET".equals(method)) {
            handleListServers(exchange);
        } else if (path.equals("/api/servers") && "POST".equals(method)) {
            handleAddServer(exchange);
        } else if (parts.length == 4 && parts[2].equals("servers")) {
            String serverId = decode(parts[3]);
            switch (method) {
                case "GET" -> sendJson(exchange, 200, toResponse(loadBalancer.getServer(serverId)));
                case "PUT" -> handleUpdateWeight(exchange, serverId);
                case "DELETE" -> handleRemoveServer(exchange, serverId);
                default -> sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
            }
        } else if (parts.length == 5 && parts[2].equals("servers") && parts[4].equals("health")
                && "PUT".equals(method)) {
            handleHealthOverride(exchange, decode(parts[3]));
        } else if (path.equals("/api/stats") && "GET".equals(method)) {
            handleStats(exchange);
        } else if (path.equals("/api/health") && "GET".equals(method)) {
            handleHealth(exchange);
        } else if (parts.length >= 5 && parts[2].equals("debug") && parts[3].equals("lookup") && "GET".equals(method)) {
            handleDebugLookup(exchange, decode(path.substring("/api/debug/lookup/".length())));
        } else if (path.equals("/api/debug/ring") && "GET".equals(method)) {
            handleDebugRing(exchange);
        } else {
            sendError(exchange, 404, "NOT_FOUND", "Not Found");
        }
    }

    private void handleListServers(HttpExchange exchange) throws IOException {
        List<ServerResponse> servers = new ArrayList<>();
        for (ServerStatus status : loadBalancer.getServerList()) {
            servers.add(toResponse(status));
        }
        AggregateStats stats = loadBalancer.getAggregateStats();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("servers", servers);
        body.put("total", stats.totalServers());
        body.put("healthy", stats.healthyServers());
        sendJson(exchange, 200, body);
    }

    private void handleAddServer(HttpExchange exchange) throws IOException {
        ServerRequest request = readBody(exchange, ServerRequest.class);
        LoadBalancerConfig.HealthCheckConfig defaults = healthCheckDefaults();

        Server newServer;
        try {
            newServer = request.toServer(ProbeType.fromName(defaults.getType()), defaults.getPath(),
                    defaults.getExpectedStatus());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new BadRequestException(e.getMessage());
        }

        loadBalancer.addServer(newServer);
        sendJson(exchange, 201, toResponse(loadBalancer.getServer(newServer.getId())));
    }

    private void handleUpdateWeight(HttpExchange exchange, String serverId) throws IOException {
        ServerRequest request = readBody(exchange, ServerRequest.class);
        if (request.getWeight() == null) {
            throw new BadRequestException("Field 'weight' is required");
        }
        loadBalancer.updateWeight(serverId, request.getWeight());
        sendJson(exchange, 200, toResponse(loadBalancer.getServer(serverId)));
    }

    private void handleRemoveServer(HttpExchange exchange, String serverId) throws IOException {
        loadBalancer.removeServer(serverId);
        sendJson(exchange, 200, Map.of(
                "server", serverId,
                "message", "Server removed"
        ));
    }

    private void handleHealthOverride(HttpExchange exchange, String serverId) throws IOException {
        HealthOverrideRequest request = readBody(exchange, HealthOverrideRequest.class);
        if (request.getHealthy() == null) {
            throw new BadRequestException("Field 'healthy' is required");
        }
        if (request.getHealthy()) {
            loadBalancer.markHealthy(serverId);
        } else {
            loadBalancer.markUnhealthy(serverId);
        }
        sendJson(exchange, 200, toResponse(loadBalancer.getServer(serverId)));
    }

    private void handleStats(HttpExchange exchange) throws IOException {
        AggregateStats stats = loadBalancer.getAggregateStats();

        Map<String, Object> aggregate = new LinkedHashMap<>();
        aggregate.put("total_servers", stats.totalServers());
        aggregate.put("healthy_servers", stats.healthyServers());
        aggregate.put("unhealthy_servers", stats.unhealthyServers());
        aggregate.put("unknown_servers", stats.unknownServers());
        aggregate.put("total_requests", stats.totalRequests());
        aggregate.put("total_errors", stats.totalErrors());
        aggregate.put("error_rate", stats.errorRate());

        Map<String, Object> perServer = new LinkedHashMap<>();
        for (ServerStatus status : loadBalancer.getServerList()) {
            perServer.put(status.id(), ServerResponse.Stats.from(status.stats()));
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("aggregate", aggregate);
        body.put("servers", perServer);
        body.put("ring", Map.of(
                "servers", loadBalancer.getRing().size(),
                "virtual_nodes", loadBalancer.getRing().virtualNodeCount()
        ));
        sendJson(exchange, 200, body);
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        AggregateStats stats = loadBalancer.getAggregateStats();
        boolean up = stats.healthyServers() > 0;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", up ? "healthy" : "unhealthy");
        body.put("healthy_servers", stats.healthyServers());
        body.put("total_servers", stats.totalServers());
        body.put("timestamp", System.currentTimeMillis());
        sendJson(exchange, up ? 200 : 503, body);
    }

    private void handleDebugLookup(HttpExchange exchange, String key) throws IOException {
        ConsistentHashRing ring = loadBalancer.getRing();
        List<String> candidates = loadBalancer.candidates(key, DEBUG_CANDIDATES);

        String selected = loadBalancer.peekServer(key).map(Server::getId).orElse(null);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("key", key);
        body.put("hash", ring.hash(key));
        body.put("primary", candidates.isEmpty() ? null : candidates.get(0));
        body.put("candidates", candidates);
        body.put("selected", selected);
        sendJson(exchange, 200, body);
    }

    private void handleDebugRing(HttpExchange exchange) throws IOException {
        ConsistentHashRing ring = loadBalancer.getRing();
        String query = exchange.getRequestURI().getQuery();
        boolean includeRing = query != null && query.contains("include_ring=true");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("total_servers", ring.size());
        body.put("total_virtual_nodes", ring.virtualNodeCount());
        body.put("base_virtual_nodes", ring.getBaseVirtualNodes());
        if (configLoader != null && configLoader.getCurrentConfig() != null) {
            body.put("hash_function", configLoader.getCurrentConfig().getRing().getHashFunction());
        }
        body.put("distribution", ring.virtualNodeCounts());

        if (includeRing) {
            List<Map<String, Object>> nodes = new ArrayList<>();
            for (VirtualNode node : ring.virtualNodes(DEBUG_RING_SAMPLE)) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("hash", node.getHashValue());
                entry.put("server", node.getServerId());
                entry.put("replica", node.getReplicaIndex());
                nodes.add(entry);
            }
            body.put("ring", nodes);
        }
        sendJson(exchange, 200, body);
    }

    // ==================== MANAGE HANDLER ====================

    private void handleManage(HttpExchange exchange, String path) throws IOException {
        if (!"POST".equals(exchange.getRequestMethod())) {
            sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
            return;
        }

        String[] parts = path.split("/");
        if (parts.length == 4 && parts[2].equals("drain")) {
            String serverId = decode(parts[3]);
            loadBalancer.markUnhealthy(serverId);
            sendJson(exchange, 200, Map.of("server", serverId, "action", "drained"));
        } else if (parts.length == 4 && parts[2].equals("enable")) {
            String serverId = decode(parts[3]);
            loadBalancer.markHealthy(serverId);
            sendJson(exchange, 200, Map.of("server", serverId, "action", "enabled"));
        } else if (path.equals("/manage/reload")) {
            handleReloadConfig(exchange);
        } else {
            sendError(exchange, 404, "NOT_FOUND", "Not Found");
        }
    }

    private void handleReloadConfig(HttpExchange exchange) throws IOException {
        if (configLoader == null) {
            sendError(exchange, 503, "CONFIGURATION_ERROR", "Configuration reload is not available");
            return;
        }
        LoadBalancerConfig newConfig = configLoader.reload();
        sendJson(exchange, 200, Map.of(
                "message", "Configuration reloaded",
                "servers", newConfig.getServers().size()
        ));
    }

    // ==================== METRICS HANDLER ====================

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "METHOD_NOT_ALLOWED", "Method Not Allowed");
            return;
        }
        if (metricsRegistry == null) {
            sendError(exchange, 404, "NOT_FOUND", "Metrics are disabled");
            return;
        }

        String metrics = metricsRegistry.scrape();
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
        byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    // ==================== PROXY HANDLER ====================

    private void handleProxy(HttpExchange exchange, String path) throws IOException {
        String key = clientAddress(exchange) + ":" + path;

        Server target;
        try {
            target = loadBalancer.selectServer(key);
        } catch (LoadBalancerException e) {
            if (metricsRegistry != null) {
                metricsRegistry.incrementRoutingFailure(e.getErrorType().name());
            }
            log.warn("Request not routed: key={}, errorType={}", key, e.getErrorType());
            throw e;
        }

        byte[] requestBody;
        try (InputStream is = exchange.getRequestBody()) {
            requestBody = is.readAllBytes();
        }
        String rawQuery = exchange.getRequestURI().getRawQuery();
        String pathAndQuery = exchange.getRequestURI().getRawPath() + (rawQuery != null ? "?" + rawQuery : "");

        ProxyRequest request = new ProxyRequest(exchange.getRequestMethod(), pathAndQuery,
                exchange.getRequestHeaders(), requestBody);
        ProxyResponse response = backendClient.forward(target, request).join();

        if (response.isBackendError()) {
            loadBalancer.recordError(target.getId(), response.latency());
        } else {
            loadBalancer.recordSuccess(target.getId(), response.latency());
        }

        String responseTime = String.format(Locale.ROOT, "%.3f", response.latency().toNanos() / 1_000_000_000.0);
        exchange.getResponseHeaders().set(SERVER_HEADER, target.getId());
        exchange.getResponseHeaders().set(RESPONSE_TIME_HEADER, responseTime);

        if (!response.isForwarded()) {
            sendError(exchange, 502, "BAD_GATEWAY", "Failed to forward request to " + target.getId()
                    + ": " + response.error());
            return;
        }

        response.headers().forEach((name, values) -> exchange.getResponseHeaders().put(name, new ArrayList<>(values)));
        byte[] body = response.body() != null ? response.body() : new byte[0];
        boolean noBody = "HEAD".equalsIgnoreCase(exchange.getRequestMethod())
                || response.statusCode() == 204 || response.statusCode() == 304;
        exchange.sendResponseHeaders(response.statusCode(), noBody || body.length == 0 ? -1 : body.length);
        if (!noBody && body.length > 0) {
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        }
    }

    /**
     * First X-Forwarded-For entry, or the remote address.
     */
    static String clientAddress(HttpExchange exchange) {
        String forwarded = exchange.getRequestHeaders().getFirst("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        InetSocketAddress remote = exchange.getRemoteAddress();
        return remote.getAddress() != null ? remote.getAddress().getHostAddress() : remote.getHostString();
    }

    // ==================== HELPER METHODS ====================

    private ServerResponse toResponse(ServerStatus status) {
        return ServerResponse.fromServerStatus(status, loadBalancer.getRing().getBaseVirtualNodes());
    }

    private LoadBalancerConfig.HealthCheckConfig healthCheckDefaults() {
        if (configLoader != null && configLoader.getCurrentConfig() != null) {
            return configLoader.getCurrentConfig().getHealthCheck();
        }
        return new LoadBalancerConfig.HealthCheckConfig();
    }

    private <T> T readBody(HttpExchange exchange, Class<T> type) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            byte[] bytes = is.readAllBytes();
            if (bytes.length == 0) {
                throw new BadRequestException("Request body is required");
            }
            return objectMapper.readValue(bytes, type);
        } catch (JsonProcessingException e) {
            throw new BadRequestException("Invalid JSON: " + e.getOriginalMessage());
        }
    }

    private static String decode(String segment) {
        return URLDecoder.decode(segment, StandardCharsets.UTF_8);
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, int statusCode, String errorType, String message) throws IOException {
        Map<String, String> error = new LinkedHashMap<>();
        error.put("error", message);
        error.put("error_type", errorType);
        sendJson(exchange, statusCode, error);
    }

    /**
     * Malformed or incomplete request body.
     */
    private static final class BadRequestException extends RuntimeException {
        BadRequestException(String message) {
            super(message);
        }
    }
}
