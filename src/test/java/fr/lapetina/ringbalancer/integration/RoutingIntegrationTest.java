package fr.lapetina.ringbalancer.integration;

import fr.lapetina.ringbalancer.domain.exception.LoadBalancerException;
import fr.lapetina.ringbalancer.domain.hash.HashAlgorithm;
import fr.lapetina.ringbalancer.domain.model.ErrorType;
import fr.lapetina.ringbalancer.domain.model.HealthState;
import fr.lapetina.ringbalancer.domain.routing.LoadBalancer;
import fr.lapetina.ringbalancer.infrastructure.config.ConfigLoader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end routing through a factory built from test-config.yaml.
 */
class RoutingIntegrationTest {

    private static final int KEYS = 10_000;

    private TestBalancerFactory factory;
    private LoadBalancer loadBalancer;

    @BeforeEach
    void setUp() {
        factory = TestBalancerFactory.create();
        loadBalancer = factory.getLoadBalancer();
        factory.awaitAllHealthy();
    }

    @AfterEach
    void tearDown() {
        if (factory != null) {
            factory.close();
        }
    }

    private Map<String, String> route() {
        Map<String, String> routes = new HashMap<>();
        for (int i = 0; i < KEYS; i++) {
            String key = "10.0.0." + (i % 250) + ":/orders/" + i;
            routes.put(key, loadBalancer.selectServer(key).getId());
        }
        return routes;
    }

    @Nested
    @DisplayName("Steady state")
    class SteadyStateTests {

        @Test
        @DisplayName("should build the pool from configuration")
        void shouldBuildPool() {
            assertThat(loadBalancer.size()).isEqualTo(3);
            assertThat(loadBalancer.getRing().virtualNodeCount()).isEqualTo(150 * 4);
            assertThat(loadBalancer.getServer("server-3").server().getWeight()).isEqualTo(2);
            assertThat(loadBalancer.hasHealthyServer()).isTrue();
        }

        @Test
        @DisplayName("should give the weight 2 server about half of the traffic")
        void shouldHonourWeights() {
            Map<String, Integer> counts = new HashMap<>();
            route().values().forEach(id -> counts.merge(id, 1, Integer::sum));

            assertThat(counts.get("server-3") / (double) KEYS).isBetween(0.4, 0.6);
            assertThat(counts.get("server-1") / (double) KEYS).isBetween(0.15, 0.35);
            assertThat(counts.get("server-2") / (double) KEYS).isBetween(0.15, 0.35);
        }

        @Test
        @DisplayName("should count every routed request")
        void shouldCountRequests() {
            route();

            assertThat(loadBalancer.getAggregateStats().totalRequests()).isEqualTo(KEYS);
        }
    }

    @Nested
    @DisplayName("Failover")
    class FailoverTests {

        @Test
        @DisplayName("should move only the failed server's keys and bring them back on recovery")
        void shouldFailOverAndRecover() {
            Map<String, String> before = route();

            factory.setHealthy("server-1", false);
            factory.awaitHealth("server-1", HealthState.UNHEALTHY);
            Map<String, String> during = route();

            before.forEach((key, owner) -> {
                if (owner.equals("server-1")) {
                    List<String> candidates = loadBalancer.candidates(key, 3);
                    assertThat(during.get(key)).isEqualTo(candidates.get(1));
                } else {
                    assertThat(during.get(key)).isEqualTo(owner);
                }
            });

            factory.setHealthy("server-1", true);
            factory.awaitHealth("server-1", HealthState.HEALTHY);

            assertThat(route()).isEqualTo(before);
        }

        @Test
        @DisplayName("should keep a server in rotation through fewer failures than retries")
        void shouldTolerateTransientFailures() throws Exception {
            factory.setHealthy("server-2", false);
            factory.getHealthMonitor().probeNow("server-2").get();
            factory.getHealthMonitor().probeNow("server-2").get();

            assertThat(factory.getHealthMonitor().isHealthy("server-2")).isTrue();
        }

        @Test
        @DisplayName("should report NO_HEALTHY_SERVER once every server is down")
        void shouldFailWhenAllDown() {
            for (String id : List.of("server-1", "server-2", "server-3")) {
                factory.setHealthy(id, false);
                factory.awaitHealth(id, HealthState.UNHEALTHY);
            }

            assertThatThrownBy(() -> loadBalancer.selectServer("anyone"))
                    .isInstanceOf(LoadBalancerException.class)
                    .extracting(e -> ((LoadBalancerException) e).getErrorType())
                    .isEqualTo(ErrorType.NO_HEALTHY_SERVER);
        }

        @Test
        @DisplayName("should keep a drained server out of rotation while its probes succeed")
        void shouldHonourDrain() {
            loadBalancer.markUnhealthy("server-3");
            factory.awaitHealth("server-3", HealthState.UNHEALTHY);

            assertThat(route().values()).doesNotContain("server-3");

            loadBalancer.markHealthy("server-3");
            assertThat(route().values()).contains("server-3");
        }
    }

    @Nested
    @DisplayName("Configuration reload")
    class ReloadTests {

        @TempDir
        Path tempDir;

        private static final String HEADER = """
                ring:
                  virtualNodes: 50
                  hashFunction: md5
                healthCheck:
                  intervalMs: 60000
                  timeoutMs: 500
                metrics:
                  enabled: false
                """;

        @Test
        @DisplayName("should reconcile the pool with the reloaded server list")
        void shouldReconcilePool() throws Exception {
            Path file = tempDir.resolve("config.yaml");
            Files.writeString(file, HEADER + """
                    servers:
                      - name: a
                        host: 127.0.0.1
                        port: 7001
                      - name: b
                        host: 127.0.0.1
                        port: 7002
                      - name: c
                        host: 127.0.0.1
                        port: 7003
                    """);

            try (TestBalancerFactory reloadable = TestBalancerFactory.create(file.toString())) {
                reloadable.awaitAllHealthy();
                LoadBalancer lb = reloadable.getLoadBalancer();

                Files.writeString(file, HEADER + """
                        servers:
                          - name: b
                            host: 127.0.0.1
                            port: 7002
                            weight: 3
                          - name: c
                            host: 127.0.0.1
                            port: 7013
                          - name: d
                            host: 127.0.0.1
                            port: 7004
                        """);
                reloadable.getConfigLoader().reload();

                assertThat(lb.getRing().serverIds()).containsExactlyInAnyOrder("b", "c", "d");
                assertThat(lb.getServer("b").server().getWeight()).isEqualTo(3);
                assertThat(lb.getServer("b").isHealthy()).isTrue();
                assertThat(lb.getServer("c").server().getPort()).isEqualTo(7013);
                assertThat(reloadable.getMetricsRegistry()).isNull();

                reloadable.awaitHealth("d", HealthState.HEALTHY);
                assertThat(lb.getAggregateStats().healthyServers()).isGreaterThanOrEqualTo(2);
            }
        }

        @Test
        @DisplayName("should keep flagging a hash function change until restart, across reloads")
        void shouldCompareRingSettingsWithRunningRing() throws Exception {
            String servers = """
                    servers:
                      - name: a
                        host: 127.0.0.1
                        port: 7001
                    """;
            Path file = tempDir.resolve("config.yaml");
            Files.writeString(file, HEADER + servers);

            try (TestBalancerFactory reloadable = TestBalancerFactory.create(file.toString())) {
                ConfigLoader loader = reloadable.getConfigLoader();
                assertThat(reloadable.requiresRestart(loader.getCurrentConfig())).isFalse();

                Files.writeString(file, HEADER.replace("hashFunction: md5", "hashFunction: sha1") + servers);
                loader.reload();
                assertThat(reloadable.requiresRestart(loader.getCurrentConfig())).isTrue();

                // Second reload with the same pending change: still not applied
                loader.reload();
                assertThat(reloadable.requiresRestart(loader.getCurrentConfig())).isTrue();
                assertThat(reloadable.getHashAlgorithm()).isEqualTo(HashAlgorithm.MD5);

                Files.writeString(file, HEADER.replace("hashFunction: md5", "hashFunction: MD5") + servers);
                loader.reload();
                assertThat(reloadable.requiresRestart(loader.getCurrentConfig())).isFalse();
            }
        }
    }
}
