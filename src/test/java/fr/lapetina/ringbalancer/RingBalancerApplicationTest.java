package fr.lapetina.ringbalancer;

import fr.lapetina.ringbalancer.integration.TestBalancerFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;

class RingBalancerApplicationTest {

    @Test
    @DisplayName("should serve the API on the configured address once started")
    void shouldStartAndServe() throws Exception {
        TestBalancerFactory factory = TestBalancerFactory.createUnstarted("test-config.yaml");

        try (RingBalancerApplication app = new RingBalancerApplication(factory)) {
            app.start();
            factory.awaitAllHealthy();

            HttpClient client = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.getPort() + "/api/health")).build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(app.getPort()).isPositive();
            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(response.body()).contains("\"healthy_servers\":3");
            assertThat(app.getFactory()).isSameAs(factory);
        }
    }
}
