package fr.lapetina.ringbalancer;

import fr.lapetina.ringbalancer.api.HttpServer;
import fr.lapetina.ringbalancer.infrastructure.config.LoadBalancerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Main entry point for the Ring Balancer.
 */
public class RingBalancerApplication implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RingBalancerApplication.class);

    private final BalancerFactory factory;
    private final HttpServer httpServer;
    private final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public RingBalancerApplication(String configPath) throws Exception {
        this(BalancerFactory.create(configPath));
    }

    RingBalancerApplication(BalancerFactory factory) throws Exception {
        log.info("Starting Ring Balancer...");

        this.factory = factory.start();

        LoadBalancerConfig.ServerConfig serverConfig = factory.getConfig().getServer();
        this.httpServer = new HttpServer(
                serverConfig.getHost(),
                serverConfig.getPort(),
                serverConfig.getBacklog(),
                serverConfig.getThreads(),
                factory.getLoadBalancer(),
                factory.getBackendClient(),
                factory.getMetricsRegistry(),
                factory.getConfigLoader()
        );

        log.info("Ring Balancer initialized");
    }

    public void start() {
        httpServer.start();
        log.info("Ring Balancer started on port {}", httpServer.getPort());
    }

    public void awaitShutdown() throws InterruptedException {
        shutdownLatch.await();
    }

    public void requestShutdown() {
        shutdownLatch.countDown();
    }

    public BalancerFactory getFactory() {
        return factory;
    }

    public int getPort() {
        return httpServer.getPort();
    }

    @Override
    public void close() {
        log.info("Shutting down Ring Balancer...");

        try {
            httpServer.close();
        } catch (Exception e) {
            log.warn("Error closing HTTP server", e);
        }

        try {
            factory.close();
        } catch (Exception e) {
            log.warn("Error closing factory", e);
        }

        log.info("Ring Balancer shut down");
    }

    public static void main(String[] args) {
        String configPath = args.length > 0 ? args[0] : "config.yaml";

        try {
            RingBalancerApplication app = new RingBalancerApplication(configPath);

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                app.requestShutdown();
                app.close();
            }));

            app.start();
            app.awaitShutdown();

        } catch (Exception e) {
            log.error("Failed to start Ring Balancer", e);
            System.exit(1);
        }
    }
}
