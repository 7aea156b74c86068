package fr.lapetina.ringbalancer.infrastructure.health;

import fr.lapetina.ringbalancer.domain.model.Server;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * TCP health probe: the server is healthy when a connection can be opened.
 *
 * Socket connects block, so they run on a dedicated pool rather than on the
 * health monitor's scheduler threads.
 */
public final class TcpHealthProbe implements HealthProbe, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TcpHealthProbe.class);

    private final ExecutorService executor;

    public TcpHealthProbe() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tcp-probe-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public CompletableFuture<ProbeResult> probe(Server server, Duration timeout) {
        return CompletableFuture.supplyAsync(() -> connect(server, timeout), executor);
    }

    private ProbeResult connect(Server server, Duration timeout) {
        long startNanos = System.nanoTime();
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(server.getHost(), server.getPort()), (int) timeout.toMillis());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            log.debug("TCP probe passed: serverId={}, latencyMs={}", server.getId(), elapsed.toMillis());
            return ProbeResult.success(elapsed);
        } catch (IOException e) {
            log.debug("TCP probe failed: serverId={}, error={}", server.getId(), e.toString());
            return ProbeResult.failure(Duration.ofNanos(System.nanoTime() - startNanos), e.toString());
        }
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
