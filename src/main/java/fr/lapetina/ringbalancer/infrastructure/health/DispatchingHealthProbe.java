package fr.lapetina.ringbalancer.infrastructure.health;

import fr.lapetina.ringbalancer.domain.model.ProbeType;
import fr.lapetina.ringbalancer.domain.model.Server;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Routes each probe to the HTTP or TCP probe according to the server's probe type.
 */
public final class DispatchingHealthProbe implements HealthProbe, AutoCloseable {

    private final HttpHealthProbe httpProbe;
    private final TcpHealthProbe tcpProbe;

    public DispatchingHealthProbe(HttpHealthProbe httpProbe, TcpHealthProbe tcpProbe) {
        this.httpProbe = httpProbe;
        this.tcpProbe = tcpProbe;
    }

    public DispatchingHealthProbe(Duration connectTimeout) {
        this(new HttpHealthProbe(connectTimeout), new TcpHealthProbe());
    }

    @Override
    public CompletableFuture<ProbeResult> probe(Server server, Duration timeout) {
        return server.getProbeType() == ProbeType.TCP
                ? tcpProbe.probe(server, timeout)
                : httpProbe.probe(server, timeout);
    }

    @Override
    public void close() {
        tcpProbe.close();
    }
}
