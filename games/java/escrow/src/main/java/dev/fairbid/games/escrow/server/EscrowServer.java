package dev.fairbid.games.escrow.server;

import dev.fairbid.games.escrow.EscrowConfig;
import dev.fairbid.games.escrow.EscrowSession;
import dev.fairbid.games.escrow.engine.InMemoryAccounts;
import dev.fairbid.games.escrow.engine.SessionEngine;
import dev.fairbid.games.escrow.engine.WallClockTicks;
import dev.fairbid.games.escrow.projector.DefaultEscrowLogProjector;
import io.grpc.Server;
import io.grpc.ServerBuilder;
import io.grpc.health.v1.HealthCheckResponse;
import io.grpc.protobuf.services.HealthStatusManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Map;

/**
 * Main server entry point for the escrow session service.
 */
public class EscrowServer {
    private static final Logger logger = LoggerFactory.getLogger(EscrowServer.class);
    private static final int DEFAULT_PORT = 50061;
    private static final long DEFAULT_TICK_MILLIS = 12_000;

    private final Server server;
    private final HealthStatusManager health = new HealthStatusManager();

    public EscrowServer(int port, SessionEngine engine) {
        this.server = ServerBuilder.forPort(port)
            .addService(new EscrowService(engine))
            .addService(new EscrowQueryService(engine))
            .addService(health.getHealthService())
            .build();
    }

    public void start() throws IOException {
        server.start();
        health.setStatus("", HealthCheckResponse.ServingStatus.SERVING);
        logger.info("Escrow server started: domain={}, port={}",
            EscrowSession.DOMAIN, server.getPort());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutting down server...");
            EscrowServer.this.stop();
        }));
    }

    public void stop() {
        if (server != null) {
            health.enterTerminalState();
            server.shutdown();
        }
    }

    public void blockUntilShutdown() throws InterruptedException {
        if (server != null) {
            server.awaitTermination();
        }
    }

    public static void main(String[] args) throws IOException, InterruptedException {
        Map<String, String> env = System.getenv();
        int port = EscrowConfig.readInt(env, "PORT", DEFAULT_PORT);
        long tickMillis = EscrowConfig.readNumber(env, "ESCROW_TICK_MILLIS", DEFAULT_TICK_MILLIS);

        EscrowConfig config = EscrowConfig.fromEnv(env);
        logger.info("Escrow configuration: minBid={}, maxBid={}, fee={}, timeoutTicks={}, tickMillis={}",
            config.minBid(), config.maxBid(), config.registrationFee(), config.timeoutTicks(), tickMillis);

        SessionEngine engine = new SessionEngine(
            config,
            new WallClockTicks(tickMillis),
            new InMemoryAccounts(),
            new DefaultEscrowLogProjector());

        EscrowServer server = new EscrowServer(port, engine);
        server.start();
        server.blockUntilShutdown();
    }
}
