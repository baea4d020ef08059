package com.coinchase;

import com.coinchase.config.ServerConfig;
import com.coinchase.server.GameServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the Coin Chase session server.
 *
 * Arguments are {@code key=value} pairs, e.g. {@code httpPort=8080 workers=16}.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config = ServerConfig.fromArgs(args);

        logger.info("===========================================");
        logger.info("  Coin Chase Session Server");
        logger.info("  HTTP port {}, {} workers", config.getHttpPort(), config.getWorkerCount());
        logger.info("===========================================");

        GameServer server = new GameServer(config);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping server...");
            server.shutdown();
        }));

        try {
            server.start();
        } catch (Exception e) {
            logger.error("Failed to start server", e);
            System.exit(1);
        }
    }
}
