package com.tcpchat;

import com.tcpchat.server.ChatServer;
import com.tcpchat.server.ConfigLoader;
import com.tcpchat.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Entry point for the TCP chat server.
 *
 * Usage: {@code Main [--config file.json] [--host addr] [-p|--port port] [-m|--max-clients n]}
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        ServerConfig config;
        try {
            config = parseArgs(args, new ConfigLoader());
        } catch (RuntimeException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }

        logger.info("===========================================");
        logger.info("  TCP Chat Server");
        logger.info("  Starting on {}:{}", config.getHost(), config.getPort());
        logger.info("===========================================");

        ChatServer server = new ChatServer(config);

        // Graceful shutdown hook
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

    /**
     * Builds the configuration: JSON file (or classpath default) first, then flags.
     * Unparseable numbers are logged and the previous value is kept.
     *
     * @throws IllegalArgumentException if the resulting settings are invalid
     */
    static ServerConfig parseArgs(String[] args, ConfigLoader loader) {
        ServerConfig config = null;
        for (int i = 0; i < args.length - 1; i++) {
            if ("--config".equals(args[i])) {
                config = loader.load(Path.of(args[i + 1]));
            }
        }
        if (config == null) {
            config = loader.loadResource(ConfigLoader.DEFAULT_RESOURCE);
        }
        ServerConfig.Builder builder = config.toBuilder();

        for (int i = 0; i < args.length; i++) {
            String flag = args[i];
            if (i + 1 >= args.length) {
                logger.warn("Ignoring flag '{}' without a value", flag);
                break;
            }
            String value = args[++i];
            switch (flag) {
                case "--config" -> {
                    // Already applied
                }
                case "--host" -> builder.host(value);
                case "-p", "--port" -> builder.port(parseInt(flag, value, config.getPort()));
                case "-m", "--max-clients" ->
                        builder.maxPendingConnections(parseInt(flag, value, config.getMaxPendingConnections()));
                default -> {
                    logger.warn("Ignoring unknown argument '{}'", flag);
                    i--;
                }
            }
        }
        return builder.build();
    }

    private static int parseInt(String flag, String value, int fallback) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} argument '{}', using {}", flag, value, fallback);
            return fallback;
        }
    }
}
