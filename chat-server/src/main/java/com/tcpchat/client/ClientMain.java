package com.tcpchat.client;

import com.tcpchat.server.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Interactive chat client.
 *
 * Usage: {@code ClientMain <host> [-p|--port port] -u|--username name}
 */
public class ClientMain {

    private static final Logger logger = LoggerFactory.getLogger(ClientMain.class);

    static final Path DOWNLOAD_DIR = Path.of("received_files");
    static final String LOCAL_HELP = "Commands:\n"
            + "  /users - List online users\n"
            + "  /send <filepath> - Send a file\n"
            + "  /quit - Disconnect";

    public static void main(String[] args) {
        String host = null;
        int port = ServerConfig.DEFAULT_PORT;
        String username = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-p", "--port" -> {
                    if (i + 1 < args.length) {
                        String value = args[++i];
                        try {
                            port = Integer.parseInt(value);
                        } catch (NumberFormatException e) {
                            logger.warn("Invalid port argument '{}', using default port {}", value, port);
                        }
                    }
                }
                case "-u", "--username" -> {
                    if (i + 1 < args.length) {
                        username = args[++i];
                    }
                }
                default -> host = args[i];
            }
        }

        if (host == null || username == null || username.isBlank()) {
            System.err.println("Usage: ClientMain <host> [-p port] -u <username>");
            System.exit(2);
            return;
        }

        PrintStream out = System.out;
        try (ChatClient client = new ChatClient(host, port, username, out, DOWNLOAD_DIR)) {
            client.connect();
            BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            runInputLoop(client, in, out);
        } catch (IOException e) {
            logger.error("Connection failed. Is the server running? {}", e.getMessage());
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Reads lines until end of input, /quit, or a closed connection.
     */
    static void runInputLoop(ChatClient client, BufferedReader in, PrintStream out)
            throws IOException, InterruptedException {
        out.println("You can start chatting. Type /help for commands.");
        String line;
        while (client.isConnected() && (line = in.readLine()) != null) {
            if (line.isEmpty()) {
                continue;
            }
            String lower = line.toLowerCase(Locale.ROOT);

            if (lower.equals("/quit")) {
                client.quit();
                // The server acks and closes; give it a moment before tearing down locally
                client.closeFuture().await(2, TimeUnit.SECONDS);
                return;
            } else if (lower.startsWith("/send ")) {
                sendFile(client, line.substring(6).trim(), out);
            } else if (lower.equals("/help")) {
                out.println(LOCAL_HELP);
            } else {
                client.sendText(line);
            }
        }
    }

    private static void sendFile(ChatClient client, String path, PrintStream out) {
        if (path.isEmpty()) {
            out.println("Usage: /send <path/to/your/file>");
            return;
        }
        Path file = Path.of(path);
        if (!Files.isRegularFile(file)) {
            logger.error("File not found: '{}'", path);
            return;
        }
        try {
            client.sendFile(file);
        } catch (IOException e) {
            logger.error("Error reading file '{}': {}", path, e.getMessage());
        } catch (IllegalArgumentException e) {
            logger.error("Cannot send '{}': {}", path, e.getMessage());
            out.println("[Error]: Cannot send '" + path + "': " + e.getMessage());
        }
    }
}
