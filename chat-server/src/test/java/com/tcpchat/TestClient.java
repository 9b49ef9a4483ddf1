package com.tcpchat;

import com.tcpchat.handler.ChatSessionHandler;
import com.tcpchat.protocol.ChatMessage;
import com.tcpchat.protocol.FrameCodec;
import com.tcpchat.protocol.MessageType;

import java.io.BufferedInputStream;
import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.fail;

/**
 * Blocking raw-socket peer used by the end-to-end tests.
 */
final class TestClient implements AutoCloseable {

    private static final int READ_TIMEOUT_MS = 5000;

    private final Socket socket;
    private final DataInputStream in;
    private final OutputStream out;

    private TestClient(Socket socket) throws IOException {
        this.socket = socket;
        this.socket.setSoTimeout(READ_TIMEOUT_MS);
        this.in = new DataInputStream(new BufferedInputStream(socket.getInputStream()));
        this.out = socket.getOutputStream();
    }

    static TestClient connect(int port) throws IOException {
        return new TestClient(new Socket("127.0.0.1", port));
    }

    /**
     * Connects, joins and consumes the welcome line.
     */
    static TestClient join(int port, String username) throws IOException {
        TestClient client = connect(port);
        client.send(MessageType.JOIN, username);
        client.expect(MessageType.TEXT, ChatSessionHandler.WELCOME);
        return client;
    }

    void send(MessageType type, String text) throws IOException {
        send(type, text.getBytes(StandardCharsets.UTF_8));
    }

    void send(MessageType type, byte[] payload) throws IOException {
        sendRaw(FrameCodec.encode(type, payload));
    }

    void sendRaw(byte[] bytes) throws IOException {
        out.write(bytes);
        out.flush();
    }

    ChatMessage receive() throws IOException {
        return FrameCodec.read(in);
    }

    /**
     * Reads the next frame and checks its type and text.
     */
    ChatMessage expect(MessageType type, String text) throws IOException {
        ChatMessage message = receive();
        assertEquals(type, message.getType(), "Unexpected frame: " + message.payloadText());
        assertEquals(text, message.payloadText());
        return message;
    }

    /**
     * @return true if the server closed the connection before the read timeout
     */
    boolean awaitClosedByServer() throws IOException {
        try {
            while (true) {
                receive();
            }
        } catch (EOFException e) {
            return true;
        } catch (SocketTimeoutException e) {
            return false;
        } catch (IOException e) {
            // Connection reset counts as closed
            return true;
        }
    }

    /**
     * Polls until the condition holds or five seconds pass.
     */
    static void awaitCondition(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + READ_TIMEOUT_MS;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Timed out waiting for: " + description);
            }
            Thread.sleep(10);
        }
    }

    void setReadTimeout(int millis) throws IOException {
        socket.setSoTimeout(millis);
    }

    @Override
    public void close() throws IOException {
        socket.close();
    }
}
