package com.tcpchat.client;

import com.tcpchat.protocol.ChatFrameDecoder;
import com.tcpchat.protocol.ChatFrameEncoder;
import com.tcpchat.protocol.ChatMessage;
import com.tcpchat.protocol.FilePayload;
import com.tcpchat.protocol.FrameCodec;
import com.tcpchat.protocol.MessageType;
import com.tcpchat.protocol.Payloads;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Client side of the chat protocol.
 *
 * Owns a single-threaded event loop and one connection. Incoming frames are
 * handed to a {@link ClientMessageHandler}; outgoing calls are asynchronous
 * and return the write future.
 */
public class ChatClient implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ChatClient.class);

    private final String host;
    private final int port;
    private final String username;
    private final int maxFrameLength;
    private final ClientMessageHandler messageHandler;

    private EventLoopGroup group;
    private Channel channel;

    public ChatClient(String host, int port, String username, PrintStream out, Path downloadDir) {
        this(host, port, username, out, downloadDir, FrameCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * @param maxFrameLength largest frame the server accepts and relays
     */
    public ChatClient(String host, int port, String username, PrintStream out, Path downloadDir,
                      int maxFrameLength) {
        this.host = host;
        this.port = port;
        this.username = username;
        this.maxFrameLength = maxFrameLength;
        this.messageHandler = new ClientMessageHandler(out, downloadDir);
    }

    /**
     * Connects and sends the JOIN frame.
     *
     * @throws IOException if the server cannot be reached
     */
    public void connect() throws IOException, InterruptedException {
        group = new NioEventLoopGroup(1);
        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ch.pipeline().addLast(new ChatFrameDecoder(maxFrameLength));
                        ch.pipeline().addLast(new ChatFrameEncoder());
                        ch.pipeline().addLast(messageHandler);
                    }
                });

        ChannelFuture connected = bootstrap.connect(host, port).await();
        if (!connected.isSuccess()) {
            group.shutdownGracefully();
            throw new IOException("Failed to connect to " + host + ":" + port, connected.cause());
        }
        channel = connected.channel();
        logger.info("Connected to server at {}:{}", host, port);

        channel.writeAndFlush(ChatMessage.of(MessageType.JOIN, username));
    }

    public ChannelFuture sendText(String text) {
        return channel.writeAndFlush(ChatMessage.of(MessageType.TEXT, text));
    }

    /**
     * Uploads a file; only its file name travels with the data.
     *
     * The size is checked against the frame the server relays
     * ({@code sender::filename::data}), which is the largest one on the way.
     * A frame over the limit would get this connection dropped.
     *
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file name contains "::" or the
     *         file is too large to relay
     */
    public ChannelFuture sendFile(Path file) throws IOException {
        String fileName = file.getFileName().toString();
        long relayedLength = FrameCodec.TYPE_SIZE
                + username.getBytes(StandardCharsets.UTF_8).length + Payloads.DELIMITER.length()
                + fileName.getBytes(StandardCharsets.UTF_8).length + Payloads.DELIMITER.length()
                + Files.size(file);
        if (relayedLength > maxFrameLength) {
            throw new IllegalArgumentException("File too large: " + Files.size(file)
                    + " bytes, frame limit is " + maxFrameLength + " bytes");
        }
        byte[] data = Files.readAllBytes(file);
        ChannelFuture future = channel.writeAndFlush(
                ChatMessage.of(MessageType.FILE, FilePayload.upload(fileName, data)));
        logger.info("Sent file '{}' ({} bytes)", fileName, data.length);
        return future;
    }

    /**
     * Asks the server to end the session; the server acks and closes.
     */
    public ChannelFuture quit() {
        return sendText("/quit");
    }

    public boolean isConnected() {
        return channel != null && channel.isActive();
    }

    /**
     * Completes when the connection is closed by either side.
     */
    public ChannelFuture closeFuture() {
        return channel.closeFuture();
    }

    public String getUsername() {
        return username;
    }

    @Override
    public void close() {
        if (channel != null) {
            channel.close().awaitUninterruptibly();
        }
        if (group != null) {
            group.shutdownGracefully();
        }
    }
}
