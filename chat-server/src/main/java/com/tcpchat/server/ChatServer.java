package com.tcpchat.server;

import com.tcpchat.command.CommandProcessor;
import com.tcpchat.handler.ChatSessionHandler;
import com.tcpchat.protocol.ChatFrameDecoder;
import com.tcpchat.protocol.ChatFrameEncoder;
import com.tcpchat.session.BroadcastEngine;
import com.tcpchat.session.ConnectionRegistry;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.timeout.IdleStateHandler;
import io.netty.util.concurrent.GlobalEventExecutor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;

/**
 * TCP chat server using Netty's NIO.
 *
 * Threading Model:
 * - Boss Group: 1 thread that accepts incoming connections
 * - Worker Group: N threads (CPU cores) that handle I/O operations
 * - Each connection gets its own pipeline and session handler, pinned to one
 *   worker thread, so its frames are processed in order
 *
 * A failing session only ever closes its own channel; the accept loop keeps running.
 */
public class ChatServer {

    private static final Logger logger = LoggerFactory.getLogger(ChatServer.class);

    private final ServerConfig config;
    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcaster;
    private final CommandProcessor commandProcessor;

    // Every accepted connection, joined or not; closed on shutdown
    private final ChannelGroup allChannels;

    // Netty event loop groups
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public ChatServer(ServerConfig config) {
        this.config = config.validate();
        this.registry = new ConnectionRegistry();
        this.broadcaster = new BroadcastEngine(registry);
        this.commandProcessor = new CommandProcessor(registry, broadcaster);
        this.allChannels = new DefaultChannelGroup("chat-connections", GlobalEventExecutor.INSTANCE);
    }

    /**
     * Starts the server.
     * This method blocks until the server is shut down.
     */
    public void start() throws InterruptedException {
        try {
            bind();
            // Block until the server channel is closed
            serverChannel.closeFuture().sync();
        } finally {
            shutdown();
        }
    }

    /**
     * Binds the listening socket and returns once the server accepts connections.
     *
     * @return the bound address; its port is the real one when port 0 was configured
     */
    public synchronized InetSocketAddress bind() throws InterruptedException {
        if (serverChannel != null) {
            throw new IllegalStateException("Server already bound to " + serverChannel.localAddress());
        }

        // Boss group: accepts incoming connections (1 thread is enough)
        bossGroup = new NioEventLoopGroup(1);

        // Worker group: handles I/O for accepted connections
        // Default: 2 * number of CPU cores
        workerGroup = new NioEventLoopGroup();

        ServerBootstrap bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                // TCP options
                .option(ChannelOption.SO_BACKLOG, config.getMaxPendingConnections())
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childOption(ChannelOption.TCP_NODELAY, true) // Disable Nagle for chat latency
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        ChannelPipeline pipeline = ch.pipeline();

                        pipeline.addLast(new ChannelTracker());

                        if (config.getReaderIdleSeconds() > 0) {
                            pipeline.addLast(new IdleStateHandler(config.getReaderIdleSeconds(), 0, 0, TimeUnit.SECONDS));
                        }

                        // Framing: u32 length, type byte, payload
                        pipeline.addLast(new ChatFrameDecoder(config.getMaxFrameLength()));
                        pipeline.addLast(new ChatFrameEncoder());

                        // Per-connection state machine
                        pipeline.addLast(new ChatSessionHandler(registry, broadcaster, commandProcessor));
                    }
                });

        try {
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            shutdown();
            throw e;
        }

        InetSocketAddress address = (InetSocketAddress) serverChannel.localAddress();
        logger.info("Server listening on {}:{}", config.getHost(), address.getPort());
        return address;
    }

    /**
     * Gracefully shuts down the server.
     * - Stops accepting new connections
     * - Closes every open connection
     * - Releases all resources
     */
    public synchronized void shutdown() {
        if (bossGroup == null) {
            return;
        }
        logger.info("Shutting down server...");

        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly();
        }
        allChannels.close().awaitUninterruptibly();

        // Graceful shutdown of event loops
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS);
        bossGroup = null;
        workerGroup = null;

        logger.info("Server shutdown complete.");
    }

    /**
     * @return the bound port, or -1 if the server is not listening
     */
    public int getPort() {
        Channel channel = serverChannel;
        if (channel == null || !channel.isActive()) {
            return -1;
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    public ConnectionRegistry getRegistry() {
        return registry;
    }

    public ServerConfig getConfig() {
        return config;
    }

    /**
     * Adds each accepted connection to the channel group; the group drops it on close.
     */
    private class ChannelTracker extends ChannelInboundHandlerAdapter {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            allChannels.add(ctx.channel());
            super.channelActive(ctx);
        }
    }
}
