package com.tcpchat.session;

import com.tcpchat.protocol.ChatMessage;
import com.tcpchat.protocol.FrameCodec;
import com.tcpchat.protocol.MessageType;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.channels.ClosedChannelException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Fans messages out to registered connections.
 *
 * Threading Model:
 * - The target list is copied out of the registry, then the lock is released
 * - Writes are queued on each target's own outbound buffer and flushed by
 *   its event loop, so a slow receiver never stalls the sender or the registry
 *
 * Broadcast is best-effort: a failed write to one target is logged and does
 * not affect the others. Direct sends hand their future back so the caller
 * can react to a delivery failure.
 */
public class BroadcastEngine {

    private static final Logger logger = LoggerFactory.getLogger(BroadcastEngine.class);

    private final ConnectionRegistry registry;

    public BroadcastEngine(ConnectionRegistry registry) {
        this.registry = registry;
    }

    /**
     * Sends one message to every registered connection except {@code exclude}.
     *
     * The frame is encoded once and shared by all targets. Never throws for
     * delivery problems.
     *
     * @param exclude connection to skip, or null to reach everyone
     * @return the number of targets a write was attempted on
     */
    public int broadcast(MessageType type, byte[] payload, Channel exclude) {
        ByteBuf frame = Unpooled.wrappedBuffer(FrameCodec.encode(type, payload));
        List<Channel> targets = registry.snapshotTargets(exclude);
        try {
            for (Channel target : targets) {
                writeQuietly(target, type, frame.retainedDuplicate());
            }
        } finally {
            frame.release();
        }
        logger.debug("Broadcast {} ({} bytes) to {} connection(s)", type, payload.length, targets.size());
        return targets.size();
    }

    public int broadcast(MessageType type, String text, Channel exclude) {
        return broadcast(type, text.getBytes(StandardCharsets.UTF_8), exclude);
    }

    private void writeQuietly(Channel target, MessageType type, ByteBuf frame) {
        try {
            target.writeAndFlush(frame).addListener((ChannelFutureListener) future -> {
                if (!future.isSuccess()) {
                    logger.warn("Failed to deliver {} to {}: {}", type,
                            registry.getUsername(target).orElse(String.valueOf(target.remoteAddress())),
                            String.valueOf(future.cause()));
                }
            });
        } catch (RuntimeException e) {
            // Netty reports write failures through the future; this only guards an unexpected throw.
            logger.warn("Failed to queue {} for {}", type, target, e);
        }
    }

    /**
     * Sends a message to a single connection.
     *
     * @return the write future; it fails if the connection is already closed
     *         or the write does not go through
     */
    public ChannelFuture sendDirect(Channel channel, MessageType type, byte[] payload) {
        if (!channel.isActive()) {
            return channel.newFailedFuture(new ClosedChannelException());
        }
        return channel.writeAndFlush(ChatMessage.of(type, payload));
    }

    public ChannelFuture sendDirect(Channel channel, MessageType type, String text) {
        return sendDirect(channel, type, text.getBytes(StandardCharsets.UTF_8));
    }
}
