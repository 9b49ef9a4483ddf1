package com.tcpchat.handler;

import com.tcpchat.command.Command;
import com.tcpchat.command.CommandProcessor;
import com.tcpchat.protocol.ChatMessage;
import com.tcpchat.protocol.FilePayload;
import com.tcpchat.protocol.MessageType;
import com.tcpchat.protocol.Payloads;
import com.tcpchat.session.BroadcastEngine;
import com.tcpchat.session.ConnectionRegistry;
import com.tcpchat.session.RegistrationResult;
import com.tcpchat.session.SessionState;

import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * Drives one connection through its session lifecycle.
 *
 * This is where the chat logic lives:
 * - AWAITING_JOIN: only a JOIN with a free, well-formed username moves on
 * - ACTIVE: TEXT is relayed (or run as a command when it starts with '/'),
 *   FILE is relayed, everything else is rejected
 * - Teardown: unregister, announce LEAVE, close
 *
 * Threading Model:
 * - One instance per channel, always called on that channel's event loop
 * - Session state needs no synchronization; only the registry is shared
 * - Frames of a connection are handled strictly in arrival order
 *
 * Important: Never block in this handler! All writes are asynchronous.
 */
public class ChatSessionHandler extends SimpleChannelInboundHandler<ChatMessage> {

    private static final Logger logger = LoggerFactory.getLogger(ChatSessionHandler.class);

    public static final String WELCOME = "Welcome! Type /help for commands.";
    public static final String USERNAME_TAKEN = "Username already taken.";
    public static final String INVALID_JOIN = "Invalid JOIN message.";
    public static final String INVALID_USERNAME = "Username must not contain '" + Payloads.DELIMITER + "'.";
    public static final String INVALID_FILE = "Invalid FILE message.";
    public static final String UNSUPPORTED_TYPE = "Unsupported message type.";

    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcaster;
    private final CommandProcessor commandProcessor;

    private SessionState state = SessionState.AWAITING_JOIN;
    private String username;

    public ChatSessionHandler(ConnectionRegistry registry, BroadcastEngine broadcaster,
                              CommandProcessor commandProcessor) {
        this.registry = registry;
        this.broadcaster = broadcaster;
        this.commandProcessor = commandProcessor;
    }

    /**
     * Called when the TCP connection is established.
     */
    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        logger.info("Accepted connection from {}", ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    /**
     * Called when the connection is gone, whatever closed it.
     */
    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        teardown(ctx);
        super.channelInactive(ctx);
    }

    /**
     * Called for every decoded frame.
     */
    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ChatMessage message) {
        logger.debug("Received {} from {} in state {}", message, describe(ctx), state);

        switch (state) {
            case AWAITING_JOIN -> handleJoin(ctx, message);
            case ACTIVE -> handleActive(ctx, message);
            default -> logger.debug("Dropping {} from {}: session is {}", message, describe(ctx), state);
        }
    }

    // === Handshake ===

    private void handleJoin(ChannelHandlerContext ctx, ChatMessage message) {
        if (message.getType() != MessageType.JOIN) {
            reply(ctx, MessageType.ERROR, INVALID_JOIN);
            return;
        }

        String requested = message.payloadText().trim();
        if (requested.isEmpty()) {
            reply(ctx, MessageType.ERROR, INVALID_JOIN);
            return;
        }
        if (Payloads.containsDelimiter(requested)) {
            reply(ctx, MessageType.ERROR, INVALID_USERNAME);
            return;
        }

        if (registry.register(ctx.channel(), requested) == RegistrationResult.USERNAME_TAKEN) {
            logger.info("{} asked for taken username '{}'", ctx.channel().remoteAddress(), requested);
            reply(ctx, MessageType.ERROR, USERNAME_TAKEN);
            return;
        }

        username = requested;
        state = SessionState.ACTIVE;
        logger.info("{} joined as '{}' ({} online)", ctx.channel().remoteAddress(), username, registry.size());

        // Written inline on this channel's event loop; relays from other threads are
        // queued behind it, so the welcome is always the joiner's first frame.
        reply(ctx, MessageType.TEXT, WELCOME);
        broadcaster.broadcast(MessageType.JOIN, username + " joined the chat.", ctx.channel());
    }

    // === Active session ===

    private void handleActive(ChannelHandlerContext ctx, ChatMessage message) {
        MessageType type = message.getType();
        if (type == MessageType.TEXT) {
            handleText(ctx, message);
        } else if (type == MessageType.FILE) {
            handleFile(ctx, message);
        } else {
            logger.warn("Rejected {} from '{}'", message, username);
            reply(ctx, MessageType.ERROR, UNSUPPORTED_TYPE);
        }
    }

    private void handleText(ChannelHandlerContext ctx, ChatMessage message) {
        String text = message.payloadText();
        if (text.startsWith("/")) {
            if (Command.parse(text) == Command.QUIT) {
                // No further frames are processed after a quit.
                state = SessionState.CLOSING;
            }
            commandProcessor.process(ctx.channel(), username, text)
                    .addListener(replyFailureListener(ctx));
            return;
        }

        logger.debug("'{}' sent text ({} bytes)", username, message.getPayloadLength());
        broadcaster.broadcast(MessageType.TEXT, Payloads.withSender(username, message.getPayload()), ctx.channel());
    }

    private void handleFile(ChannelHandlerContext ctx, ChatMessage message) {
        byte[] payload = message.getPayload();
        Optional<FilePayload> file = FilePayload.parseUpload(payload);
        if (file.isEmpty()) {
            reply(ctx, MessageType.ERROR, INVALID_FILE);
            return;
        }

        logger.info("'{}' sent file '{}' ({} bytes)", username, file.get().getFileName(), file.get().getSize());
        broadcaster.broadcast(MessageType.FILE, Payloads.withSender(username, payload), ctx.channel());
    }

    // === Teardown ===

    /**
     * Unregisters the connection and tells everyone else. Runs at most once.
     */
    private void teardown(ChannelHandlerContext ctx) {
        if (state == SessionState.CLOSED) {
            return;
        }
        state = SessionState.CLOSING;

        Optional<String> removed = registry.unregister(ctx.channel());
        if (removed.isPresent()) {
            logger.info("'{}' disconnected ({} online)", removed.get(), registry.size());
            broadcaster.broadcast(MessageType.LEAVE, removed.get() + " left the chat.", null);
        } else {
            logger.info("Connection from {} closed before joining", ctx.channel().remoteAddress());
        }

        ctx.close();
        state = SessionState.CLOSED;
    }

    // === Sending ===

    private void reply(ChannelHandlerContext ctx, MessageType type, String text) {
        broadcaster.sendDirect(ctx.channel(), type, text).addListener(replyFailureListener(ctx));
    }

    /**
     * A reply that cannot be delivered means the connection is broken; drop it.
     */
    private ChannelFutureListener replyFailureListener(ChannelHandlerContext ctx) {
        return future -> {
            if (!future.isSuccess()) {
                logger.warn("Failed to reply to {}: {}", describe(ctx), String.valueOf(future.cause()));
                ctx.close();
            }
        };
    }

    private String describe(ChannelHandlerContext ctx) {
        return username != null ? "'" + username + "'" : String.valueOf(ctx.channel().remoteAddress());
    }

    // === Netty Event Handlers ===

    /**
     * Closes connections that stay silent past the configured reader idle time.
     */
    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout, closing: {}", describe(ctx));
                ctx.close();
            }
        }
        super.userEventTriggered(ctx, evt);
    }

    /**
     * Transport and framing errors end this session only.
     */
    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            logger.warn("Malformed frame from {}, dropping connection: {}", describe(ctx), cause.getMessage());
        } else if (cause instanceof IOException) {
            logger.info("Connection lost for {}: {}", describe(ctx), cause.getMessage());
        } else {
            logger.error("Error handling {}", describe(ctx), cause);
        }
        ctx.close();
    }

    public SessionState getState() {
        return state;
    }

    /**
     * @return the joined username, or null before a successful JOIN
     */
    public String getUsername() {
        return username;
    }
}
