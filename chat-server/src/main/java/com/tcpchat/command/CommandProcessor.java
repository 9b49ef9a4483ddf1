package com.tcpchat.command;

import com.tcpchat.protocol.MessageType;
import com.tcpchat.session.BroadcastEngine;
import com.tcpchat.session.ConnectionRegistry;

import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes in-band commands for an active user.
 *
 * Responses go only to the issuing connection. No command touches the
 * registry; /quit closes the connection and the session teardown does the rest.
 */
public class CommandProcessor {

    private static final Logger logger = LoggerFactory.getLogger(CommandProcessor.class);

    public static final String QUIT_ACK = "/quit_ack";
    public static final String USERS_PREFIX = "[Server] Online users: ";
    public static final String HELP_TEXT = "[Server] Commands:\n"
            + "/users - List online users\n"
            + "/send <filepath> - Send a file\n"
            + "/quit - Disconnect";
    public static final String UNKNOWN_COMMAND = "Unknown command. Type /help.";

    private final ConnectionRegistry registry;
    private final BroadcastEngine broadcaster;

    public CommandProcessor(ConnectionRegistry registry, BroadcastEngine broadcaster) {
        this.registry = registry;
        this.broadcaster = broadcaster;
    }

    /**
     * Runs one command line.
     *
     * @param channel  the issuing connection
     * @param username the issuing user
     * @param line     the raw line, leading '/' included
     * @return the write future of the response
     */
    public ChannelFuture process(Channel channel, String username, String line) {
        Command command = Command.parse(line);
        logger.debug("'{}' issued {}", username, command);

        return switch (command) {
            case QUIT -> quit(channel, username);
            case USERS -> broadcaster.sendDirect(channel, MessageType.TEXT,
                    USERS_PREFIX + String.join(", ", registry.listUsernames()));
            case HELP -> broadcaster.sendDirect(channel, MessageType.TEXT, HELP_TEXT);
            case UNKNOWN -> broadcaster.sendDirect(channel, MessageType.ERROR, UNKNOWN_COMMAND);
        };
    }

    private ChannelFuture quit(Channel channel, String username) {
        logger.info("'{}' requested to quit", username);
        // Close once the ack is flushed or has failed; the peer then reads end of stream.
        return broadcaster.sendDirect(channel, MessageType.COMMAND, QUIT_ACK)
                .addListener(ChannelFutureListener.CLOSE);
    }
}
