package com.tcpchat.session;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The authoritative set of joined users: connection → username.
 *
 * Thread Safety:
 * - One coarse lock guards every read and write
 * - The uniqueness check and the insert happen under the same lock hold,
 *   so two connections can never both claim a name
 * - Readers get copies taken at a single instant; no I/O ever happens while
 *   the lock is held
 *
 * Iteration order is join order, which is also the order of /users.
 * Usernames compare case-sensitively.
 */
public class ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final Object lock = new Object();

    // Guarded by lock
    private final Map<Channel, String> usernames = new LinkedHashMap<>();

    /**
     * Registers a connection under a username.
     *
     * @return OK if registered, USERNAME_TAKEN if another connection holds the name
     * @throws IllegalStateException if this connection is already registered
     */
    public RegistrationResult register(Channel channel, String username) {
        Objects.requireNonNull(channel, "channel");
        Objects.requireNonNull(username, "username");

        synchronized (lock) {
            if (usernames.containsKey(channel)) {
                throw new IllegalStateException("Connection already registered as '" + usernames.get(channel) + "'");
            }
            if (usernames.containsValue(username)) {
                logger.debug("Rejected duplicate username '{}' from {}", username, channel.remoteAddress());
                return RegistrationResult.USERNAME_TAKEN;
            }
            usernames.put(channel, username);
            logger.debug("Registered '{}' ({} online)", username, usernames.size());
        }
        return RegistrationResult.OK;
    }

    /**
     * Removes a connection.
     *
     * @return the username it held, or empty if it was never registered
     */
    public Optional<String> unregister(Channel channel) {
        String removed;
        synchronized (lock) {
            removed = usernames.remove(channel);
            if (removed != null) {
                logger.debug("Unregistered '{}' ({} online)", removed, usernames.size());
            }
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Snapshot of broadcast targets.
     *
     * The list reflects the registry at one instant. Connections that leave
     * afterwards are still in it, so senders must tolerate closed channels.
     *
     * @param exclude connection to leave out, or null for none
     */
    public List<Channel> snapshotTargets(Channel exclude) {
        synchronized (lock) {
            List<Channel> targets = new ArrayList<>(usernames.size());
            for (Channel channel : usernames.keySet()) {
                if (!channel.equals(exclude)) {
                    targets.add(channel);
                }
            }
            return targets;
        }
    }

    /**
     * Snapshot of the usernames currently online, in join order.
     */
    public List<String> listUsernames() {
        synchronized (lock) {
            return new ArrayList<>(usernames.values());
        }
    }

    public Optional<String> getUsername(Channel channel) {
        synchronized (lock) {
            return Optional.ofNullable(usernames.get(channel));
        }
    }

    public boolean isRegistered(Channel channel) {
        synchronized (lock) {
            return usernames.containsKey(channel);
        }
    }

    public boolean isUsernameTaken(String username) {
        synchronized (lock) {
            return usernames.containsValue(username);
        }
    }

    public int size() {
        synchronized (lock) {
            return usernames.size();
        }
    }
}
