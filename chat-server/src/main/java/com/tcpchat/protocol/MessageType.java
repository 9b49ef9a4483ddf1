package com.tcpchat.protocol;

/**
 * Defines all message types of the chat wire protocol, with their one-byte tags.
 *
 * Client → Server:
 * - JOIN: Username announcement (handshake)
 * - TEXT: Chat line, or an in-band command when it starts with '/'
 * - FILE: "filename::" followed by raw file bytes
 *
 * Server → Client:
 * - TEXT: Relayed chat line ("sender::text") or a server notice
 * - FILE: Relayed file ("sender::filename::" followed by raw file bytes)
 * - JOIN / LEAVE: Human-readable announcements
 * - ERROR: Human-readable rejection
 * - COMMAND: Command acknowledgement ("/quit_ack")
 */
public enum MessageType {
    TEXT((byte) 0x01),
    FILE((byte) 0x02),
    JOIN((byte) 0x03),
    LEAVE((byte) 0x04),
    ERROR((byte) 0x05),
    COMMAND((byte) 0x06);

    private final byte tag;

    MessageType(byte tag) {
        this.tag = tag;
    }

    public byte getTag() {
        return tag;
    }

    /**
     * Resolves a wire tag to its message type.
     *
     * @return the matching type, or null if the tag is not part of the protocol
     */
    public static MessageType fromTag(byte tag) {
        for (MessageType type : values()) {
            if (type.tag == tag) {
                return type;
            }
        }
        return null;
    }
}
