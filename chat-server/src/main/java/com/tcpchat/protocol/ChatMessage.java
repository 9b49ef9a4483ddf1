package com.tcpchat.protocol;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One decoded protocol message: a type tag plus an opaque payload.
 *
 * Immutable once created. The payload array is copied on the way in and on
 * the way out, so instances can be shared across event loops freely.
 *
 * A message decoded from the wire may carry a tag that is not a known
 * {@link MessageType}. In that case {@link #getType()} returns null and the
 * raw tag stays available through {@link #getTypeTag()}; rejecting it is up
 * to the receiver.
 */
public final class ChatMessage {

    private static final byte[] EMPTY = new byte[0];

    private final byte typeTag;
    private final MessageType type;
    private final byte[] payload;

    private ChatMessage(byte typeTag, MessageType type, byte[] payload) {
        this.typeTag = typeTag;
        this.type = type;
        this.payload = payload;
    }

    public static ChatMessage of(MessageType type, byte[] payload) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        return new ChatMessage(type.getTag(), type, payload.length == 0 ? EMPTY : payload.clone());
    }

    public static ChatMessage of(MessageType type, String text) {
        Objects.requireNonNull(text, "text");
        return of(type, text.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Builds a message straight from wire data. Unknown tags are kept as-is.
     * The payload array is adopted, not copied; callers must not reuse it.
     */
    public static ChatMessage fromWire(byte typeTag, byte[] payload) {
        Objects.requireNonNull(payload, "payload");
        return new ChatMessage(typeTag, MessageType.fromTag(typeTag), payload);
    }

    /**
     * @return the message type, or null for a tag outside the protocol
     */
    public MessageType getType() {
        return type;
    }

    public byte getTypeTag() {
        return typeTag;
    }

    public byte[] getPayload() {
        return payload.length == 0 ? EMPTY : payload.clone();
    }

    public int getPayloadLength() {
        return payload.length;
    }

    /**
     * Decodes the payload as UTF-8; malformed sequences are replaced.
     */
    public String payloadText() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    // Package-private: lets the codec write the payload without a copy
    byte[] payloadRef() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ChatMessage)) {
            return false;
        }
        ChatMessage other = (ChatMessage) o;
        return typeTag == other.typeTag && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * typeTag + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "type=" + (type != null ? type : String.format("0x%02x", typeTag)) +
                ", payloadLength=" + payload.length +
                '}';
    }
}
