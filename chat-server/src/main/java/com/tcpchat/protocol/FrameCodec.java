package com.tcpchat.protocol;

import io.netty.buffer.ByteBuf;

import java.io.DataInputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.util.Objects;

/**
 * Encodes and decodes length-prefixed chat frames.
 *
 * Wire format (big-endian):
 * <pre>
 * +----------------+--------+-------------------+
 * | length (u32)   | type   | payload           |
 * | 4 bytes        | 1 byte | length - 1 bytes  |
 * +----------------+--------+-------------------+
 * </pre>
 * The length counts the type byte plus the payload, never the prefix itself.
 *
 * Encoding puts no upper bound on the frame. Decoding rejects a declared
 * length above {@code maxFrameLength} before allocating the body, so a peer
 * cannot make us buffer arbitrary amounts of memory.
 *
 * All methods are stateless and thread-safe.
 */
public final class FrameCodec {

    public static final int HEADER_SIZE = 4;
    public static final int TYPE_SIZE = 1;

    /** 16 MiB: enough for small file transfers, small enough to bound memory per peer. */
    public static final int DEFAULT_MAX_FRAME_LENGTH = 16 * 1024 * 1024;

    private FrameCodec() {
    }

    /**
     * Encodes a message into a standalone frame.
     *
     * @return {@code length || type || payload}
     */
    public static byte[] encode(MessageType type, byte[] payload) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(payload, "payload");
        return encode(type.getTag(), payload);
    }

    public static byte[] encode(ChatMessage message) {
        return encode(message.getTypeTag(), message.payloadRef());
    }

    private static byte[] encode(byte typeTag, byte[] payload) {
        ByteBuffer frame = ByteBuffer.allocate(HEADER_SIZE + TYPE_SIZE + payload.length);
        frame.putInt(TYPE_SIZE + payload.length);
        frame.put(typeTag);
        frame.put(payload);
        return frame.array();
    }

    /**
     * Writes a message frame into a Netty buffer.
     */
    public static void encode(ChatMessage message, ByteBuf out) {
        byte[] payload = message.payloadRef();
        out.ensureWritable(HEADER_SIZE + TYPE_SIZE + payload.length);
        out.writeInt(TYPE_SIZE + payload.length);
        out.writeByte(message.getTypeTag());
        out.writeBytes(payload);
    }

    /**
     * Reads exactly one frame from a blocking stream, with the default size limit.
     *
     * @see #read(InputStream, int)
     */
    public static ChatMessage read(InputStream in) throws IOException {
        return read(in, DEFAULT_MAX_FRAME_LENGTH);
    }

    /**
     * Reads exactly one frame from a blocking stream.
     *
     * Only the bytes of that frame are consumed. A stream that ends anywhere
     * before the frame is complete (inside the prefix or inside the body)
     * yields {@link EOFException}; a prefix that cannot describe a frame
     * yields {@link MalformedFrameException}. Callers handle both the same way.
     *
     * @param in             the stream to read from
     * @param maxFrameLength largest accepted value of the length prefix
     * @return the decoded message; its type is null for an unknown tag
     * @throws EOFException            if the stream ends before a full frame
     * @throws MalformedFrameException if the declared length is 0 or too large
     * @throws IOException             on any other transport failure
     */
    public static ChatMessage read(InputStream in, int maxFrameLength) throws IOException {
        DataInputStream data = in instanceof DataInputStream ? (DataInputStream) in : new DataInputStream(in);

        long length = Integer.toUnsignedLong(data.readInt());
        checkLength(length, maxFrameLength);

        byte typeTag = data.readByte();
        byte[] payload = new byte[(int) length - TYPE_SIZE];
        data.readFully(payload);
        return ChatMessage.fromWire(typeTag, payload);
    }

    /**
     * Validates a declared frame length.
     *
     * @throws MalformedFrameException if the length is 0 or above the limit
     */
    public static void checkLength(long length, int maxFrameLength) throws MalformedFrameException {
        if (length < TYPE_SIZE) {
            throw new MalformedFrameException("Frame length " + length + " leaves no room for a type byte", length);
        }
        if (length > maxFrameLength) {
            throw new MalformedFrameException(
                    "Frame length " + length + " exceeds maximum of " + maxFrameLength, length);
        }
    }
}
