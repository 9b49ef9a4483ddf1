package com.tcpchat.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.ByteToMessageDecoder;
import io.netty.handler.codec.CorruptedFrameException;
import io.netty.handler.codec.TooLongFrameException;

import java.util.List;

/**
 * Incremental frame decoder for the Netty pipeline.
 *
 * Bytes arrive in arbitrary chunks. A frame is emitted only once all of its
 * bytes are buffered; until then nothing is consumed. A malformed header
 * fails the channel and the session handler drops the connection.
 *
 * Not sharable: holds the partially received frame of one channel.
 */
public class ChatFrameDecoder extends ByteToMessageDecoder {

    private final int maxFrameLength;
    private boolean failed;

    public ChatFrameDecoder() {
        this(FrameCodec.DEFAULT_MAX_FRAME_LENGTH);
    }

    public ChatFrameDecoder(int maxFrameLength) {
        if (maxFrameLength < FrameCodec.TYPE_SIZE) {
            throw new IllegalArgumentException("maxFrameLength must be positive: " + maxFrameLength);
        }
        this.maxFrameLength = maxFrameLength;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf in, List<Object> out) {
        if (failed) {
            // Connection is being dropped; nothing after a bad header can be framed.
            in.skipBytes(in.readableBytes());
            return;
        }
        if (in.readableBytes() < FrameCodec.HEADER_SIZE) {
            return;
        }

        long length = in.getUnsignedInt(in.readerIndex());
        if (length < FrameCodec.TYPE_SIZE) {
            fail(in);
            throw new CorruptedFrameException("Frame length " + length + " leaves no room for a type byte");
        }
        if (length > maxFrameLength) {
            fail(in);
            throw new TooLongFrameException("Frame length " + length + " exceeds maximum of " + maxFrameLength);
        }

        if (in.readableBytes() < FrameCodec.HEADER_SIZE + length) {
            return;
        }

        in.skipBytes(FrameCodec.HEADER_SIZE);
        byte typeTag = in.readByte();
        byte[] payload = new byte[(int) length - FrameCodec.TYPE_SIZE];
        in.readBytes(payload);
        out.add(ChatMessage.fromWire(typeTag, payload));
    }

    private void fail(ByteBuf in) {
        failed = true;
        in.skipBytes(in.readableBytes());
    }
}
