package com.tcpchat.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;

/**
 * Frames outbound {@link ChatMessage}s. Pre-encoded {@link ByteBuf} frames
 * (used by broadcast) pass through this encoder untouched.
 */
@ChannelHandler.Sharable
public class ChatFrameEncoder extends MessageToByteEncoder<ChatMessage> {

    @Override
    protected void encode(ChannelHandlerContext ctx, ChatMessage msg, ByteBuf out) {
        FrameCodec.encode(msg, out);
    }
}
