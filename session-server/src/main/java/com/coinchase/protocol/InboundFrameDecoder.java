package com.coinchase.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;

import java.util.List;

/**
 * Turns one delimiter-stripped frame into an {@link InboundEvent}.
 * Sits right after the delimiter-based framer in the receiver pipeline.
 */
public class InboundFrameDecoder extends MessageToMessageDecoder<ByteBuf> {

    private final PacketCodec codec;

    public InboundFrameDecoder(PacketCodec codec) {
        this.codec = codec;
    }

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        out.add(codec.decode(frame));
    }
}
