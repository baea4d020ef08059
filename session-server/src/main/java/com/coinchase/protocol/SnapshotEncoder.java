package com.coinchase.protocol;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToByteEncoder;
import io.netty.handler.codec.compression.Snappy;

/**
 * Serializes a snapshot, appends the delimiter and compresses the whole
 * delimited message as one raw Snappy block.
 *
 * Not sharable: each channel gets its own Snappy instance.
 */
public class SnapshotEncoder extends MessageToByteEncoder<RelatedPositionsMessage> {

    private final PacketCodec codec;
    private final Snappy snappy = new Snappy();

    public SnapshotEncoder(PacketCodec codec) {
        super(RelatedPositionsMessage.class);
        this.codec = codec;
    }

    @Override
    protected void encode(ChannelHandlerContext ctx, RelatedPositionsMessage message, ByteBuf out) {
        byte[] framed = codec.encodeSnapshot(message);
        ByteBuf in = Unpooled.wrappedBuffer(framed);
        try {
            snappy.encode(in, out, framed.length);
        } finally {
            in.release();
            snappy.reset();
        }
    }
}
