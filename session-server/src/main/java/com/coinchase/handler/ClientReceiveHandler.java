package com.coinchase.handler;

import com.coinchase.protocol.InboundEvent;
import com.coinchase.worker.SessionTermination;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.ChannelInputShutdownEvent;
import io.netty.handler.codec.DecoderException;
import io.netty.handler.timeout.IdleState;
import io.netty.handler.timeout.IdleStateEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Consumer;

/**
 * Last stage of a slot's inbound pipeline.
 *
 * Forwards decoded events, in arrival order, to the processor pool and maps
 * every failure to termination of the whole session:
 * - read idle for the configured timeout
 * - oversized or malformed frames
 * - read errors and lost connections
 *
 * A clean end of stream from the client is not a failure; the session stays
 * up until the idle timeout or a disconnect request ends it.
 */
public class ClientReceiveHandler extends SimpleChannelInboundHandler<InboundEvent> {

    private static final Logger logger = LoggerFactory.getLogger(ClientReceiveHandler.class);

    private final Consumer<InboundEvent> eventSink;
    private final SessionTermination termination;

    public ClientReceiveHandler(Consumer<InboundEvent> eventSink, SessionTermination termination) {
        this.eventSink = eventSink;
        this.termination = termination;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, InboundEvent event) {
        if (termination.isTerminated()) {
            return;
        }
        logger.debug("Received {} on {}", event.type(), termination.getName());
        eventSink.accept(event);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            IdleStateEvent e = (IdleStateEvent) evt;
            if (e.state() == IdleState.READER_IDLE) {
                logger.warn("Connection idle timeout on {}, closing: {}", termination.getName(), ctx.channel().remoteAddress());
                termination.terminate("read idle timeout");
                ctx.close();
                return;
            }
        } else if (evt instanceof ChannelInputShutdownEvent) {
            logger.info("Client {} ended its stream on {}", ctx.channel().remoteAddress(), termination.getName());
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        termination.terminate("connection closed");
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof DecoderException) {
            logger.warn("Protocol violation on {}: {}", termination.getName(), cause.getMessage());
            termination.terminate("protocol violation", cause);
        } else {
            logger.warn("Read from {} failed on {}", ctx.channel().remoteAddress(), termination.getName(), cause);
            termination.terminate("read failed", cause);
        }
        ctx.close();
    }
}
